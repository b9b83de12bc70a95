package com.github.asymptotic.parser;

import com.github.asymptotic.PseudocodeException;
import com.github.asymptotic.Tokenizer.Position;

import lombok.Getter;

public class SyntaxException extends PseudocodeException {

    @Getter
    private final String expectedConstruct;

    public SyntaxException(Position position, String expectedConstruct, String found) {
        super("expected " + expectedConstruct + " but got " + found, position);
        this.expectedConstruct = expectedConstruct;
    }

    public SyntaxException(Position position, String expectedConstruct) {
        super("expected " + expectedConstruct, position);
        this.expectedConstruct = expectedConstruct;
    }

}
