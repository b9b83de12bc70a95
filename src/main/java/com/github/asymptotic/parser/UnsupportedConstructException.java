package com.github.asymptotic.parser;

import com.github.asymptotic.PseudocodeException;
import com.github.asymptotic.Tokenizer.Position;

import lombok.Getter;

/** Thrown for syntax that looks valid but lies outside the supported dialect. */
public class UnsupportedConstructException extends PseudocodeException {

    @Getter
    private final String construct;

    public UnsupportedConstructException(Position position, String construct) {
        super("unsupported construct '" + construct + "'", position);
        this.construct = construct;
    }

}
