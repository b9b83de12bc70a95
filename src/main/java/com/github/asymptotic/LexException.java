package com.github.asymptotic;

import com.github.asymptotic.Tokenizer.Position;

import lombok.Getter;

public class LexException extends PseudocodeException {

    @Getter
    private final String unexpected;

    public LexException(Position position, String unexpected) {
        super("unexpected input '" + unexpected + "'", position);
        this.unexpected = unexpected;
    }

    public LexException(Position position, String unexpected, String detail) {
        super(detail + " '" + unexpected + "'", position);
        this.unexpected = unexpected;
    }

}
