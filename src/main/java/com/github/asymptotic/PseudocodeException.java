package com.github.asymptotic;

import com.github.asymptotic.Tokenizer.Position;

import lombok.Getter;

/**
 * Base of every fatal error raised while reading pseudocode. An analysis call
 * that throws one of these produced no result at all.
 */
public class PseudocodeException extends RuntimeException {

    @Getter
    private final Position position;

    public PseudocodeException(String message, Position position) {
        super(message + " at " + position);
        this.position = position;
    }

}
