package com.tandemsystems.synthesis;

import com.tandemsystems.analysis.Rejection;

/**
 * Thrown when declarations cannot be turned into an actor. No blueprint is produced.
 */
public class SynthesisException extends RuntimeException {

    private final Rejection rejection;

    public SynthesisException(Rejection rejection) {
        super(rejection.toString());
        this.rejection = rejection;
    }

    /**
     * Returns the rejection that stopped synthesis.
     *
     * @return the rejection
     */
    public Rejection getRejection() {
        return rejection;
    }
}
