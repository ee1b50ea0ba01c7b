package com.pluginroute.executor;

/**
 * Failure of a {@link GenerationClient} call. Authentication failures are
 * flagged so the caller can ask the user for a valid API key.
 */
public class GenerationException extends Exception {

    private final boolean authenticationFailure;

    public GenerationException(String message, boolean authenticationFailure, Throwable cause) {
        super(message, cause);
        this.authenticationFailure = authenticationFailure;
    }

    public GenerationException(String message, Throwable cause) {
        this(message, false, cause);
    }

    public static GenerationException authentication(String message) {
        return new GenerationException(message, true, null);
    }

    public boolean isAuthenticationFailure() {
        return authenticationFailure;
    }
}
