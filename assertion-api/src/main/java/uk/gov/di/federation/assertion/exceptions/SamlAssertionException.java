package uk.gov.di.federation.assertion.exceptions;

public abstract class SamlAssertionException extends Exception {

    protected SamlAssertionException(String message) {
        super(message);
    }

    protected SamlAssertionException(String message, Throwable cause) {
        super(message, cause);
    }
}
