package uk.gov.di.federation.assertion.exceptions;

public class BearerTokenUnavailableException extends SamlAssertionException {

    public BearerTokenUnavailableException(String message) {
        super(message);
    }

    public BearerTokenUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
