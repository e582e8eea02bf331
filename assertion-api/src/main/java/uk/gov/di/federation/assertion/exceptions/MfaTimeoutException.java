package uk.gov.di.federation.assertion.exceptions;

import static java.lang.String.format;

/** The push confirmation was still pending after every allowed attempt. */
public class MfaTimeoutException extends SamlAssertionException {

    private final int attempts;

    public MfaTimeoutException(int attempts) {
        super(format("MFA confirmation still pending after %d attempts", attempts));
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
