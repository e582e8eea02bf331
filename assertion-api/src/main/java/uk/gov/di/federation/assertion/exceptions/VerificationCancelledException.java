package uk.gov.di.federation.assertion.exceptions;

import static java.lang.String.format;

public class VerificationCancelledException extends SamlAssertionException {

    public VerificationCancelledException(String message) {
        super(message);
    }

    public VerificationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }

    public static VerificationCancelledException cancelledException(int completedAttempts) {
        return new VerificationCancelledException(
                format("MFA verification cancelled after %d attempt(s)", completedAttempts));
    }

    public static VerificationCancelledException interruptedException(
            int completedAttempts, InterruptedException e) {
        return new VerificationCancelledException(
                format("MFA verification interrupted after %d attempt(s)", completedAttempts), e);
    }
}
