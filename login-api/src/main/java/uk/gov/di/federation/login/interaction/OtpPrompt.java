package uk.gov.di.federation.login.interaction;

import uk.gov.di.federation.login.exceptions.LoginInteractionException;

/** Asks the user for a one-time code from the chosen device. */
@FunctionalInterface
public interface OtpPrompt {
    String requestOtpToken() throws LoginInteractionException;
}
