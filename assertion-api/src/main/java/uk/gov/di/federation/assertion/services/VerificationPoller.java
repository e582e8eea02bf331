package uk.gov.di.federation.assertion.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.federation.assertion.entity.AssertionData;
import uk.gov.di.federation.assertion.entity.PollingPolicy;
import uk.gov.di.federation.assertion.entity.ProviderResponse;
import uk.gov.di.federation.assertion.entity.VerificationRequest;
import uk.gov.di.federation.assertion.entity.VerificationResult;
import uk.gov.di.federation.assertion.exceptions.MfaTimeoutException;
import uk.gov.di.federation.assertion.exceptions.SamlAssertionException;

import static java.util.Objects.isNull;
import static uk.gov.di.federation.assertion.entity.ResponseStatus.PENDING;
import static uk.gov.di.federation.assertion.entity.ResponseStatus.SUCCESS;
import static uk.gov.di.federation.assertion.exceptions.ProviderAuthenticationException.unrecognisedStatusException;
import static uk.gov.di.federation.assertion.exceptions.VerificationCancelledException.cancelledException;
import static uk.gov.di.federation.assertion.exceptions.VerificationCancelledException.interruptedException;
import static uk.gov.di.federation.assertion.services.AssertionApiClient.VERIFY_FACTOR_PATH;

/**
 * Calls {@code verify_factor} until the provider returns the SAML assertion, rejects the request,
 * or the attempt budget runs out. The first attempt is sent exactly as given. Every later attempt
 * has {@code do_not_notify=true} and an empty OTP, so a push goes out at most once per poll.
 */
public class VerificationPoller {

    private static final Logger LOG = LogManager.getLogger(VerificationPoller.class);

    private final AssertionApiClient apiClient;

    public VerificationPoller(AssertionApiClient apiClient) {
        this.apiClient = apiClient;
    }

    public VerificationResult poll(
            VerificationRequest request, PollingPolicy policy, CancellationSignal signal)
            throws SamlAssertionException {
        var attemptRequest = request;
        int attempt = 0;
        while (true) {
            if (signal.isCancelled()) {
                throw cancelledException(attempt);
            }
            attempt++;
            LOG.info(
                    "Sending verify factor request, attempt {} of {}",
                    attempt,
                    policy.maxAttempts());
            var response = apiClient.post(VERIFY_FACTOR_PATH, attemptRequest);

            if (isAssertion(response)) {
                LOG.info("MFA verified on attempt {}", attempt);
                var assertion = (AssertionData.Assertion) response.data();
                return new VerificationResult(response.status(), assertion.samlAssertion());
            }
            if (!isPending(response)) {
                LOG.warn(
                        "Unexpected verify factor status type {} on attempt {}",
                        response.status().type(),
                        attempt);
                throw unrecognisedStatusException(response.status());
            }
            if (attempt >= policy.maxAttempts()) {
                LOG.warn("MFA confirmation still pending after {} attempts", attempt);
                throw new MfaTimeoutException(attempt);
            }

            LOG.info(
                    "MFA confirmation pending on attempt {}, waiting {} ms",
                    attempt,
                    policy.attemptInterval().toMillis());
            try {
                if (signal.awaitCancellation(policy.attemptInterval())) {
                    throw cancelledException(attempt);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw interruptedException(attempt, e);
            }
            attemptRequest = request.forRetry();
        }
    }

    private static boolean isAssertion(ProviderResponse response) {
        return response.status().hasType(SUCCESS)
                && response.data() instanceof AssertionData.Assertion assertion
                && !isNull(assertion.samlAssertion())
                && !assertion.samlAssertion().isBlank();
    }

    private static boolean isPending(ProviderResponse response) {
        return response.status().hasType(PENDING) && isNull(response.data());
    }
}
