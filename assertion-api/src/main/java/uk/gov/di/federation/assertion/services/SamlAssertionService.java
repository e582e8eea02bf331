package uk.gov.di.federation.assertion.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.federation.assertion.entity.AssertionData;
import uk.gov.di.federation.assertion.entity.AssertionResult;
import uk.gov.di.federation.assertion.entity.AuthenticationRequest;
import uk.gov.di.federation.assertion.entity.Factor;
import uk.gov.di.federation.assertion.entity.PollingPolicy;
import uk.gov.di.federation.assertion.entity.ProviderFactor;
import uk.gov.di.federation.assertion.entity.VerificationRequest;
import uk.gov.di.federation.assertion.entity.VerificationResult;
import uk.gov.di.federation.assertion.exceptions.SamlAssertionException;
import uk.gov.di.federation.shared.services.ConfigurationService;

import java.util.ArrayList;
import java.util.List;

import static uk.gov.di.federation.assertion.exceptions.ProviderAuthenticationException.emptyResponseException;
import static uk.gov.di.federation.assertion.exceptions.ProviderAuthenticationException.noDevicesException;
import static uk.gov.di.federation.assertion.services.AssertionApiClient.SAML_ASSERTION_PATH;

public class SamlAssertionService {

    private static final Logger LOG = LogManager.getLogger(SamlAssertionService.class);

    private final AssertionApiClient apiClient;
    private final VerificationPoller verificationPoller;
    private final ConfigurationService configurationService;

    public SamlAssertionService(
            ConfigurationService configurationService, BearerTokenSupplier bearerTokenSupplier) {
        this(
                new AssertionApiClient(configurationService, bearerTokenSupplier),
                configurationService);
    }

    public SamlAssertionService(
            AssertionApiClient apiClient, ConfigurationService configurationService) {
        this.apiClient = apiClient;
        this.verificationPoller = new VerificationPoller(apiClient);
        this.configurationService = configurationService;
    }

    /**
     * Exchanges user credentials for either a SAML assertion or an MFA challenge.
     *
     * @throws uk.gov.di.federation.assertion.exceptions.ProviderProtocolException if the call
     *     failed or the response could not be parsed
     * @throws uk.gov.di.federation.assertion.exceptions.ProviderAuthenticationException if the
     *     provider rejected the credentials or returned neither an assertion nor a challenge
     * @throws uk.gov.di.federation.assertion.exceptions.BearerTokenUnavailableException if no
     *     bearer token could be obtained
     */
    public AssertionResult generate(AuthenticationRequest request) throws SamlAssertionException {
        LOG.info("Generating SAML assertion");
        var response = apiClient.post(SAML_ASSERTION_PATH, request);
        var status = response.status();

        if (response.data() instanceof AssertionData.Assertion assertion
                && !assertion.samlAssertion().isEmpty()) {
            LOG.info("SAML assertion generated without MFA");
            return AssertionResult.assertion(status, assertion.samlAssertion());
        }
        if (response.data() instanceof AssertionData.Challenge challenge
                && !challenge.factors().isEmpty()) {
            List<Factor> factors = new ArrayList<>();
            for (ProviderFactor providerFactor : challenge.factors()) {
                var devices = DeviceExpander.expandAll(providerFactor.devices());
                if (devices.isEmpty()) {
                    throw noDevicesException(status);
                }
                factors.add(
                        new Factor(
                                providerFactor.stateToken(),
                                devices,
                                providerFactor.callbackUrl(),
                                providerFactor.user()));
            }
            LOG.info("MFA required, {} factor(s) returned", factors.size());
            return AssertionResult.challenge(status, factors);
        }
        LOG.warn("OneLogin returned neither an assertion nor an MFA challenge");
        throw emptyResponseException(status);
    }

    public VerificationResult verifyFactor(VerificationRequest request)
            throws SamlAssertionException {
        return verifyFactor(request, PollingPolicy.fromConfiguration(configurationService));
    }

    public VerificationResult verifyFactor(VerificationRequest request, PollingPolicy policy)
            throws SamlAssertionException {
        return verifyFactor(request, policy, CancellationSignal.none());
    }

    /**
     * Completes an MFA challenge, polling while a push confirmation is pending.
     *
     * @throws uk.gov.di.federation.assertion.exceptions.MfaTimeoutException if the confirmation
     *     was still pending after {@link PollingPolicy#maxAttempts()} calls
     * @throws uk.gov.di.federation.assertion.exceptions.VerificationCancelledException if {@code
     *     signal} was cancelled or the thread interrupted while waiting
     */
    public VerificationResult verifyFactor(
            VerificationRequest request, PollingPolicy policy, CancellationSignal signal)
            throws SamlAssertionException {
        LOG.info("Verifying MFA factor for device {}", request.deviceId());
        return verificationPoller.poll(request, policy, signal);
    }
}
