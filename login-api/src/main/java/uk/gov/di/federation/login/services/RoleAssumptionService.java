package uk.gov.di.federation.login.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleWithSamlRequest;
import software.amazon.awssdk.services.sts.model.Credentials;
import uk.gov.di.federation.login.exceptions.RoleAssumptionException;
import uk.gov.di.federation.shared.services.ConfigurationService;

import java.net.URI;

/** Trades a SAML assertion for temporary AWS credentials. The call is made once, never retried. */
public class RoleAssumptionService {

    private static final Logger LOG = LogManager.getLogger(RoleAssumptionService.class);

    private final StsClient stsClient;
    private final ConfigurationService configurationService;

    public RoleAssumptionService(ConfigurationService configurationService) {
        this(createStsClient(configurationService), configurationService);
    }

    public RoleAssumptionService(StsClient stsClient, ConfigurationService configurationService) {
        this.stsClient = stsClient;
        this.configurationService = configurationService;
    }

    public Credentials assumeRole(
            String principalArn, String roleArn, String samlAssertion, long durationSeconds)
            throws RoleAssumptionException {
        var duration =
                durationSeconds > 0
                        ? durationSeconds
                        : configurationService.getRoleSessionDuration();
        if (duration > Integer.MAX_VALUE) {
            throw new RoleAssumptionException(
                    String.format("Role session duration of %d seconds is out of range", duration));
        }
        var request =
                AssumeRoleWithSamlRequest.builder()
                        .principalArn(principalArn)
                        .roleArn(roleArn)
                        .samlAssertion(samlAssertion)
                        .durationSeconds((int) duration)
                        .build();
        LOG.info("Assuming role {} with SAML assertion for {} seconds", roleArn, duration);
        try {
            var credentials = stsClient.assumeRoleWithSAML(request).credentials();
            LOG.info(
                    "Assumed role {}, credentials expire at {}",
                    roleArn,
                    credentials.expiration());
            return credentials;
        } catch (SdkException e) {
            LOG.error("Unable to assume role {}", roleArn, e);
            throw new RoleAssumptionException("Unable to assume role " + roleArn, e);
        }
    }

    private static StsClient createStsClient(ConfigurationService configurationService) {
        var localstackEndpointUri = configurationService.getLocalstackEndpointUri();
        var builder =
                StsClient.builder()
                        .region(Region.of(configurationService.getAwsRegion()))
                        .credentialsProvider(AnonymousCredentialsProvider.create());
        if (localstackEndpointUri.isPresent()) {
            LOG.info("Localstack endpoint URI is present: {}", localstackEndpointUri.get());
            builder.endpointOverride(URI.create(localstackEndpointUri.get()));
        }
        return builder.build();
    }
}
