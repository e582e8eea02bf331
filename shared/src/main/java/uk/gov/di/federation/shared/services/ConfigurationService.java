package uk.gov.di.federation.shared.services;

import uk.gov.di.federation.shared.exceptions.MissingEnvVariableException;

import java.net.URI;
import java.util.Optional;

import static java.util.Objects.isNull;

public class ConfigurationService {

    private static ConfigurationService configurationService;

    public static ConfigurationService getInstance() {
        if (configurationService == null) {
            configurationService = new ConfigurationService();
        }
        return configurationService;
    }

    public ConfigurationService() {}

    // Please keep the method names in alphabetical order so we can find stuff more easily.
    public long getAccessTokenRefreshSkew() {
        return Long.parseLong(System.getenv().getOrDefault("ACCESS_TOKEN_REFRESH_SKEW", "60"));
    }

    public String getAwsRegion() {
        return System.getenv().getOrDefault("AWS_REGION", "eu-west-2");
    }

    public Optional<String> getLocalstackEndpointUri() {
        return Optional.ofNullable(System.getenv("LOCALSTACK_ENDPOINT"));
    }

    public long getOneLoginApiCallTimeout() {
        return Long.parseLong(System.getenv().getOrDefault("ONELOGIN_API_CALL_TIMEOUT", "10000"));
    }

    public URI getOneLoginApiURI() {
        return URI.create(
                System.getenv().getOrDefault("ONELOGIN_API_URL", "https://api.us.onelogin.com"));
    }

    public String getOneLoginClientId() {
        return getMandatoryEnv("ONELOGIN_CLIENT_ID");
    }

    public String getOneLoginClientSecret() {
        return getMandatoryEnv("ONELOGIN_CLIENT_SECRET");
    }

    public long getRefreshTokenExpiry() {
        return Long.parseLong(System.getenv().getOrDefault("REFRESH_TOKEN_EXPIRY", "3888000"));
    }

    public long getRoleSessionDuration() {
        return Long.parseLong(System.getenv().getOrDefault("ROLE_SESSION_DURATION", "3600"));
    }

    public long getVerifyFactorAttemptInterval() {
        return Long.parseLong(
                System.getenv().getOrDefault("VERIFY_FACTOR_ATTEMPT_INTERVAL", "1000"));
    }

    public int getVerifyFactorMaxAttempts() {
        return Integer.parseInt(System.getenv().getOrDefault("VERIFY_FACTOR_MAX_ATTEMPTS", "60"));
    }

    private String getMandatoryEnv(String name) {
        var value = System.getenv(name);
        if (isNull(value) || value.isBlank()) {
            throw new MissingEnvVariableException(name);
        }
        return value;
    }
}
