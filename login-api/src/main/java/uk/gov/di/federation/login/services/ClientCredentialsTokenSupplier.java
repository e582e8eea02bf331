package uk.gov.di.federation.login.services;

import com.nimbusds.oauth2.sdk.AuthorizationGrant;
import com.nimbusds.oauth2.sdk.ClientCredentialsGrant;
import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.RefreshTokenGrant;
import com.nimbusds.oauth2.sdk.TokenRequest;
import com.nimbusds.oauth2.sdk.TokenResponse;
import com.nimbusds.oauth2.sdk.auth.ClientSecretBasic;
import com.nimbusds.oauth2.sdk.auth.Secret;
import com.nimbusds.oauth2.sdk.id.ClientID;
import com.nimbusds.oauth2.sdk.token.RefreshToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.federation.assertion.entity.BearerToken;
import uk.gov.di.federation.assertion.exceptions.BearerTokenUnavailableException;
import uk.gov.di.federation.assertion.services.BearerTokenSupplier;
import uk.gov.di.federation.shared.helpers.NowHelper;
import uk.gov.di.federation.shared.helpers.NowHelper.NowClock;
import uk.gov.di.federation.shared.services.ConfigurationService;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static java.lang.String.format;
import static java.util.Objects.isNull;
import static java.util.Objects.nonNull;
import static uk.gov.di.federation.shared.helpers.ConstructUriHelper.buildURI;

/**
 * Obtains OneLogin API bearer tokens with the OAuth 2.0 client credentials grant and keeps the
 * current one in memory. A token inside the refresh skew of its expiry is replaced, using the
 * refresh token while it is still valid.
 */
public class ClientCredentialsTokenSupplier implements BearerTokenSupplier {

    public static final String TOKEN_PATH = "/auth/oauth2/v2/token";
    private static final long DEFAULT_ACCESS_TOKEN_LIFETIME = 600L;
    private static final Logger LOG = LogManager.getLogger(ClientCredentialsTokenSupplier.class);

    private final ConfigurationService configurationService;
    private final NowClock nowClock;
    private BearerToken currentToken;

    public ClientCredentialsTokenSupplier(ConfigurationService configurationService) {
        this(configurationService, NowHelper.systemClock());
    }

    public ClientCredentialsTokenSupplier(
            ConfigurationService configurationService, NowClock nowClock) {
        this.configurationService = configurationService;
        this.nowClock = nowClock;
    }

    @Override
    public synchronized BearerToken currentToken() throws BearerTokenUnavailableException {
        var now = nowClock.now();
        var skew = Duration.ofSeconds(configurationService.getAccessTokenRefreshSkew());
        if (nonNull(currentToken) && currentToken.isAccessTokenUsableAt(now, skew)) {
            return currentToken;
        }

        if (nonNull(currentToken) && currentToken.isRefreshTokenUsableAt(now)) {
            LOG.info("Refreshing OneLogin access token");
            try {
                currentToken =
                        requestToken(
                                new RefreshTokenGrant(
                                        new RefreshToken(currentToken.refreshToken())));
                return currentToken;
            } catch (BearerTokenUnavailableException e) {
                LOG.warn("Unable to refresh OneLogin access token, requesting a new one", e);
            }
        }

        LOG.info("Requesting new OneLogin access token");
        currentToken = requestToken(new ClientCredentialsGrant());
        return currentToken;
    }

    private BearerToken requestToken(AuthorizationGrant grant)
            throws BearerTokenUnavailableException {
        var tokenURI = buildURI(configurationService.getOneLoginApiURI().toString(), TOKEN_PATH);
        var clientAuthentication =
                new ClientSecretBasic(
                        new ClientID(configurationService.getOneLoginClientId()),
                        new Secret(configurationService.getOneLoginClientSecret()));
        var httpRequest = new TokenRequest(tokenURI, clientAuthentication, grant).toHTTPRequest();
        var timeout = Math.toIntExact(configurationService.getOneLoginApiCallTimeout());
        httpRequest.setConnectTimeout(timeout);
        httpRequest.setReadTimeout(timeout);

        TokenResponse tokenResponse;
        try {
            tokenResponse = TokenResponse.parse(httpRequest.send());
        } catch (IOException e) {
            LOG.error("Error whilst sending OneLogin token request", e);
            throw new BearerTokenUnavailableException(
                    "Error when attempting to call OneLogin token endpoint", e);
        } catch (ParseException e) {
            LOG.error("Error whilst parsing OneLogin token response", e);
            throw new BearerTokenUnavailableException("Error parsing OneLogin token response", e);
        }

        if (!tokenResponse.indicatesSuccess()) {
            var error = tokenResponse.toErrorResponse().getErrorObject();
            LOG.warn(
                    "Unsuccessful {} response from OneLogin token endpoint: {}",
                    error.getHTTPStatusCode(),
                    error.getCode());
            throw new BearerTokenUnavailableException(
                    format(
                            "Error %d when attempting to call OneLogin token endpoint: %s",
                            error.getHTTPStatusCode(), error.getDescription()));
        }

        var tokens = tokenResponse.toSuccessResponse().getTokens();
        var accessToken = tokens.getAccessToken();
        var refreshToken = tokens.getRefreshToken();
        var createdAt = nowClock.now();
        var lifetime =
                accessToken.getLifetime() > 0
                        ? accessToken.getLifetime()
                        : DEFAULT_ACCESS_TOKEN_LIFETIME;
        Instant refreshExpiresAt =
                isNull(refreshToken)
                        ? null
                        : createdAt.plus(
                                configurationService.getRefreshTokenExpiry(), ChronoUnit.SECONDS);

        LOG.info("Received OneLogin access token valid for {} seconds", lifetime);
        return new BearerToken(
                accessToken.getValue(),
                isNull(refreshToken) ? null : refreshToken.getValue(),
                createdAt,
                createdAt.plus(lifetime, ChronoUnit.SECONDS),
                refreshExpiresAt);
    }
}
