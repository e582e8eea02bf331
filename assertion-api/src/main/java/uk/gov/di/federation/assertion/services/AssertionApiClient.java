package uk.gov.di.federation.assertion.services;

import com.nimbusds.oauth2.sdk.token.BearerAccessToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.federation.assertion.entity.ProviderResponse;
import uk.gov.di.federation.assertion.exceptions.SamlAssertionException;
import uk.gov.di.federation.shared.serialization.Json;
import uk.gov.di.federation.shared.services.ConfigurationService;
import uk.gov.di.federation.shared.services.SerializationService;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static uk.gov.di.federation.assertion.exceptions.ProviderProtocolException.interruptedException;
import static uk.gov.di.federation.assertion.exceptions.ProviderProtocolException.ioException;
import static uk.gov.di.federation.assertion.exceptions.ProviderProtocolException.timeoutException;
import static uk.gov.di.federation.shared.helpers.ConstructUriHelper.buildURI;

/** Sends JSON requests to the OneLogin SAML assertion API with the current bearer token. */
public class AssertionApiClient {

    public static final String SAML_ASSERTION_PATH = "/api/1/saml_assertion";
    public static final String VERIFY_FACTOR_PATH = "/api/1/saml_assertion/verify_factor";

    private static final Logger LOG = LogManager.getLogger(AssertionApiClient.class);
    private static final String APPLICATION_JSON = "application/json";

    private final Json objectMapper = SerializationService.getInstance();
    private final HttpClient httpClient;
    private final ConfigurationService configurationService;
    private final BearerTokenSupplier bearerTokenSupplier;
    private final ResponseClassifier responseClassifier;

    public AssertionApiClient(
            ConfigurationService configurationService, BearerTokenSupplier bearerTokenSupplier) {
        this(
                HttpClient.newBuilder()
                        .connectTimeout(
                                Duration.ofMillis(
                                        configurationService.getOneLoginApiCallTimeout()))
                        .build(),
                configurationService,
                bearerTokenSupplier,
                new ResponseClassifier());
    }

    public AssertionApiClient(
            HttpClient httpClient,
            ConfigurationService configurationService,
            BearerTokenSupplier bearerTokenSupplier,
            ResponseClassifier responseClassifier) {
        this.httpClient = httpClient;
        this.configurationService = configurationService;
        this.bearerTokenSupplier = bearerTokenSupplier;
        this.responseClassifier = responseClassifier;
    }

    public ProviderResponse post(String path, Object body) throws SamlAssertionException {
        var token = bearerTokenSupplier.currentToken();
        var uri = buildURI(configurationService.getOneLoginApiURI().toString(), path);
        var request =
                HttpRequest.newBuilder(uri)
                        .timeout(
                                Duration.ofMillis(
                                        configurationService.getOneLoginApiCallTimeout()))
                        .header(
                                "Authorization",
                                new BearerAccessToken(token.accessToken()).toAuthorizationHeader())
                        .header("Content-Type", APPLICATION_JSON)
                        .header("Accept", APPLICATION_JSON)
                        .POST(
                                HttpRequest.BodyPublishers.ofString(
                                        objectMapper.writeValueAsStringNoNulls(body)))
                        .build();

        LOG.info("Sending request to OneLogin endpoint {}", path);
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            LOG.error("Timed out calling OneLogin endpoint {}", path);
            throw timeoutException(path, configurationService.getOneLoginApiCallTimeout(), e);
        } catch (IOException e) {
            LOG.error("Error calling OneLogin endpoint {}", path, e);
            throw ioException(path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw interruptedException(path, e);
        }
        LOG.info("Received HTTP status {} from OneLogin endpoint {}", response.statusCode(), path);
        return responseClassifier.classify(response);
    }
}
