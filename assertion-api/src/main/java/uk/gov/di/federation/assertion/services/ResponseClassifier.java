package uk.gov.di.federation.assertion.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.federation.assertion.entity.AssertionData;
import uk.gov.di.federation.assertion.entity.ProviderResponse;
import uk.gov.di.federation.assertion.exceptions.ProviderAuthenticationException;
import uk.gov.di.federation.assertion.exceptions.ProviderProtocolException;
import uk.gov.di.federation.assertion.serialization.AssertionDataDeserializer;
import uk.gov.di.federation.shared.serialization.Json;
import uk.gov.di.federation.shared.services.SerializationService;

import java.lang.reflect.Type;
import java.net.http.HttpResponse;
import java.util.Map;

import static uk.gov.di.federation.assertion.exceptions.ProviderAuthenticationException.rejectedException;
import static uk.gov.di.federation.assertion.exceptions.ProviderProtocolException.parseException;

/**
 * Turns a raw OneLogin response into a {@link ProviderResponse}. The body is parsed before anything
 * else, so an unparseable body is always a protocol failure whatever the HTTP status. Only then are
 * the HTTP status and {@code status.error} checked.
 */
public class ResponseClassifier {

    private static final Logger LOG = LogManager.getLogger(ResponseClassifier.class);

    private final Json objectMapper;

    public ResponseClassifier() {
        this(
                new SerializationService(
                        Map.<Type, Object>of(
                                AssertionData.class, new AssertionDataDeserializer())));
    }

    public ResponseClassifier(Json objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ProviderResponse classify(HttpResponse<String> response)
            throws ProviderProtocolException, ProviderAuthenticationException {
        ProviderResponse providerResponse;
        try {
            providerResponse = objectMapper.readValue(response.body(), ProviderResponse.class);
        } catch (Json.JsonException e) {
            throw parseException(response.statusCode(), e);
        }

        var status = providerResponse.status();
        if (response.statusCode() < 200 || response.statusCode() > 299 || status.isError()) {
            LOG.warn(
                    "OneLogin rejected request with HTTP status {}, code {} and type {}",
                    response.statusCode(),
                    status.code(),
                    status.type());
            throw rejectedException(response.statusCode(), status);
        }
        return providerResponse;
    }
}
