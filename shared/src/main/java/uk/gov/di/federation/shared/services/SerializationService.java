package uk.gov.di.federation.shared.services;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.federation.shared.serialization.Json;
import uk.gov.di.federation.shared.validation.RequiredFieldValidator;
import uk.gov.di.federation.shared.validation.Validator;

import java.lang.reflect.Type;
import java.util.HashMap;
import java.util.Map;

import static java.util.Objects.isNull;

public class SerializationService implements Json {

    private static SerializationService INSTANCE;
    private static final Logger LOG = LogManager.getLogger(SerializationService.class);

    private final Gson gsonWithUnderscores;
    private final Gson gsonWithUnderscoresNoNulls;

    private final RequiredFieldValidator defaultValidator = new RequiredFieldValidator();

    public SerializationService() {
        this(new HashMap<>());
    }

    /**
     * @param extraTypeAdapters anything {@link GsonBuilder#registerTypeAdapter(Type, Object)}
     *     accepts: a {@code TypeAdapter}, {@code JsonSerializer} or {@code JsonDeserializer}
     */
    public SerializationService(Map<Type, Object> extraTypeAdapters) {
        gsonWithUnderscores =
                createGsonBuilder(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES, extraTypeAdapters)
                        .create();
        gsonWithUnderscoresNoNulls =
                createNoNullGsonBuilder(
                                FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES, extraTypeAdapters)
                        .create();
    }

    @Override
    public <T> T readValue(String jsonString, Class<T> clazz) throws JsonException {
        return readValue(jsonString, clazz, defaultValidator);
    }

    @Override
    public <T> T readValue(String jsonString, Class<T> clazz, Validator validator)
            throws JsonException {
        try {
            T value = gsonWithUnderscores.fromJson(jsonString, clazz);
            validateJson(value, validator);
            return value;
        } catch (JsonParseException | IllegalArgumentException | IllegalStateException e) {
            LOG.error("Error during JSON deserialization", e);
            throw new JsonException(e);
        }
    }

    private <T> void validateJson(T value, Validator validator) throws JsonException {
        var violations = validator.validate(value);
        if (!violations.isEmpty()) {
            String violationMessage =
                    "JSON validation error, missing required field(s): "
                            + String.join(", ", violations);
            violations.forEach(
                    v -> LOG.warn("Json validation failed due to missing required field: {}", v));
            throw new JsonException(violationMessage);
        }
    }

    @Override
    public String writeValueAsString(Object object) {
        return gsonWithUnderscores.toJson(object);
    }

    @Override
    public String writeValueAsStringNoNulls(Object object) {
        return gsonWithUnderscoresNoNulls.toJson(object);
    }

    public static SerializationService getInstance() {
        if (isNull(INSTANCE)) {
            INSTANCE = new SerializationService();
        }
        return INSTANCE;
    }

    private GsonBuilder createGsonBuilder(
            FieldNamingPolicy namingPolicy, Map<Type, Object> extraTypeAdapters) {
        return createNoNullGsonBuilder(namingPolicy, extraTypeAdapters).serializeNulls();
    }

    private GsonBuilder createNoNullGsonBuilder(
            FieldNamingPolicy namingPolicy, Map<Type, Object> extraTypeAdapters) {
        var builder =
                new GsonBuilder()
                        .setFieldNamingPolicy(namingPolicy)
                        .excludeFieldsWithoutExposeAnnotation()
                        .disableHtmlEscaping();
        extraTypeAdapters.forEach(builder::registerTypeAdapter);
        return builder;
    }
}
