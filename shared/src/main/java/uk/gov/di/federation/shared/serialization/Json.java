package uk.gov.di.federation.shared.serialization;

import uk.gov.di.federation.shared.validation.Validator;

public interface Json {
    <T> T readValue(String body, Class<T> klass) throws JsonException;

    <T> T readValue(String body, Class<T> klass, Validator validator) throws JsonException;

    String writeValueAsString(Object object);

    String writeValueAsStringNoNulls(Object object);

    class JsonException extends Exception {
        public JsonException(Exception e) {
            super(e);
        }

        public JsonException(String message) {
            super(message);
        }
    }
}
