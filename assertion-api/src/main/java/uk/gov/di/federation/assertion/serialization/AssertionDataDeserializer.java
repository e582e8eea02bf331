package uk.gov.di.federation.assertion.serialization;

import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import uk.gov.di.federation.assertion.entity.AssertionData;
import uk.gov.di.federation.assertion.entity.ProviderDevice;
import uk.gov.di.federation.assertion.entity.ProviderFactor;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.isNull;

public class AssertionDataDeserializer implements JsonDeserializer<AssertionData> {
    @Override
    public AssertionData deserialize(
            JsonElement json, Type typeOfT, JsonDeserializationContext context)
            throws JsonParseException {
        if (json.isJsonPrimitive() && json.getAsJsonPrimitive().isString()) {
            return new AssertionData.Assertion(json.getAsString());
        } else if (json.isJsonArray()) {
            List<ProviderFactor> factors = new ArrayList<>();
            for (JsonElement element : json.getAsJsonArray()) {
                factors.add(deserializeFactor(element, context));
            }
            return new AssertionData.Challenge(factors);
        } else {
            throw new JsonParseException("Unexpected data payload in OneLogin response: " + json);
        }
    }

    private static ProviderFactor deserializeFactor(
            JsonElement element, JsonDeserializationContext context) {
        if (!element.isJsonObject()) {
            throw new JsonParseException("MFA factor is not a JSON object: " + element);
        }
        ProviderFactor factor = context.deserialize(element, ProviderFactor.class);
        if (isNull(factor.stateToken())) {
            throw new JsonParseException("MFA factor is missing state_token");
        }
        if (nonNullDevices(factor).stream().anyMatch(AssertionDataDeserializer::isInvalid)) {
            throw new JsonParseException("MFA factor has a device entry without device_id");
        }
        return factor;
    }

    private static List<ProviderDevice> nonNullDevices(ProviderFactor factor) {
        return isNull(factor.devices()) ? List.of() : factor.devices();
    }

    private static boolean isInvalid(ProviderDevice device) {
        return isNull(device) || isNull(device.deviceId());
    }
}
