package uk.gov.di.federation.assertion.entity;

import com.google.gson.annotations.Expose;
import uk.gov.di.federation.shared.validation.Required;

public record ProviderResponse(
        @Expose @Required ResponseStatus status, @Expose AssertionData data) {}
