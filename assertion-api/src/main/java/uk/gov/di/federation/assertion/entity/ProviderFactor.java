package uk.gov.di.federation.assertion.entity;

import com.google.gson.annotations.Expose;

import java.util.List;

public record ProviderFactor(
        @Expose String stateToken,
        @Expose List<ProviderDevice> devices,
        @Expose String callbackUrl,
        @Expose FactorUser user) {}
