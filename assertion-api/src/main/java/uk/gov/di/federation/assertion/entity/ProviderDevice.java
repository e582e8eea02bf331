package uk.gov.di.federation.assertion.entity;

import com.google.gson.annotations.Expose;

public record ProviderDevice(@Expose Integer deviceId, @Expose String deviceType) {}
