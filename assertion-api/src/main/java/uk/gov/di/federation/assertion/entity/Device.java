package uk.gov.di.federation.assertion.entity;

public record Device(int deviceId, String deviceType, boolean requiresOtpToken) {}
