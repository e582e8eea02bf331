package uk.gov.di.federation.assertion.entity;

public record VerificationResult(ResponseStatus status, String samlAssertion) {}
