package uk.gov.di.federation.assertion.entity;

import java.util.List;

public record AssertionResult(ResponseStatus status, String samlAssertion, List<Factor> factors) {

    public AssertionResult {
        factors = List.copyOf(factors);
    }

    public static AssertionResult assertion(ResponseStatus status, String samlAssertion) {
        return new AssertionResult(status, samlAssertion, List.of());
    }

    public static AssertionResult challenge(ResponseStatus status, List<Factor> factors) {
        return new AssertionResult(status, "", factors);
    }

    public boolean isMfaRequired() {
        return samlAssertion.isEmpty();
    }
}
