package uk.gov.di.federation.assertion.entity;

import java.util.List;

/**
 * The {@code data} member of a provider response. A JSON string is the SAML assertion itself, a
 * JSON array is the list of MFA factors still to be completed.
 */
public sealed interface AssertionData permits AssertionData.Assertion, AssertionData.Challenge {

    record Assertion(String samlAssertion) implements AssertionData {}

    record Challenge(List<ProviderFactor> factors) implements AssertionData {}
}
