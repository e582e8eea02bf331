package uk.gov.di.federation.assertion.services;

import uk.gov.di.federation.assertion.entity.BearerToken;
import uk.gov.di.federation.assertion.exceptions.BearerTokenUnavailableException;

/**
 * Source of the bearer token that authorises calls to the OneLogin API.
 *
 * <p>Implementations must be safe for concurrent use and must hand out a token that is not about
 * to expire, refreshing it first where necessary.
 */
public interface BearerTokenSupplier {
    BearerToken currentToken() throws BearerTokenUnavailableException;
}
