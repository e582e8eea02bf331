package uk.gov.di.federation.assertion.entity;

import java.time.Duration;
import java.time.Instant;

import static java.util.Objects.nonNull;

public record BearerToken(
        String accessToken,
        String refreshToken,
        Instant createdAt,
        Instant accessExpiresAt,
        Instant refreshExpiresAt) {

    public boolean isAccessTokenUsableAt(Instant now, Duration refreshSkew) {
        return now.plus(refreshSkew).isBefore(accessExpiresAt);
    }

    public boolean isRefreshTokenUsableAt(Instant now) {
        return nonNull(refreshToken)
                && !refreshToken.isBlank()
                && nonNull(refreshExpiresAt)
                && now.isBefore(refreshExpiresAt);
    }

    @Override
    public String toString() {
        return "BearerToken[createdAt="
                + createdAt
                + ", accessExpiresAt="
                + accessExpiresAt
                + ", refreshExpiresAt="
                + refreshExpiresAt
                + "]";
    }
}
