package uk.gov.di.federation.assertion.entity;

import uk.gov.di.federation.shared.services.ConfigurationService;

import java.time.Duration;
import java.util.Objects;

/** How many times a pending push confirmation is checked, and how long to wait in between. */
public record PollingPolicy(int maxAttempts, Duration attemptInterval) {

    public PollingPolicy {
        Objects.requireNonNull(attemptInterval, "attemptInterval");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (attemptInterval.isNegative()) {
            throw new IllegalArgumentException("attemptInterval must not be negative");
        }
    }

    public static PollingPolicy fromConfiguration(ConfigurationService configurationService) {
        return new PollingPolicy(
                configurationService.getVerifyFactorMaxAttempts(),
                Duration.ofMillis(configurationService.getVerifyFactorAttemptInterval()));
    }
}
