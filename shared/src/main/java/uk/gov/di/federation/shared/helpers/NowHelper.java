package uk.gov.di.federation.shared.helpers;

import java.time.Clock;
import java.time.Instant;

public class NowHelper {

    private static final NowClock clock = new NowClock(Clock.systemUTC());

    private NowHelper() {}

    public static NowClock systemClock() {
        return clock;
    }

    public static class NowClock {
        private final Clock clock;

        public NowClock(Clock clock) {
            this.clock = clock;
        }

        public Instant now() {
            return clock.instant();
        }
    }
}
