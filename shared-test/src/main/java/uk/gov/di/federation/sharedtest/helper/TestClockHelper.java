package uk.gov.di.federation.sharedtest.helper;

import uk.gov.di.federation.shared.helpers.NowHelper.NowClock;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

public class TestClockHelper {

    public static final Instant FIXED_INSTANT = Instant.parse("2007-12-03T10:15:30.00Z");

    private TestClockHelper() {}

    public static NowClock getInstance() {
        return new NowClock(Clock.fixed(FIXED_INSTANT, ZoneId.of("UTC")));
    }
}
