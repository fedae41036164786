package ae.teletronics.custody.adapters.time;

import ae.teletronics.custody.ports.ClockProvider;

import java.time.Clock;
import java.time.Instant;

/** Production clock based on system time (UTC). */
public class SystemClockProvider implements ClockProvider {

    private final Clock clock;

    public SystemClockProvider() {
        this(Clock.systemUTC());
    }

    public SystemClockProvider(Clock clock) {
        this.clock = clock;
    }

    @Override public Instant now() { return clock.instant(); }
}
