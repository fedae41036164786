package ae.teletronics.custody.ports;

import java.time.Instant;

/**
 * Testable clock abstraction. Every expiry decision reads "now" from here.
 */
public interface ClockProvider {
    Instant now();
}
