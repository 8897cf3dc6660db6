package ou.capstone.sunseat.scoring;

import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Whether the sun counts as rising or setting at an instant.
 * <p>
 * Coarse by construction: anything from 05:00 to 12:59 UTC is rising,
 * regardless of where the aircraft is. Local solar time is not considered.
 */
public enum Phase {
    RISING,
    SETTING;

    private static final int FIRST_RISING_HOUR = 5;
    private static final int LAST_RISING_HOUR = 12;

    public static Phase at(final Instant instant) {
        final int hour = instant.atZone(ZoneOffset.UTC).getHour();
        return (hour >= FIRST_RISING_HOUR && hour <= LAST_RISING_HOUR) ? RISING : SETTING;
    }
}
