package ou.capstone.sunseat.scoring;

import java.util.Locale;

/**
 * What the passenger wants to see.
 */
public enum Preference {
    SUNRISE,
    SUNSET,
    NONE;

    /**
     * Parses a user-supplied preference. Blank means {@link #SUNRISE};
     * anything unrecognised is scored as {@link #NONE}.
     */
    public static Preference parse(final String raw) {
        if (raw == null || raw.isBlank()) {
            return SUNRISE;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "sunrise" -> SUNRISE;
            case "sunset" -> SUNSET;
            default -> NONE;
        };
    }

    /** @return the lower-case name used in output */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
