package ou.capstone.sunseat.scoring;

/**
 * Ways a seat recommendation can fail. Reported as data, never thrown.
 */
public enum ScoringError {
    /** An airport code did not resolve to coordinates. */
    NOT_FOUND("Airport not found"),
    /** Origin and destination are the same place. */
    SAME_AIRPORT("Cannot travel to the same airport"),
    /** Duration was zero or negative. */
    INVALID_DURATION("Flight duration must be greater than 0 minutes"),
    /** Date or time could not be parsed. */
    INVALID_TIMESTAMP("invalid datetime"),
    /** Anything unexpected while scoring. */
    CALCULATION_FAILED("Calculation failed");

    private final String defaultMessage;

    ScoringError(final String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
