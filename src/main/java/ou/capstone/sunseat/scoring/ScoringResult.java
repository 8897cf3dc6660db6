package ou.capstone.sunseat.scoring;

import java.util.Optional;

/**
 * Result of a scoring request: either a recommendation or a tagged error.
 */
public final class ScoringResult {
    private final boolean ok;
    private final String message;
    private final Recommendation recommendation;
    private final ScoringError error;

    private ScoringResult(boolean ok, String message, Recommendation recommendation, ScoringError error) {
        this.ok = ok;
        this.message = message;
        this.recommendation = recommendation;
        this.error = error;
    }

    public static ScoringResult success(final Recommendation recommendation) {
        return new ScoringResult(true, "OK", recommendation, null);
    }

    public static ScoringResult error(final ScoringError error) {
        return error(error, error.defaultMessage());
    }

    public static ScoringResult error(final ScoringError error, final String message) {
        return new ScoringResult(false, message, null, error);
    }

    public boolean isOk() {
        return ok;
    }

    public String message() {
        return message;
    }

    public Optional<Recommendation> recommendation() {
        return Optional.ofNullable(recommendation);
    }

    public Optional<ScoringError> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return ok ? "ScoringResult{ok, " + recommendation + "}" : "ScoringResult{" + error + ": " + message + "}";
    }
}
