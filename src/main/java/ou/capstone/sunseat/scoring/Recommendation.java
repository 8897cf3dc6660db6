package ou.capstone.sunseat.scoring;

/**
 * Outcome of a scoring run.
 * <p>
 * {@code sunriseEvent} and {@code sunsetEvent} are null when no visible
 * rising/setting minute occurred during the flight.
 */
public record Recommendation(SideScore left,
                             SideScore right,
                             double leftTotal,
                             double rightTotal,
                             Side recommendedSide,
                             Preference preference,
                             SunEvent sunriseEvent,
                             SunEvent sunsetEvent) {
}
