package ou.capstone.sunseat.scoring;

import java.time.Instant;

import ou.capstone.sunseat.route.GeoPoint;

/**
 * Inputs of one scoring run. Validation happens in {@link SeatScorer}, which
 * reports problems as a {@link ScoringResult} rather than throwing.
 */
public record FlightRequest(GeoPoint origin,
                            GeoPoint destination,
                            Instant departure,
                            int durationMinutes,
                            Preference preference) {
}
