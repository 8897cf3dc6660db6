package ou.capstone.sunseat.route;

import java.time.Instant;

/**
 * One minute of a simulated flight: when, where the aircraft is, and where the sun is overhead.
 */
public record TimeSample(Instant instant, GeoPoint aircraftPosition, GeoPoint sunSubPoint) {
}
