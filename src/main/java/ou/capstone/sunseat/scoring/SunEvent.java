package ou.capstone.sunseat.scoring;

import java.time.Instant;

import ou.capstone.sunseat.route.GeoPoint;

/** First minute of a flight at which a rising (or setting) sun was visible, and where the aircraft was. */
public record SunEvent(Instant instant, GeoPoint position) {
}
