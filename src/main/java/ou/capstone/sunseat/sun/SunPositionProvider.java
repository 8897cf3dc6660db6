package ou.capstone.sunseat.sun;

import java.time.Instant;

import ou.capstone.sunseat.route.GeoPoint;

/**
 * Supplies the sub-solar point (the spot on Earth with the sun at zenith)
 * for a UTC instant.
 */
@FunctionalInterface
public interface SunPositionProvider {

    /**
     * @param instant UTC instant
     * @return the sub-solar point at that instant
     */
    GeoPoint subSolarPoint(Instant instant);
}
