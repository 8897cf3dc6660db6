package ou.capstone.sunseat.scoring;

import java.util.Optional;

import ou.capstone.sunseat.route.GeoPoint;
import ou.capstone.sunseat.route.Geodesy;
import ou.capstone.sunseat.route.TimeSample;

/**
 * Decides, for one minute of flight, whether the sun is up and on which side of the aircraft.
 * <p>
 * The altitude used here is an approximation: 90 minus half the summed
 * latitude and longitude gaps between aircraft and sub-solar point. It grows
 * as the sun gets closer overhead but is not a spherical altitude, and it
 * mis-ranks samples near the antimeridian and at high latitudes.
 */
public final class SampleClassifier {

    private final GeoPoint destination;

    public SampleClassifier(final GeoPoint destination) {
        this.destination = destination;
    }

    /**
     * @return the classified sample, or empty when the sun is at or below the horizon
     */
    public Optional<ClassifiedSample> classify(final TimeSample sample) {
        final GeoPoint plane = sample.aircraftPosition();
        final GeoPoint sun = sample.sunSubPoint();

        final double altitude = approximateAltitude(plane, sun);
        if (altitude <= 0) {
            return Optional.empty();
        }

        final double bearingToDestination = Geodesy.bearing(plane, destination);
        final double bearingToSun = Geodesy.bearing(plane, sun);

        return Optional.of(new ClassifiedSample(
                altitude,
                sideOf(bearingToSun, bearingToDestination),
                Phase.at(sample.instant()),
                altitude / 90.0));
    }

    /** Approximate sun altitude in degrees, clamped to [0, 90]. */
    static double approximateAltitude(final GeoPoint plane, final GeoPoint sun) {
        final double latDiff = Math.abs(sun.latDeg - plane.latDeg);
        final double lonDiff = Math.abs(sun.lonDeg - plane.lonDeg);
        return Math.max(0.0, 90.0 - (latDiff + lonDiff) / 2.0);
    }

    /**
     * Facing the destination, the sun is on the right when its bearing is
     * clockwise of the destination bearing.
     */
    static Side sideOf(final double bearingToSun, final double bearingToDestination) {
        final double angleDiff = ((bearingToSun - bearingToDestination + 540.0) % 360.0) - 180.0;
        return angleDiff > 0 ? Side.RIGHT : Side.LEFT;
    }
}
