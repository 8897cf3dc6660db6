package ou.capstone.sunseat.route;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.sunseat.sun.SunPositionCache;

/**
 * FlightPathSampler
 *
 * - Steps through a flight one minute at a time, minute 0 through the duration inclusive
 * - Positions the aircraft by linear interpolation of latitude and longitude (not great-circle)
 * - Looks the sun up through the run's {@link SunPositionCache}
 *
 * Each call to {@link #iterator()} starts again from departure.
 */
public final class FlightPathSampler implements Iterable<TimeSample> {
    private static final Logger logger = LoggerFactory.getLogger(FlightPathSampler.class);

    private static final Duration STEP = Duration.ofMinutes(1);

    private final GeoPoint origin;
    private final GeoPoint destination;
    private final Instant departure;
    private final int durationMinutes;
    private final SunPositionCache sunCache;

    public FlightPathSampler(final GeoPoint origin,
                             final GeoPoint destination,
                             final Instant departure,
                             final int durationMinutes,
                             final SunPositionCache sunCache) {
        if (durationMinutes < 0) {
            throw new IllegalArgumentException("Duration must not be negative, got: " + durationMinutes);
        }
        this.origin = origin;
        this.destination = destination;
        this.departure = departure;
        this.durationMinutes = durationMinutes;
        this.sunCache = sunCache;
    }

    /** @return number of samples the sequence yields (duration + 1) */
    public int sampleCount() {
        return durationMinutes + 1;
    }

    /**
     * Aircraft position at the given minute.
     * Latitude and longitude are interpolated independently.
     */
    public GeoPoint positionAt(final int minute) {
        // Endpoints are returned as-is so rounding never moves them
        if (minute <= 0) return origin;
        if (minute >= durationMinutes) return destination;

        final double progress = durationMinutes > 0 ? (double) minute / durationMinutes : 0.0;
        final double lat = origin.latDeg + (destination.latDeg - origin.latDeg) * progress;
        final double lon = origin.lonDeg + (destination.lonDeg - origin.lonDeg) * progress;
        return new GeoPoint(lat, lon);
    }

    @Override
    public Iterator<TimeSample> iterator() {
        logger.debug("Sampling {} minutes from {} to {} departing {}",
                durationMinutes, origin, destination, departure);
        return new Iterator<>() {
            private int minute = 0;

            @Override
            public boolean hasNext() {
                return minute <= durationMinutes;
            }

            @Override
            public TimeSample next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("Flight ended at minute " + durationMinutes);
                }
                final Instant at = departure.plus(STEP.multipliedBy(minute));
                final TimeSample sample = new TimeSample(at, positionAt(minute), sunCache.get(at));
                minute++;
                return sample;
            }
        };
    }
}
