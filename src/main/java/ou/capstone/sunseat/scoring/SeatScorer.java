package ou.capstone.sunseat.scoring;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.sunseat.route.FlightPathSampler;
import ou.capstone.sunseat.route.GeoPoint;
import ou.capstone.sunseat.route.TimeSample;
import ou.capstone.sunseat.sun.SubSolarPointCalculator;
import ou.capstone.sunseat.sun.SunPositionCache;
import ou.capstone.sunseat.sun.SunPositionProvider;

/**
 * Scores both sides of the aircraft for sun visibility over a whole flight.
 * <p>
 * Each call builds its own {@link SunPositionCache}, sampler and aggregator,
 * so calls are independent of each other and may run on separate threads.
 */
public final class SeatScorer {
    private static final Logger logger = LoggerFactory.getLogger(SeatScorer.class);

    private final SunPositionProvider sunPositions;

    public SeatScorer() {
        this(new SubSolarPointCalculator());
    }

    public SeatScorer(final SunPositionProvider sunPositions) {
        this.sunPositions = sunPositions;
    }

    public ScoringResult scoreFlight(final FlightRequest request) {
        return scoreFlight(request.origin(), request.destination(), request.departure(),
                request.durationMinutes(), request.preference());
    }

    /**
     * Samples the flight minute by minute and recommends a side.
     *
     * @return a recommendation, or {@link ScoringError#SAME_AIRPORT} /
     *         {@link ScoringError#INVALID_DURATION}
     */
    public ScoringResult scoreFlight(final GeoPoint origin,
                                     final GeoPoint destination,
                                     final Instant departure,
                                     final int durationMinutes,
                                     final Preference preference) {
        if (origin.equals(destination)) {
            logger.warn("Origin and destination are both {}", origin);
            return ScoringResult.error(ScoringError.SAME_AIRPORT);
        }
        if (durationMinutes <= 0) {
            logger.warn("Rejecting non-positive flight duration: {} minutes", durationMinutes);
            return ScoringResult.error(ScoringError.INVALID_DURATION);
        }

        final long t0 = System.currentTimeMillis();

        final SunPositionCache sunCache = new SunPositionCache(sunPositions);
        final FlightPathSampler sampler =
                new FlightPathSampler(origin, destination, departure, durationMinutes, sunCache);
        final SampleClassifier classifier = new SampleClassifier(destination);
        final ScoreAggregator aggregator = new ScoreAggregator();

        for (TimeSample sample : sampler) {
            final Optional<ClassifiedSample> classified = classifier.classify(sample);
            classified.ifPresent(c -> aggregator.add(c, sample.instant(), sample.aircraftPosition()));
        }

        final Recommendation recommendation = aggregator.recommend(preference);

        if (logger.isDebugEnabled()) {
            logger.debug("Scored {} of {} samples in {} ms ({} sun computations)",
                    aggregator.counted(), sampler.sampleCount(),
                    System.currentTimeMillis() - t0, sunCache.computations());
            logSummary(recommendation);
        }
        return ScoringResult.success(recommendation);
    }

    private static void logSummary(final Recommendation r) {
        logger.debug("Preference: {}", r.preference().label());
        logger.debug("Left side - sunrise: {}, sunset: {}, total: {}",
                fmt(r.left().sunrise()), fmt(r.left().sunset()), fmt(r.leftTotal()));
        logger.debug("Right side - sunrise: {}, sunset: {}, total: {}",
                fmt(r.right().sunrise()), fmt(r.right().sunset()), fmt(r.rightTotal()));
        logger.debug("Recommended side: {}", r.recommendedSide());
        if (r.sunriseEvent() != null) {
            logger.debug("Sunrise event: {} at {}", r.sunriseEvent().instant(), r.sunriseEvent().position());
        }
        if (r.sunsetEvent() != null) {
            logger.debug("Sunset event: {} at {}", r.sunsetEvent().instant(), r.sunsetEvent().position());
        }
    }

    private static String fmt(final double v) {
        return String.format(Locale.US, "%.2f", v);
    }
}
