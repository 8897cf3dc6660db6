package ou.capstone.sunseat;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.sunseat.airport.Airport;
import ou.capstone.sunseat.airport.AirportResolver;
import ou.capstone.sunseat.route.GeoPoint;
import ou.capstone.sunseat.route.Geodesy;
import ou.capstone.sunseat.scoring.Preference;
import ou.capstone.sunseat.scoring.ScoringError;
import ou.capstone.sunseat.scoring.ScoringResult;
import ou.capstone.sunseat.scoring.SeatScorer;
import ou.capstone.sunseat.sun.SunPositionProvider;

/**
 * Entry point for seat recommendations by airport code.
 * <p>
 * Resolves both airports once, validates the request, and hands the
 * coordinates to {@link SeatScorer}. Every failure comes back as a
 * {@link ScoringResult} error; nothing is thrown to the caller.
 */
public final class SeatRecommendationService {
    private static final Logger logger = LoggerFactory.getLogger(SeatRecommendationService.class);

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("H:mm", Locale.ROOT);

    private final AirportResolver airports;
    private final SeatScorer scorer;
    private final SunPositionProvider sunPositions;

    public SeatRecommendationService(final AirportResolver airports,
                                     final SeatScorer scorer,
                                     final SunPositionProvider sunPositions) {
        this.airports = airports;
        this.scorer = scorer;
        this.sunPositions = sunPositions;
    }

    public ScoringResult recommend(final SeatQuery query) {
        return respond(query).result();
    }

    /**
     * Scores a request and reports which airports its codes resolved to.
     */
    public SeatResponse respond(final SeatQuery query) {
        logger.info("Seat recommendation: {} to {} on {} {} UTC, {} min, preference {}",
                query.fromCode(), query.toCode(), query.date(), query.time(),
                query.duration(), query.preference());

        final String fromCode = normalizeCode(query.fromCode());
        final String toCode = normalizeCode(query.toCode());

        // Step 1: resolve airports (once each, before any sampling)
        final Optional<Airport> from = airports.lookup(fromCode);
        final Optional<Airport> to = airports.lookup(toCode);
        final Airport origin = from.orElse(null);
        final Airport destination = to.orElse(null);
        if (origin == null || destination == null) {
            final String missing = origin == null ? fromCode : toCode;
            logger.warn("Airport not found: {}", missing);
            return new SeatResponse(query, origin, destination,
                    ScoringResult.error(ScoringError.NOT_FOUND, "Airport not found: " + missing));
        }
        return new SeatResponse(query, origin, destination, score(query, fromCode, toCode, origin, destination));
    }

    private ScoringResult score(final SeatQuery query, final String fromCode, final String toCode,
                                final Airport origin, final Airport destination) {
        final GeoPoint from = origin.location();
        final GeoPoint to = destination.location();

        // Step 2: validate
        if (fromCode.equals(toCode) || from.equals(to)) {
            return ScoringResult.error(ScoringError.SAME_AIRPORT);
        }
        if (query.duration() <= 0) {
            return ScoringResult.error(ScoringError.INVALID_DURATION);
        }
        final Optional<Instant> departure = parseUtc(query.date(), query.time());
        if (departure.isEmpty()) {
            return ScoringResult.error(ScoringError.INVALID_TIMESTAMP,
                    "Invalid departure date/time: " + query.date() + " " + query.time());
        }

        final Preference preference = Preference.parse(query.preference());
        if (preference == Preference.NONE && query.preference() != null
                && !"none".equalsIgnoreCase(query.preference().trim())) {
            logger.warn("Unknown preference '{}', scoring without a preference", query.preference());
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Route {} -> {} is {} km", origin, destination,
                    Math.round(Geodesy.greatCircleDistanceKm(from, to)));
        }

        // Step 3: score
        try {
            return scorer.scoreFlight(from, to, departure.get(), query.duration(), preference);
        } catch (final RuntimeException e) {
            logger.error("Seat scoring failed", e);
            return ScoringResult.error(ScoringError.CALCULATION_FAILED,
                    ScoringError.CALCULATION_FAILED.defaultMessage() + ": " + e.getMessage());
        }
    }

    /**
     * Sub-solar point at a UTC date and time.
     *
     * @return empty when the date or time cannot be parsed
     */
    public Optional<GeoPoint> subsolar(final String date, final String time) {
        return parseUtc(date, time).map(sunPositions::subSolarPoint);
    }

    /** Parses {@code yyyy-MM-dd} and {@code HH:mm} as a UTC instant. */
    static Optional<Instant> parseUtc(final String date, final String time) {
        if (date == null || time == null) {
            return Optional.empty();
        }
        try {
            final LocalDate d = LocalDate.parse(date.trim(), DATE);
            final LocalTime t = LocalTime.parse(time.trim(), TIME);
            return Optional.of(d.atTime(t).toInstant(ZoneOffset.UTC));
        } catch (final DateTimeParseException e) {
            logger.warn("Could not parse date/time '{} {}': {}", date, time, e.getMessage());
            return Optional.empty();
        }
    }

    private static String normalizeCode(final String code) {
        return code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
    }
}
