package ou.capstone.sunseat.airport;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.sunseat.exceptions.SunSeatException;

/**
 * Resolves airports from the local directory, falling back to the remote
 * lookup and caching what it finds there.
 */
public final class CachingAirportResolver implements AirportResolver {
    private static final Logger logger = LoggerFactory.getLogger(CachingAirportResolver.class);

    private static final int IATA_LENGTH = 3;

    private final AirportDirectory directory;
    private final AeroDataBoxClient remote;

    /**
     * @param remote may be null to resolve from the directory only
     */
    public CachingAirportResolver(final AirportDirectory directory, final AeroDataBoxClient remote) {
        this.directory = directory;
        this.remote = remote;
    }

    @Override
    public Optional<Airport> lookup(final String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        final String upper = code.trim().toUpperCase(Locale.ROOT);

        final Optional<Airport> local = directory.findByCode(upper);
        if (local.isPresent()) {
            logger.debug("Resolved {} from local directory", upper);
            return local;
        }
        if (remote == null) {
            logger.debug("No remote lookup configured; {} not found", upper);
            return Optional.empty();
        }

        logger.info("{} not in local directory; trying remote lookup", upper);
        try {
            final Optional<Airport> fetched = remote.fetch(upper);
            fetched.ifPresent(a -> {
                directory.put(a);
                logger.info("Cached airport {}", a);
            });
            return fetched;
        } catch (SunSeatException e) {
            logger.warn("Remote lookup failed for {}: {}", upper, e.getMessage());
            if (logger.isDebugEnabled()) {
                logger.debug("Stack trace for failed lookup:", e);
            }
            return Optional.empty();
        }
    }

    /**
     * Searches the directory; a three-letter query with no local match is
     * tried as an exact code against the remote lookup.
     */
    @Override
    public List<Airport> search(final String query) {
        final List<Airport> results = directory.search(query);
        if (results.isEmpty() && query != null && query.trim().length() == IATA_LENGTH) {
            return lookup(query).map(List::of).orElse(List.of());
        }
        return results;
    }
}
