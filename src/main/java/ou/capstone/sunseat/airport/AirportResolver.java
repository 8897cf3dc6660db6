package ou.capstone.sunseat.airport;

import java.util.List;
import java.util.Optional;

import ou.capstone.sunseat.route.GeoPoint;

/**
 * Turns an airport code into an airport and its coordinates.
 * Implementations report failure as an empty result, never by throwing.
 */
public interface AirportResolver {

    /**
     * @param code IATA code (case-insensitive); ICAO codes are accepted where the source knows them
     * @return the airport, or empty when unknown
     */
    Optional<Airport> lookup(String code);

    /**
     * Finds airports whose IATA code contains the query (at most 5).
     */
    List<Airport> search(String query);

    default Optional<GeoPoint> resolve(final String code) {
        return lookup(code).map(Airport::location);
    }
}
