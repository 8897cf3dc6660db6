package ou.capstone.sunseat.airport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory airport store seeded from an OpenFlights-format CSV on the classpath.
 * <p>
 * Resource location: src/main/resources/data/airports.csv
 * Columns: ID,Name,City,Country,IATA,ICAO,Latitude,Longitude,Altitude,Timezone,DST,TzDatabase.
 * {@code \N} marks a missing value. Rows without an IATA code or coordinates are skipped.
 */
public class AirportDirectory {
    private static final Logger logger = LoggerFactory.getLogger(AirportDirectory.class);

    public static final String DEFAULT_RESOURCE_PATH = "/data/airports.csv";

    private static final int SEARCH_LIMIT = 5;
    private static final String OPENFLIGHTS_NULL = "\\N";

    private static final int COL_NAME = 1;
    private static final int COL_CITY = 2;
    private static final int COL_COUNTRY = 3;
    private static final int COL_IATA = 4;
    private static final int COL_ICAO = 5;
    private static final int COL_LAT = 6;
    private static final int COL_LON = 7;
    private static final int COL_TZ_DATABASE = 11;

    // Indexes for fast lookups
    private final Map<String, Airport> byIata = new ConcurrentHashMap<>();
    private final Map<String, Airport> byIcao = new ConcurrentHashMap<>();

    /** Creates an empty directory. */
    public AirportDirectory() {
    }

    /**
     * Creates a directory seeded from a classpath resource.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static AirportDirectory fromClasspath(final String resourcePath) {
        final AirportDirectory directory = new AirportDirectory();
        directory.loadCsv(resourcePath);
        return directory;
    }

    private void loadCsv(final String resourcePath) {
        final InputStream is = AirportDirectory.class.getResourceAsStream(resourcePath);
        if (is == null) {
            throw new IllegalStateException("CSV not found on classpath: " + resourcePath);
        }

        int loaded = 0;
        int skipped = 0;

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            String line;
            boolean first = true;
            while ((line = reader.readLine()) != null) {
                // Strip BOM if present
                if (first && !line.isEmpty() && line.charAt(0) == '\uFEFF') line = line.substring(1);
                first = false;
                if (line.isBlank()) continue;

                final Optional<Airport> airport = parseRow(parseCsvLine(line));
                if (airport.isEmpty()) {
                    skipped++;
                    continue;
                }
                put(airport.get());
                loaded++;
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load airport CSV: " + resourcePath, e);
        }

        logger.info("Loaded {} airports from {}", loaded, resourcePath);
        if (skipped > 0) {
            logger.debug("Skipped {} rows without IATA code or coordinates", skipped);
        }
    }

    static Optional<Airport> parseRow(final List<String> cols) {
        if (cols.size() <= COL_LON) return Optional.empty();

        final String iata = nullIfMissing(cols.get(COL_IATA));
        if (iata == null) return Optional.empty();

        final double lat = parseDoubleOrNaN(cols.get(COL_LAT));
        final double lon = parseDoubleOrNaN(cols.get(COL_LON));
        if (!(lat >= -90.0 && lat <= 90.0) || !(lon >= -180.0 && lon <= 180.0)) {
            return Optional.empty();
        }

        final String tz = cols.size() > COL_TZ_DATABASE ? nullIfMissing(cols.get(COL_TZ_DATABASE)) : null;
        return Optional.of(new Airport(
                iata.toUpperCase(Locale.ROOT),
                upperOrNull(nullIfMissing(cols.get(COL_ICAO))),
                emptyIfNull(nullIfMissing(cols.get(COL_NAME))),
                emptyIfNull(nullIfMissing(cols.get(COL_CITY))),
                emptyIfNull(nullIfMissing(cols.get(COL_COUNTRY))),
                lat, lon,
                emptyIfNull(tz)));
    }

    /** Adds or replaces an airport. */
    public void put(final Airport airport) {
        byIata.put(airport.iata().toUpperCase(Locale.ROOT), airport);
        if (airport.icao() != null && !airport.icao().isBlank()) {
            byIcao.put(airport.icao().toUpperCase(Locale.ROOT), airport);
        }
    }

    public Optional<Airport> findByIata(final String iata) {
        if (iata == null || iata.isBlank()) return Optional.empty();
        return Optional.ofNullable(byIata.get(iata.trim().toUpperCase(Locale.ROOT)));
    }

    public Optional<Airport> findByIcao(final String icao) {
        if (icao == null || icao.isBlank()) return Optional.empty();
        return Optional.ofNullable(byIcao.get(icao.trim().toUpperCase(Locale.ROOT)));
    }

    /**
     * Get an airport by IATA code, falling back to ICAO.
     */
    public Optional<Airport> findByCode(final String code) {
        final Optional<Airport> byIataCode = findByIata(code);
        return byIataCode.isPresent() ? byIataCode : findByIcao(code);
    }

    /**
     * Airports whose IATA code contains the query, case-insensitive, ordered by code, at most 5.
     */
    public List<Airport> search(final String query) {
        if (query == null || query.isBlank()) return List.of();
        final String needle = query.trim().toUpperCase(Locale.ROOT);
        final List<Airport> out = new ArrayList<>();
        for (Airport a : byIata.values()) {
            if (a.iata().contains(needle)) out.add(a);
        }
        out.sort(Comparator.comparing(Airport::iata));
        return out.size() > SEARCH_LIMIT ? List.copyOf(out.subList(0, SEARCH_LIMIT)) : List.copyOf(out);
    }

    public int size() {
        return byIata.size();
    }

    private static String nullIfMissing(final String s) {
        if (s == null) return null;
        final String t = s.trim();
        return (t.isEmpty() || OPENFLIGHTS_NULL.equals(t)) ? null : t;
    }

    private static String emptyIfNull(final String s) {
        return s == null ? "" : s;
    }

    private static String upperOrNull(final String s) {
        return s == null ? null : s.toUpperCase(Locale.ROOT);
    }

    private static double parseDoubleOrNaN(final String s) {
        if (s == null || s.isBlank()) return Double.NaN;
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    /**
     * Minimal CSV parser (handles quotes, commas, and escaped quotes).
     */
    static List<String> parseCsvLine(final String line) {
        List<String> out = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inQuotes) {
                if (c == '\"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '\"') {
                        sb.append('\"');
                        i++;
                    } else inQuotes = false;
                } else {
                    sb.append(c);
                }
            } else {
                if (c == ',') {
                    out.add(sb.toString());
                    sb.setLength(0);
                } else if (c == '\"') {
                    inQuotes = true;
                } else {
                    sb.append(c);
                }
            }
        }
        out.add(sb.toString());
        return out;
    }
}
