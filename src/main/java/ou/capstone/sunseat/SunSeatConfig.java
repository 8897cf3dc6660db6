package ou.capstone.sunseat;

import java.util.Map;

import ou.capstone.sunseat.airport.AirportDirectory;

/**
 * Process configuration, read from environment variables and system properties.
 *
 * @param aeroDataApiKey      key for the AeroDataBox remote lookup; null disables it
 * @param aeroDataApiHost     base URL of the AeroDataBox API
 * @param httpTimeoutSeconds  per-request timeout for remote lookups
 * @param airportResource     classpath location of the bundled airport CSV
 */
public record SunSeatConfig(String aeroDataApiKey,
                            String aeroDataApiHost,
                            int httpTimeoutSeconds,
                            String airportResource) {

    public static final String ENV_API_KEY = "AERODATA_API_KEY";
    public static final String ENV_API_HOST = "AERODATA_API_HOST";
    public static final String ENV_HTTP_TIMEOUT = "SUNSEAT_HTTP_TIMEOUT_SECONDS";
    public static final String PROP_AIRPORT_RESOURCE = "SunSeat.AirportResource";

    public static final String DEFAULT_API_HOST = "https://prod.api.market/api/v1/aedbx/aerodatabox";
    public static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 5;

    /** Reads the configuration of the running process. */
    public static SunSeatConfig fromEnvironment() {
        return fromMap(System.getenv(),
                System.getProperty(PROP_AIRPORT_RESOURCE, AirportDirectory.DEFAULT_RESOURCE_PATH));
    }

    static SunSeatConfig fromMap(final Map<String, String> env, final String airportResource) {
        final String key = env.get(ENV_API_KEY);
        final String timeoutRaw = env.getOrDefault(ENV_HTTP_TIMEOUT, String.valueOf(DEFAULT_HTTP_TIMEOUT_SECONDS));
        int timeout;
        try {
            timeout = Integer.parseInt(timeoutRaw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(ENV_HTTP_TIMEOUT + " must be an integer, got: " + timeoutRaw, e);
        }
        if (timeout <= 0) {
            throw new IllegalStateException(ENV_HTTP_TIMEOUT + " must be positive, got: " + timeout);
        }
        return new SunSeatConfig(
                (key == null || key.isBlank()) ? null : key.trim(),
                env.getOrDefault(ENV_API_HOST, DEFAULT_API_HOST),
                timeout,
                airportResource);
    }

    public boolean remoteLookupEnabled() {
        return aeroDataApiKey != null;
    }

    @Override
    public String toString() {
        // Never print the key itself
        return String.format("SunSeatConfig{remoteLookup=%s, host=%s, httpTimeoutSeconds=%d, airportResource=%s}",
                remoteLookupEnabled(), aeroDataApiHost, httpTimeoutSeconds, airportResource);
    }
}
