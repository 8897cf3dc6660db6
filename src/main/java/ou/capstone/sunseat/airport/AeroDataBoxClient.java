package ou.capstone.sunseat.airport;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ou.capstone.sunseat.SunSeatConfig;
import ou.capstone.sunseat.exceptions.SunSeatException;

/**
 * Looks airports up by IATA code on the AeroDataBox API (via api.market).
 * <p>
 * "Not found" covers a missing API key, a non-2xx status, an empty body and
 * a response without coordinates. Transport and JSON failures are thrown.
 */
public class AeroDataBoxClient
{
    private static final Logger logger = LoggerFactory.getLogger(AeroDataBoxClient.class);

    private static final String AIRPORT_PATH = "/airports/iata/";
    private static final String API_KEY_HEADER = "x-api-market-key";

    private static final ObjectMapper mapper = new ObjectMapper();

    private final HttpClient httpClient;
    private final String host;
    private final String apiKey;
    private final Duration timeout;

    public AeroDataBoxClient( final SunSeatConfig config )
    {
        this( HttpClient.newBuilder()
                        .connectTimeout( Duration.ofSeconds( config.httpTimeoutSeconds() ) )
                        .build(),
                config.aeroDataApiHost(),
                config.aeroDataApiKey(),
                Duration.ofSeconds( config.httpTimeoutSeconds() ) );
    }

    AeroDataBoxClient( final HttpClient httpClient, final String host, final String apiKey,
                       final Duration timeout )
    {
        this.httpClient = httpClient;
        this.host = host;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    /**
     * Fetches one airport.
     *
     * @param iataCode three-letter code, case-insensitive
     * @return the airport, or empty when the API does not know it
     * @throws SunSeatException if the request could not be made or the body is not JSON
     */
    public Optional<Airport> fetch( final String iataCode ) throws SunSeatException
    {
        final String code = iataCode.trim().toUpperCase( Locale.ROOT );
        if ( apiKey == null )
        {
            logger.warn( "AERODATA_API_KEY not set; skipping remote lookup for {}", code );
            return Optional.empty();
        }

        final URI uri = URI.create( host + AIRPORT_PATH
                + URLEncoder.encode( code, StandardCharsets.UTF_8 ) );
        final HttpRequest request = HttpRequest.newBuilder( uri )
                .timeout( timeout )
                .header( API_KEY_HEADER, apiKey )
                .header( "Accept", "application/json" )
                .GET()
                .build();

        logger.debug( "Requesting {}", uri );
        final HttpResponse<String> response;
        try
        {
            response = httpClient.send( request, BodyHandlers.ofString() );
        }
        catch ( final IOException e )
        {
            throw new SunSeatException( "AeroDataBox request failed for " + code, e );
        }
        catch ( final InterruptedException e )
        {
            Thread.currentThread().interrupt();
            throw new SunSeatException( "Interrupted while looking up " + code, e );
        }

        final int status = response.statusCode();
        if ( status < 200 || status >= 300 )
        {
            logger.warn( "AeroDataBox error {} for {}", status, code );
            return Optional.empty();
        }
        final String body = response.body();
        if ( body == null || body.isBlank() )
        {
            logger.warn( "AeroDataBox returned empty response for {}", code );
            return Optional.empty();
        }
        return parseAirport( code, body );
    }

    /**
     * Maps an AeroDataBox airport document to an {@link Airport}.
     *
     * @return empty when latitude or longitude is missing or out of range
     */
    static Optional<Airport> parseAirport( final String code, final String json ) throws SunSeatException
    {
        final JsonNode root;
        try
        {
            root = mapper.readTree( json );
        }
        catch ( final JsonProcessingException e )
        {
            throw new SunSeatException( "Malformed AeroDataBox response for " + code, e );
        }

        final JsonNode location = root.path( "location" );
        final JsonNode lat = location.path( "lat" );
        final JsonNode lon = location.path( "lon" );
        if ( !lat.isNumber() || !lon.isNumber() )
        {
            logger.warn( "Missing coordinates for airport {}: {}", code, location );
            return Optional.empty();
        }
        final double latitude = lat.asDouble();
        final double longitude = lon.asDouble();
        if ( Math.abs( latitude ) > 90.0 || Math.abs( longitude ) > 180.0 )
        {
            logger.warn( "Out-of-range coordinates for airport {}: {}", code, location );
            return Optional.empty();
        }

        return Optional.of( new Airport(
                code,
                textOrNull( root, "icao" ),
                firstText( root, "fullName", "shortName", "name" ),
                root.path( "municipalityName" ).asText( "" ),
                root.path( "country" ).path( "name" ).asText( "" ),
                latitude,
                longitude,
                root.path( "timeZone" ).asText( "" ) ) );
    }

    private static String firstText( final JsonNode node, final String... fields )
    {
        for ( String f : fields )
        {
            final String v = node.path( f ).asText( "" );
            if ( !v.isBlank() )
            {
                return v;
            }
        }
        return "";
    }

    private static String textOrNull( final JsonNode node, final String field )
    {
        final String v = node.path( field ).asText( "" );
        return v.isBlank() ? null : v.toUpperCase( Locale.ROOT );
    }
}
