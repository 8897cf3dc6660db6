package ou.capstone.sunseat.print;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ou.capstone.sunseat.SeatQuery;
import ou.capstone.sunseat.SeatResponse;
import ou.capstone.sunseat.airport.Airport;
import ou.capstone.sunseat.route.GeoPoint;
import ou.capstone.sunseat.scoring.Recommendation;
import ou.capstone.sunseat.scoring.ScoringResult;
import ou.capstone.sunseat.scoring.SideScore;
import ou.capstone.sunseat.scoring.SunEvent;

/**
 * Renders results as JSON documents, snake_case keys, pretty-printed.
 * Errors render as {@code {"error": "..."}}.
 */
public final class ResultJsonWriter {

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Airport codes are the resolved IATA codes, not what the user typed.
     */
    public String recommendation(final SeatResponse response) {
        final ScoringResult result = response.result();
        if (!result.isOk() || result.recommendation().isEmpty()) {
            return error(result.message());
        }
        final Recommendation r = result.recommendation().get();
        final SeatQuery query = response.query();

        final ObjectNode root = mapper.createObjectNode();
        root.put("from_airport", response.origin().iata());
        root.put("to_airport", response.destination().iata());
        root.put("departure_date", query.date());
        root.put("departure_time", query.time());
        root.put("duration_minutes", query.duration());
        root.put("preference", r.preference().label());

        final ObjectNode scores = root.putObject("scores");
        scores.set("left_side", side(r.left()));
        scores.set("right_side", side(r.right()));
        scores.put("left_total", r.leftTotal());
        scores.put("right_total", r.rightTotal());
        scores.put("recommended_side", r.recommendedSide().name().toLowerCase(Locale.ROOT));
        scores.put("preference", r.preference().label());
        if (r.sunriseEvent() != null) scores.set("sunrise_event", event(r.sunriseEvent()));
        if (r.sunsetEvent() != null) scores.set("sunset_event", event(r.sunsetEvent()));

        return write(root);
    }

    public String subsolar(final GeoPoint point) {
        return write(latLon(point));
    }

    public String airport(final Airport airport) {
        return write(airportNode(airport));
    }

    public String airports(final List<Airport> airports) {
        final ArrayNode array = mapper.createArrayNode();
        for (Airport a : airports) {
            array.add(airportNode(a));
        }
        return write(array);
    }

    public String error(final String message) {
        final ObjectNode root = mapper.createObjectNode();
        root.put("error", message);
        return write(root);
    }

    private ObjectNode side(final SideScore score) {
        final ObjectNode node = mapper.createObjectNode();
        node.put("sunrise", score.sunrise());
        node.put("sunset", score.sunset());
        return node;
    }

    private ObjectNode event(final SunEvent event) {
        final ObjectNode node = mapper.createObjectNode();
        node.put("time", DateTimeFormatter.ISO_INSTANT.format(event.instant()));
        node.set("location", latLon(event.position()));
        return node;
    }

    private ObjectNode latLon(final GeoPoint point) {
        final ObjectNode node = mapper.createObjectNode();
        node.put("lat", point.getLatitude());
        node.put("lon", point.getLongitude());
        return node;
    }

    private ObjectNode airportNode(final Airport a) {
        final ObjectNode node = mapper.createObjectNode();
        node.put("iata", a.iata());
        node.put("name", a.name());
        node.put("city", a.city());
        node.put("country", a.country());
        node.put("lat", a.latitude());
        node.put("lon", a.longitude());
        node.put("tz", a.timeZone());
        return node;
    }

    private String write(final Object node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (final JsonProcessingException e) {
            // Tree nodes built here always serialize
            throw new IllegalStateException("Could not serialize result", e);
        }
    }
}
