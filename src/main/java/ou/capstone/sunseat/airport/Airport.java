package ou.capstone.sunseat.airport;

import ou.capstone.sunseat.route.GeoPoint;

/**
 * An airport known by IATA code. City, country and time zone may be empty
 * when the source did not provide them.
 */
public record Airport(String iata, String icao, String name, String city, String country,
                      double latitude, double longitude, String timeZone) {

    public GeoPoint location() {
        return new GeoPoint(latitude, longitude);
    }

    @Override
    public String toString() {
        return iata + " (" + name + ") " + location();
    }
}
