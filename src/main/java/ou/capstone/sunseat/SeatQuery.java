package ou.capstone.sunseat;

/**
 * A seat recommendation request as the user typed it.
 *
 * @param fromCode   origin airport code
 * @param toCode     destination airport code
 * @param date       departure date, yyyy-MM-dd (UTC)
 * @param time       departure time, HH:mm (UTC)
 * @param duration   flight time in minutes
 * @param preference "sunrise", "sunset" or "none"; null means sunrise
 */
public record SeatQuery(String fromCode,
                        String toCode,
                        String date,
                        String time,
                        int duration,
                        String preference) {
}
