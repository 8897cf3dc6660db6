package ou.capstone.sunseat.sun;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.sunseat.route.GeoPoint;

/**
 * Minute-resolution memo of sub-solar points for a single scoring run.
 * <p>
 * Not thread-safe; every run creates its own instance.
 */
public final class SunPositionCache {
    private static final Logger logger = LoggerFactory.getLogger(SunPositionCache.class);

    private static final DateTimeFormatter MINUTE_KEY =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final SunPositionProvider provider;
    private final Map<String, GeoPoint> byMinute = new HashMap<>();
    private int computations;

    public SunPositionCache(final SunPositionProvider provider) {
        this.provider = provider;
    }

    /**
     * Returns the sub-solar point for the minute containing {@code instant},
     * computing it on first request only.
     */
    public GeoPoint get(final Instant instant) {
        final String key = keyFor(instant);
        GeoPoint point = byMinute.get(key);
        if (point == null) {
            point = provider.subSolarPoint(instant);
            byMinute.put(key, point);
            computations++;
            if (logger.isTraceEnabled()) {
                logger.trace("Sub-solar point for {}: {}", key, point);
            }
        }
        return point;
    }

    /** Cache key: the UTC instant truncated to the minute, {@code yyyy-MM-dd HH:mm}. */
    static String keyFor(final Instant instant) {
        return MINUTE_KEY.format(instant);
    }

    public int size() {
        return byMinute.size();
    }

    /** @return number of provider calls made so far */
    public int computations() {
        return computations;
    }
}
