package ou.capstone.sunseat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;

class SunSeatConfigTest {

    @Test
    void defaultsWhenEnvironmentIsEmpty() {
        SunSeatConfig config = SunSeatConfig.fromMap(Map.of(), "/data/airports.csv");

        assertNull(config.aeroDataApiKey());
        assertFalse(config.remoteLookupEnabled());
        assertEquals(SunSeatConfig.DEFAULT_API_HOST, config.aeroDataApiHost());
        assertEquals(5, config.httpTimeoutSeconds());
        assertEquals("/data/airports.csv", config.airportResource());
    }

    @Test
    void readsValuesFromEnvironment() {
        SunSeatConfig config = SunSeatConfig.fromMap(Map.of(
                "AERODATA_API_KEY", " abc123 ",
                "AERODATA_API_HOST", "http://localhost:8089",
                "SUNSEAT_HTTP_TIMEOUT_SECONDS", "12"), "/other.csv");

        assertEquals("abc123", config.aeroDataApiKey());
        assertTrue(config.remoteLookupEnabled());
        assertEquals("http://localhost:8089", config.aeroDataApiHost());
        assertEquals(12, config.httpTimeoutSeconds());
    }

    @Test
    void blankKeyDisablesRemoteLookup() {
        assertFalse(SunSeatConfig.fromMap(Map.of("AERODATA_API_KEY", "  "), "/x.csv").remoteLookupEnabled());
    }

    @Test
    void badTimeoutIsAConfigurationError() {
        assertThrows(IllegalStateException.class,
                () -> SunSeatConfig.fromMap(Map.of("SUNSEAT_HTTP_TIMEOUT_SECONDS", "soon"), "/x.csv"));
        assertThrows(IllegalStateException.class,
                () -> SunSeatConfig.fromMap(Map.of("SUNSEAT_HTTP_TIMEOUT_SECONDS", "0"), "/x.csv"));
    }

    @Test
    void toStringDoesNotLeakKey() {
        SunSeatConfig config = SunSeatConfig.fromMap(Map.of("AERODATA_API_KEY", "topsecret"), "/x.csv");
        assertFalse(config.toString().contains("topsecret"));
        assertTrue(config.toString().contains("remoteLookup=true"));
    }
}
