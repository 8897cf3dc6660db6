package ou.capstone.sunseat.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import ou.capstone.sunseat.route.GeoPoint;
import ou.capstone.sunseat.route.TimeSample;

class SampleClassifierTest {

    private static final double TOLERANCE = 1e-9;
    private static final Instant MORNING = Instant.parse("2024-06-21T07:00:00Z");
    private static final Instant EVENING = Instant.parse("2024-06-21T19:00:00Z");

    @Test
    void sunNorthOfEastboundFlightIsOnTheLeft() {
        SampleClassifier classifier = new SampleClassifier(new GeoPoint(0, 90));
        TimeSample sample = new TimeSample(MORNING, new GeoPoint(0, 10), new GeoPoint(23, 20));

        ClassifiedSample c = classifier.classify(sample).orElseThrow();

        assertEquals(Side.LEFT, c.side());
        assertEquals(Phase.RISING, c.phase());
    }

    @Test
    void sunSouthOfEastboundFlightIsOnTheRight() {
        SampleClassifier classifier = new SampleClassifier(new GeoPoint(0, 90));
        TimeSample sample = new TimeSample(EVENING, new GeoPoint(0, 10), new GeoPoint(-23, 20));

        ClassifiedSample c = classifier.classify(sample).orElseThrow();

        assertEquals(Side.RIGHT, c.side());
        assertEquals(Phase.SETTING, c.phase());
    }

    @Test
    void sunNorthOfWestboundFlightIsOnTheRight() {
        SampleClassifier classifier = new SampleClassifier(new GeoPoint(0, -90));
        TimeSample sample = new TimeSample(MORNING, new GeoPoint(0, 10), new GeoPoint(23, 0));

        assertEquals(Side.RIGHT, classifier.classify(sample).orElseThrow().side());
    }

    @Test
    void sunDeadAheadCountsAsLeft() {
        // angle difference of exactly 0 is not > 0
        assertEquals(Side.LEFT, SampleClassifier.sideOf(90.0, 90.0));
        assertEquals(Side.RIGHT, SampleClassifier.sideOf(91.0, 90.0));
        assertEquals(Side.LEFT, SampleClassifier.sideOf(89.0, 90.0));
        // wrap-around near north
        assertEquals(Side.RIGHT, SampleClassifier.sideOf(5.0, 355.0));
        assertEquals(Side.LEFT, SampleClassifier.sideOf(355.0, 5.0));
    }

    @Test
    void weightIsAltitudeOverNinety() {
        SampleClassifier classifier = new SampleClassifier(new GeoPoint(0, 90));
        // |dLat| + |dLon| = 10 + 20 = 30, altitude = 75
        TimeSample sample = new TimeSample(MORNING, new GeoPoint(0, 0), new GeoPoint(10, 20));

        ClassifiedSample c = classifier.classify(sample).orElseThrow();

        assertEquals(75.0, c.altitudeDeg(), TOLERANCE);
        assertEquals(75.0 / 90.0, c.weight(), TOLERANCE);
    }

    @Test
    void sunOverheadHasFullWeight() {
        assertEquals(90.0, SampleClassifier.approximateAltitude(new GeoPoint(5, 5), new GeoPoint(5, 5)), TOLERANCE);
    }

    @Test
    void sunBelowHorizonIsDiscarded() {
        SampleClassifier classifier = new SampleClassifier(new GeoPoint(0, 90));
        // |dLat| + |dLon| = 20 + 170 = 190 -> altitude clamps to 0
        TimeSample sample = new TimeSample(MORNING, new GeoPoint(0, 0), new GeoPoint(20, -170));

        Optional<ClassifiedSample> c = classifier.classify(sample);

        assertTrue(c.isEmpty());
        assertEquals(0.0, SampleClassifier.approximateAltitude(new GeoPoint(0, 0), new GeoPoint(20, -170)), TOLERANCE);
    }

    @Test
    void altitudeExactlyZeroIsDiscarded() {
        SampleClassifier classifier = new SampleClassifier(new GeoPoint(0, 90));
        // |dLat| + |dLon| = 0 + 180 -> altitude 0
        TimeSample sample = new TimeSample(MORNING, new GeoPoint(0, 0), new GeoPoint(0, 180));
        assertTrue(classifier.classify(sample).isEmpty());
    }

    @Test
    void altitudeApproximationIgnoresAntimeridianWrap_knownLowFidelity() {
        // Two degrees apart across 180, but the summed-difference model sees 358 degrees of longitude
        GeoPoint plane = new GeoPoint(0, 179);
        GeoPoint sun = new GeoPoint(0, -179);
        assertEquals(0.0, SampleClassifier.approximateAltitude(plane, sun), TOLERANCE);
    }
}
