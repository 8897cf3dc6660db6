package ou.capstone.sunseat.scoring;

import java.time.Instant;

import ou.capstone.sunseat.route.GeoPoint;

/**
 * Sums classified samples per side and phase, remembers the first sunrise and
 * sunset sightings, and turns the totals into a side recommendation.
 * <p>
 * Ties go to the right side at every level of the comparison.
 */
public final class ScoreAggregator {

    private SideScore left = SideScore.ZERO;
    private SideScore right = SideScore.ZERO;
    private SunEvent sunriseEvent;
    private SunEvent sunsetEvent;
    private int counted;

    /**
     * Adds one sample's weight and records it as the sunrise/sunset event if it is the first of its phase.
     */
    public void add(final ClassifiedSample sample, final Instant instant, final GeoPoint position) {
        if (sample.side() == Side.RIGHT) {
            right = right.plus(sample.phase(), sample.weight());
        } else {
            left = left.plus(sample.phase(), sample.weight());
        }
        counted++;

        if (sample.phase() == Phase.RISING && sunriseEvent == null) {
            sunriseEvent = new SunEvent(instant, position);
        } else if (sample.phase() == Phase.SETTING && sunsetEvent == null) {
            sunsetEvent = new SunEvent(instant, position);
        }
    }

    public SideScore left() {
        return left;
    }

    public SideScore right() {
        return right;
    }

    /** @return number of samples added */
    public int counted() {
        return counted;
    }

    public Recommendation recommend(final Preference preference) {
        final double leftTotal = left.total();
        final double rightTotal = right.total();

        final Side side = switch (preference) {
            case SUNRISE -> pick(left.sunrise(), right.sunrise(), leftTotal, rightTotal);
            case SUNSET -> pick(left.sunset(), right.sunset(), leftTotal, rightTotal);
            case NONE -> byTotal(leftTotal, rightTotal);
        };

        return new Recommendation(left, right, leftTotal, rightTotal, side, preference,
                sunriseEvent, sunsetEvent);
    }

    private static Side pick(final double leftPhase, final double rightPhase,
                             final double leftTotal, final double rightTotal) {
        if (leftPhase > rightPhase) return Side.LEFT;
        if (rightPhase > leftPhase) return Side.RIGHT;
        return byTotal(leftTotal, rightTotal);
    }

    private static Side byTotal(final double leftTotal, final double rightTotal) {
        return leftTotal > rightTotal ? Side.LEFT : Side.RIGHT;
    }
}
