package ou.capstone.sunseat.scoring;

/**
 * Accumulated sun weight on one side of the aircraft, split by phase.
 */
public record SideScore(double sunrise, double sunset) {

    public static final SideScore ZERO = new SideScore(0.0, 0.0);

    public double total() {
        return sunrise + sunset;
    }

    /** @return the score for one phase */
    public double of(final Phase phase) {
        return phase == Phase.RISING ? sunrise : sunset;
    }

    SideScore plus(final Phase phase, final double weight) {
        return phase == Phase.RISING
                ? new SideScore(sunrise + weight, sunset)
                : new SideScore(sunrise, sunset + weight);
    }
}
