package ou.capstone.sunseat.scoring;

/**
 * Verdict for a minute in which the sun is above the (simplified) horizon.
 *
 * @param altitudeDeg approximate sun altitude, (0, 90]
 * @param side        side of the aircraft the sun is on
 * @param phase       rising or setting, by UTC hour
 * @param weight      altitude / 90
 */
public record ClassifiedSample(double altitudeDeg, Side side, Phase phase, double weight) {
}
