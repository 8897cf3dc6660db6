package ou.capstone.sunseat.scoring;

/** Side of the aircraft, facing the direction of travel. */
public enum Side {
    LEFT,
    RIGHT
}
