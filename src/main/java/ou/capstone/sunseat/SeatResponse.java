package ou.capstone.sunseat;

import ou.capstone.sunseat.airport.Airport;
import ou.capstone.sunseat.scoring.ScoringResult;

/**
 * A scored request together with the airports its codes resolved to.
 *
 * @param query       the request as typed
 * @param origin      resolved origin, null when it could not be resolved
 * @param destination resolved destination, null when it could not be resolved
 * @param result      recommendation or error
 */
public record SeatResponse(SeatQuery query,
                           Airport origin,
                           Airport destination,
                           ScoringResult result) {
}
