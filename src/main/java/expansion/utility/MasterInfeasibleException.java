package expansion.utility;

/**
 * Thrown when the master problem does not solve to optimality. The master is feasible at x = 0, theta = 0, so
 * this always points to a solver or data problem and ends the run.
 */
public class MasterInfeasibleException extends OptException {
    public MasterInfeasibleException(String message) {
        super(message);
    }
}
