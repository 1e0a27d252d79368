package expansion.utility;

/**
 * Thrown when a dispatch subproblem reports infeasibility. Unserved energy makes every subproblem feasible,
 * so callers recover from this with a feasibility cut instead of stopping.
 */
public class SubproblemInfeasibleException extends OptException {
    private final int scenarioNum;

    public SubproblemInfeasibleException(int scenarioNum, String message) {
        super(message);
        this.scenarioNum = scenarioNum;
    }

    public int getScenarioNum() {
        return scenarioNum;
    }
}
