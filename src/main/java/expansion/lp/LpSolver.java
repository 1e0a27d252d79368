package expansion.lp;

import expansion.utility.OptException;

/**
 * LpSolver is the seam between the decomposition and the linear programming engine.
 * <p>
 * Implementations must be safe to call from several threads at once, as subproblems of one iteration may be
 * solved in parallel. Dual values follow the convention dual = d(objective) / d(rhs), so a binding "less than"
 * constraint of a minimization has a non-positive dual.
 */
public interface LpSolver {
    /**
     * Solves the given minimization model.
     *
     * @param model model to solve; it is only read.
     * @return status, and primal values, objective and tracked duals when the status is OPTIMAL.
     * @throws OptException if the engine itself fails (as opposed to reporting a non-optimal status).
     */
    LpResult solve(LpModel model) throws OptException;
}
