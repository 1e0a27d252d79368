package expansion.lp;

/**
 * Termination status reported by an LpSolver. Primal and dual values are only available for OPTIMAL.
 */
public enum LpStatus {OPTIMAL, INFEASIBLE, UNBOUNDED, OTHER}
