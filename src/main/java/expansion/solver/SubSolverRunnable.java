package expansion.solver;

import expansion.lp.LpSolver;
import expansion.registry.DataRegistry;
import expansion.utility.OptException;
import expansion.utility.SubproblemInfeasibleException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs one SubSolver and keeps its outcome so that the caller, possibly on another thread, can collect it.
 */
public class SubSolverRunnable implements Runnable {
    private final static Logger logger = LogManager.getLogger(SubSolverRunnable.class);
    private final DataRegistry dataRegistry;
    private final LpSolver lpSolver;
    private final int iter;
    private final int scenarioNum;
    private final double[] xValues;

    private SubproblemSolution solution;
    private boolean infeasible;
    private OptException error;

    public SubSolverRunnable(DataRegistry dataRegistry, LpSolver lpSolver, int iter, int scenarioNum,
                             double[] xValues) {
        this.dataRegistry = dataRegistry;
        this.lpSolver = lpSolver;
        this.iter = iter;
        this.scenarioNum = scenarioNum;
        this.xValues = xValues;
    }

    public void run() {
        try {
            SubSolver subSolver = new SubSolver(dataRegistry, lpSolver, scenarioNum, xValues);
            solution = subSolver.solve();
            logger.debug("iter " + iter + " scenario " + scenarioNum + " recourse: " + solution.getObjValue());
        } catch (SubproblemInfeasibleException ex) {
            infeasible = true;
        } catch (OptException ex) {
            logger.error("iter " + iter + " scenario " + scenarioNum + ": " + ex.getMessage());
            error = ex;
        }
    }

    public int getScenarioNum() {
        return scenarioNum;
    }

    public SubproblemSolution getSolution() {
        return solution;
    }

    public boolean isInfeasible() {
        return infeasible;
    }

    public OptException getError() {
        return error;
    }
}
