package expansion.solver;

import expansion.lp.LpResult;
import expansion.lp.LpSolver;
import expansion.lp.LpStatus;
import expansion.model.SubModelBuilder;
import expansion.registry.DataRegistry;
import expansion.registry.Parameters;
import expansion.utility.OptException;
import expansion.utility.SubproblemInfeasibleException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class SubSolver {
    /**
     * SubSolver solves the dispatch problem of one scenario for a fixed investment vector. The model is rebuilt
     * from scratch on every call.
     */
    private static final Logger logger = LogManager.getLogger(SubSolver.class);
    private final DataRegistry dataRegistry;
    private final LpSolver lpSolver;
    private final int scenarioNum;
    private final double[] xValues;

    private SubModelBuilder subModelBuilder;

    public SubSolver(DataRegistry dataRegistry, LpSolver lpSolver, int scenarioNum, double[] xValues) {
        this.dataRegistry = dataRegistry;
        this.lpSolver = lpSolver;
        this.scenarioNum = scenarioNum;
        this.xValues = xValues;
    }

    void constructSecondStage() {
        subModelBuilder = new SubModelBuilder(dataRegistry, scenarioNum, Parameters.getValueOfLostLoad());
        subModelBuilder.buildVariables();
        subModelBuilder.buildObjective();
        subModelBuilder.buildConstraints(xValues);
    }

    /**
     * Solves the dispatch problem.
     *
     * @return optimal dispatch with its duals.
     * @throws SubproblemInfeasibleException if the solver reports infeasibility.
     * @throws OptException                  if the solver fails or stops with any other non-optimal status.
     */
    public SubproblemSolution solve() throws OptException {
        if (subModelBuilder == null)
            constructSecondStage();

        LpResult result = lpSolver.solve(subModelBuilder.getModel());
        if (result.getStatus() == LpStatus.INFEASIBLE) {
            logger.warn("sub-problem of scenario " + scenarioNum + " is infeasible");
            throw new SubproblemInfeasibleException(scenarioNum,
                "sub-problem of scenario " + scenarioNum + " is infeasible");
        }
        if (!result.isOptimal()) {
            logger.error("sub-problem status: " + result.getStatus());
            throw new OptException("optimal solution not found for sub-problem of scenario " + scenarioNum);
        }

        Dual dual = new Dual(subModelBuilder.getDualsDemand(result), subModelBuilder.getDualsCapacity(result));
        return new SubproblemSolution(scenarioNum, result.getObjValue(), subModelBuilder.getpValues(result),
            subModelBuilder.getLolValues(result), dual);
    }
}
