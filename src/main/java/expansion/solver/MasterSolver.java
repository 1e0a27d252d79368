package expansion.solver;

import expansion.lp.LpResult;
import expansion.lp.LpSolver;
import expansion.model.MasterModelBuilder;
import expansion.registry.DataRegistry;
import expansion.utility.MasterInfeasibleException;
import expansion.utility.OptException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

public class MasterSolver {
    /**
     * Class that solves the first-stage model (i.e. the Benders master problem). Cuts are only ever appended.
     */
    private final static Logger logger = LogManager.getLogger(MasterSolver.class);
    private final DataRegistry dataRegistry;
    private final LpSolver lpSolver;
    private final MasterModelBuilder masterModelBuilder;

    private double objValue;
    private double[] xValues;
    private double[] thetaValues;
    private double investmentCost; // sum_i I_i x_i, used for the Benders upper bound.
    private int numOptimalityCuts;
    private int numFeasibilityCuts;

    public MasterSolver(DataRegistry dataRegistry, LpSolver lpSolver, boolean multiCut) {
        this.dataRegistry = dataRegistry;
        this.lpSolver = lpSolver;
        masterModelBuilder = new MasterModelBuilder(dataRegistry, multiCut);
    }

    public void constructFirstStage() {
        masterModelBuilder.buildVariables();
        masterModelBuilder.buildObjective();
        xValues = new double[dataRegistry.getNumTechnologies()];
        thetaValues = new double[masterModelBuilder.getNumThetas()];
    }

    public void solve() throws OptException {
        LpResult result = lpSolver.solve(masterModelBuilder.getModel());
        if (!result.isOptimal()) {
            logger.error("master problem status: " + result.getStatus());
            throw new MasterInfeasibleException("master problem not solved to optimality, status "
                + result.getStatus());
        }

        objValue = result.getObjValue();
        logger.info("master objective: " + objValue);

        // Round-off can leave tiny negative capacities.
        xValues = Arrays.stream(masterModelBuilder.getxValues(result)).map(v -> Math.max(v, 0.0)).toArray();
        thetaValues = masterModelBuilder.getThetaValues(result);
        investmentCost = dataRegistry.getInvestmentCost(xValues);
    }

    public void addOptimalityCut(BendersCut cut) {
        masterModelBuilder.addOptimalityCut(cut.getThetaIndex(), cut.getAlpha(), cut.getBeta(),
            "benders_cut_" + getNumCuts());
        ++numOptimalityCuts;
    }

    /**
     * Adds sum_i x_i >= rhs. Only used when a subproblem unexpectedly reports infeasibility.
     */
    public void addFeasibilityCut(double rhs) {
        masterModelBuilder.addFeasibilityCut(rhs, "feasibility_cut_" + getNumCuts());
        ++numFeasibilityCuts;
    }

    public double getObjValue() {
        return objValue;
    }

    public double[] getxValues() {
        return xValues.clone();
    }

    public double[] getThetaValues() {
        return thetaValues.clone();
    }

    public double getInvestmentCost() {
        return investmentCost;
    }

    public int getNumOptimalityCuts() {
        return numOptimalityCuts;
    }

    public int getNumFeasibilityCuts() {
        return numFeasibilityCuts;
    }

    public int getNumCuts() {
        return numOptimalityCuts + numFeasibilityCuts;
    }
}
