package expansion.model;

import expansion.domain.Technology;
import expansion.lp.LpConstraint;
import expansion.lp.LpModel;
import expansion.lp.LpResult;
import expansion.lp.LpSense;
import expansion.registry.DataRegistry;
import expansion.utility.Constants;

import java.util.List;

public class MasterModelBuilder {
    /**
     * Builds the investment (first-stage) LP:
     * <p>
     * min sum_i I_i x_i + sum_k w_k theta_k, x >= 0, theta >= 0,
     * <p>
     * where there is a single theta with weight 1 for aggregated cuts and one theta per scenario weighted by
     * the scenario probability for multi-cuts. Cuts are appended to the model as they arrive.
     */
    private final DataRegistry dataRegistry;
    private final boolean multiCut;
    private final LpModel model;

    private int[] x; // x[i] = index of the capacity variable of technology i.
    private int[] thetas;

    public MasterModelBuilder(DataRegistry dataRegistry, boolean multiCut) {
        this.dataRegistry = dataRegistry;
        this.multiCut = multiCut;
        model = new LpModel("master");
    }

    public void buildVariables() {
        List<Technology> technologies = dataRegistry.getTechnologies();
        x = new int[technologies.size()];
        for (int i = 0; i < technologies.size(); ++i)
            x[i] = model.addVariable("x_" + technologies.get(i).getName(), 0.0, Double.POSITIVE_INFINITY);

        if (multiCut) {
            List<String> scenarioNames = dataRegistry.getScenarioNames();
            thetas = new int[scenarioNames.size()];
            for (int k = 0; k < thetas.length; ++k)
                thetas[k] = model.addVariable("theta_" + scenarioNames.get(k), 0.0, Double.POSITIVE_INFINITY);
        } else {
            thetas = new int[1];
            thetas[0] = model.addVariable("theta", 0.0, Double.POSITIVE_INFINITY);
        }
    }

    public void buildObjective() {
        List<Technology> technologies = dataRegistry.getTechnologies();
        for (int i = 0; i < technologies.size(); ++i)
            model.setObjectiveCoef(x[i], technologies.get(i).getInvestmentCost());

        if (multiCut) {
            double[] probabilities = dataRegistry.getProbabilities();
            for (int k = 0; k < thetas.length; ++k)
                model.setObjectiveCoef(thetas[k], probabilities[k]);
        } else
            model.setObjectiveCoef(thetas[0], 1.0);
    }

    /**
     * Adds theta_k >= alpha + beta x, written as theta_k - beta x >= alpha.
     */
    public void addOptimalityCut(int thetaIndex, double alpha, double[] beta, String name) {
        double rhs = Math.abs(alpha) >= Constants.EPS ? alpha : 0.0;
        LpConstraint cut = model.addConstraint(name, LpSense.GE, rhs, false);
        cut.addTerm(thetas[thetaIndex], 1.0);
        for (int i = 0; i < x.length; ++i)
            if (Math.abs(beta[i]) >= Constants.EPS)
                cut.addTerm(x[i], -beta[i]);
    }

    /**
     * Adds sum_i x_i >= rhs.
     */
    public void addFeasibilityCut(double rhs, String name) {
        LpConstraint cut = model.addConstraint(name, LpSense.GE, rhs, false);
        for (int xIndex : x)
            cut.addTerm(xIndex, 1.0);
    }

    public LpModel getModel() {
        return model;
    }

    public int getNumThetas() {
        return thetas.length;
    }

    public double[] getxValues(LpResult result) {
        double[] values = new double[x.length];
        for (int i = 0; i < x.length; ++i)
            values[i] = result.getValue(x[i]);
        return values;
    }

    public double[] getThetaValues(LpResult result) {
        double[] values = new double[thetas.length];
        for (int k = 0; k < thetas.length; ++k)
            values[k] = result.getValue(thetas[k]);
        return values;
    }
}
