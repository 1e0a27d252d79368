package expansion.model;

import expansion.domain.DemandSlice;
import expansion.domain.Scenario;
import expansion.domain.Technology;
import expansion.lp.LpConstraint;
import expansion.lp.LpModel;
import expansion.lp.LpResult;
import expansion.lp.LpSense;
import expansion.registry.DataRegistry;

import java.util.List;

public class SubModelBuilder {
    /**
     * Builds the dispatch (second-stage) LP of one scenario for fixed capacities x:
     * <p>
     * min sum_{i,j} MC_i T_j p_ij + sum_j VOLL T_j lol_j
     * <p>
     * s.t. sum_i p_ij + lol_j = dD_j for every slice j (demand balance),
     * sum_j p_ij <= x_i for every technology i (capacity),
     * p >= 0, lol >= 0.
     * <p>
     * Unserved energy lol is unbounded above, so the model is feasible for every x >= 0.
     */
    private final DataRegistry dataRegistry;
    private final Scenario scenario;
    private final double valueOfLostLoad;
    private final LpModel model;

    private int[][] p; // p[i][j] = index of dispatch of technology i in slice j.
    private int[] lol; // lol[j] = index of unserved energy in slice j.
    private LpConstraint[] demandConstraints;
    private LpConstraint[] capacityConstraints;

    public SubModelBuilder(DataRegistry dataRegistry, int scenarioNum, double valueOfLostLoad) {
        this.dataRegistry = dataRegistry;
        this.scenario = dataRegistry.getScenarios().get(scenarioNum);
        this.valueOfLostLoad = valueOfLostLoad;
        model = new LpModel("sub_" + scenario.getName());
    }

    public void buildVariables() {
        List<Technology> technologies = dataRegistry.getTechnologies();
        List<DemandSlice> slices = dataRegistry.getDemandSlices();

        p = new int[technologies.size()][slices.size()];
        for (int i = 0; i < technologies.size(); ++i) {
            for (int j = 0; j < slices.size(); ++j) {
                String varName = "p_" + technologies.get(i).getName() + "_" + slices.get(j).getCategory();
                p[i][j] = model.addVariable(varName, 0.0, Double.POSITIVE_INFINITY);
            }
        }

        lol = new int[slices.size()];
        for (int j = 0; j < slices.size(); ++j)
            lol[j] = model.addVariable("lol_" + slices.get(j).getCategory(), 0.0, Double.POSITIVE_INFINITY);
    }

    public void buildObjective() {
        List<Technology> technologies = dataRegistry.getTechnologies();
        List<DemandSlice> slices = dataRegistry.getDemandSlices();

        for (int j = 0; j < slices.size(); ++j) {
            final double duration = slices.get(j).getDuration();
            for (int i = 0; i < technologies.size(); ++i)
                model.setObjectiveCoef(p[i][j], technologies.get(i).getMarginalCost() * duration);
            model.setObjectiveCoef(lol[j], valueOfLostLoad * duration);
        }
    }

    public void buildConstraints(double[] xValues) {
        List<Technology> technologies = dataRegistry.getTechnologies();
        List<DemandSlice> slices = dataRegistry.getDemandSlices();

        demandConstraints = new LpConstraint[slices.size()];
        for (int j = 0; j < slices.size(); ++j) {
            LpConstraint cons = model.addConstraint("demand_" + slices.get(j).getCategory(), LpSense.EQ,
                scenario.getWidth(j), true);
            for (int i = 0; i < technologies.size(); ++i)
                cons.addTerm(p[i][j], 1.0);
            cons.addTerm(lol[j], 1.0);
            demandConstraints[j] = cons;
        }

        capacityConstraints = new LpConstraint[technologies.size()];
        for (int i = 0; i < technologies.size(); ++i) {
            LpConstraint cons = model.addConstraint("capacity_" + technologies.get(i).getName(), LpSense.LE,
                xValues[i], true);
            for (int j = 0; j < slices.size(); ++j)
                cons.addTerm(p[i][j], 1.0);
            capacityConstraints[i] = cons;
        }
    }

    public LpModel getModel() {
        return model;
    }

    public double[][] getpValues(LpResult result) {
        double[][] values = new double[p.length][];
        for (int i = 0; i < p.length; ++i) {
            values[i] = new double[p[i].length];
            for (int j = 0; j < p[i].length; ++j)
                values[i][j] = result.getValue(p[i][j]);
        }
        return values;
    }

    public double[] getLolValues(LpResult result) {
        double[] values = new double[lol.length];
        for (int j = 0; j < lol.length; ++j)
            values[j] = result.getValue(lol[j]);
        return values;
    }

    public double[] getDualsDemand(LpResult result) {
        double[] duals = new double[demandConstraints.length];
        for (int j = 0; j < duals.length; ++j)
            duals[j] = result.getDual(demandConstraints[j].getIndex());
        return duals;
    }

    public double[] getDualsCapacity(LpResult result) {
        double[] duals = new double[capacityConstraints.length];
        for (int i = 0; i < duals.length; ++i)
            duals[i] = result.getDual(capacityConstraints[i].getIndex());
        return duals;
    }
}
