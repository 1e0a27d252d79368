package expansion.lp;

import java.util.ArrayList;
import java.util.List;

public class LpModel {
    /**
     * Solver-neutral description of a minimization LP. Variables and constraints are identified by the indices
     * returned when they are added; an LpSolver reports values in the same order.
     */
    private final String name;
    private final ArrayList<String> varNames;
    private final ArrayList<Double> lowerBounds;
    private final ArrayList<Double> upperBounds;
    private final ArrayList<Double> objCoefs;
    private final ArrayList<LpConstraint> constraints;

    public LpModel(String name) {
        this.name = name;
        varNames = new ArrayList<>();
        lowerBounds = new ArrayList<>();
        upperBounds = new ArrayList<>();
        objCoefs = new ArrayList<>();
        constraints = new ArrayList<>();
    }

    public int addVariable(String varName, double lb, double ub) {
        varNames.add(varName);
        lowerBounds.add(lb);
        upperBounds.add(ub);
        objCoefs.add(0.0);
        return varNames.size() - 1;
    }

    public void setObjectiveCoef(int varIndex, double coef) {
        objCoefs.set(varIndex, coef);
    }

    public LpConstraint addConstraint(String consName, LpSense sense, double rhs, boolean dualTracked) {
        LpConstraint constraint = new LpConstraint(constraints.size(), consName, sense, rhs, dualTracked);
        constraints.add(constraint);
        return constraint;
    }

    public String getName() {
        return name;
    }

    public int getNumVariables() {
        return varNames.size();
    }

    public String getVarName(int varIndex) {
        return varNames.get(varIndex);
    }

    public double getLowerBound(int varIndex) {
        return lowerBounds.get(varIndex);
    }

    public double getUpperBound(int varIndex) {
        return upperBounds.get(varIndex);
    }

    public double getObjectiveCoef(int varIndex) {
        return objCoefs.get(varIndex);
    }

    public int getNumConstraints() {
        return constraints.size();
    }

    public List<LpConstraint> getConstraints() {
        return constraints;
    }
}
