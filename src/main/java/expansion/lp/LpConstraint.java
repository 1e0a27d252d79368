package expansion.lp;

import java.util.LinkedHashMap;
import java.util.Map;

public class LpConstraint {
    /**
     * Linear constraint sum(coef * var) (sense) rhs. Terms are keyed by variable index in the owning LpModel.
     */
    private final int index;
    private final String name;
    private final LpSense sense;
    private final double rhs;
    private final boolean dualTracked; // solvers report duals only for tracked constraints.
    private final LinkedHashMap<Integer, Double> terms;

    LpConstraint(int index, String name, LpSense sense, double rhs, boolean dualTracked) {
        this.index = index;
        this.name = name;
        this.sense = sense;
        this.rhs = rhs;
        this.dualTracked = dualTracked;
        terms = new LinkedHashMap<>();
    }

    /**
     * Adds coef to the coefficient of the given variable. Repeated calls for the same variable accumulate.
     */
    public LpConstraint addTerm(int varIndex, double coef) {
        terms.merge(varIndex, coef, Double::sum);
        return this;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public LpSense getSense() {
        return sense;
    }

    public double getRhs() {
        return rhs;
    }

    public boolean isDualTracked() {
        return dualTracked;
    }

    public Map<Integer, Double> getTerms() {
        return terms;
    }
}
