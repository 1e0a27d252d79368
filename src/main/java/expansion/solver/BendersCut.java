package expansion.solver;

import expansion.utility.Constants;
import expansion.utility.Util;

public class BendersCut {
    /**
     * Benders cut holds the intercept and gradient of an optimality cut that will be added to the Benders master
     * problem. Given first-stage variables x, gradient \beta and intercept \alpha, the cut is
     * <p>
     * \theta_k \geq \alpha + \beta x
     * <p>
     * where k is the theta index (always 0 for aggregated cuts, the scenario number for multi-cuts).
     */
    private final int thetaIndex;
    private double alpha;
    private final double[] beta;

    BendersCut(int thetaIndex, double alpha, int dim) {
        this.thetaIndex = thetaIndex;
        this.alpha = alpha;
        this.beta = new double[dim];
    }

    void addToAlpha(double value) {
        alpha += value;
    }

    void addToBeta(double[] values, double weight) {
        for (int i = 0; i < beta.length; ++i)
            beta[i] += values[i] * weight;
    }

    public int getThetaIndex() {
        return thetaIndex;
    }

    public double getAlpha() {
        return alpha;
    }

    public double[] getBeta() {
        return beta.clone();
    }

    /**
     * Evaluates the right-hand side of the cut at the given first-stage solution.
     */
    public double evaluate(double[] x) {
        return alpha + Util.dot(beta, x);
    }

    /**
     * Check if the given master solution is cut off by the current cut.
     *
     * @param x     master problem investment values
     * @param theta value of the theta the cut is attached to
     * @return true if cut separates the solution, false otherwise
     */
    public boolean separates(double[] x, double theta) {
        return theta < evaluate(x) - Constants.MINIMUM_CUT_VIOLATION;
    }
}
