package expansion.solver;

class Dual {
    /**
     * Holds dual information of a dispatch subproblem: prices of the demand balance constraints (one per slice)
     * and of the capacity constraints (one per technology).
     */
    private final double[] dualsDemand;
    private final double[] dualsCapacity;

    Dual(double[] dualsDemand, double[] dualsCapacity) {
        this.dualsDemand = dualsDemand;
        this.dualsCapacity = dualsCapacity;
    }

    double[] getDualsDemand() {
        return dualsDemand;
    }

    double[] getDualsCapacity() {
        return dualsCapacity;
    }

    /**
     * Builds the weighted contribution of these duals to a cut on the given theta. The demand widths are the
     * right-hand sides that do not depend on x, so they make up the intercept; the capacity duals multiply x.
     *
     * @param thetaIndex theta the cut bounds.
     * @param widths     demand widths of the scenario the duals come from.
     * @param weight     scenario probability for aggregated cuts, 1 for multi-cuts.
     * @return cut with alpha = weight * sum_j lambda_j dD_j and beta = weight * rho.
     */
    BendersCut getBendersCut(int thetaIndex, double[] widths, double weight) {
        BendersCut cut = new BendersCut(thetaIndex, 0.0, dualsCapacity.length);
        addToCut(cut, widths, weight);
        return cut;
    }

    void addToCut(BendersCut cut, double[] widths, double weight) {
        double scenAlpha = 0.0;
        for (int j = 0; j < dualsDemand.length; ++j)
            scenAlpha += dualsDemand[j] * widths[j];

        cut.addToAlpha(scenAlpha * weight);
        cut.addToBeta(dualsCapacity, weight);
    }
}
