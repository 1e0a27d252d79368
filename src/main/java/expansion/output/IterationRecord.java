package expansion.output;

import expansion.utility.Enums;

public class IterationRecord {
    /**
     * Snapshot of one decomposition iteration. The recourse value is NaN when some scenario could not be
     * evaluated, and the cut type is null when the iteration added no cut.
     */
    private final int iteration;
    private final double[] xValues;
    private final double[] thetaValues;
    private final double investmentCost;
    private final double recourse;
    private final double lowerBound;
    private final double upperBound;
    private final double gap;
    private final Enums.CutType cutType;

    public IterationRecord(int iteration, double[] xValues, double[] thetaValues, double investmentCost,
                           double recourse, double lowerBound, double upperBound, Enums.CutType cutType) {
        this.iteration = iteration;
        this.xValues = xValues.clone();
        this.thetaValues = thetaValues.clone();
        this.investmentCost = investmentCost;
        this.recourse = recourse;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.gap = upperBound - lowerBound;
        this.cutType = cutType;
    }

    public int getIteration() {
        return iteration;
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

    public double getRecourse() {
        return recourse;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public double getGap() {
        return gap;
    }

    public Enums.CutType getCutType() {
        return cutType;
    }
}
