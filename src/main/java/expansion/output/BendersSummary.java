package expansion.output;

import expansion.utility.Enums;

public class BendersSummary {
    /**
     * Final report of a decomposition run.
     */
    private final Enums.Variant variant;
    private final Enums.Outcome outcome;
    private int numIterations;
    private int numCuts;
    private double[] xValues; // last master solution.
    private double[] thetaValues;
    private double[] incumbentxValues; // solution that gave the upper bound.
    private double lowerBound;
    private double upperBound;
    private double expectedUnservedEnergy;
    private double solutionTime;

    public BendersSummary(Enums.Variant variant, Enums.Outcome outcome) {
        this.variant = variant;
        this.outcome = outcome;
        lowerBound = Double.NaN;
        upperBound = Double.POSITIVE_INFINITY;
        expectedUnservedEnergy = Double.NaN;
    }

    public Enums.Variant getVariant() {
        return variant;
    }

    public Enums.Outcome getOutcome() {
        return outcome;
    }

    public int getNumIterations() {
        return numIterations;
    }

    public void setNumIterations(int numIterations) {
        this.numIterations = numIterations;
    }

    public int getNumCuts() {
        return numCuts;
    }

    public void setNumCuts(int numCuts) {
        this.numCuts = numCuts;
    }

    public double[] getxValues() {
        return xValues;
    }

    public void setxValues(double[] xValues) {
        this.xValues = xValues;
    }

    public double[] getThetaValues() {
        return thetaValues;
    }

    public void setThetaValues(double[] thetaValues) {
        this.thetaValues = thetaValues;
    }

    public double[] getIncumbentxValues() {
        return incumbentxValues;
    }

    public void setIncumbentxValues(double[] incumbentxValues) {
        this.incumbentxValues = incumbentxValues;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public void setLowerBound(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public void setUpperBound(double upperBound) {
        this.upperBound = upperBound;
    }

    public double getGap() {
        return upperBound - lowerBound;
    }

    public double getExpectedUnservedEnergy() {
        return expectedUnservedEnergy;
    }

    public void setExpectedUnservedEnergy(double expectedUnservedEnergy) {
        this.expectedUnservedEnergy = expectedUnservedEnergy;
    }

    public double getSolutionTime() {
        return solutionTime;
    }

    public void setSolutionTime(double solutionTime) {
        this.solutionTime = solutionTime;
    }
}
