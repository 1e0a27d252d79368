package expansion.solver;

import java.util.Arrays;

public class SubproblemSolution {
    /**
     * Optimal dispatch of one scenario for a fixed investment vector, with the duals needed to build cuts.
     */
    private final int scenarioNum;
    private final double objValue;
    private final double[][] pValues; // pValues[i][j] = dispatch of technology i in slice j.
    private final double[] lolValues; // unserved power per slice.
    private final Dual dual;

    SubproblemSolution(int scenarioNum, double objValue, double[][] pValues, double[] lolValues, Dual dual) {
        this.scenarioNum = scenarioNum;
        this.objValue = objValue;
        this.pValues = pValues;
        this.lolValues = lolValues;
        this.dual = dual;
    }

    public int getScenarioNum() {
        return scenarioNum;
    }

    public double getObjValue() {
        return objValue;
    }

    public double getDispatch(int techIndex, int sliceIndex) {
        return pValues[techIndex][sliceIndex];
    }

    public double[] getUnservedPower() {
        return lolValues.clone();
    }

    public double getTotalUnservedPower() {
        return Arrays.stream(lolValues).sum();
    }

    public double[] getDualsDemand() {
        return dual.getDualsDemand().clone();
    }

    public double[] getDualsCapacity() {
        return dual.getDualsCapacity().clone();
    }

    Dual getDual() {
        return dual;
    }
}
