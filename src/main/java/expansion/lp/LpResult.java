package expansion.lp;

import java.util.Arrays;

public class LpResult {
    /**
     * Outcome of one LP solve. For non-optimal statuses the value arrays are empty.
     */
    private final LpStatus status;
    private final double objValue;
    private final double[] values; // primal values in variable order.
    private final double[] duals; // duals in constraint order, NaN for constraints whose dual is not tracked.

    public LpResult(LpStatus status, double objValue, double[] values, double[] duals) {
        this.status = status;
        this.objValue = objValue;
        this.values = values;
        this.duals = duals;
    }

    public static LpResult withStatus(LpStatus status) {
        return new LpResult(status, Double.NaN, new double[0], new double[0]);
    }

    public LpStatus getStatus() {
        return status;
    }

    public boolean isOptimal() {
        return status == LpStatus.OPTIMAL;
    }

    public double getObjValue() {
        return objValue;
    }

    public double getValue(int varIndex) {
        return values[varIndex];
    }

    public double getDual(int consIndex) {
        return duals[consIndex];
    }

    @Override
    public String toString() {
        return "LpResult{status=" + status + ", objValue=" + objValue + ", values=" + Arrays.toString(values)
            + "}";
    }
}
