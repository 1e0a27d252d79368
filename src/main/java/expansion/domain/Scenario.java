package expansion.domain;

import java.util.Arrays;

public class Scenario {
    /**
     * Scenario holds the probability and the per-slice demand widths of one second-stage realization.
     */
    private final String name;
    private final double probability;
    private final double[] widths; // widths[j] is the width of slice j in this scenario.

    public Scenario(String name, double probability, double[] widths) {
        this.name = name;
        this.probability = probability;
        this.widths = widths.clone();
    }

    public String getName() {
        return name;
    }

    public double getProbability() {
        return probability;
    }

    public double getWidth(int sliceIndex) {
        return widths[sliceIndex];
    }

    public double[] getWidths() {
        return widths.clone();
    }

    public int getNumSlices() {
        return widths.length;
    }

    public double getMaxWidth() {
        return Arrays.stream(widths).max().orElse(0.0);
    }
}
