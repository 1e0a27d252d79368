package expansion.domain;

public class DemandSlice {
    /**
     * DemandSlice is one block of the load-duration curve. Its width is the power band between the minimum and
     * maximum load levels of the block and its duration weights the dispatch costs incurred in it.
     */
    private final String category;
    private final double duration;
    private final double minLevel;
    private final double maxLevel;

    public DemandSlice(String category, double duration, double minLevel, double maxLevel) {
        this.category = category;
        this.duration = duration;
        this.minLevel = minLevel;
        this.maxLevel = maxLevel;
    }

    public String getCategory() {
        return category;
    }

    public double getDuration() {
        return duration;
    }

    public double getMinLevel() {
        return minLevel;
    }

    public double getMaxLevel() {
        return maxLevel;
    }

    public double getWidth() {
        return maxLevel - minLevel;
    }

    @Override
    public String toString() {
        return category + " (duration: " + duration + ", width: " + getWidth() + ")";
    }
}
