package expansion.domain;

public class Technology {
    /**
     * Technology holds the cost data of a generation technology that can be invested in.
     */
    private final String name;
    private final double marginalCost; // cost per MWh dispatched.
    private final double investmentCost; // cost per MW of installed capacity.

    public Technology(String name, double marginalCost, double investmentCost) {
        this.name = name;
        this.marginalCost = marginalCost;
        this.investmentCost = investmentCost;
    }

    public String getName() {
        return name;
    }

    public double getMarginalCost() {
        return marginalCost;
    }

    public double getInvestmentCost() {
        return investmentCost;
    }

    @Override
    public String toString() {
        return name + " (marginal: " + marginalCost + ", investment: " + investmentCost + ")";
    }
}
