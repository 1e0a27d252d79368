package expansion.registry;

import expansion.domain.DemandSlice;
import expansion.domain.Scenario;
import expansion.domain.Technology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class DataRegistry {
    /**
     * Holds validated input data. Instances are built by DataRegistryBuilder and never change afterwards.
     * <p>
     * Deterministic instances carry a single implicit scenario with probability 1 whose widths are the widths
     * of the demand slices, so that the solvers can treat every instance as scenario-based.
     */
    private final List<Technology> technologies;
    private final List<DemandSlice> demandSlices;
    private final List<Scenario> scenarios;
    private final boolean stochastic;

    DataRegistry(ArrayList<Technology> technologies, ArrayList<DemandSlice> demandSlices,
                 ArrayList<Scenario> scenarios, boolean stochastic) {
        this.technologies = Collections.unmodifiableList(new ArrayList<>(technologies));
        this.demandSlices = Collections.unmodifiableList(new ArrayList<>(demandSlices));
        this.scenarios = Collections.unmodifiableList(new ArrayList<>(scenarios));
        this.stochastic = stochastic;
    }

    public List<Technology> getTechnologies() {
        return technologies;
    }

    public List<DemandSlice> getDemandSlices() {
        return demandSlices;
    }

    public List<Scenario> getScenarios() {
        return scenarios;
    }

    public boolean isStochastic() {
        return stochastic;
    }

    public int getNumTechnologies() {
        return technologies.size();
    }

    public int getNumSlices() {
        return demandSlices.size();
    }

    public int getNumScenarios() {
        return scenarios.size();
    }

    public ArrayList<String> getTechnologyNames() {
        ArrayList<String> names = new ArrayList<>();
        for (Technology technology : technologies)
            names.add(technology.getName());
        return names;
    }

    public ArrayList<String> getScenarioNames() {
        ArrayList<String> names = new ArrayList<>();
        for (Scenario scenario : scenarios)
            names.add(scenario.getName());
        return names;
    }

    public double[] getProbabilities() {
        double[] probabilities = new double[scenarios.size()];
        for (int i = 0; i < scenarios.size(); ++i)
            probabilities[i] = scenarios.get(i).getProbability();
        return probabilities;
    }

    /**
     * Computes the first-stage cost of the given investment vector.
     *
     * @param xValues installed capacity per technology, in technology order.
     * @return sum of investment cost times capacity over all technologies.
     */
    public double getInvestmentCost(double[] xValues) {
        double cost = 0.0;
        for (int i = 0; i < technologies.size(); ++i)
            cost += technologies.get(i).getInvestmentCost() * xValues[i];
        return cost;
    }

    public double getMaxMarginalCost() {
        double maxCost = 0.0;
        for (Technology technology : technologies)
            maxCost = Math.max(maxCost, technology.getMarginalCost());
        return maxCost;
    }
}
