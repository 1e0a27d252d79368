package expansion.registry;

import expansion.domain.DemandSlice;
import expansion.domain.Scenario;
import expansion.domain.Technology;
import expansion.utility.Constants;
import expansion.utility.DataException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

public class DataRegistryBuilder {
    private final static Logger logger = LogManager.getLogger(DataRegistryBuilder.class);
    private final DataRegistry dataRegistry;

    /**
     * Builds a deterministic registry whose only scenario is given by the slice widths.
     */
    public DataRegistryBuilder(List<Technology> technologies, List<DemandSlice> demandSlices)
            throws DataException {
        this(technologies, demandSlices, null);
    }

    /**
     * Validates the given records and builds a registry from them.
     *
     * @param technologies technologies available for investment.
     * @param demandSlices slices of the load-duration curve.
     * @param scenarios    demand scenarios; null or empty for a deterministic instance.
     * @throws DataException if any record is missing, malformed or inconsistent with the others.
     */
    public DataRegistryBuilder(List<Technology> technologies, List<DemandSlice> demandSlices,
                               List<Scenario> scenarios) throws DataException {
        checkTechnologies(technologies);
        checkDemandSlices(demandSlices);

        final boolean stochastic = scenarios != null && !scenarios.isEmpty();
        ArrayList<Scenario> registryScenarios = new ArrayList<>();
        if (stochastic) {
            checkScenarios(scenarios, demandSlices.size());
            registryScenarios.addAll(scenarios);
        } else
            registryScenarios.add(buildImplicitScenario(demandSlices));

        dataRegistry = new DataRegistry(new ArrayList<>(technologies), new ArrayList<>(demandSlices),
            registryScenarios, stochastic);
        logger.info("collected " + technologies.size() + " technologies, " + demandSlices.size()
            + " demand slices and " + registryScenarios.size() + " scenario(s).");
    }

    public DataRegistry getDataRegistry() {
        return dataRegistry;
    }

    private static void checkTechnologies(List<Technology> technologies) throws DataException {
        if (technologies == null || technologies.isEmpty())
            throw new DataException("no technologies provided");

        HashSet<String> names = new HashSet<>();
        for (Technology technology : technologies) {
            final String name = technology.getName();
            if (name == null || name.isEmpty())
                throw new DataException("technology without a name");
            if (!names.add(name))
                throw new DataException("duplicate technology " + name);
            checkNonNegative(technology.getMarginalCost(), "marginal cost of " + name);
            checkNonNegative(technology.getInvestmentCost(), "investment cost of " + name);
        }
    }

    private static void checkDemandSlices(List<DemandSlice> demandSlices) throws DataException {
        if (demandSlices == null || demandSlices.isEmpty())
            throw new DataException("no demand slices provided");

        HashSet<String> categories = new HashSet<>();
        for (DemandSlice slice : demandSlices) {
            final String category = slice.getCategory();
            if (!categories.add(category.toLowerCase()))
                throw new DataException("duplicate demand slice " + category);
            if (!Double.isFinite(slice.getDuration()) || slice.getDuration() <= 0)
                throw new DataException("duration of slice " + category + " must be positive, found "
                    + slice.getDuration());
            if (!Double.isFinite(slice.getMinLevel()) || !Double.isFinite(slice.getMaxLevel()))
                throw new DataException("load levels of slice " + category + " must be finite");
            checkNonNegative(slice.getWidth(), "width (max level - min level) of slice " + category);
        }
    }

    private static void checkScenarios(List<Scenario> scenarios, int numSlices) throws DataException {
        HashSet<String> names = new HashSet<>();
        double totalProbability = 0.0;
        for (Scenario scenario : scenarios) {
            final String name = scenario.getName();
            if (!names.add(name))
                throw new DataException("duplicate scenario " + name);

            final double probability = scenario.getProbability();
            if (!Double.isFinite(probability) || probability <= 0 || probability > 1)
                throw new DataException("probability of scenario " + name + " must be in (0,1], found "
                    + probability);
            totalProbability += probability;

            if (scenario.getNumSlices() != numSlices)
                throw new DataException("scenario " + name + " has " + scenario.getNumSlices()
                    + " widths, expected " + numSlices);
            for (int j = 0; j < numSlices; ++j)
                checkNonNegative(scenario.getWidth(j), "width of slice " + j + " in scenario " + name);
        }

        if (Math.abs(totalProbability - 1.0) > Constants.PROBABILITY_TOLERANCE)
            throw new DataException("scenario probabilities sum to " + totalProbability + " instead of 1");
    }

    private static Scenario buildImplicitScenario(List<DemandSlice> demandSlices) {
        double[] widths = new double[demandSlices.size()];
        for (int j = 0; j < demandSlices.size(); ++j)
            widths[j] = demandSlices.get(j).getWidth();
        return new Scenario("base", 1.0, widths);
    }

    private static void checkNonNegative(double value, String description) throws DataException {
        if (!Double.isFinite(value) || value < 0)
            throw new DataException(description + " must be non-negative, found " + value);
    }
}
