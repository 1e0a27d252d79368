package expansion.main;

import expansion.dao.NeedsDAO;
import expansion.dao.ScenarioDAO;
import expansion.dao.TechnologyDAO;
import expansion.domain.DemandSlice;
import expansion.domain.Scenario;
import expansion.domain.Technology;
import expansion.lp.GlopSolver;
import expansion.output.BendersSummary;
import expansion.output.OutputManager;
import expansion.registry.DataRegistry;
import expansion.registry.DataRegistryBuilder;
import expansion.registry.Parameters;
import expansion.solver.BendersSolver;
import expansion.utility.Enums;
import expansion.utility.OptException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.util.ArrayList;

class Controller {
    /**
     * Class that controls the entire solution process from reading data to writing output.
     */
    private final static Logger logger = LogManager.getLogger(Controller.class);
    private final DataRegistry dataRegistry;

    Controller() throws OptException {
        logger.info("Started reading data...");
        final String path = Parameters.getInstancePath();
        logger.debug("instance path: " + path);

        ArrayList<Technology> technologies = new TechnologyDAO(path + File.separator + "technology.csv")
            .getTechnologies();
        ArrayList<DemandSlice> slices = new NeedsDAO(path + File.separator + "needs.csv").getDemandSlices();

        final File scenarioFile = new File(path + File.separator + "scenarios.csv");
        if (Parameters.isUseScenarios() && scenarioFile.exists()) {
            ArrayList<Scenario> scenarios = new ScenarioDAO(scenarioFile.getPath(), slices).getScenarios();
            dataRegistry = new DataRegistryBuilder(technologies, slices, scenarios).getDataRegistry();
        } else
            dataRegistry = new DataRegistryBuilder(technologies, slices).getDataRegistry();

        logger.info("number of technologies: " + dataRegistry.getNumTechnologies());
        logger.info("number of demand slices: " + dataRegistry.getNumSlices());
        logger.info("number of scenarios: " + dataRegistry.getNumScenarios());
        logger.info("completed reading data.");
    }

    DataRegistry getDataRegistry() {
        return dataRegistry;
    }

    BendersSummary solve() throws OptException {
        Enums.Variant variant = BendersSolver.selectVariant(dataRegistry, Parameters.isBendersMultiCut());
        OutputManager outputManager = new OutputManager(dataRegistry, variant, Parameters.getOutputPath());
        try {
            BendersSolver bendersSolver = new BendersSolver(dataRegistry,
                new GlopSolver(Parameters.getSolverTimeLimitInSec()), outputManager);
            BendersSummary summary = bendersSolver.solve();

            logger.info("Benders lower bound: " + summary.getLowerBound());
            logger.info("Benders upper bound: " + summary.getUpperBound());
            logger.info("Benders gap: " + summary.getGap());
            logger.info("Benders iterations: " + summary.getNumIterations());
            logger.info("Benders cuts: " + summary.getNumCuts());
            logger.info("expected unserved energy: " + summary.getExpectedUnservedEnergy());
            return summary;
        } finally {
            outputManager.close();
        }
    }
}
