package expansion.solver;

import expansion.registry.DataRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;

public class CutGenerator {
    /**
     * Turns the duals of a complete set of scenario subproblems into optimality cuts.
     * <p>
     * Aggregated: theta >= sum_w P_w (sum_j lambda_jw dD_jw + rho_w x).
     * Multi-cut: theta_w >= sum_j lambda_jw dD_jw + rho_w x for every scenario w.
     * <p>
     * Both rely on LP duality: the duals of an optimal dispatch are a subgradient of the recourse function, so each
     * cut supports it and is tight at the x it was generated at.
     */
    private final static Logger logger = LogManager.getLogger(CutGenerator.class);
    private final DataRegistry dataRegistry;
    private final boolean multiCut;

    public CutGenerator(DataRegistry dataRegistry, boolean multiCut) {
        this.dataRegistry = dataRegistry;
        this.multiCut = multiCut;
    }

    public ArrayList<BendersCut> generateCuts(BendersData bendersData) {
        checkUsable(bendersData);
        if (multiCut)
            return buildMultiCuts(bendersData);

        ArrayList<BendersCut> cuts = new ArrayList<>();
        cuts.add(buildAggregateCut(bendersData));
        return cuts;
    }

    public BendersCut buildAggregateCut(BendersData bendersData) {
        checkUsable(bendersData);
        double[] probabilities = dataRegistry.getProbabilities();
        BendersCut cut = new BendersCut(0, 0.0, dataRegistry.getNumTechnologies());
        for (int w = 0; w < bendersData.getNumScenarios(); ++w) {
            double[] widths = dataRegistry.getScenarios().get(w).getWidths();
            bendersData.getSolution(w).getDual().addToCut(cut, widths, probabilities[w]);
        }
        logger.debug("aggregated cut alpha: " + cut.getAlpha());
        return cut;
    }

    public ArrayList<BendersCut> buildMultiCuts(BendersData bendersData) {
        checkUsable(bendersData);
        ArrayList<BendersCut> cuts = new ArrayList<>();
        for (int w = 0; w < bendersData.getNumScenarios(); ++w) {
            double[] widths = dataRegistry.getScenarios().get(w).getWidths();
            BendersCut cut = bendersData.getSolution(w).getDual().getBendersCut(w, widths, 1.0);
            logger.debug("scenario " + w + " cut alpha: " + cut.getAlpha());
            cuts.add(cut);
        }
        return cuts;
    }

    private static void checkUsable(BendersData bendersData) {
        if (!bendersData.isComplete())
            throw new IllegalStateException("second-stage results of iteration " + bendersData.getIteration()
                + " are incomplete");
        if (bendersData.getError() != null || bendersData.hasInfeasibleScenarios())
            throw new IllegalStateException("second-stage results of iteration " + bendersData.getIteration()
                + " have no duals for every scenario");
    }
}
