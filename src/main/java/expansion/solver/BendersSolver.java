package expansion.solver;

import expansion.domain.DemandSlice;
import expansion.lp.LpSolver;
import expansion.output.BendersSummary;
import expansion.output.IterationRecord;
import expansion.output.ResultsRecorder;
import expansion.registry.DataRegistry;
import expansion.registry.Parameters;
import expansion.utility.CSVHelper;
import expansion.utility.Enums;
import expansion.utility.MasterInfeasibleException;
import expansion.utility.OptException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class BendersSolver {
    /**
     * Class that solves the 2-stage capacity expansion problem using Benders decomposition. With a single
     * scenario this is classic Benders; with several it is the L-shaped method using either one aggregated cut
     * or one cut per scenario each iteration.
     * <p>
     * Bounds, cuts and the iteration log belong to one BendersSolver object and only its thread changes them.
     */
    private final static Logger logger = LogManager.getLogger(BendersSolver.class);
    private final DataRegistry dataRegistry;
    private final LpSolver lpSolver;
    private final ResultsRecorder resultsRecorder;
    private final Enums.Variant variant;
    private final boolean multiCut;
    private BufferedWriter cutWriter;

    private Enums.LoopState state;
    private MasterSolver masterSolver;
    private CutGenerator cutGenerator;
    private int iteration;
    private double lowerBound;
    private double upperBound;
    private final ArrayList<IterationRecord> iterationRecords;

    private double[] incumbentxValues;
    private BendersData incumbentData;
    private BendersSummary summary;
    private double solutionTime;

    public BendersSolver(DataRegistry dataRegistry, LpSolver lpSolver, ResultsRecorder resultsRecorder) {
        this.dataRegistry = dataRegistry;
        this.lpSolver = lpSolver;
        this.resultsRecorder = resultsRecorder;
        multiCut = dataRegistry.isStochastic() && Parameters.isBendersMultiCut();
        variant = selectVariant(dataRegistry, Parameters.isBendersMultiCut());
        state = Enums.LoopState.INIT;
        iteration = 0;
        lowerBound = Double.NEGATIVE_INFINITY;
        upperBound = Double.POSITIVE_INFINITY;
        iterationRecords = new ArrayList<>();
    }

    public static Enums.Variant selectVariant(DataRegistry dataRegistry, boolean multiCut) {
        if (!dataRegistry.isStochastic())
            return Enums.Variant.DETERMINISTIC;
        return multiCut ? Enums.Variant.MULTI_CUT : Enums.Variant.AGGREGATE;
    }

    public BendersSummary solve() throws OptException {
        if (state != Enums.LoopState.INIT)
            throw new IllegalStateException("BendersSolver objects can only be solved once");

        checkValueOfLostLoad();
        if (Parameters.isDebugVerbose())
            openCutWriter();

        Instant start = Instant.now();

        masterSolver = new MasterSolver(dataRegistry, lpSolver, multiCut);
        masterSolver.constructFirstStage();
        cutGenerator = new CutGenerator(dataRegistry, multiCut);
        SubSolverWrapper ssWrapper = new SubSolverWrapper(dataRegistry, lpSolver);

        logger.info("algorithm starts.");
        logger.info("variant: " + variant.name());

        try {
            while (!isTerminal())
                runBendersIteration(ssWrapper);
        } catch (MasterInfeasibleException ex) {
            state = Enums.LoopState.ABORTED;
            logger.error("master problem failed in iteration " + iteration + ", aborting");
            solutionTime = Duration.between(start, Instant.now()).toMillis() / 1000.0;
            resultsRecorder.recordSummary(buildSummary(Enums.Outcome.MASTER_INFEASIBLE));
            throw ex;
        } catch (OptException ex) {
            state = Enums.LoopState.ABORTED;
            throw ex;
        } finally {
            ssWrapper.end();
            closeCutWriter();
        }

        solutionTime = Duration.between(start, Instant.now()).toMillis() / 1000.0;
        logger.info("Benders solution time: " + solutionTime + " seconds");

        summary = buildSummary(state == Enums.LoopState.CONVERGED
            ? Enums.Outcome.CONVERGED
            : Enums.Outcome.NON_CONVERGENCE);
        resultsRecorder.recordSummary(summary);
        logger.info("algorithm ends with outcome " + summary.getOutcome().name());
        return summary;
    }

    private boolean isTerminal() {
        return state == Enums.LoopState.CONVERGED
            || state == Enums.LoopState.ITERATION_LIMIT
            || state == Enums.LoopState.ABORTED;
    }

    private void runBendersIteration(SubSolverWrapper ssWrapper) throws OptException {
        ++iteration;
        state = Enums.LoopState.SOLVING_MASTER;
        masterSolver.solve();

        final double prevLowerBound = lowerBound;
        lowerBound = masterSolver.getObjValue();
        if (masterSolver.getNumCuts() > 0 && lowerBound < prevLowerBound - Parameters.getBendersTolerance())
            logger.warn("lower bound decreased from " + prevLowerBound + " to " + lowerBound);

        final double[] xValues = masterSolver.getxValues();
        final double[] thetaValues = masterSolver.getThetaValues();

        state = Enums.LoopState.SOLVING_SUBPROBLEMS;
        BendersData bendersData = ssWrapper.solve(xValues, iteration);
        if (bendersData.getError() != null)
            throw bendersData.getError();

        logger.info("----- iteration: " + iteration);
        logger.info("----- lower bound: " + lowerBound);

        if (bendersData.hasInfeasibleScenarios()) {
            addFeasibilityCut(bendersData, xValues, thetaValues);
            checkIterationLimit();
            return;
        }

        final double expectedRecourse = bendersData.getExpectedRecourse(dataRegistry.getProbabilities());
        final double candidate = masterSolver.getInvestmentCost() + expectedRecourse;
        logger.info("----- upper bound: " + upperBound);
        logger.info("----- upper bound from subsolver: " + candidate);

        if (candidate < upperBound) {
            upperBound = candidate;
            incumbentxValues = xValues;
            incumbentData = bendersData;
        }
        logger.info("----- updated upper bound: " + upperBound);

        if (upperBound < lowerBound - Parameters.getBendersTolerance())
            logger.warn("upper bound " + upperBound + " is below lower bound " + lowerBound);

        if (stoppingConditionReached()) {
            state = Enums.LoopState.CONVERGED;
            record(xValues, thetaValues, expectedRecourse, null);
            return;
        }

        int numAdded = 0;
        for (BendersCut cut : cutGenerator.generateCuts(bendersData)) {
            if (cut.separates(xValues, thetaValues[cut.getThetaIndex()])) {
                masterSolver.addOptimalityCut(cut);
                ++numAdded;
                if (cutWriter != null)
                    writeBendersCut(cut);
            }
        }
        logger.info("----- number of cuts added: " + numAdded);
        logger.info("----- total number of cuts: " + masterSolver.getNumCuts());

        record(xValues, thetaValues, expectedRecourse, numAdded == 0
            ? null
            : (multiCut ? Enums.CutType.OPTIMALITY_MULTI_CUT : Enums.CutType.OPTIMALITY));
        checkIterationLimit();
    }

    private void addFeasibilityCut(BendersData bendersData, double[] xValues, double[] thetaValues)
            throws OptException {
        double rhs = 0.0;
        for (int scenarioNum : bendersData.getInfeasibleScenarios())
            rhs = Math.max(rhs, dataRegistry.getScenarios().get(scenarioNum).getMaxWidth());

        logger.warn("scenarios " + bendersData.getInfeasibleScenarios() + " infeasible in iteration "
            + iteration + ", adding feasibility cut with rhs " + rhs);
        masterSolver.addFeasibilityCut(rhs);
        record(xValues, thetaValues, Double.NaN, Enums.CutType.FEASIBILITY);
    }

    private void record(double[] xValues, double[] thetaValues, double recourse, Enums.CutType cutType)
            throws OptException {
        IterationRecord record = new IterationRecord(iteration, xValues, thetaValues,
            masterSolver.getInvestmentCost(), recourse, lowerBound, upperBound, cutType);
        iterationRecords.add(record);
        resultsRecorder.recordIteration(record);
    }

    private boolean stoppingConditionReached() {
        final double diff = upperBound - lowerBound;
        logger.info("----- gap: " + diff);
        if (Math.abs(diff) <= Parameters.getBendersTolerance())
            return true;

        final double relTolerance = Parameters.getBendersRelativeTolerance();
        return relTolerance > 0 && Math.abs(diff) <= relTolerance * Math.abs(upperBound);
    }

    private void checkIterationLimit() {
        if (iteration >= Parameters.getNumBendersIterations()) {
            logger.info("----- benders iteration limit reached");
            state = Enums.LoopState.ITERATION_LIMIT;
        }
    }

    private void checkValueOfLostLoad() {
        final double voll = Parameters.getValueOfLostLoad();
        final double maxMarginalCost = dataRegistry.getMaxMarginalCost();
        if (voll <= maxMarginalCost)
            logger.warn("value of lost load " + voll + " does not exceed the largest marginal cost "
                + maxMarginalCost + ", shedding load may be preferred to dispatch");
    }

    private BendersSummary buildSummary(Enums.Outcome outcome) {
        BendersSummary bendersSummary = new BendersSummary(variant, outcome);
        bendersSummary.setNumIterations(iteration);
        bendersSummary.setNumCuts(masterSolver.getNumCuts());
        bendersSummary.setLowerBound(lowerBound);
        bendersSummary.setUpperBound(upperBound);
        bendersSummary.setSolutionTime(solutionTime);
        if (outcome != Enums.Outcome.MASTER_INFEASIBLE) {
            bendersSummary.setxValues(masterSolver.getxValues());
            bendersSummary.setThetaValues(masterSolver.getThetaValues());
        }
        if (incumbentxValues != null) {
            bendersSummary.setIncumbentxValues(incumbentxValues.clone());
            bendersSummary.setExpectedUnservedEnergy(computeExpectedUnservedEnergy(incumbentData));
        }
        return bendersSummary;
    }

    /**
     * @return sum over scenarios of probability times unserved energy (unserved power times slice duration).
     */
    private double computeExpectedUnservedEnergy(BendersData bendersData) {
        double[] probabilities = dataRegistry.getProbabilities();
        List<DemandSlice> slices = dataRegistry.getDemandSlices();
        double expected = 0.0;
        for (int w = 0; w < probabilities.length; ++w) {
            double[] lol = bendersData.getSolution(w).getUnservedPower();
            for (int j = 0; j < slices.size(); ++j)
                expected += probabilities[w] * lol[j] * slices.get(j).getDuration();
        }
        return expected;
    }

    private void openCutWriter() throws OptException {
        final String fileName = Parameters.getOutputPath() + File.separator + variant.getFilePrefix() + "_cuts.csv";
        try {
            new File(fileName).getAbsoluteFile().getParentFile().mkdirs();
            cutWriter = new BufferedWriter(new FileWriter(fileName, StandardCharsets.UTF_8));
            ArrayList<String> row = new ArrayList<>(Arrays.asList("iter", "theta_index"));
            for (String name : dataRegistry.getTechnologyNames())
                row.add("beta_" + name);
            row.add("alpha");
            CSVHelper.writeLine(cutWriter, row);
        } catch (IOException ex) {
            logger.error(ex);
            throw new OptException("unable to open cut file " + fileName, ex);
        }
    }

    private void writeBendersCut(BendersCut cut) throws OptException {
        ArrayList<String> row = new ArrayList<>();
        row.add(Integer.toString(iteration));
        row.add(Integer.toString(cut.getThetaIndex()));
        for (double b : cut.getBeta())
            row.add(Double.toString(b));
        row.add(Double.toString(cut.getAlpha()));
        try {
            CSVHelper.writeLine(cutWriter, row);
        } catch (IOException ex) {
            logger.error(ex);
            throw new OptException("unable to write cut of iteration " + iteration, ex);
        }
    }

    private void closeCutWriter() throws OptException {
        if (cutWriter == null)
            return;
        try {
            cutWriter.close();
        } catch (IOException ex) {
            logger.error(ex);
            throw new OptException("unable to close cut file", ex);
        } finally {
            cutWriter = null;
        }
    }

    public Enums.Variant getVariant() {
        return variant;
    }

    public Enums.LoopState getState() {
        return state;
    }

    public int getIteration() {
        return iteration;
    }

    public int getNumBendersCuts() {
        return masterSolver != null ? masterSolver.getNumCuts() : 0;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public List<IterationRecord> getIterationRecords() {
        return Collections.unmodifiableList(iterationRecords);
    }

    public double[] getIncumbentxValues() {
        return incumbentxValues != null ? incumbentxValues.clone() : null;
    }

    public BendersSummary getSummary() {
        return summary;
    }

    public double getSolutionTime() {
        return solutionTime;
    }
}
