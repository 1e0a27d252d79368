package expansion.solver;

import expansion.lp.GlopSolver;
import expansion.lp.LpResult;
import expansion.lp.LpSolver;
import expansion.lp.LpStatus;
import expansion.output.BendersSummary;
import expansion.output.IterationRecord;
import expansion.output.ResultsRecorder;
import expansion.registry.DataRegistry;
import expansion.registry.Parameters;
import expansion.utility.DataException;
import expansion.utility.Enums;
import expansion.utility.MasterInfeasibleException;
import expansion.utility.OptException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BendersSolverTests {
    private final LpSolver glop = new GlopSolver(10);

    /**
     * Keeps everything in memory.
     */
    private static class Recorder implements ResultsRecorder {
        private final ArrayList<IterationRecord> records = new ArrayList<>();
        private BendersSummary summary;

        @Override
        public void recordIteration(IterationRecord record) {
            records.add(record);
        }

        @Override
        public void recordSummary(BendersSummary summary) {
            this.summary = summary;
        }
    }

    @BeforeEach
    void setUp() {
        Parameters.setDefaults();
    }

    private static BendersSummary solve(DataRegistry dataRegistry, LpSolver lpSolver, Recorder recorder)
            throws OptException {
        return new BendersSolver(dataRegistry, lpSolver, recorder).solve();
    }

    @Test
    @DisplayName("expensive capacity is not built when shedding the single slice is cheaper")
    void testExpensiveInvestment() throws OptException {
        DataRegistry dataRegistry = InstanceFactory.buildSingleSlice(100000, 20000, 100);
        Recorder recorder = new Recorder();
        BendersSummary summary = solve(dataRegistry, glop, recorder);

        assertEquals(Enums.Variant.DETERMINISTIC, summary.getVariant());
        assertEquals(Enums.Outcome.CONVERGED, summary.getOutcome());
        assertEquals(2, summary.getNumIterations());
        assertEquals(100000, summary.getUpperBound(), 1e-6);
        assertTrue(Math.abs(summary.getGap()) <= 1e-3);
        assertArrayEquals(new double[]{0, 0}, summary.getIncumbentxValues(), 1e-6);
        assertEquals(100, summary.getExpectedUnservedEnergy(), 1e-6);
        assertEquals(1, summary.getNumCuts());
        assertTrue(recorder.summary == summary);
    }

    @Test
    @DisplayName("full demand is served by the technology with the lowest total cost")
    void testCheapInvestment() throws OptException {
        DataRegistry dataRegistry = InstanceFactory.buildSingleSlice(100, 20, 100);
        Recorder recorder = new Recorder();
        BendersSolver bendersSolver = new BendersSolver(dataRegistry, glop, recorder);
        BendersSummary summary = bendersSolver.solve();

        assertEquals(Enums.Outcome.CONVERGED, summary.getOutcome());
        assertEquals(Enums.LoopState.CONVERGED, bendersSolver.getState());
        assertEquals(3, summary.getNumIterations());
        assertEquals(7000, summary.getUpperBound(), 1e-6);
        assertEquals(7000, summary.getLowerBound(), 1e-3);
        assertArrayEquals(new double[]{0, 100}, summary.getIncumbentxValues(), 1e-6);
        assertEquals(0, summary.getExpectedUnservedEnergy(), 1e-6);

        List<IterationRecord> records = recorder.records;
        assertEquals(3, records.size());
        assertEquals(Enums.CutType.OPTIMALITY, records.get(0).getCutType());
        assertEquals(100000, records.get(0).getRecourse(), 1e-6);
        assertEquals(100000, records.get(0).getUpperBound(), 1e-6);
        assertEquals(20 * 100000 / 950.0, records.get(1).getLowerBound(), 1e-6);
        assertEquals(20 * 100000 / 950.0 + 5000, records.get(1).getUpperBound(), 1e-6);
        assertNull(records.get(2).getCutType());
        assertEquals(records, bendersSolver.getIterationRecords());
        assertEquals(2, bendersSolver.getNumBendersCuts());
        assertTrue(bendersSolver.getSummary() == summary);
    }

    @Test
    @DisplayName("huge demand is shed when capacity costs more than lost load")
    void testHugeDemand() throws OptException {
        Parameters.setBendersRelativeTolerance(1e-9);
        DataRegistry dataRegistry = InstanceFactory.buildSingleSlice(2000, 2000, 1e9);
        BendersSummary summary = solve(dataRegistry, glop, new Recorder());

        assertEquals(Enums.Outcome.CONVERGED, summary.getOutcome());
        assertEquals(1e12, summary.getUpperBound(), 1e3);
        assertTrue(Double.isFinite(summary.getLowerBound()));
        assertEquals(1e9, summary.getExpectedUnservedEnergy(), 1.0);
        assertArrayEquals(new double[]{0, 0}, summary.getIncumbentxValues(), 1e-6);
    }

    @Test
    @DisplayName("the iteration cap ends the run with a non-convergence report")
    void testIterationLimit() throws OptException {
        Parameters.setNumBendersIterations(2);
        Parameters.setBendersTolerance(0.0);
        DataRegistry dataRegistry = InstanceFactory.buildSingleSlice(100, 20, 100);
        Recorder recorder = new Recorder();
        BendersSolver bendersSolver = new BendersSolver(dataRegistry, glop, recorder);
        BendersSummary summary = bendersSolver.solve();

        assertEquals(Enums.Outcome.NON_CONVERGENCE, summary.getOutcome());
        assertEquals(Enums.LoopState.ITERATION_LIMIT, bendersSolver.getState());
        assertEquals(2, summary.getNumIterations());
        assertEquals(2, recorder.records.size());
        assertEquals(5000, summary.getGap(), 1e-6);
        assertEquals(100000 / 950.0, summary.getIncumbentxValues()[1], 1e-6);
        assertThrows(IllegalStateException.class, bendersSolver::solve);
    }

    @Test
    @DisplayName("a single scenario with probability 1 reproduces the deterministic run")
    void testSingleScenario() throws OptException {
        BendersSummary deterministic = solve(InstanceFactory.buildTwoSliceDeterministic(), glop, new Recorder());
        BendersSummary stochastic = solve(InstanceFactory.buildTwoSliceSingleScenario(), glop, new Recorder());

        assertEquals(Enums.Variant.DETERMINISTIC, deterministic.getVariant());
        assertEquals(Enums.Variant.AGGREGATE, stochastic.getVariant());
        assertEquals(Enums.Outcome.CONVERGED, stochastic.getOutcome());
        assertEquals(deterministic.getNumIterations(), stochastic.getNumIterations());
        assertEquals(deterministic.getUpperBound(), stochastic.getUpperBound(), 1e-6);
        assertEquals(deterministic.getLowerBound(), stochastic.getLowerBound(), 1e-6);
        assertArrayEquals(deterministic.getxValues(), stochastic.getxValues(), 1e-6);
        assertArrayEquals(deterministic.getThetaValues(), stochastic.getThetaValues(), 1e-6);
    }

    @Test
    @DisplayName("aggregated and multi-cut runs reach the same optimal cost")
    void testAggregateAndMultiCut() throws OptException {
        DataRegistry dataRegistry = InstanceFactory.buildTwoScenarios();
        Recorder aggregateRecorder = new Recorder();
        BendersSummary aggregate = solve(dataRegistry, glop, aggregateRecorder);

        Parameters.setBendersMultiCut(true);
        Recorder multiCutRecorder = new Recorder();
        BendersSummary multiCut = solve(dataRegistry, glop, multiCutRecorder);

        assertEquals(Enums.Variant.AGGREGATE, aggregate.getVariant());
        assertEquals(Enums.Variant.MULTI_CUT, multiCut.getVariant());
        assertEquals(Enums.Outcome.CONVERGED, aggregate.getOutcome());
        assertEquals(Enums.Outcome.CONVERGED, multiCut.getOutcome());
        assertEquals(aggregate.getUpperBound(), multiCut.getUpperBound(), 2e-3);
        assertEquals(2, multiCut.getThetaValues().length);
        assertEquals(Enums.CutType.OPTIMALITY_MULTI_CUT, multiCutRecorder.records.get(0).getCutType());
        assertEquals(Enums.CutType.OPTIMALITY, aggregateRecorder.records.get(0).getCutType());
    }

    @Test
    @DisplayName("the upper bound never increases and the lower bound never decreases")
    void testBoundMonotonicity() throws OptException {
        Recorder recorder = new Recorder();
        solve(InstanceFactory.buildTwoScenarios(), glop, recorder);

        List<IterationRecord> records = recorder.records;
        assertTrue(records.size() > 1);
        for (int k = 1; k < records.size(); ++k) {
            assertTrue(records.get(k).getUpperBound() <= records.get(k - 1).getUpperBound());
            assertTrue(records.get(k).getLowerBound() >= records.get(k - 1).getLowerBound() - 1e-6);
            assertTrue(records.get(k).getUpperBound() >= records.get(k).getLowerBound() - 1e-6);
        }
    }

    @Test
    @DisplayName("solving second-stage problems on actors gives the sequential result")
    void testParallelSecondStage() throws OptException {
        DataRegistry dataRegistry = InstanceFactory.buildTwoScenarios();
        Parameters.setBendersMultiCut(true);
        BendersSummary sequential = solve(dataRegistry, glop, new Recorder());

        Parameters.setRunSecondStageInParallel(true);
        Parameters.setNumThreadsForSecondStage(2);
        Parameters.setSecondStageTimeoutInSec(60);
        BendersSummary parallel = solve(dataRegistry, glop, new Recorder());

        assertEquals(Enums.Outcome.CONVERGED, parallel.getOutcome());
        assertEquals(sequential.getNumIterations(), parallel.getNumIterations());
        assertEquals(sequential.getUpperBound(), parallel.getUpperBound(), 1e-6);
        assertArrayEquals(sequential.getIncumbentxValues(), parallel.getIncumbentxValues(), 1e-6);
    }

    @Test
    @DisplayName("a failed master aborts the run and keeps the iterations logged so far")
    void testMasterFailure() throws OptException {
        AtomicInteger numMasterSolves = new AtomicInteger(0);
        LpSolver failingSecondMaster = model -> {
            if (model.getName().equals("master") && numMasterSolves.incrementAndGet() == 2)
                return LpResult.withStatus(LpStatus.INFEASIBLE);
            return glop.solve(model);
        };

        DataRegistry dataRegistry = InstanceFactory.buildSingleSlice(100, 20, 100);
        Recorder recorder = new Recorder();
        BendersSolver bendersSolver = new BendersSolver(dataRegistry, failingSecondMaster, recorder);
        assertThrows(MasterInfeasibleException.class, bendersSolver::solve);

        assertEquals(Enums.LoopState.ABORTED, bendersSolver.getState());
        assertEquals(1, recorder.records.size());
        assertEquals(Enums.Outcome.MASTER_INFEASIBLE, recorder.summary.getOutcome());
        assertEquals(2, recorder.summary.getNumIterations());
    }

    @Test
    @DisplayName("an infeasible subproblem adds a feasibility cut and the run continues")
    void testSubproblemInfeasible() throws OptException {
        AtomicInteger numSubSolves = new AtomicInteger(0);
        LpSolver failingFirstSub = model -> {
            if (model.getName().startsWith("sub_") && numSubSolves.incrementAndGet() == 1)
                return LpResult.withStatus(LpStatus.INFEASIBLE);
            return glop.solve(model);
        };

        DataRegistry dataRegistry = InstanceFactory.buildSingleSlice(100, 20, 100);
        Recorder recorder = new Recorder();
        BendersSummary summary = solve(dataRegistry, failingFirstSub, recorder);

        IterationRecord first = recorder.records.get(0);
        assertEquals(Enums.CutType.FEASIBILITY, first.getCutType());
        assertTrue(Double.isNaN(first.getRecourse()));
        assertEquals(Double.POSITIVE_INFINITY, first.getUpperBound());
        assertFalse(Double.isNaN(recorder.records.get(1).getRecourse()));

        assertEquals(Enums.Outcome.CONVERGED, summary.getOutcome());
        assertEquals(7000, summary.getUpperBound(), 1e-6);
        assertArrayEquals(new double[]{0, 100}, summary.getIncumbentxValues(), 1e-6);
    }

    @Test
    @DisplayName("a cut already satisfied by the master point is not added")
    void testNonSeparatingCutDropped() throws OptException {
        DataRegistry dataRegistry = InstanceFactory.buildSingleSlice(100000, 20000, 100);
        Parameters.setBendersTolerance(-1.0);
        Parameters.setNumBendersIterations(3);
        Recorder recorder = new Recorder();
        BendersSolver bendersSolver = new BendersSolver(dataRegistry, glop, recorder);
        BendersSummary summary = bendersSolver.solve();

        assertEquals(Enums.Outcome.NON_CONVERGENCE, summary.getOutcome());
        assertEquals(3, recorder.records.size());
        assertEquals(1, bendersSolver.getNumBendersCuts());
        assertEquals(1, summary.getNumCuts());
    }

    @Test
    @DisplayName("an interrupt during the parallel second stage aborts the run and keeps the interrupt flag")
    void testInterruptedSecondStage() throws DataException {
        Parameters.setRunSecondStageInParallel(true);
        Parameters.setNumThreadsForSecondStage(2);
        Parameters.setSecondStageTimeoutInSec(60);
        LpSolver interruptingMaster = model -> {
            if (model.getName().equals("master"))
                Thread.currentThread().interrupt();
            return glop.solve(model);
        };

        DataRegistry dataRegistry = InstanceFactory.buildTwoScenarios();
        try {
            assertThrows(OptException.class, () -> solve(dataRegistry, interruptingMaster, new Recorder()));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
