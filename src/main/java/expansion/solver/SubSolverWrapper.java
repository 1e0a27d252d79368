package expansion.solver;

import expansion.actor.ActorManager;
import expansion.lp.LpSolver;
import expansion.registry.DataRegistry;
import expansion.registry.Parameters;
import expansion.utility.OptException;

/**
 * Wrapper class that solves the second-stage problems of an iteration, either one after the other or in
 * parallel on an actor pool. Either way the returned BendersData holds every scenario.
 */
class SubSolverWrapper {
    private final DataRegistry dataRegistry;
    private final LpSolver lpSolver;
    private ActorManager actorManager;

    SubSolverWrapper(DataRegistry dataRegistry, LpSolver lpSolver) {
        this.dataRegistry = dataRegistry;
        this.lpSolver = lpSolver;
        if (Parameters.isRunSecondStageInParallel()) {
            actorManager = new ActorManager();
            actorManager.createActors(Parameters.getNumThreadsForSecondStage());
        }
    }

    BendersData solve(double[] xValues, int iter) throws OptException {
        return actorManager != null ? solveParallel(xValues, iter) : solveSequential(xValues, iter);
    }

    BendersData solveSequential(double[] xValues, int iter) {
        final int numScenarios = dataRegistry.getNumScenarios();
        BendersData bendersData = new BendersData(iter, numScenarios);
        for (int i = 0; i < numScenarios; ++i) {
            SubSolverRunnable ssr = new SubSolverRunnable(dataRegistry, lpSolver, iter, i, xValues);
            ssr.run();
            bendersData.addResult(ssr);
        }
        return bendersData;
    }

    BendersData solveParallel(double[] xValues, int iter) throws OptException {
        final int numScenarios = dataRegistry.getNumScenarios();
        actorManager.initBendersData(new BendersData(iter, numScenarios));

        SubSolverRunnable[] models = new SubSolverRunnable[numScenarios];
        for (int i = 0; i < numScenarios; ++i)
            models[i] = new SubSolverRunnable(dataRegistry, lpSolver, iter, i, xValues);

        final long timeoutInMs = (long) (Parameters.getSecondStageTimeoutInSec() * 1000);
        return actorManager.solveModels(models, timeoutInMs);
    }

    void end() {
        if (actorManager != null) {
            actorManager.end();
            actorManager = null;
        }
    }
}
