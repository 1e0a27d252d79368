package expansion.solver;

import expansion.utility.OptException;

import java.util.ArrayList;

public class BendersData {
    /**
     * BendersData objects gather the second-stage outcomes of one iteration, one slot per scenario. Cuts may only
     * be built once every slot is filled.
     */
    private final int iteration;
    private final SubproblemSolution[] solutions;
    private final boolean[] processed;
    private final boolean[] infeasible;
    private int numProcessed;
    private OptException error;

    BendersData(int iteration, int numScenarios) {
        this.iteration = iteration;
        solutions = new SubproblemSolution[numScenarios];
        processed = new boolean[numScenarios];
        infeasible = new boolean[numScenarios];
        numProcessed = 0;
    }

    /**
     * Stores the outcome of a finished subproblem run. A scenario reported twice is counted once.
     */
    public void addResult(SubSolverRunnable runnable) {
        final int scenarioNum = runnable.getScenarioNum();
        if (processed[scenarioNum])
            return;

        processed[scenarioNum] = true;
        ++numProcessed;
        if (runnable.getError() != null && error == null)
            error = runnable.getError();
        else if (runnable.isInfeasible())
            infeasible[scenarioNum] = true;
        else
            solutions[scenarioNum] = runnable.getSolution();
    }

    public boolean isComplete() {
        return numProcessed == solutions.length;
    }

    public int getIteration() {
        return iteration;
    }

    public int getNumScenarios() {
        return solutions.length;
    }

    public OptException getError() {
        return error;
    }

    public boolean hasInfeasibleScenarios() {
        for (boolean b : infeasible)
            if (b)
                return true;
        return false;
    }

    public ArrayList<Integer> getInfeasibleScenarios() {
        ArrayList<Integer> scenarios = new ArrayList<>();
        for (int i = 0; i < infeasible.length; ++i)
            if (infeasible[i])
                scenarios.add(i);
        return scenarios;
    }

    public SubproblemSolution getSolution(int scenarioNum) {
        return solutions[scenarioNum];
    }

    /**
     * @param probabilities scenario probabilities.
     * @return sum over scenarios of probability times recourse value.
     */
    public double getExpectedRecourse(double[] probabilities) {
        double expected = 0.0;
        for (int i = 0; i < solutions.length; ++i)
            expected += probabilities[i] * solutions[i].getObjValue();
        return expected;
    }
}
