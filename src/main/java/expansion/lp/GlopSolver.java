package expansion.lp;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import expansion.utility.OptException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * LpSolver backed by the GLOP simplex code of Google OR-Tools. A fresh native model is built for every call, so
 * one instance can serve several threads.
 */
public class GlopSolver implements LpSolver {
    private final static Logger logger = LogManager.getLogger(GlopSolver.class);
    private final long timeLimitInMs;

    /**
     * @param timeLimitInSec limit for a single solve; 0 or less disables it.
     */
    public GlopSolver(double timeLimitInSec) {
        Loader.loadNativeLibraries();
        timeLimitInMs = timeLimitInSec > 0 ? Math.round(timeLimitInSec * 1000) : 0;
    }

    @Override
    public LpResult solve(LpModel model) throws OptException {
        MPSolver solver = MPSolver.createSolver("GLOP");
        if (solver == null)
            throw new OptException("GLOP solver is not available");

        try {
            if (timeLimitInMs > 0)
                solver.setTimeLimit(timeLimitInMs);

            MPVariable[] vars = buildVariables(solver, model);
            MPConstraint[] cons = buildConstraints(solver, model, vars);

            MPSolver.ResultStatus resultStatus = solver.solve();
            LpStatus status = toLpStatus(resultStatus);
            logger.debug(model.getName() + " solve status: " + resultStatus);
            if (status != LpStatus.OPTIMAL)
                return LpResult.withStatus(status);

            double[] values = new double[vars.length];
            for (int i = 0; i < vars.length; ++i)
                values[i] = vars[i].solutionValue();

            List<LpConstraint> constraints = model.getConstraints();
            double[] duals = new double[cons.length];
            Arrays.fill(duals, Double.NaN);
            for (int i = 0; i < cons.length; ++i)
                if (constraints.get(i).isDualTracked())
                    duals[i] = cons[i].dualValue();

            return new LpResult(status, solver.objective().value(), values, duals);
        } catch (RuntimeException ex) {
            logger.error("GLOP failed on " + model.getName(), ex);
            throw new OptException("GLOP failed on " + model.getName(), ex);
        } finally {
            solver.delete();
        }
    }

    private static MPVariable[] buildVariables(MPSolver solver, LpModel model) {
        MPVariable[] vars = new MPVariable[model.getNumVariables()];
        MPObjective objective = solver.objective();
        for (int i = 0; i < vars.length; ++i) {
            vars[i] = solver.makeNumVar(model.getLowerBound(i), model.getUpperBound(i), model.getVarName(i));
            objective.setCoefficient(vars[i], model.getObjectiveCoef(i));
        }
        objective.setMinimization();
        return vars;
    }

    private static MPConstraint[] buildConstraints(MPSolver solver, LpModel model, MPVariable[] vars) {
        List<LpConstraint> constraints = model.getConstraints();
        MPConstraint[] cons = new MPConstraint[constraints.size()];
        for (int i = 0; i < cons.length; ++i) {
            LpConstraint constraint = constraints.get(i);
            final double rhs = constraint.getRhs();
            double lb = Double.NEGATIVE_INFINITY;
            double ub = Double.POSITIVE_INFINITY;
            switch (constraint.getSense()) {
                case LE:
                    ub = rhs;
                    break;
                case GE:
                    lb = rhs;
                    break;
                case EQ:
                    lb = rhs;
                    ub = rhs;
                    break;
            }

            cons[i] = solver.makeConstraint(lb, ub, constraint.getName());
            for (Map.Entry<Integer, Double> term : constraint.getTerms().entrySet())
                cons[i].setCoefficient(vars[term.getKey()], term.getValue());
        }
        return cons;
    }

    private static LpStatus toLpStatus(MPSolver.ResultStatus resultStatus) {
        switch (resultStatus) {
            case OPTIMAL:
                return LpStatus.OPTIMAL;
            case INFEASIBLE:
                return LpStatus.INFEASIBLE;
            case UNBOUNDED:
                return LpStatus.UNBOUNDED;
            default:
                return LpStatus.OTHER;
        }
    }
}
