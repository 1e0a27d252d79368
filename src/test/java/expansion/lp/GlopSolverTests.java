package expansion.lp;

import expansion.utility.OptException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GlopSolverTests {
    @Test
    @DisplayName("primal values, objective and duals of tracked constraints are returned")
    void testOptimalSolve() throws OptException {
        // min x + 2y s.t. x + y >= 10, x <= 4
        LpModel model = new LpModel("small");
        final int x = model.addVariable("x", 0.0, Double.POSITIVE_INFINITY);
        final int y = model.addVariable("y", 0.0, Double.POSITIVE_INFINITY);
        model.setObjectiveCoef(x, 1.0);
        model.setObjectiveCoef(y, 2.0);
        LpConstraint cover = model.addConstraint("cover", LpSense.GE, 10.0, true).addTerm(x, 1.0).addTerm(y, 1.0);
        LpConstraint bound = model.addConstraint("bound", LpSense.LE, 4.0, true).addTerm(x, 1.0);
        LpConstraint loose = model.addConstraint("loose", LpSense.LE, 100.0, false).addTerm(y, 1.0);

        assertEquals(2, model.getNumVariables());
        assertEquals(3, model.getNumConstraints());

        LpResult result = new GlopSolver(10).solve(model);
        assertTrue(result.isOptimal());
        assertEquals(16.0, result.getObjValue(), 1e-9);
        assertEquals(4.0, result.getValue(x), 1e-9);
        assertEquals(6.0, result.getValue(y), 1e-9);
        assertEquals(2.0, result.getDual(cover.getIndex()), 1e-9);
        assertEquals(-1.0, result.getDual(bound.getIndex()), 1e-9);
        assertTrue(Double.isNaN(result.getDual(loose.getIndex())));
    }

    @Test
    @DisplayName("equality constraints and merged terms are passed to the solver")
    void testEquality() throws OptException {
        LpModel model = new LpModel("equality");
        final int x = model.addVariable("x", 0.0, 8.0);
        model.setObjectiveCoef(x, 3.0);
        LpConstraint cons = model.addConstraint("fix", LpSense.EQ, 5.0, true);
        cons.addTerm(x, 0.5).addTerm(x, 0.5);

        LpResult result = new GlopSolver(0).solve(model);
        assertTrue(result.isOptimal());
        assertEquals(5.0, result.getValue(x), 1e-9);
        assertEquals(15.0, result.getObjValue(), 1e-9);
        assertEquals(3.0, result.getDual(cons.getIndex()), 1e-9);
    }

    @Test
    @DisplayName("infeasible models are reported through the status")
    void testInfeasible() throws OptException {
        LpModel model = new LpModel("infeasible");
        final int x = model.addVariable("x", 0.0, 3.0);
        model.setObjectiveCoef(x, 1.0);
        model.addConstraint("too_much", LpSense.GE, 5.0, false).addTerm(x, 1.0);

        LpResult result = new GlopSolver(10).solve(model);
        assertFalse(result.isOptimal());
        assertEquals(LpStatus.INFEASIBLE, result.getStatus());
    }
}
