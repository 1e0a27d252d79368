package expansion.utility;

public class Enums {

    /**
     * Variant specifies which flavour of the decomposition is run.
     * <p>
     * DETERMINISTIC: classic Benders with a single implicit scenario.
     * AGGREGATE: L-shaped method with one expected-recourse theta and one aggregated cut per iteration.
     * MULTI_CUT: L-shaped method with one theta and one cut per scenario.
     */
    public enum Variant {
        DETERMINISTIC("benders"),
        AGGREGATE("lshaped"),
        MULTI_CUT("lshaped_multicut");

        private final String filePrefix;

        Variant(String filePrefix) {
            this.filePrefix = filePrefix;
        }

        public String getFilePrefix() {
            return filePrefix;
        }
    }

    /**
     * LoopState tracks where the decomposition loop is. CONVERGED, ABORTED and ITERATION_LIMIT are terminal.
     */
    public enum LoopState {INIT, SOLVING_MASTER, SOLVING_SUBPROBLEMS, CONVERGED, ABORTED, ITERATION_LIMIT}

    /**
     * Outcome reported in the final summary of a run.
     */
    public enum Outcome {CONVERGED, NON_CONVERGENCE, MASTER_INFEASIBLE}

    /**
     * CutType tags each iteration record with the kind of cut the iteration produced.
     */
    public enum CutType {
        OPTIMALITY("optimality"),
        OPTIMALITY_MULTI_CUT("optimality_multi_cut"),
        FEASIBILITY("feasibility");

        private final String tag;

        CutType(String tag) {
            this.tag = tag;
        }

        public String getTag() {
            return tag;
        }
    }
}
