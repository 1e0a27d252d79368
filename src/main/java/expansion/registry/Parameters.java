package expansion.registry;

import java.util.HashMap;

public class Parameters {
    private static String instancePath;
    private static String outputPath;

    private static boolean useScenarios; // if false, scenarios.csv is ignored and the deterministic variant runs.
    private static boolean bendersMultiCut;
    private static double bendersTolerance; // absolute tolerance on UB - LB.
    private static double bendersRelativeTolerance; // relative tolerance on (UB - LB) / |UB|, disabled if 0.
    private static int numBendersIterations;

    /**
     * Penalty price per MWh of unserved energy. It must exceed every marginal cost so that load is shed only when
     * installed capacity is insufficient.
     */
    private static double valueOfLostLoad;

    private static double solverTimeLimitInSec;
    private static double secondStageTimeoutInSec;

    private static boolean debugVerbose; // writes cuts and master solutions of every iteration.

    private static boolean runSecondStageInParallel;
    private static int numThreadsForSecondStage;

    public static void setDefaults() {
        instancePath = "data";
        outputPath = "solution";

        useScenarios = true;
        bendersMultiCut = false;
        bendersTolerance = 1e-3;
        bendersRelativeTolerance = 0.0;
        numBendersIterations = 50;
        valueOfLostLoad = 1000.0;

        solverTimeLimitInSec = 60.0;
        secondStageTimeoutInSec = 600.0;

        debugVerbose = false;

        runSecondStageInParallel = false;
        numThreadsForSecondStage = 1;
    }

    static {
        setDefaults();
    }

    public static void setInstancePath(String instancePath) {
        Parameters.instancePath = instancePath;
    }

    public static String getInstancePath() {
        return instancePath;
    }

    public static void setOutputPath(String outputPath) {
        Parameters.outputPath = outputPath;
    }

    public static String getOutputPath() {
        return outputPath;
    }

    public static void setUseScenarios(boolean useScenarios) {
        Parameters.useScenarios = useScenarios;
    }

    public static boolean isUseScenarios() {
        return useScenarios;
    }

    public static void setBendersMultiCut(boolean bendersMultiCut) {
        Parameters.bendersMultiCut = bendersMultiCut;
    }

    public static boolean isBendersMultiCut() {
        return bendersMultiCut;
    }

    public static void setBendersTolerance(double bendersTolerance) {
        Parameters.bendersTolerance = bendersTolerance;
    }

    public static double getBendersTolerance() {
        return bendersTolerance;
    }

    public static void setBendersRelativeTolerance(double bendersRelativeTolerance) {
        Parameters.bendersRelativeTolerance = bendersRelativeTolerance;
    }

    public static double getBendersRelativeTolerance() {
        return bendersRelativeTolerance;
    }

    public static void setNumBendersIterations(int numBendersIterations) {
        Parameters.numBendersIterations = numBendersIterations;
    }

    public static int getNumBendersIterations() {
        return numBendersIterations;
    }

    public static void setValueOfLostLoad(double valueOfLostLoad) {
        Parameters.valueOfLostLoad = valueOfLostLoad;
    }

    public static double getValueOfLostLoad() {
        return valueOfLostLoad;
    }

    public static void setSolverTimeLimitInSec(double solverTimeLimitInSec) {
        Parameters.solverTimeLimitInSec = solverTimeLimitInSec;
    }

    public static double getSolverTimeLimitInSec() {
        return solverTimeLimitInSec;
    }

    public static void setSecondStageTimeoutInSec(double secondStageTimeoutInSec) {
        Parameters.secondStageTimeoutInSec = secondStageTimeoutInSec;
    }

    public static double getSecondStageTimeoutInSec() {
        return secondStageTimeoutInSec;
    }

    public static void setDebugVerbose(boolean debugVerbose) {
        Parameters.debugVerbose = debugVerbose;
    }

    public static boolean isDebugVerbose() {
        return debugVerbose;
    }

    public static void setRunSecondStageInParallel(boolean runSecondStageInParallel) {
        Parameters.runSecondStageInParallel = runSecondStageInParallel;
    }

    public static boolean isRunSecondStageInParallel() {
        return runSecondStageInParallel;
    }

    public static void setNumThreadsForSecondStage(int numThreadsForSecondStage) {
        Parameters.numThreadsForSecondStage = numThreadsForSecondStage;
    }

    public static int getNumThreadsForSecondStage() {
        return numThreadsForSecondStage;
    }

    public static HashMap<String, Object> asMap() {
        HashMap<String, Object> results = new HashMap<>();
        results.put("instancePath", instancePath);
        results.put("useScenarios", useScenarios);
        results.put("bendersMultiCut", bendersMultiCut);
        results.put("bendersTolerance", bendersTolerance);
        results.put("bendersRelativeTolerance", bendersRelativeTolerance);
        results.put("bendersIterations", numBendersIterations);
        results.put("valueOfLostLoad", valueOfLostLoad);
        results.put("solverTimeLimitInSec", solverTimeLimitInSec);
        results.put("secondStageTimeoutInSec", secondStageTimeoutInSec);
        results.put("runSecondStageInParallel", runSecondStageInParallel);
        results.put("numThreads", numThreadsForSecondStage);
        return results;
    }
}
