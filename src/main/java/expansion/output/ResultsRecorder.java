package expansion.output;

import expansion.utility.OptException;

/**
 * Receives the iteration log and the final summary of a decomposition run.
 */
public interface ResultsRecorder {
    void recordIteration(IterationRecord record) throws OptException;

    void recordSummary(BendersSummary summary) throws OptException;
}
