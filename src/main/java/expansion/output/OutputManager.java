package expansion.output;

import expansion.registry.DataRegistry;
import expansion.registry.Parameters;
import expansion.utility.CSVHelper;
import expansion.utility.Enums;
import expansion.utility.OptException;
import expansion.utility.Util;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.TreeMap;

public class OutputManager implements ResultsRecorder {
    /**
     * OutputManager writes the iteration log of a run to "<variant>_results.csv" and its final summary to
     * "<variant>_summary.yaml", both under the output folder. Rows are flushed as soon as they arrive so that
     * the log survives an aborted run.
     */
    private final static Logger logger = LogManager.getLogger(OutputManager.class);
    private final DataRegistry dataRegistry;
    private final Enums.Variant variant;
    private final String resultsPath;
    private final String summaryPath;
    private final List<String> headers;
    private BufferedWriter resultsWriter;

    public OutputManager(DataRegistry dataRegistry, Enums.Variant variant, String outputPath) {
        this.dataRegistry = dataRegistry;
        this.variant = variant;
        resultsPath = outputPath + File.separator + variant.getFilePrefix() + "_results.csv";
        summaryPath = outputPath + File.separator + variant.getFilePrefix() + "_summary.yaml";
        headers = Collections.unmodifiableList(buildHeaders());
    }

    public List<String> getHeaders() {
        return headers;
    }

    public String getResultsPath() {
        return resultsPath;
    }

    public String getSummaryPath() {
        return summaryPath;
    }

    private ArrayList<String> buildHeaders() {
        ArrayList<String> row = new ArrayList<>(Collections.singletonList("iter"));
        row.addAll(dataRegistry.getTechnologyNames());
        if (variant == Enums.Variant.MULTI_CUT) {
            for (String name : dataRegistry.getScenarioNames())
                row.add("theta_" + name);
        } else
            row.add("theta");

        row.add("investment_cost");
        row.add(variant == Enums.Variant.DETERMINISTIC ? "Q" : "EQ");
        row.addAll(Arrays.asList("LB", "UB", "gap", "cut_type"));
        return row;
    }

    @Override
    public void recordIteration(IterationRecord record) throws OptException {
        ArrayList<String> row = new ArrayList<>();
        row.add(Integer.toString(record.getIteration()));
        for (double x : record.getxValues())
            row.add(Double.toString(x));
        for (double theta : record.getThetaValues())
            row.add(Double.toString(theta));

        row.add(Double.toString(record.getInvestmentCost()));
        row.add(Double.toString(record.getRecourse()));
        row.add(Double.toString(record.getLowerBound()));
        row.add(Double.toString(record.getUpperBound()));
        row.add(Double.toString(record.getGap()));
        row.add(record.getCutType() != null ? record.getCutType().getTag() : "");

        if (row.size() != headers.size())
            throw new OptException("iteration row has " + row.size() + " fields, expected " + headers.size());

        try {
            if (resultsWriter == null) {
                new File(resultsPath).getAbsoluteFile().getParentFile().mkdirs();
                resultsWriter = new BufferedWriter(new FileWriter(resultsPath, StandardCharsets.UTF_8));
                CSVHelper.writeLine(resultsWriter, headers);
            }
            CSVHelper.writeLine(resultsWriter, row);
            resultsWriter.flush();
        } catch (IOException ex) {
            logger.error(ex);
            throw new OptException("unable to write iteration " + record.getIteration() + " to " + resultsPath, ex);
        }
    }

    @Override
    public void recordSummary(BendersSummary summary) throws OptException {
        close();

        LinkedHashMap<String, Object> solution = new LinkedHashMap<>();
        solution.put("outcome", summary.getOutcome().name());
        solution.put("iterations", summary.getNumIterations());
        solution.put("cuts", summary.getNumCuts());
        solution.put("lower bound", summary.getLowerBound());
        solution.put("upper bound", summary.getUpperBound());
        solution.put("gap", summary.getGap());
        solution.put("expected unserved energy", summary.getExpectedUnservedEnergy());
        solution.put("solution time (seconds)", summary.getSolutionTime());
        solution.put("capacity", toTechnologyMap(summary.getxValues()));
        solution.put("incumbent capacity", toTechnologyMap(summary.getIncumbentxValues()));
        if (summary.getThetaValues() != null)
            solution.put("theta", Util.toList(summary.getThetaValues()));

        LinkedHashMap<String, Object> input = new LinkedHashMap<>();
        input.put("variant", variant.name());
        input.put("number of technologies", dataRegistry.getNumTechnologies());
        input.put("number of demand slices", dataRegistry.getNumSlices());
        input.put("number of scenarios", dataRegistry.getNumScenarios());

        LinkedHashMap<String, Object> all = new LinkedHashMap<>();
        all.put("input", input);
        all.put("parameters", new TreeMap<>(Parameters.asMap()));
        all.put("solution", solution);

        new File(summaryPath).getAbsoluteFile().getParentFile().mkdirs();
        Util.writeToYaml(all, summaryPath);
        logger.info("wrote summary to " + summaryPath);
    }

    private LinkedHashMap<String, Double> toTechnologyMap(double[] values) {
        LinkedHashMap<String, Double> map = new LinkedHashMap<>();
        if (values == null)
            return map;

        ArrayList<String> names = dataRegistry.getTechnologyNames();
        for (int i = 0; i < names.size(); ++i)
            map.put(names.get(i), values[i]);
        return map;
    }

    /**
     * Closes the iteration log. Safe to call more than once.
     */
    public void close() throws OptException {
        if (resultsWriter == null)
            return;
        try {
            resultsWriter.close();
        } catch (IOException ex) {
            logger.error(ex);
            throw new OptException("unable to close " + resultsPath, ex);
        } finally {
            resultsWriter = null;
        }
    }
}
