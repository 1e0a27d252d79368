package expansion.main;

import expansion.registry.Parameters;
import expansion.utility.Constants;
import expansion.utility.OptException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class that owns main().
 */
public class Main {
    private final static Logger logger = LogManager.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            CommandLine cmd = addOptions(args);
            if (cmd == null)
                return;

            Parameters.setDefaults();
            updateParameters(cmd);
            singleRun();
        } catch (OptException ex) {
            logger.error(ex);
            System.exit(Constants.ERROR_CODE);
        }
    }

    static CommandLine addOptions(String[] args) throws OptException {
        Options options = new Options();
        options.addOption("cut", true, "benders cut type (single/multi)");
        options.addOption("deterministic", false, "ignore scenarios.csv and run deterministic Benders");
        options.addOption("inputPath", true, "path to folder with technology.csv, needs.csv and scenarios.csv");
        options.addOption("iterations", true, "maximum number of Benders iterations");
        options.addOption("outputPath", true, "path to output folder");
        options.addOption("parallel", true, "number of parallel runs for second stage");
        options.addOption("relTolerance", true, "relative Benders gap tolerance (0 to disable)");
        options.addOption("timeLimit", true, "time limit in seconds for each LP solve");
        options.addOption("tolerance", true, "absolute Benders gap tolerance");
        options.addOption("verbose", false, "write cut file and debug information");
        options.addOption("voll", true, "value of lost load");
        options.addOption("h", false, "help (show options and exit)");

        CommandLineParser parser = new DefaultParser();
        try {
            CommandLine cmd = parser.parse(options, args);
            if (cmd.hasOption('h')) {
                HelpFormatter helpFormatter = new HelpFormatter();
                helpFormatter.printHelp("expansion.jar", options);
                return null;
            }
            return cmd;
        } catch (ParseException ex) {
            logger.error(ex);
            throw new OptException("error parsing CLI args", ex);
        }
    }

    private static void singleRun() throws OptException {
        logger.info("Started optimization...");
        Controller controller = new Controller();
        controller.solve();
        logger.info("completed optimization.");
    }

    static void updateParameters(CommandLine cmd) throws OptException {
        Parameters.setInstancePath(cmd.getOptionValue("inputPath", "data"));
        Parameters.setOutputPath(cmd.getOptionValue("outputPath", "solution"));
        if (cmd.hasOption("cut")) {
            final String cutType = cmd.getOptionValue("cut");
            if (cutType.equals("single"))
                Parameters.setBendersMultiCut(false);
            else if (cutType.equals("multi"))
                Parameters.setBendersMultiCut(true);
            else throw new OptException("unknown cut type " + cutType);
        }
        if (cmd.hasOption("deterministic"))
            Parameters.setUseScenarios(false);
        if (cmd.hasOption("verbose"))
            Parameters.setDebugVerbose(true);

        try {
            if (cmd.hasOption("tolerance"))
                Parameters.setBendersTolerance(Double.parseDouble(cmd.getOptionValue("tolerance")));
            if (cmd.hasOption("relTolerance"))
                Parameters.setBendersRelativeTolerance(Double.parseDouble(cmd.getOptionValue("relTolerance")));
            if (cmd.hasOption("iterations"))
                Parameters.setNumBendersIterations(Integer.parseInt(cmd.getOptionValue("iterations")));
            if (cmd.hasOption("voll"))
                Parameters.setValueOfLostLoad(Double.parseDouble(cmd.getOptionValue("voll")));
            if (cmd.hasOption("timeLimit"))
                Parameters.setSolverTimeLimitInSec(Double.parseDouble(cmd.getOptionValue("timeLimit")));
            if (cmd.hasOption("parallel")) {
                final int numThreads = Integer.parseInt(cmd.getOptionValue("parallel"));
                Parameters.setNumThreadsForSecondStage(numThreads);
                Parameters.setRunSecondStageInParallel(numThreads > 1);
            }
        } catch (NumberFormatException ex) {
            logger.error(ex);
            throw new OptException("invalid numeric CLI arg", ex);
        }

        if (Parameters.getNumBendersIterations() < 1)
            throw new OptException("number of Benders iterations must be positive");
        if (Parameters.getBendersTolerance() < 0 || Parameters.getBendersRelativeTolerance() < 0)
            throw new OptException("Benders tolerances cannot be negative");
    }
}
