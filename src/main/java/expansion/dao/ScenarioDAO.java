package expansion.dao;

import expansion.domain.DemandSlice;
import expansion.domain.Scenario;
import expansion.utility.CSVHelper;
import expansion.utility.DataException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads demand scenarios from a csv file with the columns scenario and probability followed by one width
 * column per demand slice, named after the slice category.
 */
public class ScenarioDAO {
    private final static Logger logger = LogManager.getLogger(ScenarioDAO.class);
    private final ArrayList<Scenario> scenarios;

    public ScenarioDAO(String filePath, List<DemandSlice> demandSlices) throws DataException {
        scenarios = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new FileReader(filePath, StandardCharsets.UTF_8))) {
            CsvColumns columns = new CsvColumns(filePath, CSVHelper.parseLine(reader));
            final int nameCol = columns.indexOf("scenario");
            final int probabilityCol = columns.indexOf("probability");

            int[] widthCols = new int[demandSlices.size()];
            for (int j = 0; j < demandSlices.size(); ++j)
                widthCols[j] = columns.indexOf(demandSlices.get(j).getCategory());

            if (columns.size() != demandSlices.size() + 2)
                throw new DataException(filePath + " has " + (columns.size() - 2)
                    + " width columns, expected one per demand slice (" + demandSlices.size() + ")");

            int lineNum = 1;
            List<String> row;
            while ((row = CSVHelper.parseLine(reader)) != null) {
                ++lineNum;
                double[] widths = new double[widthCols.length];
                for (int j = 0; j < widthCols.length; ++j)
                    widths[j] = columns.getDouble(row, widthCols[j], lineNum);

                scenarios.add(new Scenario(
                    columns.getString(row, nameCol, lineNum),
                    columns.getDouble(row, probabilityCol, lineNum),
                    widths));
            }
        } catch (IOException ex) {
            logger.error(ex);
            throw new DataException("unable to read scenarios from " + filePath, ex);
        }
        if (scenarios.isEmpty())
            throw new DataException(filePath + " has no scenarios");
        logger.info("read " + scenarios.size() + " scenarios from " + filePath);
    }

    public ArrayList<Scenario> getScenarios() {
        return scenarios;
    }
}
