package expansion.dao;

import expansion.domain.DemandSlice;
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
 * Reads the load-duration curve slices from a csv file with the columns category, duration, min_level and
 * max_level. The category column may also be called charge_category.
 */
public class NeedsDAO {
    private final static Logger logger = LogManager.getLogger(NeedsDAO.class);
    private final ArrayList<DemandSlice> demandSlices;

    public NeedsDAO(String filePath) throws DataException {
        demandSlices = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new FileReader(filePath, StandardCharsets.UTF_8))) {
            CsvColumns columns = new CsvColumns(filePath, CSVHelper.parseLine(reader));
            final int categoryCol = findCategoryColumn(columns);
            final int durationCol = columns.indexOf("duration");
            final int minCol = columns.indexOf("min_level");
            final int maxCol = columns.indexOf("max_level");

            int lineNum = 1;
            List<String> row;
            while ((row = CSVHelper.parseLine(reader)) != null) {
                ++lineNum;
                demandSlices.add(new DemandSlice(
                    columns.getString(row, categoryCol, lineNum),
                    columns.getDouble(row, durationCol, lineNum),
                    columns.getDouble(row, minCol, lineNum),
                    columns.getDouble(row, maxCol, lineNum)));
            }
        } catch (IOException ex) {
            logger.error(ex);
            throw new DataException("unable to read demand slices from " + filePath, ex);
        }
        logger.info("read " + demandSlices.size() + " demand slices from " + filePath);
    }

    public ArrayList<DemandSlice> getDemandSlices() {
        return demandSlices;
    }

    private static int findCategoryColumn(CsvColumns columns) throws DataException {
        try {
            return columns.indexOf("category");
        } catch (DataException ex) {
            return columns.indexOf("charge_category");
        }
    }
}
