package expansion.dao;

import expansion.domain.Technology;
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
 * Reads technology data from a csv file with the columns technology, cost and initial_investment.
 */
public class TechnologyDAO {
    private final static Logger logger = LogManager.getLogger(TechnologyDAO.class);
    private final ArrayList<Technology> technologies;

    public TechnologyDAO(String filePath) throws DataException {
        technologies = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new FileReader(filePath, StandardCharsets.UTF_8))) {
            CsvColumns columns = new CsvColumns(filePath, CSVHelper.parseLine(reader));
            final int nameCol = columns.indexOf("technology");
            final int costCol = columns.indexOf("cost");
            final int investmentCol = columns.indexOf("initial_investment");

            int lineNum = 1;
            List<String> row;
            while ((row = CSVHelper.parseLine(reader)) != null) {
                ++lineNum;
                technologies.add(new Technology(
                    columns.getString(row, nameCol, lineNum),
                    columns.getDouble(row, costCol, lineNum),
                    columns.getDouble(row, investmentCol, lineNum)));
            }
        } catch (IOException ex) {
            logger.error(ex);
            throw new DataException("unable to read technologies from " + filePath, ex);
        }
        logger.info("read " + technologies.size() + " technologies from " + filePath);
    }

    public ArrayList<Technology> getTechnologies() {
        return technologies;
    }
}
