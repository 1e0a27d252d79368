package expansion.dao;

import expansion.utility.DataException;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps header names of a csv table to column positions.
 */
class CsvColumns {
    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private final String fileName;
    private final ArrayList<String> headers;

    CsvColumns(String fileName, List<String> headerRow) throws DataException {
        if (headerRow == null)
            throw new DataException(fileName + " is empty");

        this.fileName = fileName;
        headers = new ArrayList<>();
        for (String header : headerRow) {
            String cleaned = header;
            if (!cleaned.isEmpty() && cleaned.charAt(0) == BYTE_ORDER_MARK)
                cleaned = cleaned.substring(1);
            String name = cleaned.trim().toLowerCase();
            if (headers.contains(name))
                throw new DataException(fileName + " has duplicate column " + header.trim());
            headers.add(name);
        }
    }

    int indexOf(String header) throws DataException {
        int index = headers.indexOf(header.toLowerCase());
        if (index < 0)
            throw new DataException(fileName + " has no column " + header);
        return index;
    }

    int size() {
        return headers.size();
    }

    String getString(List<String> row, int column, int lineNum) throws DataException {
        if (column >= row.size())
            throw new DataException(fileName + " line " + lineNum + " has no value for column "
                + headers.get(column));
        return row.get(column);
    }

    double getDouble(List<String> row, int column, int lineNum) throws DataException {
        String value = getString(row, column, lineNum);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException ex) {
            throw new DataException(fileName + " line " + lineNum + ": column " + headers.get(column)
                + " has non-numeric value '" + value + "'", ex);
        }
    }
}
