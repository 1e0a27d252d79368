package expansion.utility;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes single rows of comma-separated files.
 * <p>
 * Values containing commas or quotes are wrapped in double quotes on write, with embedded quotes doubled.
 * The same convention is understood on read. Blank lines are skipped.
 */
public class CSVHelper {

    public static void writeLine(Writer w, List<String> values) throws IOException {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < values.size(); ++i) {
            if (i > 0)
                line.append(',');
            line.append(escape(values.get(i)));
        }
        line.append('\n');
        w.write(line.toString());
    }

    /**
     * Reads the next non-blank row.
     *
     * @param reader handle that holds a csv file.
     * @return trimmed values of the row, or null at the end of the file.
     * @throws IOException if there is any issue reading from the file.
     */
    public static List<String> parseLine(BufferedReader reader) throws IOException {
        String line = reader.readLine();
        while (line != null && line.trim().isEmpty())
            line = reader.readLine();

        if (line == null)
            return null;

        ArrayList<String> values = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); ++i) {
            char ch = line.charAt(i);
            if (quoted) {
                if (ch == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    ++i;
                } else if (ch == '"')
                    quoted = false;
                else
                    current.append(ch);
            } else if (ch == '"')
                quoted = true;
            else if (ch == ',') {
                values.add(current.toString().trim());
                current.setLength(0);
            } else if (ch != '\r')
                current.append(ch);
        }
        values.add(current.toString().trim());
        return values;
    }

    private static String escape(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0)
            return value;
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }
}
