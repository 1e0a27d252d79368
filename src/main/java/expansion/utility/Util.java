package expansion.utility;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;

public class Util {
    private final static Logger logger = LogManager.getLogger(Util.class);

    public static void writeToYaml(Object o, String filePath) throws OptException {
        try (BufferedWriter writer = new BufferedWriter(new FileWriter(filePath, StandardCharsets.UTF_8))) {
            DumperOptions options = new DumperOptions();
            options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
            options.setPrettyFlow(true);
            Yaml yaml = new Yaml(options);
            yaml.dump(o, writer);
        } catch (IOException ex) {
            logger.error(ex);
            throw new OptException("error writing to YAML", ex);
        }
    }

    /**
     * Boxes an array so that snakeyaml dumps it as a list.
     */
    public static ArrayList<Double> toList(double[] values) {
        ArrayList<Double> list = new ArrayList<>();
        if (values != null)
            for (double v : values)
                list.add(v);
        return list;
    }

    public static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; ++i)
            sum += a[i] * b[i];
        return sum;
    }
}
