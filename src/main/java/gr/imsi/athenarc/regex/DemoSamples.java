package gr.imsi.athenarc.regex;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Demo patterns and candidate strings, read from {@code application.properties}.
 */
public class DemoSamples {
    private static final Logger LOG = LoggerFactory.getLogger(DemoSamples.class);

    public static final String RESOURCE = "/application.properties";

    public static class Sample {
        private final String name;
        private final String pattern;
        private final List<String> inputs;

        public Sample(String name, String pattern, List<String> inputs) {
            this.name = name;
            this.pattern = pattern;
            this.inputs = inputs;
        }

        public String getName() {
            return name;
        }

        public String getPattern() {
            return pattern;
        }

        public List<String> getInputs() {
            return inputs;
        }
    }

    private DemoSamples() {
    }

    public static Properties readProperties() {
        return readProperties(RESOURCE);
    }

    /**
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static Properties readProperties(String resource) {
        Properties properties = new Properties();
        try (InputStream input = DemoSamples.class.getResourceAsStream(resource)) {
            if (input == null) {
                LOG.error("Unable to find {} in resources.", resource);
                throw new IllegalStateException("Missing resource " + resource);
            }
            properties.load(input);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read " + resource, ex);
        }
        return properties;
    }

    /**
     * Reads {@code demo.count} samples, numbered from 1. A sample without a
     * pattern is an error; a sample without inputs has no candidates.
     */
    public static List<Sample> fromProperties(Properties properties) {
        int count = Integer.parseInt(properties.getProperty("demo.count", "0").trim());
        List<Sample> samples = new ArrayList<>(count);
        for (int n = 1; n <= count; n++) {
            String prefix = "demo." + n + ".";
            String pattern = properties.getProperty(prefix + "pattern");
            Preconditions.checkArgument(pattern != null, "Missing %spattern", prefix);
            String name = properties.getProperty(prefix + "name", "Sample " + n);
            String inputs = properties.getProperty(prefix + "inputs", "");
            List<String> candidates = inputs.isEmpty()
                ? Collections.emptyList()
                : Arrays.asList(inputs.split(",", -1));
            samples.add(new Sample(name, pattern, candidates));
        }
        return samples;
    }
}
