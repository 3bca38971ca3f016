package gr.imsi.athenarc.regex;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Stopwatch;

import gr.imsi.athenarc.regex.compiler.MalformedPatternException;
import gr.imsi.athenarc.regex.nfa.NFAState;

public class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    @Parameter(names = "-pattern", description = "Pattern to compile. Runs the configured demo samples if omitted")
    private String pattern;

    @Parameter(names = "-inputs", variableArity = true, description = "Candidate strings to match against the pattern")
    private List<String> inputs = new ArrayList<>();

    @Parameter(names = "-trace", description = "Print the first-path walk for every candidate")
    private boolean trace;

    @Parameter(names = "-dot", description = "Print the compiled automaton in Graphviz DOT format")
    private boolean dot;

    @Parameter(names = "--help", help = true, description = "Displays help")
    private boolean help;

    public static void main(String... args) {
        int status = new Main().run(System.out, args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return process exit status: 0 on success, 1 for a malformed pattern or missing samples, 2 for bad arguments
     */
    int run(PrintStream out, String... args) {
        JCommander jCommander = new JCommander(this);
        jCommander.setProgramName("regex-fsm");
        try {
            jCommander.parse(args);
        } catch (ParameterException e) {
            LOG.error("Invalid arguments: {}", e.getMessage());
            jCommander.usage();
            return 2;
        }
        if (help) {
            jCommander.usage();
            return 0;
        }

        List<DemoSamples.Sample> samples = new ArrayList<>();
        if (pattern != null) {
            samples.add(new DemoSamples.Sample(pattern, pattern, inputs));
        } else {
            try {
                samples.addAll(DemoSamples.fromProperties(DemoSamples.readProperties()));
            } catch (IllegalStateException | IllegalArgumentException e) {
                LOG.error("Could not load demo samples", e);
                out.println("error: " + e.getMessage());
                return 1;
            }
            if (samples.isEmpty()) {
                LOG.error("No demo samples configured in {}", DemoSamples.RESOURCE);
                out.println("error: no demo samples configured");
                return 1;
            }
        }

        boolean first = true;
        for (DemoSamples.Sample sample : samples) {
            if (!first) {
                out.println();
            }
            first = false;
            try {
                runSample(out, sample);
            } catch (MalformedPatternException e) {
                LOG.error("Could not compile pattern \"{}\"", sample.getPattern(), e);
                out.println("error: " + e.getMessage());
                return 1;
            }
        }
        return 0;
    }

    private void runSample(PrintStream out, DemoSamples.Sample sample) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        RegexFSM regex = RegexFSM.compile(sample.getPattern());
        LOG.info("Compiled \"{}\" into {} states in {} us", sample.getPattern(), regex.getNfa().size(),
            stopwatch.elapsed(TimeUnit.MICROSECONDS));

        out.println(sample.getName() + ":");
        if (dot) {
            out.print(regex.toDotFormat());
        }
        for (String input : sample.getInputs()) {
            boolean result = regex.matches(input);
            out.println(result);
            if (trace) {
                List<NFAState> path = regex.walkFirstPath(input);
                out.println("  path: " + path.stream().map(NFAState::getLabel).collect(Collectors.joining(" -> ")));
            }
        }
    }
}
