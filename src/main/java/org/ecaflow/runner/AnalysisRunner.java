package org.ecaflow.runner;

import org.ecaflow.analysis.AnalysisReport;
import org.ecaflow.analysis.AutomationAnalyzer;
import org.ecaflow.analysis.AutomationAnalyzer.AnalysisConfig;
import org.ecaflow.analysis.AutomationAnalyzer.AnalysisResult;
import org.ecaflow.config.AutomationConfigLoader;
import org.ecaflow.config.CatalogConfigLoader;
import org.ecaflow.config.CatalogConfigLoader.CatalogFormatException;
import org.ecaflow.model.Automation;
import org.ecaflow.model.ServiceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Command-line entry point: loads automations, analyzes them and writes the
 * JSON report.
 *
 * <pre>
 * java -jar eca-flow-analyzer.jar --in automations.yaml [--out report.json]
 *      [--catalog extra.yaml [--replace-catalog]] [--parallel] [--strict] [--compact]
 * </pre>
 *
 * Exit codes: 0 on success, 1 when {@code --strict} is set and any finding
 * exists, 2 when input cannot be loaded or the arguments are invalid.
 */
public class AnalysisRunner {

    private static final Logger log = LoggerFactory.getLogger(AnalysisRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FINDINGS = 1;
    public static final int EXIT_ERROR = 2;

    static final String USAGE = String.join(System.lineSeparator(),
        "Usage: eca-flow-analyzer [options]",
        "  --in <file>          automations YAML (default: stdin)",
        "  --out <file>         report JSON (default: stdout)",
        "  --catalog <file>     extra catalog merged over the bundled one",
        "  --replace-catalog    use --catalog instead of the bundled catalog",
        "  --parallel           run the analysis passes concurrently",
        "  --strict             exit with 1 when any finding is reported",
        "  --compact            single-line JSON",
        "  --help               show this message");

    // ========================================================================
    // Options
    // ========================================================================

    /**
     * Parsed command-line options.
     */
    public static class RunnerOptions {
        public Path input;
        public Path output;
        public Path catalog;
        public boolean replaceCatalog;
        public boolean parallel;
        public boolean strict;
        public boolean compact;
        public boolean help;

        public static RunnerOptions parse(String[] args) {
            RunnerOptions options = new RunnerOptions();
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--in", "-i" -> options.input = Paths.get(value(args, ++i, "--in"));
                    case "--out", "-o" -> options.output = Paths.get(value(args, ++i, "--out"));
                    case "--catalog" -> options.catalog = Paths.get(value(args, ++i, "--catalog"));
                    case "--replace-catalog" -> options.replaceCatalog = true;
                    case "--parallel" -> options.parallel = true;
                    case "--strict" -> options.strict = true;
                    case "--compact" -> options.compact = true;
                    case "--help", "-h" -> options.help = true;
                    default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
                }
            }
            if (options.replaceCatalog && options.catalog == null) {
                throw new IllegalArgumentException("--replace-catalog requires --catalog");
            }
            return options;
        }

        private static String value(String[] args, int i, String flag) {
            if (i >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            return args[i];
        }
    }

    // ========================================================================
    // Execution
    // ========================================================================

    private final InputStream stdin;
    private final PrintStream stdout;

    public AnalysisRunner() {
        this(System.in, System.out);
    }

    public AnalysisRunner(InputStream stdin, PrintStream stdout) {
        this.stdin = stdin;
        this.stdout = stdout;
    }

    public static void main(String[] args) {
        System.exit(new AnalysisRunner().run(args));
    }

    public int run(String[] args) {
        RunnerOptions options;
        try {
            options = RunnerOptions.parse(args);
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            System.err.println(USAGE);
            return EXIT_ERROR;
        }
        if (options.help) {
            stdout.println(USAGE);
            return EXIT_OK;
        }

        ServiceCatalog catalog;
        List<Automation> automations;
        try {
            catalog = loadCatalog(options);
            automations = loadAutomations(options);
        } catch (IOException e) {
            log.error("Cannot read input: {}", e.getMessage());
            return EXIT_ERROR;
        } catch (YAMLException | CatalogFormatException | IllegalArgumentException e) {
            log.error("Invalid input: {}", e.getMessage());
            return EXIT_ERROR;
        }

        AnalysisConfig config = AnalysisConfig.builder()
            .parallel(options.parallel)
            .build();
        AnalysisResult result = new AutomationAnalyzer(catalog, config).analyze(automations);
        AnalysisReport report = result.getReport();

        ReportWriter writer = new ReportWriter(options.compact);
        try {
            if (options.output != null) {
                writer.write(report, options.output);
                log.info("Report written to {}", options.output);
            } else {
                writer.write(report, stdout);
            }
        } catch (IOException e) {
            log.error("Cannot write report: {}", e.getMessage());
            return EXIT_ERROR;
        }

        if (options.strict && report.hasFindings()) {
            log.info("{} finding(s) reported in strict mode", report.totalFindings());
            return EXIT_FINDINGS;
        }
        return EXIT_OK;
    }

    private ServiceCatalog loadCatalog(RunnerOptions options) throws IOException {
        CatalogConfigLoader loader = new CatalogConfigLoader();
        if (options.catalog == null) {
            return loader.loadDefault();
        }
        return loader.loadWithOverrides(options.catalog, options.replaceCatalog);
    }

    private List<Automation> loadAutomations(RunnerOptions options) throws IOException {
        AutomationConfigLoader loader = new AutomationConfigLoader();
        if (options.input == null) {
            log.info("Reading automations from stdin");
            return loader.loadFromStream(stdin);
        }
        return loader.loadFromFile(options.input);
    }
}
