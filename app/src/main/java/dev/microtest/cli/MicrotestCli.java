package dev.microtest.cli;

import dev.microtest.BuildInfo;
import dev.microtest.engine.EngineOptions;
import dev.microtest.engine.TestEngine;
import dev.microtest.engine.TestResult;
import dev.microtest.engine.TestRunException;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

/**
 * Command-line front end: runs the tests under a directory and prints a report.
 *
 * <p>Everything after a literal {@code --} is passed through to the tests untouched.
 */
@CommandLine.Command(
        name = "microtest",
        mixinStandardHelpOptions = true,
        versionProvider = MicrotestCli.VersionProvider.class,
        description = "Discovers and runs Test*.java / *Test.java files under a directory.")
public final class MicrotestCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(MicrotestCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    /** Also what picocli returns for usage errors. */
    static final int EXIT_ABORTED = 2;

    static final String CONSOLE_LEVEL_PROPERTY = "microtest.console.level";

    @CommandLine.Parameters(
            index = "0",
            arity = "0..1",
            paramLabel = "PATH",
            description = "Directory to search for tests (default: current directory).")
    private Path path = Path.of(".");

    @CommandLine.Option(
            names = {"-k", "--filter"},
            description = "Only run tests whose file path or name contains this text.")
    @Nullable
    private String filter;

    @CommandLine.Option(names = "--tag", description = "Only run tests carrying this tag. Can be repeated.")
    private List<String> tags = new ArrayList<>();

    @CommandLine.Option(names = "--exclude-tag", description = "Skip tests carrying this tag. Can be repeated.")
    private List<String> excludeTags = new ArrayList<>();

    @CommandLine.ArgGroup(exclusive = true)
    @Nullable
    private Verbosity verbosity;

    @CommandLine.Option(names = "--no-estimates", description = "Do not print time estimates.")
    private boolean noEstimates;

    @CommandLine.Option(names = "--json", paramLabel = "FILE", description = "Also write the results as JSON.")
    @Nullable
    private Path jsonFile;

    private List<String> extraArgs = List.of();

    @CommandLine.Spec
    @Nullable
    private CommandLine.Model.CommandSpec spec;

    static final class Verbosity {
        @CommandLine.Option(
                names = {"-v", "--verbose"},
                description = "Show debug output and each test's logs and artifacts.")
        boolean verbose;

        @CommandLine.Option(
                names = {"-q", "--quiet"},
                description = "Print only a one-line summary.")
        boolean quiet;
    }

    static final class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] {"microtest " + BuildInfo.version};
        }
    }

    public static void main(String[] args) {
        System.exit(execute(args, new PrintWriter(System.out, true), new PrintWriter(System.err, true)));
    }

    /** Parses {@code args}, runs and reports; returns the process exit code. */
    static int execute(String[] args, PrintWriter out, PrintWriter err) {
        int separator = Arrays.asList(args).indexOf("--");
        String[] own = separator < 0 ? args : Arrays.copyOfRange(args, 0, separator);
        var cli = new MicrotestCli();
        if (separator >= 0) {
            cli.extraArgs = List.of(Arrays.copyOfRange(args, separator + 1, args.length));
        }
        var commandLine = new CommandLine(cli);
        commandLine.setOut(out);
        commandLine.setErr(err);
        commandLine.setExecutionExceptionHandler((ex, cl, parseResult) -> {
            logger.error("microtest failed", ex);
            cl.getErr().println("Error: " + ex.getMessage());
            return EXIT_ABORTED;
        });
        return commandLine.execute(own);
    }

    @Override
    public Integer call() {
        boolean verbose = verbosity != null && verbosity.verbose;
        boolean quiet = verbosity != null && verbosity.quiet;
        if (verbose) {
            applyConsoleLevel("DEBUG");
        } else if (quiet) {
            applyConsoleLevel("OFF");
        }
        logger.info("microtest version: {}", BuildInfo.version);

        var options = EngineOptions.fromSystemProperties()
                .withTags(new LinkedHashSet<>(tags))
                .withExcludeTags(new LinkedHashSet<>(excludeTags));
        if (noEstimates || quiet) {
            options = options.withShowEstimates(false);
        }

        List<TestResult> results;
        try {
            results = new TestEngine(options).run(path, filter, extraArgs);
        } catch (TestRunException e) {
            logger.error("Run aborted: {}", e.getMessage());
            err().println("Error: " + e.getMessage());
            return EXIT_ABORTED;
        }

        var report = new ResultReport(results);
        if (quiet) {
            report.printQuiet(out());
        } else {
            report.printReport(out(), verbose);
        }

        if (jsonFile != null) {
            try {
                report.writeJson(jsonFile);
                logger.debug("Wrote {} results to {}", results.size(), jsonFile);
            } catch (IOException e) {
                logger.error("Could not write results to {}", jsonFile, e);
                err().println("Error: could not write " + jsonFile + ": " + e.getMessage());
                return EXIT_ABORTED;
            }
        }
        return report.stats().failed() > 0 ? EXIT_FAILURES : EXIT_OK;
    }

    private PrintWriter out() {
        return spec == null ? new PrintWriter(System.out, true) : spec.commandLine().getOut();
    }

    private PrintWriter err() {
        return spec == null ? new PrintWriter(System.err, true) : spec.commandLine().getErr();
    }

    /** Sets the console threshold read by log4j2.xml and reloads the configuration. */
    private static void applyConsoleLevel(String level) {
        System.setProperty(CONSOLE_LEVEL_PROPERTY, level);
        Configurator.reconfigure();
    }
}
