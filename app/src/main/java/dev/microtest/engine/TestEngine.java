package dev.microtest.engine;

import dev.microtest.context.SkipTestException;
import dev.microtest.context.TestContext;
import dev.microtest.logging.ContextLogCapture;
import dev.microtest.store.DurationStore;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Discovers and runs the tests under a root directory, one at a time on the calling thread.
 *
 * <p>Every unit gets a fresh {@link TestContext}. Whatever the unit does (return, throw, skip, call
 * {@link TestContext#fatal}) is turned into a {@link TestResult}; nothing a test raises escapes {@link #run}.
 * Durations are persisted to the store file in the root so the next run can print estimates.
 */
public class TestEngine {
    private static final Logger logger = LogManager.getLogger(TestEngine.class);

    private final EngineOptions options;

    public TestEngine() {
        this(EngineOptions.defaults());
    }

    public TestEngine(EngineOptions options) {
        this.options = options;
    }

    public EngineOptions options() {
        return options;
    }

    public List<TestResult> run(Path root) throws TestRunException {
        return run(root, null, List.of());
    }

    public List<TestResult> run(Path root, @Nullable String filter) throws TestRunException {
        return run(root, filter, List.of());
    }

    /**
     * Runs every selected test under {@code root}.
     *
     * @param filter keeps tests whose relative file path or name contains it; null runs everything
     * @param extraArgs handed to tests through {@link TestContext#args()} and {@link RunArguments#current()}
     * @return one result per executed test plus one per test file that failed to load, in discovery order
     * @throws TestRunException if the root is not a readable directory or no Java compiler is available
     */
    public List<TestResult> run(Path root, @Nullable String filter, List<String> extraArgs) throws TestRunException {
        if (!Files.isDirectory(root)) {
            throw new TestRunException("Test root " + root + " does not exist or is not a directory");
        }
        var store = DurationStore.load(root.resolve(options.storeFileName()));

        try (var discovery = new TestDiscovery(root, options.extraClasspath())) {
            List<Path> files;
            try {
                files = discovery.findTestFiles();
            } catch (IOException e) {
                throw new TestRunException("Cannot walk test root " + root, e);
            }
            logger.debug("Found {} test files under {}", files.size(), root);

            var plan = plan(discovery, files, filter);
            if (options.showEstimates()) {
                var keys = plan.stream()
                        .filter(p -> p instanceof Planned.Unit)
                        .map(p -> ((Planned.Unit) p).unit().unit().key())
                        .toList();
                logger.info(String.format(
                        Locale.ROOT, "Estimated total time: ~%.1fs for %d tests", store.estimateTotal(keys), keys.size()));
            }

            var results = new ArrayList<TestResult>(plan.size());
            List<String> previousArgs = RunArguments.set(extraArgs);
            try (var capture = ContextLogCapture.install()) {
                for (Planned planned : plan) {
                    if (planned instanceof Planned.Unit u) {
                        var result = runUnit(u.unit(), extraArgs, capture, store);
                        results.add(result);
                    } else if (planned instanceof Planned.Broken b) {
                        logger.error("Could not load {}: {}", b.file(), b.failure().message());
                        results.add(TestResult.loadFailure(b.file(), b.failure()));
                    }
                }
            } finally {
                RunArguments.set(previousArgs);
            }

            long passed = results.stream().filter(TestResult::passed).count();
            logger.info("Tests completed: {}/{} passed.", passed, results.size());
            store.save();
            return results;
        }
    }

    private List<Planned> plan(TestDiscovery discovery, List<Path> files, @Nullable String filter) {
        var plan = new ArrayList<Planned>();
        for (Path file : files) {
            String relative = discovery.relativeName(file);
            var loaded = discovery.load(file);
            if (loaded instanceof TestDiscovery.DiscoveredFile.LoadFailed failed) {
                if (filter == null || relative.contains(filter)) {
                    plan.add(new Planned.Broken(failed.file(), failed.failure()));
                }
            } else if (loaded instanceof TestDiscovery.DiscoveredFile.Loaded ok) {
                for (var unit : ok.units()) {
                    if ((filter == null || unit.unit().matches(filter)) && options.selects(unit.unit())) {
                        plan.add(new Planned.Unit(unit));
                    }
                }
            }
        }
        return plan;
    }

    private TestResult runUnit(
            TestDiscovery.DiscoveredUnit discovered, List<String> extraArgs, ContextLogCapture capture, DurationStore store) {
        var unit = discovered.unit();
        String key = unit.key();
        TestContext ctx = options.contextFactory().create(unit.file(), unit.name(), extraArgs);

        if (options.showEstimates()) {
            var estimate = store.estimate(key);
            if (estimate.isPresent()) {
                logger.info(String.format(Locale.ROOT, "STARTING: %s (est ~%.1fs)", key, estimate.getAsDouble()));
            } else {
                logger.info("STARTING: {}", key);
            }
        } else {
            logger.info("STARTING: {}", key);
        }

        Outcome outcome;
        long start = System.nanoTime();
        try (var binding = capture.bind(ctx)) {
            outcome = invokeGuarded(discovered, ctx);
        }
        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;

        if (outcome instanceof Outcome.Passed && ctx.isFatal()) {
            outcome = new Outcome.Failed(FailureDetail.fatal(ctx.fatalMessage(), unit.className() + "." + unit.name()));
        }
        store.record(key, seconds);

        var status = outcome.status();
        logger.info(String.format(Locale.ROOT, "FINISHED %s: %s in %.3fs", status.name(), key, seconds));

        FailureDetail failure = outcome instanceof Outcome.Failed f ? f.detail() : null;
        String skipReason = outcome instanceof Outcome.Skipped s ? s.reason() : null;
        return new TestResult(
                unit.file(), unit.name(), status, ctx.logs(), ctx.artifacts(), seconds, failure, skipReason);
    }

    /**
     * Runs one unit and classifies how it ended. Never throws, and never leaves the interrupt status a unit set on
     * the controlling thread for the next unit to trip over.
     */
    private Outcome invokeGuarded(TestDiscovery.DiscoveredUnit discovered, TestContext ctx) {
        var method = discovered.method();
        var testClass = discovered.testClass();
        var thread = Thread.currentThread();
        var previousLoader = thread.getContextClassLoader();
        thread.setContextClassLoader(testClass.getClassLoader());
        try {
            method.setAccessible(true);
            Object target = null;
            if (!Modifier.isStatic(method.getModifiers())) {
                var constructor = testClass.getDeclaredConstructor();
                constructor.setAccessible(true);
                target = constructor.newInstance();
            }
            Object returned = discovered.unit().wantsContext() ? method.invoke(target, ctx) : method.invoke(target);
            await(returned);
            return new Outcome.Passed();
        } catch (Throwable t) {
            return classify(unwrap(t), testClass.getName());
        } finally {
            thread.setContextClassLoader(previousLoader);
            if (Thread.interrupted()) {
                logger.debug("Cleared interrupt status left by {}", discovered.unit().key());
            }
        }
    }

    private static void await(@Nullable Object returned) throws ExecutionException, InterruptedException {
        if (returned instanceof CompletionStage<?> stage) {
            stage.toCompletableFuture().get();
        } else if (returned instanceof Future<?> future) {
            future.get();
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof InvocationTargetException
                        || current instanceof ExecutionException
                        || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static Outcome classify(Throwable cause, String testClassName) {
        if (cause instanceof SkipTestException skip) {
            return new Outcome.Skipped(skip.getMessage());
        }
        return new Outcome.Failed(FailureDetail.from(cause, testClassName));
    }

    private sealed interface Planned permits Planned.Unit, Planned.Broken {
        record Unit(TestDiscovery.DiscoveredUnit unit) implements Planned {}

        record Broken(String file, FailureDetail failure) implements Planned {}
    }
}
