package dev.microtest.engine;

import com.sun.source.tree.ClassTree;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.tree.ExpressionTree;
import com.sun.source.tree.MethodTree;
import com.sun.source.tree.Tree;
import com.sun.source.util.JavacTask;
import dev.microtest.context.Tags;
import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.lang.reflect.Method;
import java.net.MalformedURLException;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.ToolProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Finds test files under a root, compiles them with the system Java compiler and loads their test methods.
 *
 * <p>A test file is a {@code .java} file named {@code Test*.java} or {@code *Test.java}. Its test units are the
 * methods of its top-level class whose names start with {@code test}, in the order they are declared in the
 * source. Each file is compiled on its own (with the root as source path, so helpers next to it resolve) into its
 * own output directory and loaded by its own class loader, with assertions enabled. A file that does not compile
 * or whose class fails to initialize becomes a {@link DiscoveredFile.LoadFailed}.
 */
final class TestDiscovery implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TestDiscovery.class);

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of("target", "build", "out", "node_modules");
    private static final String TEST_METHOD_PREFIX = "test";

    private final Path root;
    private final JavaCompiler compiler;
    private final Path outputRoot;
    private final String classpath;
    private final List<Path> extraClasspath;
    private final List<URLClassLoader> classLoaders = new ArrayList<>();

    TestDiscovery(Path root, List<Path> extraClasspath) throws TestRunException {
        this.root = root;
        JavaCompiler systemCompiler = ToolProvider.getSystemJavaCompiler();
        if (systemCompiler == null) {
            throw new TestRunException("No system Java compiler available; run microtest on a JDK, not a JRE");
        }
        this.compiler = systemCompiler;
        try {
            this.outputRoot = Files.createTempDirectory("microtest-classes");
        } catch (IOException e) {
            throw new TestRunException("Cannot create output directory for compiled tests", e);
        }
        this.classpath = buildClasspath(extraClasspath);
        this.extraClasspath = List.copyOf(extraClasspath);
    }

    static boolean isTestFileName(String fileName) {
        return fileName.endsWith(".java") && (fileName.startsWith("Test") || fileName.endsWith("Test.java"));
    }

    static boolean isSkippedDirectory(String dirName) {
        return dirName.startsWith(".") || SKIPPED_DIRECTORIES.contains(dirName);
    }

    /** Test files below the root, depth first, entries of each directory in name order. */
    List<Path> findTestFiles() throws IOException {
        var found = new ArrayList<Path>();
        collect(root, found);
        return found;
    }

    private void collect(Path dir, List<Path> found) throws IOException {
        List<Path> entries;
        try (Stream<Path> listing = Files.list(dir)) {
            entries = listing.sorted(Comparator.comparing(p -> p.getFileName().toString())).toList();
        }
        for (Path entry : entries) {
            String name = entry.getFileName().toString();
            if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                if (!isSkippedDirectory(name)) {
                    collect(entry, found);
                }
            } else if (isTestFileName(name) && Files.isRegularFile(entry)) {
                found.add(entry);
            }
        }
    }

    String relativeName(Path file) {
        return root.relativize(file).toString().replace(File.separatorChar, '/');
    }

    /** Compiles and loads one test file. */
    DiscoveredFile load(Path file) {
        String relative = relativeName(file);
        logger.debug("Loading test file {}", relative);

        var diagnostics = new DiagnosticCollector<JavaFileObject>();
        var compilerOutput = new StringWriter();
        Path outputDir;
        String className;
        List<String> methodNames;
        try {
            outputDir = Files.createDirectory(outputRoot.resolve(String.valueOf(classLoaders.size())));
        } catch (IOException e) {
            return new DiscoveredFile.LoadFailed(relative, FailureDetail.from(e, null));
        }
        var classLoader = new URLClassLoader(loaderUrls(outputDir, extraClasspath), TestDiscovery.class.getClassLoader());
        classLoader.setDefaultAssertionStatus(true);
        classLoaders.add(classLoader);

        try (var fileManager = compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8)) {
            var options = List.of(
                    "-classpath", classpath,
                    "-sourcepath", root.toString(),
                    "-d", outputDir.toString(),
                    "-proc:none",
                    "-implicit:class",
                    "-g");
            var task = (JavacTask) compiler.getTask(
                    compilerOutput, fileManager, diagnostics, options, null, fileManager.getJavaFileObjects(file));

            var declared = new DeclaredTests();
            for (CompilationUnitTree unit : task.parse()) {
                declared.read(unit, baseName(file));
            }
            task.generate();

            var errors = diagnostics.getDiagnostics().stream()
                    .filter(d -> d.getKind() == Diagnostic.Kind.ERROR)
                    .toList();
            if (!errors.isEmpty()) {
                return new DiscoveredFile.LoadFailed(relative, compileFailure(relative, errors, compilerOutput));
            }
            if (declared.className == null) {
                return new DiscoveredFile.LoadFailed(
                        relative,
                        new FailureDetail("No class declared in " + relative, relative, null, null));
            }
            className = declared.className;
            methodNames = declared.methodNames;
        } catch (IOException | RuntimeException e) {
            logger.debug("Compiling {} failed", relative, e);
            return new DiscoveredFile.LoadFailed(relative, FailureDetail.from(e, null));
        }

        Class<?> testClass;
        try {
            testClass = Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            Throwable cause = e instanceof ExceptionInInitializerError && e.getCause() != null ? e.getCause() : e;
            logger.debug("Loading {} from {} failed", className, relative, e);
            return new DiscoveredFile.LoadFailed(relative, FailureDetail.from(cause, className));
        }
        if (testClass.getClassLoader() != classLoader) {
            // parent-first delegation handed back a class the engine's own classpath already provides
            return new DiscoveredFile.LoadFailed(
                    relative,
                    new FailureDetail(
                            "Class " + className + " in " + relative
                                    + " is shadowed by a class of the same name on the engine classpath",
                            relative,
                            null,
                            null));
        }

        var units = new ArrayList<DiscoveredUnit>();
        for (String name : methodNames) {
            Method method = resolve(testClass, name);
            if (method == null) {
                continue;
            }
            var tags = method.getAnnotation(Tags.class);
            var unit = new TestUnit(
                    relative,
                    name,
                    testClass.getName(),
                    method.getParameterCount() > 0,
                    tags == null ? Set.of() : Set.of(tags.value()));
            units.add(new DiscoveredUnit(unit, testClass, method));
        }
        logger.debug("Found {} tests in {}", units.size(), relative);
        return new DiscoveredFile.Loaded(relative, units);
    }

    /** Overloads resolve to the variant with the fewest parameters. */
    private static @Nullable Method resolve(Class<?> testClass, String name) {
        return Arrays.stream(testClass.getDeclaredMethods())
                .filter(m -> m.getName().equals(name) && !m.isSynthetic() && !m.isBridge())
                .min(Comparator.comparingInt(Method::getParameterCount))
                .orElse(null);
    }

    private static FailureDetail compileFailure(
            String relative, List<Diagnostic<? extends JavaFileObject>> errors, StringWriter compilerOutput) {
        var first = errors.get(0);
        String location = first.getSource() == null
                ? relative
                : Path.of(first.getSource().getName()).getFileName() + ":" + first.getLineNumber();
        String details = errors.stream()
                .map(d -> (d.getSource() == null ? "" : d.getSource().getName() + ":" + d.getLineNumber() + ": ")
                        + d.getMessage(Locale.ROOT))
                .collect(Collectors.joining("\n"));
        if (!compilerOutput.toString().isBlank()) {
            details = details + "\n" + compilerOutput;
        }
        return new FailureDetail(
                "Failed to compile " + relative + ": " + first.getMessage(Locale.ROOT), location, null, details);
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - ".java".length());
    }

    private static String buildClasspath(List<Path> extraClasspath) {
        var entries = new LinkedHashSet<String>();
        for (String entry : System.getProperty("java.class.path", "").split(File.pathSeparator)) {
            if (!entry.isBlank()) {
                entries.add(entry);
            }
        }
        // the manifest-only jars some launchers use hide these, so add them explicitly
        addCodeSource(entries, TestDiscovery.class);
        addCodeSource(entries, LogManager.class);
        extraClasspath.forEach(p -> entries.add(p.toAbsolutePath().toString()));
        return String.join(File.pathSeparator, entries);
    }

    private static void addCodeSource(Set<String> entries, Class<?> type) {
        var source = type.getProtectionDomain().getCodeSource();
        if (source == null || source.getLocation() == null) {
            return;
        }
        try {
            entries.add(Path.of(source.getLocation().toURI()).toString());
        } catch (URISyntaxException | IllegalArgumentException | FileSystemNotFoundException e) {
            logger.debug("Cannot use code source of {}: {}", type.getName(), e.getMessage());
        }
    }

    private static URL[] loaderUrls(Path outputDir, List<Path> extraClasspath) {
        var urls = new ArrayList<URL>();
        try {
            urls.add(outputDir.toUri().toURL());
            for (Path entry : extraClasspath) {
                urls.add(entry.toAbsolutePath().toUri().toURL());
            }
        } catch (MalformedURLException e) {
            throw new UncheckedIOException(e);
        }
        return urls.toArray(URL[]::new);
    }

    @Override
    public void close() {
        for (var classLoader : classLoaders) {
            try {
                classLoader.close();
            } catch (IOException e) {
                logger.debug("Closing test class loader failed: {}", e.getMessage());
            }
        }
        classLoaders.clear();
        try (Stream<Path> walk = Files.walk(outputRoot)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            logger.debug("Could not clean up {}: {}", outputRoot, e.getMessage());
        }
    }

    /** Class name and test method order read from a parsed compilation unit. */
    private static final class DeclaredTests {
        private @Nullable String className;
        private final List<String> methodNames = new ArrayList<>();

        void read(CompilationUnitTree unit, String expectedSimpleName) {
            ClassTree primary = null;
            for (Tree type : unit.getTypeDecls()) {
                if (type instanceof ClassTree classTree) {
                    if (classTree.getSimpleName().contentEquals(expectedSimpleName)) {
                        primary = classTree;
                        break;
                    }
                    if (primary == null) {
                        primary = classTree;
                    }
                }
            }
            if (primary == null) {
                return;
            }

            ExpressionTree packageName = unit.getPackageName();
            String simpleName = primary.getSimpleName().toString();
            className = packageName == null ? simpleName : packageName + "." + simpleName;

            for (Tree member : primary.getMembers()) {
                if (member instanceof MethodTree method) {
                    String name = method.getName().toString();
                    if (name.startsWith(TEST_METHOD_PREFIX) && !methodNames.contains(name)) {
                        methodNames.add(name);
                    }
                }
            }
        }
    }

    sealed interface DiscoveredFile permits DiscoveredFile.Loaded, DiscoveredFile.LoadFailed {
        String file();

        record Loaded(String file, List<DiscoveredUnit> units) implements DiscoveredFile {}

        record LoadFailed(String file, FailureDetail failure) implements DiscoveredFile {}
    }

    record DiscoveredUnit(TestUnit unit, Class<?> testClass, Method method) {}
}
