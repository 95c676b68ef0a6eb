package dev.microtest.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestDiscoveryTest {

    @Test
    void recognizesTestFileNames() {
        assertTrue(TestDiscovery.isTestFileName("TestDemo.java"));
        assertTrue(TestDiscovery.isTestFileName("DemoTest.java"));
        assertFalse(TestDiscovery.isTestFileName("Demo.java"));
        assertFalse(TestDiscovery.isTestFileName("TestDemo.class"));
        assertFalse(TestDiscovery.isTestFileName("Contest.txt"));
    }

    @Test
    void skipsBuildAndHiddenDirectories() {
        assertTrue(TestDiscovery.isSkippedDirectory("target"));
        assertTrue(TestDiscovery.isSkippedDirectory(".git"));
        assertTrue(TestDiscovery.isSkippedDirectory("node_modules"));
        assertFalse(TestDiscovery.isSkippedDirectory("src"));
    }

    @Test
    void declarationOrderComesFromSource(@TempDir Path root) throws Exception {
        Path file = Files.writeString(root.resolve("OrderTest.java"), """
                import dev.microtest.context.Tags;
                import dev.microtest.context.TestContext;

                public class OrderTest {
                    static void testZebra() {}

                    @Tags("slow")
                    static void testApple(TestContext ctx) {}

                    static void helper() {}

                    static void testMango() {}

                    static void testMango(TestContext ctx) {}
                }
                """);

        try (var discovery = new TestDiscovery(root, List.of())) {
            var loaded = assertInstanceOf(TestDiscovery.DiscoveredFile.Loaded.class, discovery.load(file));
            var units = loaded.units().stream().map(TestDiscovery.DiscoveredUnit::unit).toList();

            assertEquals(List.of("testZebra", "testApple", "testMango"), units.stream().map(TestUnit::name).toList());
            assertFalse(units.get(0).wantsContext());
            assertTrue(units.get(1).wantsContext());
            assertEquals(Set.of("slow"), units.get(1).tags());
            // the overload with fewer parameters wins
            assertFalse(units.get(2).wantsContext());
            assertEquals("OrderTest", units.get(0).className());
        }
    }

    @Test
    void findsFilesInSortedDepthFirstOrder(@TempDir Path root) throws IOException, TestRunException {
        Files.createDirectories(root.resolve("b"));
        Files.createDirectories(root.resolve("a/nested"));
        Files.createDirectories(root.resolve("build"));
        Files.writeString(root.resolve("b/TestB.java"), "");
        Files.writeString(root.resolve("a/nested/ZTest.java"), "");
        Files.writeString(root.resolve("a/TestA.java"), "");
        Files.writeString(root.resolve("build/TestGenerated.java"), "");
        Files.writeString(root.resolve("Readme.java"), "");

        try (var discovery = new TestDiscovery(root, List.of())) {
            var names = discovery.findTestFiles().stream().map(discovery::relativeName).toList();

            assertEquals(List.of("a/TestA.java", "a/nested/ZTest.java", "b/TestB.java"), names);
        }
    }

    @Test
    void fileWithoutClassIsLoadFailure(@TempDir Path root) throws Exception {
        Path file = Files.writeString(root.resolve("TestEmpty.java"), "// nothing here\n");

        try (var discovery = new TestDiscovery(root, List.of())) {
            var failed = assertInstanceOf(TestDiscovery.DiscoveredFile.LoadFailed.class, discovery.load(file));
            assertEquals("TestEmpty.java", failed.file());
        }
    }

    @Test
    void classAlreadyOnEngineClasspathIsLoadFailure(@TempDir Path root) throws Exception {
        Files.createDirectories(root.resolve("dev/microtest/engine"));
        Path file = Files.writeString(root.resolve("dev/microtest/engine/EngineOptionsTest.java"), """
                package dev.microtest.engine;

                public class EngineOptionsTest {
                    static void testImpostor() {}
                }
                """);

        try (var discovery = new TestDiscovery(root, List.of())) {
            var failed = assertInstanceOf(TestDiscovery.DiscoveredFile.LoadFailed.class, discovery.load(file));
            assertTrue(failed.failure().message().contains("shadowed"), failed.failure().message());
        }
    }

    @Test
    void sameClassNameInTwoDirectoriesLoadsBoth(@TempDir Path root) throws Exception {
        Files.createDirectories(root.resolve("one"));
        Files.createDirectories(root.resolve("two"));
        Path first = Files.writeString(root.resolve("one/TestSame.java"), "public class TestSame { static void testOne() {} }");
        Path second = Files.writeString(root.resolve("two/TestSame.java"), "public class TestSame { static void testTwo() {} }");

        try (var discovery = new TestDiscovery(root, List.of())) {
            var a = assertInstanceOf(TestDiscovery.DiscoveredFile.Loaded.class, discovery.load(first));
            var b = assertInstanceOf(TestDiscovery.DiscoveredFile.Loaded.class, discovery.load(second));

            assertEquals("testOne", a.units().get(0).unit().name());
            assertEquals("testTwo", b.units().get(0).unit().name());
        }
    }
}
