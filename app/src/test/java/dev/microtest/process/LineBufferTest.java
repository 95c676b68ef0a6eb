package dev.microtest.process;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class LineBufferTest {

    @Test
    void sealedBufferDropsAppends() {
        var buffer = new LineBuffer();
        assertTrue(buffer.append("a"));
        buffer.seal();

        assertFalse(buffer.append("b"));
        assertEquals(List.of("a"), buffer.snapshot());
    }

    @Test
    void snapshotIsIsolatedFromLaterAppends() {
        var buffer = new LineBuffer();
        buffer.append("a");
        var snapshot = buffer.snapshot();
        buffer.append("b");

        assertEquals(List.of("a"), snapshot);
        assertEquals(2, buffer.size());
    }

    @Test
    void concurrentAppendsAreAllKeptInPerThreadOrder() throws InterruptedException {
        var buffer = new LineBuffer();
        var threads = new ArrayList<Thread>();
        for (int t = 0; t < 4; t++) {
            String prefix = "t" + t + "-";
            var thread = new Thread(() -> {
                for (int i = 0; i < 500; i++) {
                    buffer.append(prefix + i);
                }
            });
            threads.add(thread);
            thread.start();
        }
        for (var thread : threads) {
            thread.join();
        }

        var lines = buffer.snapshot();
        assertEquals(2000, lines.size());
        for (int t = 0; t < 4; t++) {
            String prefix = "t" + t + "-";
            var own = lines.stream().filter(l -> l.startsWith(prefix)).toList();
            for (int i = 0; i < own.size(); i++) {
                assertEquals(prefix + i, own.get(i));
            }
        }
    }
}
