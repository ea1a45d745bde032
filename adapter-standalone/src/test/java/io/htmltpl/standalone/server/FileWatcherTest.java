package io.htmltpl.standalone.server;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileWatcherTest {

    @TempDir
    Path watchDir;

    private FileWatcher watcher;

    @AfterEach
    void tearDown() {
        if (watcher != null) {
            watcher.stop();
        }
    }

    @Test
    void fileCreation_triggersCallback() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicInteger callbackCount = new AtomicInteger(0);

        watcher = new FileWatcher(watchDir, 100, () -> {
            callbackCount.incrementAndGet();
            latch.countDown();
        });
        watcher.start();

        Files.writeString(watchDir.resolve("new.html"), "<p>new</p>");

        assertTrue(latch.await(5, TimeUnit.SECONDS), "Callback should fire within 5 seconds");
        assertEquals(1, callbackCount.get());
    }

    @Test
    void rapidSaves_debounced_singleCallback() throws Exception {
        int debounceMs = 500;
        CountDownLatch latch = new CountDownLatch(1);
        AtomicInteger callbackCount = new AtomicInteger(0);

        watcher = new FileWatcher(watchDir, debounceMs, () -> {
            callbackCount.incrementAndGet();
            latch.countDown();
        });
        watcher.start();

        for (int i = 0; i < 5; i++) {
            Files.writeString(watchDir.resolve("page-" + i + ".html"), "<p>" + i + "</p>");
            Thread.sleep(50);
        }

        assertTrue(latch.await(5, TimeUnit.SECONDS), "Callback should fire within 5 seconds");
        Thread.sleep(debounceMs + 200);
        assertEquals(1, callbackCount.get(), "Rapid saves should coalesce into one callback");
    }

    @Test
    void nestedDirectoriesAreWatched() throws Exception {
        Path sub = Files.createDirectories(watchDir.resolve("users/admin"));
        CountDownLatch latch = new CountDownLatch(1);

        watcher = new FileWatcher(watchDir, 100, latch::countDown);
        watcher.start();
        assertEquals(3, watcher.watchedDirectoryCount());

        Files.writeString(sub.resolve("list.html"), "<ul></ul>");

        assertTrue(latch.await(5, TimeUnit.SECONDS), "Change in a nested directory should fire");
    }

    @Test
    void newDirectoryIsRegistered() throws Exception {
        CountDownLatch firstChange = new CountDownLatch(1);
        CountDownLatch secondChange = new CountDownLatch(2);

        watcher = new FileWatcher(watchDir, 100, () -> {
            firstChange.countDown();
            secondChange.countDown();
        });
        watcher.start();

        Path created = Files.createDirectory(watchDir.resolve("fresh"));
        assertTrue(firstChange.await(5, TimeUnit.SECONDS));

        Files.writeString(created.resolve("page.html"), "x");

        assertTrue(secondChange.await(5, TimeUnit.SECONDS), "Files in a new directory should be watched");
    }

    @Test
    void callbackFailureDoesNotStopWatching() throws Exception {
        CountDownLatch latch = new CountDownLatch(2);

        watcher = new FileWatcher(watchDir, 50, () -> {
            latch.countDown();
            throw new IllegalStateException("reload failed");
        });
        watcher.start();

        Files.writeString(watchDir.resolve("a.html"), "a");
        Thread.sleep(500);
        Files.writeString(watchDir.resolve("b.html"), "b");

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertTrue(watcher.isRunning());
    }

    @Test
    void stop_isIdempotent() throws Exception {
        watcher = new FileWatcher(watchDir, 100, () -> {});
        watcher.start();
        assertTrue(watcher.isRunning());

        watcher.stop();
        watcher.stop();

        assertFalse(watcher.isRunning());
        assertEquals(0, watcher.watchedDirectoryCount());
    }
}
