package io.htmltpl.standalone.server;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches a template directory tree and fires a callback after changes settle.
 *
 * <p>Every directory under the root is registered with a {@link WatchService}; directories created
 * later are registered as they appear. Each create/modify/delete event (re)starts a debounce timer,
 * so a burst of edits causes one callback. The callback runs on the debounce thread; its failures
 * are logged and do not stop the watcher.
 */
public final class FileWatcher {

    private static final Logger LOG = LoggerFactory.getLogger(FileWatcher.class);

    private final Path root;
    private final int debounceMs;
    private final Runnable reloadCallback;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ConcurrentHashMap<WatchKey, Path> watchedDirs = new ConcurrentHashMap<>();

    private WatchService watchService;
    private Thread watchThread;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pendingReload;

    /**
     * @param root           directory tree to watch
     * @param debounceMs     quiet period before the callback fires
     * @param reloadCallback invoked once per settled burst of changes
     */
    public FileWatcher(Path root, int debounceMs, Runnable reloadCallback) {
        this.root = root;
        this.debounceMs = debounceMs;
        this.reloadCallback = reloadCallback;
    }

    /**
     * Registers the tree and starts watching on a daemon thread.
     *
     * @throws IOException if the watch service cannot be created or a directory cannot be
     *     registered
     */
    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            LOG.warn("FileWatcher already running");
            return;
        }

        watchService = FileSystems.getDefault().newWatchService();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "template-watcher-debounce");
            t.setDaemon(true);
            return t;
        });

        registerTree(root);

        watchThread = new Thread(this::pollLoop, "template-watcher");
        watchThread.setDaemon(true);
        watchThread.start();
        LOG.info("FileWatcher started (root={}, debounce={}ms, dirs={})", root, debounceMs, watchedDirs.size());
    }

    /** Stops watching and releases all resources. */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        try {
            if (watchService != null) {
                watchService.close();
            }
        } catch (IOException e) {
            LOG.warn("Error closing WatchService", e);
        }

        if (scheduler != null) {
            scheduler.shutdownNow();
        }

        if (watchThread != null) {
            watchThread.interrupt();
        }
        watchedDirs.clear();
        LOG.info("FileWatcher stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Number of directories currently registered. */
    int watchedDirectoryCount() {
        return watchedDirs.size();
    }

    private void registerTree(Path dir) throws IOException {
        List<Path> dirs;
        try (Stream<Path> walk = Files.walk(dir)) {
            dirs = walk.filter(Files::isDirectory).collect(Collectors.toList());
        }
        for (Path d : dirs) {
            WatchKey key = d.register(
                    watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_DELETE);
            watchedDirs.put(key, d);
            LOG.debug("Watching directory: {}", d);
        }
    }

    private void pollLoop() {
        while (running.get()) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }

            Path dir = watchedDirs.get(key);
            boolean changed = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                WatchEvent.Kind<?> kind = event.kind();
                changed = true;
                if (kind == StandardWatchEventKinds.OVERFLOW || dir == null) {
                    continue;
                }
                Path path = dir.resolve((Path) event.context());
                LOG.debug("File change detected: {} ({})", path, kind.name());
                if (kind == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(path)) {
                    try {
                        registerTree(path);
                    } catch (IOException | ClosedWatchServiceException e) {
                        LOG.warn("Cannot watch new directory {}: {}", path, e.getMessage());
                    }
                }
            }

            if (!key.reset()) {
                watchedDirs.remove(key);
                LOG.debug("Watch key no longer valid: {}", dir);
            }

            if (changed) {
                scheduleReload();
            }
        }
    }

    /** (Re)schedules the callback; a pending one is cancelled so rapid changes coalesce. */
    private synchronized void scheduleReload() {
        if (!running.get()) {
            return;
        }
        if (pendingReload != null && !pendingReload.isDone()) {
            pendingReload.cancel(false);
        }

        pendingReload = scheduler.schedule(
                () -> {
                    LOG.info("Template changes settled, reloading");
                    try {
                        reloadCallback.run();
                    } catch (RuntimeException e) {
                        LOG.error("Reload callback failed: {}", e.getMessage(), e);
                    }
                },
                debounceMs,
                TimeUnit.MILLISECONDS);
    }
}
