package com.example.codescan.session;

import com.example.codescan.geometry.DisplaySize;
import com.example.codescan.geometry.ScanRegion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Thread-safe front for a {@link ScanSession}: every entry point is marshaled onto one serial
 * executor, so submission order is execution order. A {@code stop()} submitted before a batch
 * makes that batch drop.
 *
 * <p>Nothing here blocks the caller.</p>
 */
public class SerialScanSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SerialScanSession.class);

    private final ScanSession session;
    private final Executor executor;
    private final ExecutorService owned; // null when the executor is supplied by the caller
    private final AtomicBoolean closed = new AtomicBoolean();

    /** Owns a single daemon thread named {@code threadName}. */
    public SerialScanSession(ScanSession session, String threadName) {
        this(session, newSerialExecutor(threadName), true);
    }

    /**
     * Runs on a caller-supplied executor, which must execute tasks one at a time in submission order.
     */
    public SerialScanSession(ScanSession session, Executor serialExecutor) {
        this(session, serialExecutor, false);
    }

    private SerialScanSession(ScanSession session, Executor executor, boolean owns) {
        this.session = Objects.requireNonNull(session, "session");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.owned = (owns && executor instanceof ExecutorService es) ? es : null;
    }

    public void start() {
        submit("start", session::start);
    }

    public void stop() {
        submit("stop", session::stop);
    }

    public void onDetectionBatch(List<DetectionEvent> batch) {
        // the detector may reuse its list between frames
        List<DetectionEvent> copy = (batch == null) ? List.of() : new ArrayList<>(batch);
        submit("onDetectionBatch", () -> session.onDetectionBatch(copy));
    }

    public void onOrientationChanged(OrientationState orientation) {
        submit("onOrientationChanged", () -> session.onOrientationChanged(orientation));
    }

    public void configureRegion(DisplaySize displaySize) {
        submit("configureRegion", () -> session.configureRegion(displaySize));
    }

    public void setScanRegion(ScanRegion scanRegion) {
        Objects.requireNonNull(scanRegion, "scanRegion");
        submit("setScanRegion", () -> session.setScanRegion(scanRegion));
    }

    public void onSetupFailed(Throwable error) {
        submit("onSetupFailed", () -> session.onSetupFailed(error));
    }

    /** Snapshot taken on the serial context, after everything submitted before it. */
    public CompletableFuture<ScanSessionSnapshot> snapshot() {
        CompletableFuture<ScanSessionSnapshot> f = new CompletableFuture<>();
        boolean queued = submit("snapshot", () -> f.complete(session.snapshot()));
        if (!queued) {
            f.completeExceptionally(new RejectedExecutionException("serial scan session closed"));
        }
        return f;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Queues a final {@code stop()} and, when the executor is owned, shuts it down after that stop.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        dispatch("close", session::stop);
        if (owned != null) {
            owned.shutdown();
        }
    }

    private boolean submit(String op, Runnable task) {
        if (closed.get()) {
            log.debug("[SerialScanSession] {} dropped, session closed", op);
            return false;
        }
        return dispatch(op, task);
    }

    private boolean dispatch(String op, Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("[SerialScanSession] {} failed on serial context", op, e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("[SerialScanSession] {} rejected by executor: {}", op, e.getMessage());
            return false;
        }
    }

    private static ExecutorService newSerialExecutor(String threadName) {
        String name = (threadName == null || threadName.isBlank()) ? "codescan-serial" : threadName;
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }
}
