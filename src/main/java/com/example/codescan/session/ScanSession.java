package com.example.codescan.session;

import com.example.codescan.error.GeometryUnavailableException;
import com.example.codescan.error.ScanFailure;
import com.example.codescan.error.ScanFailureKind;
import com.example.codescan.geometry.DisplayRect;
import com.example.codescan.geometry.DisplaySize;
import com.example.codescan.geometry.NormalizedRect;
import com.example.codescan.geometry.RegionMapper;
import com.example.codescan.geometry.ScanRegion;
import com.example.codescan.metrics.ScanSessionMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Scan lifecycle and detection-selection policy.
 *
 * <ul>
 *   <li>IDLE → SCANNING on {@link #start()}; full-frame with a region-not-configured warning when no ROI is set</li>
 *   <li>SCANNING → HALTED_ON_DETECTION when a batch yields a qualifying event; capture is disarmed
 *       before the result callback runs</li>
 *   <li>HALTED_ON_DETECTION → SCANNING when the callback returns false, → IDLE when it returns true</li>
 *   <li>any → IDLE on {@link #stop()}</li>
 * </ul>
 *
 * <p>Not thread-safe: every entry point must run on one serial context. Use
 * {@link SerialScanSession} when callers live on other threads.</p>
 */
@Slf4j
public class ScanSession {

    private final CaptureCollaborator capture;
    private final DisplayCollaborator display;
    private final ScanListener listener;
    private final RegionMapper regionMapper;
    private final DetectionSelector selector;
    private final ScanSessionMetrics metrics;

    private SessionState state = SessionState.IDLE;
    private ScanRegion scanRegion;
    private OrientationState orientation;
    private DisplaySize displaySize = DisplaySize.UNKNOWN;
    private NormalizedRect regionOfInterest; // null = not configured
    private DetectionEvent lastDetection;
    private boolean setupFailed;
    private long armCount;
    private long haltSeq;

    public ScanSession(CaptureCollaborator capture, DisplayCollaborator display, ScanListener listener) {
        this(capture, display, listener, new RegionMapper(), DetectionSelector.acceptAny(),
                ScanSessionMetrics.noop(), ScanRegion.square(ScanRegion.DEFAULT_SIZE), OrientationState.PORTRAIT);
    }

    public ScanSession(CaptureCollaborator capture,
                       DisplayCollaborator display,
                       ScanListener listener,
                       RegionMapper regionMapper,
                       DetectionSelector selector,
                       ScanSessionMetrics metrics,
                       ScanRegion scanRegion,
                       OrientationState orientation) {
        this.capture = Objects.requireNonNull(capture, "capture");
        this.display = Objects.requireNonNull(display, "display");
        this.listener = (listener == null) ? ScanListener.DEFAULTS : listener;
        this.regionMapper = (regionMapper == null) ? new RegionMapper() : regionMapper;
        this.selector = (selector == null) ? DetectionSelector.acceptAny() : selector;
        this.metrics = (metrics == null) ? ScanSessionMetrics.noop() : metrics;
        this.scanRegion = (scanRegion == null) ? ScanRegion.square(ScanRegion.DEFAULT_SIZE) : scanRegion;
        this.orientation = OrientationState.orDefault(orientation);
    }

    // ------------------------------------------------------------------ region

    /**
     * Layout pass: records the display size and recomputes the region of interest.
     * On failure the previous region is kept and a geometry-unavailable failure is reported.
     *
     * @return true when a fresh region of interest was computed
     */
    public boolean configureRegion(DisplaySize displaySize) {
        this.displaySize = (displaySize == null) ? DisplaySize.UNKNOWN : displaySize;
        return remapRegion();
    }

    /** Changes the scan box size and remaps when the display size is already known. */
    public boolean setScanRegion(ScanRegion scanRegion) {
        this.scanRegion = Objects.requireNonNull(scanRegion, "scanRegion");
        return displaySize.isKnown() && remapRegion();
    }

    /**
     * Rotation event. Forwards the orientation to the display layer, then requests a fresh
     * mapping so the next arm uses it. Session state is left untouched.
     */
    public void onOrientationChanged(OrientationState newOrientation) {
        OrientationState o = OrientationState.orDefault(newOrientation);
        OrientationState previous = this.orientation;
        this.orientation = o;
        log.debug("[ScanSession] orientation {} -> {} (state={})", previous, o, state);
        try {
            display.applyOrientation(o);
        } catch (RuntimeException e) {
            callbackFailed("applyOrientation", e);
        }
        if (displaySize.isKnown()) {
            remapRegion();
        }
    }

    private boolean remapRegion() {
        try {
            DisplayRect box = regionMapper.computeScanRegion(displaySize, scanRegion);
            NormalizedRect roi = regionMapper.mapToNormalized(box, display);
            this.regionOfInterest = roi;
            log.debug("[ScanSession] region {} on {} -> roi {}", box, displaySize, roi);
            return true;
        } catch (GeometryUnavailableException e) {
            log.warn("[ScanSession] region not computed, keeping previous roi={}: {}", regionOfInterest, e.getMessage());
            report(ScanFailure.from(e));
            return false;
        } catch (RuntimeException e) {
            // display layer failed or produced an out-of-frame rect
            log.warn("[ScanSession] display mapping failed, keeping previous roi={}", regionOfInterest, e);
            report(ScanFailure.of(ScanFailureKind.GEOMETRY_UNAVAILABLE,
                    "display layer mapping failed: " + e.getMessage(), e));
            return false;
        }
    }

    // ------------------------------------------------------------------ lifecycle

    /**
     * Arms the detector. No-op while already scanning. Clears the last halted detection and any
     * setup-failure latch.
     */
    public void start() {
        if (state == SessionState.SCANNING) {
            log.debug("[ScanSession] start() ignored, already scanning");
            return;
        }
        setupFailed = false;
        lastDetection = null;
        if (regionOfInterest == null) {
            log.warn("[ScanSession] region of interest not configured, scanning full frame");
            report(ScanFailure.of(ScanFailureKind.REGION_NOT_CONFIGURED,
                    "scan box was never applied; detector armed on the full frame"));
        }
        arm();
    }

    /** Immediate and unconditional. From IDLE this is a no-op. */
    public void stop() {
        switch (state) {
            case IDLE -> log.trace("[ScanSession] stop() ignored, already idle");
            case SCANNING -> {
                transition(SessionState.IDLE);
                disarm();
            }
            case HALTED_ON_DETECTION -> transition(SessionState.IDLE);
        }
    }

    /**
     * Capture-side setup failure. The session goes idle and stays there until the caller
     * calls {@link #start()} again.
     */
    public void onSetupFailed(Throwable error) {
        setupFailed = true;
        SessionState previous = state;
        if (previous != SessionState.IDLE) {
            transition(SessionState.IDLE);
        }
        if (previous == SessionState.SCANNING) {
            disarm();
        }
        log.error("[ScanSession] capture setup failed (state was {})", previous, error);
        report(ScanFailure.of(ScanFailureKind.SETUP_FAILED,
                error == null ? "capture setup failed" : String.valueOf(error.getMessage()), error));
    }

    // ------------------------------------------------------------------ detection

    /**
     * Detection intake, one call per processed frame. Dropped unless the session is scanning.
     */
    public void onDetectionBatch(List<DetectionEvent> batch) {
        if (state != SessionState.SCANNING) {
            metrics.batchDropped();
            log.trace("[ScanSession] batch dropped in state {}", state);
            return;
        }
        DetectionEvent hit = selectDetection(batch);
        if (hit == null) {
            return;
        }
        lastDetection = hit;
        metrics.detection(hit.typeTag());
        transition(SessionState.HALTED_ON_DETECTION);
        long seq = ++haltSeq;
        disarm();

        boolean halt;
        try {
            halt = listener.onCapture(hit.content());
        } catch (RuntimeException e) {
            callbackFailed("onCapture", e);
            halt = true;
        }

        if (state != SessionState.HALTED_ON_DETECTION || seq != haltSeq) {
            // start()/stop() from inside the callback already decided
            log.debug("[ScanSession] capture decision superseded, state={}", state);
            return;
        }
        if (halt) {
            transition(SessionState.IDLE);
        } else {
            arm();
        }
    }

    /** First qualifying event of the batch, or null. */
    public DetectionEvent selectDetection(List<DetectionEvent> batch) {
        return selector.select(batch);
    }

    // ------------------------------------------------------------------ accessors

    public SessionState getState() {
        return state;
    }

    public NormalizedRect getRegionOfInterest() {
        return regionOfInterest;
    }

    public ScanRegion getScanRegion() {
        return scanRegion;
    }

    public OrientationState getOrientation() {
        return orientation;
    }

    public DetectionEvent getLastDetection() {
        return lastDetection;
    }

    public boolean isSetupFailed() {
        return setupFailed;
    }

    public ScanSessionSnapshot snapshot() {
        return new ScanSessionSnapshot(state, regionOfInterest, scanRegion, orientation, displaySize,
                lastDetection, setupFailed, armCount);
    }

    // ------------------------------------------------------------------ internals

    private void arm() {
        invokeHook("beforeStart", () -> listener.beforeStart(this));
        try {
            capture.armDetector(regionOfInterest);
        } catch (RuntimeException e) {
            onSetupFailed(e);
            return;
        }
        armCount++;
        transition(SessionState.SCANNING);
    }

    private void disarm() {
        try {
            capture.disarmDetector();
        } catch (RuntimeException e) {
            callbackFailed("disarmDetector", e);
        }
        invokeHook("afterStop", () -> listener.afterStop(this));
    }

    private void transition(SessionState to) {
        SessionState from = state;
        if (from == to) {
            return;
        }
        state = to;
        metrics.transition(from, to);
        log.debug("[ScanSession] {} -> {}", from, to);
    }

    private void invokeHook(String name, Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            callbackFailed(name, e);
        }
    }

    private void callbackFailed(String name, RuntimeException e) {
        log.warn("[ScanSession] {} raised {}", name, e.toString(), e);
        report(ScanFailure.of(ScanFailureKind.CALLBACK_FAILURE, name + " failed: " + e.getMessage(), e));
    }

    private void report(ScanFailure failure) {
        metrics.failure(failure.kind());
        try {
            listener.onFailure(failure);
        } catch (RuntimeException e) {
            log.warn("[ScanSession] onFailure hook raised while reporting {}", failure.kind().code(), e);
        }
    }
}
