package com.example.codescan.config;

import com.example.codescan.geometry.RegionMapper;
import com.example.codescan.metrics.ScanSessionMetrics;
import com.example.codescan.session.CaptureCollaborator;
import com.example.codescan.session.DetectionSelector;
import com.example.codescan.session.DisplayCollaborator;
import com.example.codescan.session.ScanListener;
import com.example.codescan.session.ScanSession;
import com.example.codescan.session.SerialScanSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executor;

/**
 * Builds sessions from {@link CodeScanProperties}. One factory serves any number of sessions;
 * sessions share nothing mutable.
 */
@Slf4j
@RequiredArgsConstructor
public class ScanSessionFactory {

    private final CodeScanProperties props;
    private final RegionMapper regionMapper;
    private final DetectionSelector selector;
    private final ScanSessionMetrics metrics;

    public ScanSession create(CaptureCollaborator capture, DisplayCollaborator display, ScanListener listener) {
        log.debug("[ScanSessionFactory] new session box={} symbologies={} orientation={}",
                props.scanRegion(), selector.getAcceptedSymbologies(), props.getDefaultOrientation());
        return new ScanSession(capture, display, listener, regionMapper, selector, metrics,
                props.scanRegion(), props.getDefaultOrientation());
    }

    /** Session behind its own serial thread. */
    public SerialScanSession createSerial(CaptureCollaborator capture, DisplayCollaborator display,
                                          ScanListener listener) {
        return new SerialScanSession(create(capture, display, listener), props.getSerial().getThreadName());
    }

    /** Session on the host's serial context (e.g. the detector's delivery queue). */
    public SerialScanSession createSerial(CaptureCollaborator capture, DisplayCollaborator display,
                                          ScanListener listener, Executor serialExecutor) {
        return new SerialScanSession(create(capture, display, listener), serialExecutor);
    }
}
