package com.example.codescan.metrics;

import com.example.codescan.error.ScanFailureKind;
import com.example.codescan.geometry.RegionMapper;
import com.example.codescan.geometry.ScanRegion;
import com.example.codescan.session.CaptureCollaborator;
import com.example.codescan.session.DetectionEvent;
import com.example.codescan.session.DetectionSelector;
import com.example.codescan.session.DisplayCollaborator;
import com.example.codescan.session.OrientationState;
import com.example.codescan.session.ScanHooks;
import com.example.codescan.session.ScanSession;
import com.example.codescan.session.SessionState;
import com.example.codescan.session.Symbology;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;

class ScanSessionMetricsTest {

    @Test
    void countsTransitionsDetectionsFailuresAndDrops() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ScanSessionMetrics metrics = new ScanSessionMetrics(registry, true, "scan");
        ScanSession session = new ScanSession(mock(CaptureCollaborator.class), mock(DisplayCollaborator.class),
                ScanHooks.defaults(), new RegionMapper(), DetectionSelector.acceptAny(), metrics,
                ScanRegion.square(200), OrientationState.PORTRAIT);

        session.onDetectionBatch(List.of(DetectionEvent.of(Symbology.QR, "early")));
        session.start();
        session.onDetectionBatch(List.of(DetectionEvent.of(Symbology.QR, "hit")));

        assertThat(session.getState()).isEqualTo(SessionState.IDLE);
        assertThat(registry.get("scan.batches.dropped").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("scan.detections").tag("symbology", "qr").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("scan.failures").tag("kind", ScanFailureKind.REGION_NOT_CONFIGURED.code())
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("scan.session.transitions").tag("from", "idle").tag("to", "scanning")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("scan.session.transitions").tag("from", "halted_on_detection").tag("to", "idle")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void disabledOrMissingRegistryIsSilent() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        new ScanSessionMetrics(registry, false, "scan").batchDropped();
        assertThat(registry.getMeters()).isEmpty();

        assertThatCode(() -> {
            new ScanSessionMetrics(null, true, null).failure(ScanFailureKind.SETUP_FAILED);
            ScanSessionMetrics.noop().detection(null);
        }).doesNotThrowAnyException();
    }
}
