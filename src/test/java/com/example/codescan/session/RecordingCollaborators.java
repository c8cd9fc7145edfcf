package com.example.codescan.session;

import com.example.codescan.error.ScanFailure;
import com.example.codescan.geometry.DisplayRect;
import com.example.codescan.geometry.DisplaySize;
import com.example.codescan.geometry.NormalizedRect;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Capture + display + listener spy. Every interaction is appended to {@link #calls} in order,
 * so tests can assert on ordering (e.g. disarm before onCapture).
 *
 * <p>The display mapping is a plain scale by the configured frame size (no crop).</p>
 */
class RecordingCollaborators implements CaptureCollaborator, DisplayCollaborator, ScanListener {

    final List<String> calls = new ArrayList<>();
    final List<ScanFailure> failures = new ArrayList<>();
    final List<NormalizedRect> armedWith = new ArrayList<>();
    final List<String> captured = new ArrayList<>();

    DisplaySize frameSize = new DisplaySize(400, 800);
    Predicate<String> decision = content -> true;
    boolean armed;
    int frameRectRequests;
    OrientationState appliedOrientation;
    SessionState stateSeenByCallback;
    boolean armedSeenByCallback;
    ScanSession session;

    // capture

    @Override
    public void armDetector(NormalizedRect roi) {
        calls.add("arm");
        armedWith.add(roi);
        armed = true;
    }

    @Override
    public void disarmDetector() {
        calls.add("disarm");
        armed = false;
    }

    // display

    @Override
    public NormalizedRect frameRectFor(DisplayRect r) {
        calls.add("frameRectFor");
        frameRectRequests++;
        return NormalizedRect.clamped(r.x() / frameSize.width(), r.y() / frameSize.height(),
                r.width() / frameSize.width(), r.height() / frameSize.height());
    }

    @Override
    public void applyOrientation(OrientationState orientation) {
        calls.add("applyOrientation:" + orientation);
        appliedOrientation = orientation;
    }

    // listener

    @Override
    public void onFailure(ScanFailure failure) {
        calls.add("onFailure:" + failure.kind().code());
        failures.add(failure);
    }

    @Override
    public boolean onCapture(String content) {
        calls.add("onCapture:" + content);
        captured.add(content);
        armedSeenByCallback = armed;
        stateSeenByCallback = (session == null) ? null : session.getState();
        return decision.test(content);
    }

    @Override
    public void beforeStart(ScanSession s) {
        calls.add("beforeStart");
    }

    @Override
    public void afterStop(ScanSession s) {
        calls.add("afterStop");
    }

    long count(String call) {
        return calls.stream().filter(call::equals).count();
    }

    ScanSession newSession() {
        session = new ScanSession(this, this, this);
        return session;
    }
}
