package com.example.codescan.session;

import com.example.codescan.error.ScanFailure;
import lombok.Builder;
import lombok.Getter;

import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Options-style {@link ScanListener}: supply any subset of the hooks, the rest keep their defaults
 * ({@code onFail: noop, onCapture: accept and halt, beforeStart: noop, afterStop: noop}).
 */
@Getter
@Builder(toBuilder = true)
public final class ScanHooks implements ScanListener {

    @Builder.Default
    private final Consumer<ScanFailure> onFail = failure -> { };

    /** Returns true to halt, false to resume. */
    @Builder.Default
    private final Predicate<String> onCapture = content -> true;

    @Builder.Default
    private final Consumer<ScanSession> beforeStart = session -> { };

    @Builder.Default
    private final Consumer<ScanSession> afterStop = session -> { };

    public static ScanHooks defaults() {
        return ScanHooks.builder().build();
    }

    @Override
    public void onFailure(ScanFailure failure) {
        onFail.accept(failure);
    }

    @Override
    public boolean onCapture(String content) {
        return onCapture.test(content);
    }

    @Override
    public void beforeStart(ScanSession session) {
        beforeStart.accept(session);
    }

    @Override
    public void afterStop(ScanSession session) {
        afterStop.accept(session);
    }
}
