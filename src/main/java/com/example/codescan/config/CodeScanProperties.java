package com.example.codescan.config;

import com.example.codescan.geometry.OversizePolicy;
import com.example.codescan.geometry.ScanRegion;
import com.example.codescan.session.OrientationState;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "codescan")
public class CodeScanProperties {

    /** Master switch for the auto-configuration. */
    private boolean enabled = true;

    /** Scan box side in display points. */
    private int boxSize = ScanRegion.DEFAULT_SIZE;

    /**
     * Optional rectangular box. When both are positive they win over {@link #boxSize}.
     */
    private int boxWidth;
    private int boxHeight;

    private OversizePolicy oversizePolicy = OversizePolicy.CLAMP;

    /** Accepted symbology tags (case-insensitive). Empty accepts any symbology. */
    private List<String> symbologies = new ArrayList<>();

    private OrientationState defaultOrientation = OrientationState.PORTRAIT;

    private final Metrics metrics = new Metrics();
    private final Serial serial = new Serial();

    public static class Metrics {
        private boolean enabled = true;
        private String prefix = "codescan";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }

    public static class Serial {
        /** Name of the thread owned by a serial session. */
        private String threadName = "codescan-serial";

        public String getThreadName() { return threadName; }
        public void setThreadName(String threadName) { this.threadName = threadName; }
    }

    /** Effective scan box: the rectangular override when set, else a square of {@link #boxSize}. */
    public ScanRegion scanRegion() {
        if (boxWidth > 0 && boxHeight > 0) {
            return new ScanRegion(boxWidth, boxHeight);
        }
        return ScanRegion.square(boxSize);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getBoxSize() {
        return boxSize;
    }

    public void setBoxSize(int boxSize) {
        if (boxSize <= 0) {
            throw new IllegalArgumentException("codescan.box-size must be positive: " + boxSize);
        }
        this.boxSize = boxSize;
    }

    public int getBoxWidth() {
        return boxWidth;
    }

    public void setBoxWidth(int boxWidth) {
        this.boxWidth = boxWidth;
    }

    public int getBoxHeight() {
        return boxHeight;
    }

    public void setBoxHeight(int boxHeight) {
        this.boxHeight = boxHeight;
    }

    public OversizePolicy getOversizePolicy() {
        return oversizePolicy;
    }

    public void setOversizePolicy(OversizePolicy oversizePolicy) {
        this.oversizePolicy = (oversizePolicy == null) ? OversizePolicy.CLAMP : oversizePolicy;
    }

    public List<String> getSymbologies() {
        return symbologies;
    }

    public void setSymbologies(List<String> symbologies) {
        this.symbologies = (symbologies == null) ? new ArrayList<>() : symbologies;
    }

    public OrientationState getDefaultOrientation() {
        return defaultOrientation;
    }

    public void setDefaultOrientation(OrientationState defaultOrientation) {
        this.defaultOrientation = OrientationState.orDefault(defaultOrientation);
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Serial getSerial() {
        return serial;
    }
}
