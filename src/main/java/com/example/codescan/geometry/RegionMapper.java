package com.example.codescan.geometry;

import com.example.codescan.error.GeometryUnavailableException;

import java.util.Objects;

/**
 * Converts a caller's visual scan box into the detector-space region of interest.
 *
 * <p>RegionMapper only produces the <em>input</em> rectangle (center + size). The
 * display-to-frame transform is delegated to the display layer through
 * {@link FrameRectTransform}. Stateless and thread-safe.</p>
 */
public class RegionMapper {

    private final OversizePolicy oversizePolicy;

    public RegionMapper() {
        this(OversizePolicy.CLAMP);
    }

    public RegionMapper(OversizePolicy oversizePolicy) {
        this.oversizePolicy = (oversizePolicy == null) ? OversizePolicy.CLAMP : oversizePolicy;
    }

    public OversizePolicy getOversizePolicy() {
        return oversizePolicy;
    }

    /**
     * Square of side {@code boxSize} centered in the display.
     *
     * @throws IllegalArgumentException     if {@code boxSize} is not positive
     * @throws GeometryUnavailableException if the display size is not known yet
     */
    public DisplayRect computeScanRegion(DisplaySize displaySize, int boxSize) {
        if (boxSize <= 0) {
            throw new IllegalArgumentException("boxSize must be positive: " + boxSize);
        }
        requireKnown(displaySize);
        double side = boxSize;
        if (oversizePolicy == OversizePolicy.CLAMP) {
            side = Math.min(side, displaySize.minSide());
        }
        return DisplayRect.centeredIn(displaySize, side, side);
    }

    /**
     * Rectangular variant. Under {@link OversizePolicy#CLAMP} each axis is clamped on its own.
     */
    public DisplayRect computeScanRegion(DisplaySize displaySize, ScanRegion region) {
        Objects.requireNonNull(region, "region");
        if (region.isSquare()) {
            return computeScanRegion(displaySize, region.widthPx());
        }
        requireKnown(displaySize);
        double w = region.widthPx();
        double h = region.heightPx();
        if (oversizePolicy == OversizePolicy.CLAMP) {
            w = Math.min(w, displaySize.width());
            h = Math.min(h, displaySize.height());
        }
        return DisplayRect.centeredIn(displaySize, w, h);
    }

    /**
     * Hands {@code displayRect} to the display layer and returns its answer unchanged.
     *
     * @throws GeometryUnavailableException if the layer returns null
     */
    public NormalizedRect mapToNormalized(DisplayRect displayRect, FrameRectTransform frameRectFor) {
        Objects.requireNonNull(displayRect, "displayRect");
        Objects.requireNonNull(frameRectFor, "frameRectFor");
        NormalizedRect roi = frameRectFor.frameRectFor(displayRect);
        if (roi == null) {
            throw new GeometryUnavailableException("display layer returned no frame mapping for " + displayRect);
        }
        return roi;
    }

    public NormalizedRect computeRegionOfInterest(DisplaySize displaySize, ScanRegion region,
                                                  FrameRectTransform frameRectFor) {
        return mapToNormalized(computeScanRegion(displaySize, region), frameRectFor);
    }

    private static void requireKnown(DisplaySize displaySize) {
        if (displaySize == null || !displaySize.isKnown()) {
            throw new GeometryUnavailableException("display size unknown: " + displaySize);
        }
    }
}
