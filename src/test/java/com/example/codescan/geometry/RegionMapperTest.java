package com.example.codescan.geometry;

import com.example.codescan.error.GeometryUnavailableException;
import com.example.codescan.error.ScanFailureKind;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RegionMapperTest {

    private final RegionMapper mapper = new RegionMapper();

    @Test
    void squareBoxIsCenteredAndContained() {
        DisplaySize display = new DisplaySize(375, 667);
        for (int box : new int[]{1, 50, 200, 374, 375}) {
            DisplayRect r = mapper.computeScanRegion(display, box);
            assertEquals(box, r.width(), 1e-9, "width for " + box);
            assertEquals(box, r.height(), 1e-9, "height for " + box);
            assertEquals(display.centerX(), r.centerX(), 1e-9);
            assertEquals(display.centerY(), r.centerY(), 1e-9);
            assertTrue(r.isContainedIn(display), "contained for " + box);
        }
    }

    @Test
    void defaultBoxOnPortraitPhone() {
        DisplayRect r = mapper.computeScanRegion(new DisplaySize(400, 800), 200);
        assertEquals(new DisplayRect(100, 300, 200, 200), r);
    }

    @Test
    void oversizedBoxIsClampedToShortSideByDefault() {
        DisplaySize display = new DisplaySize(300, 500);
        DisplayRect r = mapper.computeScanRegion(display, 1000);

        assertEquals(OversizePolicy.CLAMP, mapper.getOversizePolicy());
        assertEquals(300, r.width(), 1e-9);
        assertEquals(300, r.height(), 1e-9);
        assertEquals(150, r.centerX(), 1e-9);
        assertEquals(250, r.centerY(), 1e-9);
        assertTrue(r.isContainedIn(display));
    }

    @Test
    void oversizedBoxOverflowsWhenConfigured() {
        RegionMapper overflow = new RegionMapper(OversizePolicy.OVERFLOW);
        DisplaySize display = new DisplaySize(300, 500);
        DisplayRect r = overflow.computeScanRegion(display, 1000);

        assertEquals(1000, r.width(), 1e-9);
        assertEquals(-350, r.x(), 1e-9);
        assertEquals(-250, r.y(), 1e-9);
        assertEquals(150, r.centerX(), 1e-9);
        assertEquals(250, r.centerY(), 1e-9);
        assertFalse(r.isContainedIn(display));
    }

    @Test
    void rectangularRegionClampsEachAxis() {
        DisplayRect r = mapper.computeScanRegion(new DisplaySize(300, 500), new ScanRegion(400, 100));
        assertEquals(new DisplayRect(0, 200, 300, 100), r);
    }

    @Test
    void nonPositiveBoxIsRejected() {
        DisplaySize display = new DisplaySize(300, 500);
        assertThrows(IllegalArgumentException.class, () -> mapper.computeScanRegion(display, 0));
        assertThrows(IllegalArgumentException.class, () -> mapper.computeScanRegion(display, -5));
        assertThrows(IllegalArgumentException.class, () -> new ScanRegion(0, 10));
    }

    @Test
    void unknownDisplaySignalsGeometryUnavailable() {
        GeometryUnavailableException e = assertThrows(GeometryUnavailableException.class,
                () -> mapper.computeScanRegion(DisplaySize.UNKNOWN, 200));
        assertEquals(ScanFailureKind.GEOMETRY_UNAVAILABLE, e.getKind());

        assertThrows(GeometryUnavailableException.class, () -> mapper.computeScanRegion(null, 200));
        assertThrows(GeometryUnavailableException.class,
                () -> mapper.computeScanRegion(new DisplaySize(Double.NaN, 100), 50));
    }

    @Test
    void mapToNormalizedReturnsDisplayLayerResultUnchanged() {
        NormalizedRect fromLayer = new NormalizedRect(0.1, 0.2, 0.3, 0.4);
        AtomicReference<DisplayRect> seen = new AtomicReference<>();
        DisplayRect box = new DisplayRect(10, 20, 30, 40);

        NormalizedRect out = mapper.mapToNormalized(box, r -> {
            seen.set(r);
            return fromLayer;
        });

        assertSame(fromLayer, out);
        assertEquals(box, seen.get());
    }

    @Test
    void nullFromDisplayLayerSignalsGeometryUnavailable() {
        assertThrows(GeometryUnavailableException.class,
                () -> mapper.mapToNormalized(new DisplayRect(0, 0, 10, 10), r -> null));
    }

    @Test
    void computeRegionOfInterestChainsBothSteps() {
        DisplaySize display = new DisplaySize(400, 800);
        NormalizedRect roi = mapper.computeRegionOfInterest(display, ScanRegion.square(200),
                r -> NormalizedRect.clamped(r.x() / 400, r.y() / 800, r.width() / 400, r.height() / 800));
        assertEquals(new NormalizedRect(0.25, 0.375, 0.5, 0.25), roi);
    }
}
