package com.example.codescan.session;

import com.example.codescan.geometry.NormalizedRect;

import java.util.Objects;

/**
 * One candidate code reported by the external detector for a frame tick.
 *
 * @param typeTag symbology tag, e.g. {@link Symbology#QR}
 * @param content decoded string; null when the object could not be decoded
 * @param bounds  object bounds in frame-normalized coordinates; may be null if the detector omits them
 */
public record DetectionEvent(String typeTag, String content, NormalizedRect bounds) {

    public DetectionEvent {
        Objects.requireNonNull(typeTag, "typeTag");
    }

    public static DetectionEvent of(String typeTag, String content) {
        return new DetectionEvent(typeTag, content, null);
    }

    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }
}
