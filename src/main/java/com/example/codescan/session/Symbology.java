package com.example.codescan.session;

import java.util.Locale;

/** Well-known symbology tags. Detectors may report others; tags compare case-insensitively. */
public final class Symbology {

    public static final String QR = "QR";
    public static final String MICRO_QR = "MICRO_QR";
    public static final String AZTEC = "AZTEC";
    public static final String DATA_MATRIX = "DATA_MATRIX";
    public static final String PDF417 = "PDF417";
    public static final String EAN_13 = "EAN_13";
    public static final String EAN_8 = "EAN_8";
    public static final String UPC_E = "UPC_E";
    public static final String CODE_39 = "CODE_39";
    public static final String CODE_93 = "CODE_93";
    public static final String CODE_128 = "CODE_128";
    public static final String ITF = "ITF";

    private Symbology() {
    }

    /** Trimmed, upper-case form; null for null or blank input. */
    public static String normalize(String tag) {
        if (tag == null) return null;
        String t = tag.trim();
        return t.isEmpty() ? null : t.toUpperCase(Locale.ROOT);
    }
}
