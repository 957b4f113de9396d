package com.aurumshield.backend.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Content fingerprints used for breach IDs, snapshot hashes and audit dedup keys.
 * All call sites go through {@link #fingerprint(String)} so the hash can be swapped in one place.
 */
public final class Fingerprints {

    private static final int FNV_OFFSET_BASIS = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    private static final DateTimeFormatter MINUTE_BUCKET =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm").withZone(ZoneOffset.UTC);

    private Fingerprints() {
    }

    /**
     * 32-bit FNV-1a over the UTF-16 code units of {@code raw}, as 8 lowercase hex chars.
     */
    public static String fingerprint(String raw) {
        int hash = FNV_OFFSET_BASIS;
        for (int i = 0; i < raw.length(); i++) {
            hash ^= raw.charAt(i);
            hash *= FNV_PRIME;
        }
        return String.format("%08x", hash);
    }

    public static String fingerprint(String... parts) {
        return fingerprint(String.join("|", parts));
    }

    /** UTC minute bucket, e.g. {@code 2026-02-17T02:30}. */
    public static String minuteBucket(Instant instant) {
        return MINUTE_BUCKET.format(instant);
    }

    public static String fixed(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }
}
