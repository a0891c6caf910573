package com.alphacheck.domain;

import java.util.regex.Pattern;

/**
 * Integer trading-time keys used across every pipeline table.
 *
 * <p>Intraday buckets are encoded as HHMMSSmmm integers (e.g. 93000000 = 09:30:00.000,
 * 140000000 = 14:00:00.000). The previous trading day's closing snapshot is keyed by the
 * {@link #PREV_CLOSE} sentinel, which sorts before every intraday bucket.
 *
 * <p>Upstream files mark the closing snapshot with a textual marker (e.g. "nil_last_alpha");
 * {@link #parse(String)} folds every non-integer value onto the sentinel so checkers never
 * see the raw marker.
 */
public final class TradingTime {

    /** Sentinel for the previous trading day's closing target/position. */
    public static final long PREV_CLOSE = -1L;

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern INTEGRAL_DECIMAL = Pattern.compile("[-+]?\\d+\\.0*");

    private TradingTime() {}

    /**
     * Normalizes a raw time cell. Integers pass through, anything else becomes PREV_CLOSE.
     *
     * @throws NumberFormatException when an integer cell does not fit in a long
     */
    public static long parse(String raw) {
        if (raw == null) {
            return PREV_CLOSE;
        }
        String trimmed = raw.trim();
        if (INTEGER.matcher(trimmed).matches()) {
            return Long.parseLong(trimmed);
        }
        // "93000000.0" style cells written by spreadsheet exports
        if (INTEGRAL_DECIMAL.matcher(trimmed).matches()) {
            return Long.parseLong(trimmed.substring(0, trimmed.indexOf('.')));
        }
        return PREV_CLOSE;
    }

    public static boolean isPrevClose(long time) {
        return time == PREV_CLOSE;
    }

    public static boolean isIntraday(long time) {
        return time != PREV_CLOSE;
    }

    /**
     * Human-readable label: "PREV" for the sentinel, H:MM for HHMMSSmmm keys,
     * the raw number for anything shorter.
     */
    public static String format(long time) {
        if (time == PREV_CLOSE) {
            return "PREV";
        }
        if (time >= 10_000_000L) {
            long hour = time / 10_000_000L;
            long minute = (time / 100_000L) % 100;
            return String.format("%d:%02d", hour, minute);
        }
        return String.valueOf(time);
    }
}
