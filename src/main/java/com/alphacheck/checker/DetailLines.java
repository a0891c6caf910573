package com.alphacheck.checker;

import com.alphacheck.domain.TradingTime;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.function.Function;

/** Formatting helpers for checker messages and detail listings. */
public final class DetailLines {

    private DetailLines() {}

    /**
     * Appends one header per group followed by at most {@code maxRows} item lines and a
     * {@code ... and N more} trailer when the group was truncated.
     */
    public static <K, T> void appendGrouped(
            List<String> out,
            SortedMap<K, List<T>> groups,
            Function<K, String> header,
            Function<T, String> item,
            int maxRows) {
        for (Map.Entry<K, List<T>> group : groups.entrySet()) {
            out.add("  " + header.apply(group.getKey()));
            appendLimited(out, group.getValue(), item, maxRows, "    ");
        }
    }

    public static <T> void appendLimited(
            List<String> out, List<T> items, Function<T, String> item, int maxRows, String indent) {
        int shown = Math.min(items.size(), maxRows);
        for (int i = 0; i < shown; i++) {
            out.add(indent + item.apply(items.get(i)));
        }
        if (items.size() > shown) {
            out.add(indent + "... and " + (items.size() - shown) + " more");
        }
    }

    /** Volume rendered with at most six decimals and no trailing zeros. */
    public static String volume(double value) {
        if (!Double.isFinite(value)) {
            return String.valueOf(value);
        }
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(6, RoundingMode.HALF_UP).stripTrailingZeros();
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.toPlainString();
    }

    /** Bucket key rendered as raw value plus clock time, e.g. {@code 93000000 (9:30)}. */
    public static String time(long time) {
        if (TradingTime.isPrevClose(time)) {
            return TradingTime.format(time);
        }
        return time + " (" + TradingTime.format(time) + ")";
    }

    public static String plural(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }
}
