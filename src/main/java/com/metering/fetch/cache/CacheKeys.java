package com.metering.fetch.cache;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Deterministic keys for cached payloads and request coalescing.
 *
 * Keys look like {@code timeseries/{site}/{startDate}_{endDate}/{hash}.{format}}.
 * The date segment keeps listings browsable; the hash covers the sorted distinct
 * point names and the full start and end instants, so two ranges on the same days
 * never share an entry.
 */
public final class CacheKeys {

    public static final String PREFIX = "timeseries/";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);
    private static final int HASH_LENGTH = 16;

    private CacheKeys() {
    }

    public static String forRequest(String site, Collection<String> points, Instant start, Instant end, String format) {
        String extension = format == null || format.isBlank() ? "json" : format.trim().toLowerCase(Locale.ROOT);
        return PREFIX
            + URLEncoder.encode(site, StandardCharsets.UTF_8) + "/"
            + DATE.format(start) + "_" + DATE.format(end) + "/"
            + sha256(canonicalPoints(points) + "|" + start + "|" + end) + "." + extension;
    }

    /**
     * Content hash identifying identical requests regardless of point order.
     */
    public static String requestHash(String site, Collection<String> points, Instant start, Instant end) {
        return sha256(site + "|" + canonicalPoints(points) + "|" + start + "|" + end);
    }

    static String canonicalPoints(Collection<String> points) {
        return String.join(",", new TreeSet<>(points));
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
