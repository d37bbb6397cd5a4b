package com.tradeagent.intent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical JSON encoding and SHA-256 digests for hash-bound records.
 *
 * <p>Canonical form:
 * <ul>
 *   <li>keys sorted, no whitespace</li>
 *   <li>non-ASCII characters escaped, output is pure ASCII</li>
 *   <li>decimals in plain notation, trailing zeros stripped, at least one fractional digit
 *       ({@code 4 -> 4.0}, {@code 0.550 -> 0.55})</li>
 *   <li>instants as UTC with millisecond precision, e.g. {@code 2024-01-01T00:00:00.000Z}</li>
 * </ul>
 */
public final class CanonicalJson {

    private static final JsonMapper MAPPER = JsonMapper.builder()
            .enable(JsonWriteFeature.ESCAPE_NON_ASCII)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    private static final DateTimeFormatter INSTANT_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private CanonicalJson() {}

    public static String write(Map<String, ?> fields) {
        Map<String, Object> sorted = new TreeMap<>();
        fields.forEach((key, value) -> sorted.put(key, normalize(value)));
        try {
            return MAPPER.writeValueAsString(sorted);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Canonical JSON serialization failed", e);
        }
    }

    public static BigDecimal normalizeNumber(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 1 ? stripped.setScale(1) : stripped;
    }

    public static String formatInstant(Instant instant) {
        return INSTANT_FORMAT.format(instant.truncatedTo(ChronoUnit.MILLIS));
    }

    public static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static Object normalize(Object value) {
        if (value instanceof BigDecimal decimal) {
            return normalizeNumber(decimal);
        }
        if (value instanceof Instant instant) {
            return formatInstant(instant);
        }
        return value;
    }
}
