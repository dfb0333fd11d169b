package io.github.drompincen.elvtrack.runtime.validation;

import io.github.drompincen.elvtrack.protocol.api.WireEnum;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed, field-by-field reads over a raw JSON payload. A {@code null} value is
 * treated exactly like an absent key. Every failure names the offending field.
 */
public final class PayloadReader {

    private final Map<String, Object> raw;

    public PayloadReader(Map<String, Object> raw) {
        this.raw = raw != null ? raw : Map.of();
    }

    public String optionalString(String field) {
        Object value = raw.get(field);
        if (value == null) return null;
        if (!(value instanceof String s)) throw new ValidationException(field, "must be a string");
        return s;
    }

    public String requiredString(String field) {
        String value = optionalString(field);
        if (value == null || value.isBlank()) throw new ValidationException(field, "is required");
        return value;
    }

    public Integer optionalInteger(String field) {
        Object value = raw.get(field);
        if (value == null) return null;
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) return (int) d;
            throw new ValidationException(field, "must be an integer");
        }
        if (value instanceof String s && s.trim().matches("-?\\d{1,9}")) {
            return Integer.parseInt(s.trim());
        }
        throw new ValidationException(field, "must be an integer");
    }

    public Double optionalNumber(String field) {
        Object value = raw.get(field);
        if (value == null) return null;
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException(field, "must be a number");
            }
        }
        throw new ValidationException(field, "must be a number");
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> optionalObject(String field) {
        Object value = raw.get(field);
        if (value == null) return null;
        if (!(value instanceof Map<?, ?> map)) throw new ValidationException(field, "must be an object");
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) throw new ValidationException(field, "keys must be strings");
        }
        return new LinkedHashMap<>((Map<String, Object>) map);
    }

    public List<String> optionalUrlList(String field) {
        Object value = raw.get(field);
        if (value == null) return null;
        if (!(value instanceof List<?> list)) throw new ValidationException(field, "must be a list of URLs");
        List<String> urls = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            Object item = list.get(i);
            if (!(item instanceof String s) || !isHttpUrl(s)) {
                throw new ValidationException(field + "[" + i + "]", "must be an absolute http(s) URL");
            }
            urls.add(s);
        }
        return urls;
    }

    /** Absent means {@code fallback}; a present value must be one of the enum's wire literals. */
    public <E extends Enum<E> & WireEnum> E enumValue(String field, Class<E> type, E fallback) {
        Object value = raw.get(field);
        if (value == null) {
            if (fallback == null) throw new ValidationException(field, "is required");
            return fallback;
        }
        if (value instanceof String s) {
            return WireEnum.fromWire(type, s).orElseThrow(() -> notOneOf(field, type, s));
        }
        throw notOneOf(field, type, value);
    }

    /** Parses a single wire literal, e.g. a query parameter; {@code null} stays {@code null}. */
    public static <E extends Enum<E> & WireEnum> E parseWire(String field, Class<E> type, String value) {
        if (value == null) return null;
        return WireEnum.fromWire(type, value).orElseThrow(() -> notOneOf(field, type, value));
    }

    public Instant optionalInstant(String field) {
        Object value = raw.get(field);
        return value == null ? null : Timestamps.parse(field, value);
    }

    private static <E extends Enum<E> & WireEnum> ValidationException notOneOf(String field, Class<E> type, Object value) {
        return new ValidationException(field,
                "must be one of [" + WireEnum.allowedValues(type) + "], got '" + value + "'");
    }

    private static boolean isHttpUrl(String s) {
        try {
            URI uri = new URI(s);
            return uri.isAbsolute() && uri.getHost() != null
                    && ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()));
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
