package com.purchasingpower.workgraph.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.workgraph.core.WorkItemStatus;
import com.purchasingpower.workgraph.core.WorkItemType;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.Collections;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Cleans and validates caller-supplied values before they reach Cypher.
 *
 * All values are bound as statement parameters, so this class is about keeping
 * stored text safe to render and IDs predictable, not about query escaping.
 * Identifiers, however, are restricted to a small alphabet:
 * - Node IDs: a-z A-Z 0-9 _ . - (max 100, must start alphanumeric)
 * - No Cypher keywords, quotes, semicolons, comments or $parameters
 *
 * Rejections throw {@link GraphOperationException} with kind VALIDATION.
 */
@Slf4j
public final class InputSanitizer {

    public static final String TRUNCATION_MARKER = "...[TRUNCATED]";

    private static final int DEFAULT_MAX_LENGTH = 10_000;
    private static final int MAX_ID_LENGTH = 100;
    private static final int MAX_METADATA_DEPTH = 10;
    private static final int MAX_METADATA_TOP_LEVEL_KEYS = 50;
    private static final int MAX_METADATA_OBJECT_KEYS = 100;
    private static final int MAX_METADATA_ARRAY_ITEMS = 1000;
    private static final int MAX_METADATA_STRING_LENGTH = 1000;
    private static final int MAX_KEY_LENGTH = 100;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern SCRIPT_BLOCK = Pattern.compile("<script[^>]*>[\\s\\S]*?</script>", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCRIPT_OPEN = Pattern.compile("<script[^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern JS_URL = Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE);
    private static final Pattern EVENT_HANDLER = Pattern.compile("\\s*on\\w+\\s*=\\s*[^>]*", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMBED_OPEN = Pattern.compile("<(iframe|object|embed|link|meta|form)[^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMBED_CLOSE = Pattern.compile("</(iframe|object|embed|link|meta|form)>", Pattern.CASE_INSENSITIVE);
    private static final Pattern DATA_URL = Pattern.compile("data:\\s*[^;]*;[^,]*,", Pattern.CASE_INSENSITIVE);
    private static final Pattern VB_URL = Pattern.compile("vbscript:", Pattern.CASE_INSENSITIVE);
    private static final Pattern CSS_EXPRESSION = Pattern.compile("expression\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern CSS_IMPORT = Pattern.compile("@import", Pattern.CASE_INSENSITIVE);
    private static final Pattern DANGEROUS_CALL = Pattern.compile(
        "(eval|setTimeout|setInterval|Function|execScript|execSync|atob|btoa|unescape|decodeURI|decodeURIComponent)\\s*\\(",
        Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> ID_INJECTION_PATTERNS = List.of(
        Pattern.compile("[';]"),
        Pattern.compile("\\b(match|delete|create|set|union|call|drop|remove|return|where|merge|detach)\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("//"),
        Pattern.compile("/\\*"),
        Pattern.compile("\\$\\w+")
    );

    private static final Pattern ID_DISALLOWED_CHARS = Pattern.compile("[^a-zA-Z0-9\\-_.]");

    private InputSanitizer() {
    }

    /**
     * Truncates, strips control characters and neutralizes markup.
     *
     * @param input Any value; rendered with {@code toString()}
     * @param maxLength Maximum length kept before the truncation marker is appended
     * @return Clean string, empty for null input
     */
    public static String sanitizeString(Object input, int maxLength) {
        if (input == null) {
            return "";
        }
        String str = input.toString();
        if (str.length() > maxLength) {
            str = str.substring(0, maxLength) + TRUNCATION_MARKER;
        }
        str = CONTROL_CHARS.matcher(str).replaceAll("");
        return sanitizeHtml(str);
    }

    public static String sanitizeString(Object input) {
        return sanitizeString(input, DEFAULT_MAX_LENGTH);
    }

    static String sanitizeHtml(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        String out = SCRIPT_BLOCK.matcher(input).replaceAll("[SCRIPT_REMOVED]");
        out = SCRIPT_OPEN.matcher(out).replaceAll("[SCRIPT_REMOVED]");
        out = JS_URL.matcher(out).replaceAll("[JS_URL_REMOVED]");
        out = EVENT_HANDLER.matcher(out).replaceAll("[EVENT_HANDLER_REMOVED]");
        out = EMBED_OPEN.matcher(out).replaceAll("[$1_REMOVED]");
        out = EMBED_CLOSE.matcher(out).replaceAll("");
        out = DATA_URL.matcher(out).replaceAll("");
        out = VB_URL.matcher(out).replaceAll("");
        out = CSS_EXPRESSION.matcher(out).replaceAll("");
        out = CSS_IMPORT.matcher(out).replaceAll("");
        return DANGEROUS_CALL.matcher(out).replaceAll("[BLOCKED_FUNCTION]");
    }

    /**
     * Validates an entity identifier.
     *
     * @param id Raw identifier
     * @param label Name used in error messages ("Node ID", "Contributor ID", ...)
     * @return The identifier with disallowed characters removed
     * @throws GraphOperationException if the identifier is missing, too long or looks like injection
     */
    public static String sanitizeId(Object id, String label) {
        if (id == null || id.toString().isBlank()) {
            throw GraphOperationException.validation(label + " is required");
        }
        String str = id.toString().trim();

        for (Pattern pattern : ID_INJECTION_PATTERNS) {
            if (pattern.matcher(str).find()) {
                log.warn("Rejected {} with suspicious pattern: {}", label, abbreviate(str));
                throw GraphOperationException.validation(label + " contains invalid characters or patterns");
            }
        }

        String sanitized = ID_DISALLOWED_CHARS.matcher(str).replaceAll("");
        if (sanitized.isEmpty()) {
            throw GraphOperationException.validation(
                "Invalid " + label + " format - only alphanumeric, hyphens, underscores, and periods allowed");
        }
        if (sanitized.length() > MAX_ID_LENGTH) {
            throw GraphOperationException.validation(label + " too long (max " + MAX_ID_LENGTH + " characters)");
        }
        if (!Character.isLetterOrDigit(sanitized.charAt(0))) {
            throw GraphOperationException.validation(label + " cannot start with special characters");
        }
        return sanitized;
    }

    public static String sanitizeNodeId(Object id) {
        return sanitizeId(id, "Node ID");
    }

    /**
     * Copies a metadata object keeping it small and free of markup.
     *
     * <p>Limits: depth 10, 50 top-level keys, 100 keys per nested object,
     * 1000 array items and 1000 characters per string. Non-finite numbers become 0.
     *
     * @return Sanitized copy, empty when the input is not an object
     */
    public static Map<String, Object> sanitizeMetadata(Object metadata) {
        if (!(metadata instanceof Map<?, ?> map)) {
            return new LinkedHashMap<>();
        }
        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.add(map);

        Map<String, Object> sanitized = new LinkedHashMap<>();
        int count = 0;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (count++ >= MAX_METADATA_TOP_LEVEL_KEYS) {
                break;
            }
            String key = sanitizeString(entry.getKey(), MAX_KEY_LENGTH);
            if (!key.isEmpty()) {
                sanitized.put(key, sanitizeValue(entry.getValue(), 0, seen));
            }
        }
        return sanitized;
    }

    private static Object sanitizeValue(Object value, int depth, Set<Object> seen) {
        if (depth > MAX_METADATA_DEPTH) {
            return "[MAX_DEPTH_EXCEEDED]";
        }
        if (value == null || value instanceof Boolean) {
            return value;
        }
        if (value instanceof String str) {
            return sanitizeString(str, MAX_METADATA_STRING_LENGTH);
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? number : 0;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>();
            int limit = Math.min(list.size(), MAX_METADATA_ARRAY_ITEMS);
            for (int i = 0; i < limit; i++) {
                out.add(sanitizeValue(list.get(i), depth + 1, seen));
            }
            if (list.size() > MAX_METADATA_ARRAY_ITEMS) {
                out.add("[ARRAY_TRUNCATED]");
            }
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            if (!seen.add(map)) {
                return "[CIRCULAR_REFERENCE_REMOVED]";
            }
            Map<String, Object> out = new LinkedHashMap<>();
            if (map.size() > MAX_METADATA_OBJECT_KEYS) {
                out.put("[OBJECT_TRUNCATED]", (map.size() - MAX_METADATA_OBJECT_KEYS) + " properties removed");
            }
            int count = 0;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (count++ >= MAX_METADATA_OBJECT_KEYS) {
                    break;
                }
                String key = sanitizeString(entry.getKey(), MAX_KEY_LENGTH);
                if (!key.isEmpty()) {
                    out.put(key, sanitizeValue(entry.getValue(), depth + 1, seen));
                }
            }
            return out;
        }
        return sanitizeString(value);
    }

    /**
     * Parses an enum value case-insensitively.
     *
     * @param raw Caller value; null or blank selects {@code fallback}
     * @param fallback Value for absent input, or null if the value is required
     * @throws GraphOperationException if the value is unknown, or absent with no fallback
     */
    public static <E extends Enum<E>> E sanitizeEnum(Object raw, Class<E> type, E fallback, String label) {
        if (raw == null || raw.toString().isBlank()) {
            if (fallback == null) {
                throw GraphOperationException.validation(label + " is required");
            }
            return fallback;
        }
        String upper = raw.toString().trim().toUpperCase(Locale.ROOT);
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(upper)) {
                return constant;
            }
        }
        String allowed = Arrays.stream(type.getEnumConstants())
            .map(Enum::name)
            .collect(Collectors.joining(", "));
        throw GraphOperationException.validation("Invalid " + label + ". Must be one of: " + allowed);
    }

    public static WorkItemType sanitizeNodeType(Object raw, WorkItemType fallback) {
        return sanitizeEnum(raw, WorkItemType.class, fallback, "node type");
    }

    public static WorkItemStatus sanitizeNodeStatus(Object raw, WorkItemStatus fallback) {
        return sanitizeEnum(raw, WorkItemStatus.class, fallback, "node status");
    }

    /**
     * Validates a priority component. Out-of-range values are rejected, never clamped.
     *
     * @return The value, or null when absent
     * @throws GraphOperationException if not a finite number in [0,1]
     */
    public static Double sanitizePriority(Object priority, String label) {
        if (priority == null) {
            return null;
        }
        double num;
        if (priority instanceof Number number) {
            num = number.doubleValue();
        } else {
            try {
                num = Double.parseDouble(priority.toString().trim());
            } catch (NumberFormatException e) {
                throw GraphOperationException.validation(label + " must be a finite number");
            }
        }
        if (!Double.isFinite(num)) {
            throw GraphOperationException.validation(label + " must be a finite number");
        }
        if (num < 0 || num > 1) {
            throw GraphOperationException.validation(label + " must be between 0 and 1, got " + num);
        }
        return num;
    }

    public static void validateBulkOperation(int count, int maxCount) {
        if (count > maxCount) {
            throw GraphOperationException.validation(
                "Bulk operation limit exceeded. Maximum " + maxCount + " items allowed, got " + count);
        }
    }

    /**
     * Rejects payloads whose JSON form is larger than {@code maxMb} megabytes.
     */
    public static void validateMemoryUsage(Object payload, int maxMb) {
        long bytes;
        try {
            bytes = MAPPER.writeValueAsString(payload).getBytes(StandardCharsets.UTF_8).length;
        } catch (JsonProcessingException e) {
            throw GraphOperationException.validation("Payload is not serializable: " + e.getOriginalMessage());
        }
        long limit = (long) maxMb * 1024 * 1024;
        if (bytes > limit) {
            log.warn("Rejected payload of {} bytes (limit {} MB)", bytes, maxMb);
            throw GraphOperationException.validation(String.format(Locale.ROOT,
                "Payload too large: %.2f MB exceeds limit of %d MB", bytes / (1024.0 * 1024.0), maxMb));
        }
    }

    private static String abbreviate(String value) {
        return value.length() <= 40 ? value : value.substring(0, 40) + "...";
    }
}
