package org.neuralchilli.festival.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * YAML frontmatter of a markdown file plus the text that follows it.
 * Accessors are lenient: a missing key or a value of the wrong type yields the default.
 */
public record Frontmatter(Map<String, Object> fields, String body) {

    public Frontmatter {
        fields = fields != null ? fields : Map.of();
        body = body != null ? body : "";
    }

    /**
     * A file with no frontmatter: everything is body
     */
    public static Frontmatter none(String content) {
        return new Frontmatter(Map.of(), content);
    }

    public boolean isPresent() {
        return !fields.isEmpty();
    }

    public Optional<String> getString(String key) {
        Object value = fields.get(key);
        if (value == null || value instanceof Map || value instanceof List) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public Optional<Integer> getInteger(String key) {
        Object value = fields.get(key);
        if (value instanceof Integer number) {
            return Optional.of(number);
        }
        if (value instanceof Number number) {
            // Long and BigInteger for large YAML ints; out of int range counts as absent
            try {
                return Optional.of(new BigDecimal(number.toString()).intValueExact());
            } catch (ArithmeticException | NumberFormatException e) {
                return Optional.empty();
            }
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Integer.parseInt(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = fields.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("false") || normalized.equals("no") || normalized.equals("off")) {
                return false;
            }
            if (normalized.equals("true") || normalized.equals("yes") || normalized.equals("on")) {
                return true;
            }
        }
        return defaultValue;
    }

    /**
     * A YAML list of scalars; a single scalar counts as a one-item list.
     */
    public List<String> getStringList(String key) {
        Object value = fields.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>();
            for (Object item : list) {
                if (item == null || item instanceof Map || item instanceof List) {
                    continue;
                }
                String text = item.toString().trim();
                if (!text.isEmpty()) {
                    result.add(text);
                }
            }
            return result;
        }
        if (value instanceof Map) {
            return List.of();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? List.of() : List.of(text);
    }
}
