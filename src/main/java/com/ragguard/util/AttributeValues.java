package com.ragguard.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Coercion helpers for loosely typed attribute values (string, string list, number, date)
 */
public final class AttributeValues {

    /** Separator used when a list is flattened into a single string attribute */
    public static final String LIST_SEPARATOR = "|";

    private static final Pattern LIST_SPLIT = Pattern.compile("\\|");

    private AttributeValues() {
    }

    /**
     * Flattens an attribute into a list of trimmed, non-blank strings.
     * Pipe-delimited strings are split into their elements.
     */
    public static List<String> toStringList(Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object element : (Collection<?>) value) {
                addSplit(result, element);
            }
        } else {
            addSplit(result, value);
        }
        return result;
    }

    /**
     * First value of an attribute as a string, or the fallback when absent or blank
     */
    public static String firstString(Object value, String fallback) {
        if (value instanceof Collection) {
            for (Object element : (Collection<?>) value) {
                if (element != null && !element.toString().isBlank()) {
                    return element.toString();
                }
            }
            return fallback;
        }
        if (value == null || value.toString().isBlank()) {
            return fallback;
        }
        return value.toString();
    }

    public static String join(Collection<String> values) {
        return values == null ? "" : String.join(LIST_SEPARATOR, values);
    }

    private static void addSplit(List<String> target, Object element) {
        if (element == null) {
            return;
        }
        for (String part : LIST_SPLIT.split(element.toString())) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                target.add(trimmed);
            }
        }
    }
}
