package org.neuralchilli.festival.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for the festival naming convention: {@code NNN_PHASE}, {@code NN_sequence},
 * {@code NN_task.md}.
 */
public final class FileNames {

    private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d+)");
    private static final Pattern NUMERIC_PREFIX = Pattern.compile("^\\d+[_\\-.\\s]*");

    private FileNames() {
    }

    /**
     * Leading digit run as an integer, or -1 if the name does not start with a digit.
     * Example: "02_build.md" -> 2
     */
    public static int leadingNumber(String name) {
        if (name == null) {
            return -1;
        }
        Matcher matcher = LEADING_NUMBER.matcher(name);
        if (!matcher.find()) {
            return -1;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            // more digits than an int holds; not a task number we can order by
            return -1;
        }
    }

    /**
     * Check if a directory name takes part in ordering: starts with a digit
     * and is not hidden or underscore-prefixed.
     */
    public static boolean isNumberedDirectory(String name) {
        if (name == null || name.length() < 2) {
            return false;
        }
        if (name.startsWith(".") || name.startsWith("_")) {
            return false;
        }
        return Character.isDigit(name.charAt(0));
    }

    /**
     * Remove the last extension. Example: "02_build.md" -> "02_build"
     */
    public static String stripExtension(String name) {
        if (name == null) {
            return null;
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Remove a specific suffix if present. Example: ("build.md", ".md") -> "build"
     */
    public static String stripSuffix(String name, String suffix) {
        if (name == null || suffix == null || suffix.isEmpty()) {
            return name;
        }
        return name.endsWith(suffix) ? name.substring(0, name.length() - suffix.length()) : name;
    }

    /**
     * Display name: filename without numeric prefix and extension.
     * Example: "02_build_api.md" -> "build_api"
     */
    public static String displayName(String fileName) {
        String stem = stripExtension(fileName);
        if (stem == null) {
            return null;
        }
        String stripped = NUMERIC_PREFIX.matcher(stem).replaceFirst("");
        return stripped.isEmpty() ? stem : stripped;
    }
}
