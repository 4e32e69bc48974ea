package com.layergen.util;

import java.util.Arrays;
import java.util.Locale;

/**
 * Derives class names and package segments from table names.
 *
 * <p>{@code sys_menu_item} becomes class {@code SysMenuItem} with table suffix {@code menuitem}.
 */
public final class TableNaming {

    private TableNaming() {
    }

    public static String className(String tableName) {
        StringBuilder sb = new StringBuilder();
        for (String word : words(tableName)) {
            sb.append(Character.toUpperCase(word.charAt(0)));
            sb.append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    /**
     * Package segment for a table: everything after the first {@code _}-separated word, joined and
     * lower-cased. A table without an underscore uses its whole name.
     */
    public static String tableSuffix(String tableName) {
        String[] words = words(tableName);
        StringBuilder sb = new StringBuilder();
        for (int i = words.length > 1 ? 1 : 0; i < words.length; i++) {
            sb.append(words[i].toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    private static String[] words(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("table name is required");
        }
        String cleaned = tableName.trim().replaceAll("[^A-Za-z0-9_]", "_");
        String[] words = Arrays.stream(cleaned.split("_"))
                .filter(w -> !w.isEmpty())
                .toArray(String[]::new);
        if (words.length == 0) {
            throw new IllegalArgumentException("table name has no usable characters: " + tableName);
        }
        return words;
    }
}
