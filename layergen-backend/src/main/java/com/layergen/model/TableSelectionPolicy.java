package com.layergen.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collection;
import java.util.List;

/**
 * Decides which tables take part in a run: either an explicit allow-list (exact names) or a set
 * of literal name prefixes.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TableSelectionPolicy {

    public enum Mode {
        ALLOW_LIST,
        PREFIXES
    }

    Mode mode;
    List<String> names;

    public static TableSelectionPolicy allowList(Collection<String> tables) {
        return new TableSelectionPolicy(Mode.ALLOW_LIST, List.copyOf(tables));
    }

    public static TableSelectionPolicy prefixes(Collection<String> prefixes) {
        return new TableSelectionPolicy(Mode.PREFIXES, List.copyOf(prefixes));
    }

    /**
     * Test a table name against the policy. Prefixes are compared with a plain
     * {@link String#startsWith}, so characters such as {@code _} or {@code %} carry no pattern meaning.
     *
     * @param tableName table name from the catalog
     * @return whether the table is selected
     */
    public boolean matches(String tableName) {
        if (tableName == null) {
            return false;
        }
        if (mode == Mode.ALLOW_LIST) {
            return names.contains(tableName);
        }
        for (String prefix : names) {
            if (tableName.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public String describe() {
        return (mode == Mode.ALLOW_LIST ? "tables=" : "prefixes=") + names;
    }
}
