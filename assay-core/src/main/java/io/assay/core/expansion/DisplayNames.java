package io.assay.core.expansion;

import java.lang.reflect.Array;
import java.util.List;
import java.util.StringJoiner;

/// Builds display labels for data-driven cases.
///
/// {@snippet :
/// DisplayNames.forRow("add", List.of(1, 2)); // "add (1,2)"
/// }
public final class DisplayNames {

    private DisplayNames() {}

    /// Derives the label of a row that declares none.
    ///
    /// @param baseName method name or declared display name, not null
    /// @param values row values, not null, may contain nulls
    /// @return `"<baseName> (<v1>,<v2>,...)"`, never null
    public static String forRow(String baseName, List<Object> values) {
        StringJoiner joiner = new StringJoiner(",", baseName + " (", ")");
        for (Object value : values) {
            joiner.add(render(value));
        }
        return joiner.toString();
    }

    static String render(Object value) {
        if (value == null) {
            return "null";
        }
        if (value.getClass().isArray()) {
            StringJoiner joiner = new StringJoiner(",", "[", "]");
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                joiner.add(render(Array.get(value, i)));
            }
            return joiner.toString();
        }
        return String.valueOf(value);
    }
}
