package io.textimport.tsv;

import java.util.List;

/**
 * Checks a field-name list before it is bound to decoded tokens.
 */
public final class FieldNames {
    private FieldNames() {}

    /**
     * @throws IllegalArgumentException on an empty list, a blank name, a name starting or ending with
     *                                  {@code '.'} or containing {@code ".."}, identical names, or
     *                                  names where one is a dotted parent of the other ({@code a} and {@code a.b})
     */
    public static List<String> validate(List<String> fields) {
        if (fields == null || fields.isEmpty()) throw new IllegalArgumentException("at least one field name is required");
        for (String f : fields) {
            if (f == null || f.isBlank()) throw new IllegalArgumentException("field names cannot be blank");
            if (f.startsWith(".") || f.endsWith(".")) throw new IllegalArgumentException("field '" + f + "' cannot start or end with '.'");
            if (f.contains("..")) throw new IllegalArgumentException("field '" + f + "' cannot contain consecutive '.' characters");
        }
        for (int i = 0; i < fields.size(); i++) {
            String a = fields.get(i);
            for (int j = i + 1; j < fields.size(); j++) {
                String b = fields.get(j);
                if (a.equals(b)) throw new IllegalArgumentException("fields cannot be identical: '" + a + "' and '" + b + "'");
                if (isParent(a, b) || isParent(b, a)) {
                    throw new IllegalArgumentException("fields '" + a + "' and '" + b + "' are incompatible");
                }
            }
        }
        return List.copyOf(fields);
    }

    private static boolean isParent(String parent, String child) {
        return child.length() > parent.length() && child.startsWith(parent) && child.charAt(parent.length()) == '.';
    }
}
