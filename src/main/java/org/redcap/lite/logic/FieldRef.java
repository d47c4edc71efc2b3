package org.redcap.lite.logic;

import java.util.Locale;
import java.util.Objects;

/**
 * A field reference, {@code [name]}, or a checkbox choice reference,
 * {@code [name(code)]}.
 *
 * @param name   The field name
 * @param choice The checkbox choice code, or null for a plain field
 */
public record FieldRef(String name, String choice) implements ComparisonOperand {

    /**
     * Separator REDCap puts between a checkbox field and its choice code in
     * exported column names.
     */
    public static final String CHECKBOX_SEPARATOR = "___";

    public FieldRef {
        Objects.requireNonNull(name, "Field name cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Field name cannot be empty");
        }
    }

    public static FieldRef of(String name) {
        return new FieldRef(name, null);
    }

    public static FieldRef checkbox(String name, String choice) {
        return new FieldRef(name, Objects.requireNonNull(choice, "Choice cannot be null"));
    }

    public boolean isCheckbox() {
        return choice != null;
    }

    /**
     * The exported column holding this field. A checkbox choice maps to
     * {@code name___code}, with '-' in the code exported as '_'.
     */
    public String columnName() {
        if (choice == null) {
            return name;
        }
        return name + CHECKBOX_SEPARATOR + choice.replace('-', '_').toLowerCase(Locale.ROOT);
    }

    @Override
    public <T> T accept(LogicExpressionVisitor<T> visitor) {
        return visitor.visitField(this);
    }

    @Override
    public String toString() {
        return choice == null ? "[" + name + "]" : "[" + name + "(" + choice + ")]";
    }
}
