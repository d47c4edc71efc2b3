package org.redcap.lite.types;

/**
 * Closed set of categories a REDCap response value can fall into.
 *
 * REDCap stores every response as a string. The category decides how that
 * string behaves in equality, ordering and arithmetic:
 * <ul>
 * <li>MISSING: the empty string; numeric value 0.0</li>
 * <li>NUMBER: a string that parses fully as a signed decimal</li>
 * <li>TEXT: anything else; numeric value NaN</li>
 * <li>DATE: text matching a configured date/time format</li>
 * <li>CODE: text listed as a missing-data code</li>
 * </ul>
 * DATE and CODE are refinements of TEXT and behave exactly like it.
 */
public enum Category {
    MISSING,
    NUMBER,
    TEXT,
    DATE,
    CODE;

    /**
     * @return true for TEXT and its refinements, i.e. every category whose
     *         numeric value is NaN
     */
    public boolean isTextual() {
        return this == TEXT || this == DATE || this == CODE;
    }
}
