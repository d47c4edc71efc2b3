package org.redcap.lite.logic;

import org.redcap.lite.logic.antlr.AntlrLogicParserAdapter;
import org.redcap.lite.logic.antlr.LogicAstBuilder;
import org.redcap.lite.logic.antlr.RedcapLogicParser;

/**
 * Branching-logic parser.
 *
 * Parsing runs in two stages: the ANTLR-generated parser builds the concrete
 * syntax tree of {@code RedcapLogic.g4}, then {@link LogicAstBuilder} lowers
 * it to a {@link LogicExpression}. Keeping the stages apart lets the grammar
 * change without touching the AST.
 *
 * Examples:
 * - [age] >= 18
 * - [consent] = '1' and ([site] = 'A' or [site] = 'B')
 * - !([smoker(2)] = '1')
 */
public final class LogicParser {

    private LogicParser() {
        // Static utility class
    }

    /**
     * Parses a branching-logic string.
     *
     * @param logic The logic string
     * @return The parsed expression AST
     * @throws LogicParseException if the string is blank or not valid logic
     */
    public static LogicExpression parse(String logic) {
        RedcapLogicParser.LogicContext tree = parseTree(logic);
        return new LogicAstBuilder().visit(tree);
    }

    /**
     * Parses a branching-logic string to its concrete syntax tree.
     *
     * @throws LogicParseException if the string is blank or not valid logic
     */
    public static RedcapLogicParser.LogicContext parseTree(String logic) {
        if (logic == null || logic.isBlank()) {
            throw new LogicParseException("Branching logic is blank");
        }
        return AntlrLogicParserAdapter.parse(normalize(logic));
    }

    /**
     * Rewrites REDCap's accepted spellings into the grammar's: typographic
     * quotes become ASCII quotes, and {@code !=} outside quoted text becomes
     * {@code <>}.
     */
    public static String normalize(String logic) {
        StringBuilder sb = new StringBuilder(logic.length());
        char quote = 0;
        for (int i = 0; i < logic.length(); i++) {
            char c = normalizeQuote(logic.charAt(i));
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                sb.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                sb.append(c);
            } else if (c == '!' && i + 1 < logic.length() && logic.charAt(i + 1) == '=') {
                sb.append("<>");
                i++;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static char normalizeQuote(char c) {
        return switch (c) {
            case '‘', '’', '‚', '′' -> '\'';
            case '“', '”', '„', '″' -> '"';
            default -> c;
        };
    }
}
