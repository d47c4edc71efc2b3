package org.redcap.lite.logic.antlr;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.redcap.lite.logic.LogicParseException;

/**
 * Runs the ANTLR-generated RedcapLogicLexer/RedcapLogicParser over a
 * normalized logic string.
 */
public final class AntlrLogicParserAdapter {

    private AntlrLogicParserAdapter() {
        // Static utility class
    }

    /**
     * Parses a normalized logic string to its concrete syntax tree.
     *
     * @param logic The normalized logic string
     * @return The root {@code logic} context
     * @throws LogicParseException if lexing or parsing fails
     */
    public static RedcapLogicParser.LogicContext parse(String logic) {
        RedcapLogicLexer lexer = new RedcapLogicLexer(CharStreams.fromString(logic));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ErrorListener());

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        RedcapLogicParser parser = new RedcapLogicParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new ErrorListener());

        return parser.logic();
    }

    /**
     * Error listener that converts ANTLR errors to LogicParseException.
     */
    private static class ErrorListener extends BaseErrorListener {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            throw new LogicParseException(msg, line, charPositionInLine);
        }
    }
}
