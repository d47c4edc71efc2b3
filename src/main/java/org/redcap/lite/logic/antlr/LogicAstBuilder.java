package org.redcap.lite.logic.antlr;

import org.antlr.v4.runtime.ParserRuleContext;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;
import org.redcap.lite.logic.And;
import org.redcap.lite.logic.Comparison;
import org.redcap.lite.logic.ComparisonOperand;
import org.redcap.lite.logic.FieldRef;
import org.redcap.lite.logic.Literal;
import org.redcap.lite.logic.LogicExpression;
import org.redcap.lite.logic.LogicParseException;
import org.redcap.lite.logic.Not;
import org.redcap.lite.logic.Or;
import org.redcap.lite.types.ComparisonOperator;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * ANTLR visitor that lowers the RedcapLogic parse tree to the
 * {@link LogicExpression} AST.
 *
 * The grammar structure:
 * - logic: orExpression EOF
 * - orExpression: andExpression (OR andExpression)*
 * - andExpression: unaryExpression (AND unaryExpression)*
 * - unaryExpression: '!' '(' orExpression ')' | '(' orExpression ')' | comparison
 * - comparison: field comparisonOperator operand
 *
 * A single-operand AND/OR level collapses to its operand, so the AST only has
 * combinators where the source has them. Every field seen along the way is
 * recorded in {@link #referencedFields()}.
 */
public class LogicAstBuilder extends RedcapLogicBaseVisitor<LogicExpression> {

    private final Set<String> referencedFields = new LinkedHashSet<>();

    /**
     * @return the export column names of every field visited so far, in order
     *         of first appearance
     */
    public Set<String> referencedFields() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(referencedFields));
    }

    // ========================================
    // ENTRY POINT
    // ========================================

    @Override
    public LogicExpression visitLogic(RedcapLogicParser.LogicContext ctx) {
        return visit(ctx.orExpression());
    }

    // ========================================
    // BOOLEAN STRUCTURE
    // ========================================

    @Override
    public LogicExpression visitOrExpression(RedcapLogicParser.OrExpressionContext ctx) {
        List<LogicExpression> operands = visitAll(ctx.andExpression());
        return operands.size() == 1 ? operands.get(0) : new Or(operands);
    }

    @Override
    public LogicExpression visitAndExpression(RedcapLogicParser.AndExpressionContext ctx) {
        List<LogicExpression> operands = visitAll(ctx.unaryExpression());
        return operands.size() == 1 ? operands.get(0) : new And(operands);
    }

    @Override
    public LogicExpression visitNegation(RedcapLogicParser.NegationContext ctx) {
        return new Not(visit(ctx.orExpression()));
    }

    @Override
    public LogicExpression visitParenthesized(RedcapLogicParser.ParenthesizedContext ctx) {
        return visit(ctx.orExpression());
    }

    @Override
    public LogicExpression visitComparisonExpression(RedcapLogicParser.ComparisonExpressionContext ctx) {
        return visit(ctx.comparison());
    }

    private List<LogicExpression> visitAll(List<? extends ParserRuleContext> contexts) {
        MutableList<LogicExpression> operands = Lists.mutable.empty();
        for (ParserRuleContext context : contexts) {
            operands.add(visit(context));
        }
        return operands.asUnmodifiable();
    }

    // ========================================
    // COMPARISONS
    // ========================================

    @Override
    public LogicExpression visitComparison(RedcapLogicParser.ComparisonContext ctx) {
        FieldRef left = (FieldRef) visit(ctx.field());
        ComparisonOperator operator = ComparisonOperator.fromSymbol(ctx.comparisonOperator().getText());
        ComparisonOperand right = (ComparisonOperand) visit(ctx.operand());
        return Comparison.of(left, operator, right);
    }

    @Override
    public LogicExpression visitFieldOperand(RedcapLogicParser.FieldOperandContext ctx) {
        return visit(ctx.field());
    }

    @Override
    public LogicExpression visitStringOperand(RedcapLogicParser.StringOperandContext ctx) {
        return Literal.string(unquote(ctx.STRING().getText()));
    }

    @Override
    public LogicExpression visitNumberOperand(RedcapLogicParser.NumberOperandContext ctx) {
        return Literal.number(ctx.NUMBER().getText());
    }

    @Override
    public LogicExpression visitField(RedcapLogicParser.FieldContext ctx) {
        FieldRef field = parseField(ctx.FIELD().getText());
        referencedFields.add(field.columnName());
        return field;
    }

    // ========================================
    // HELPERS
    // ========================================

    /**
     * Splits a FIELD token, {@code [name]} or {@code [name(code)]}.
     */
    static FieldRef parseField(String token) {
        if (token.length() < 3 || token.charAt(0) != '[' || token.charAt(token.length() - 1) != ']') {
            throw new LogicParseException("Invalid field reference: " + token);
        }
        String body = token.substring(1, token.length() - 1);
        int open = body.indexOf('(');
        if (open < 0) {
            return FieldRef.of(body);
        }
        if (!body.endsWith(")")) {
            throw new LogicParseException("Invalid checkbox reference: " + token);
        }
        return FieldRef.checkbox(body.substring(0, open), body.substring(open + 1, body.length() - 1));
    }

    private static String unquote(String quoted) {
        return quoted.substring(1, quoted.length() - 1);
    }
}
