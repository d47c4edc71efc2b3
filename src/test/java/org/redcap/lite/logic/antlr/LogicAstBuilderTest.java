package org.redcap.lite.logic.antlr;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.redcap.lite.logic.FieldRef;
import org.redcap.lite.logic.LogicExpression;
import org.redcap.lite.logic.LogicParseException;
import org.redcap.lite.logic.LogicParser;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LogicAstBuilderTest {

    @Test
    @DisplayName("Referenced fields are recorded in order of first appearance")
    void testReferencedFields() {
        LogicAstBuilder builder = new LogicAstBuilder();
        builder.visit(LogicParser.parseTree("[b] = 1 or [a] >= [b] and [c(3)] = '1'"));

        assertEquals(List.of("b", "a", "c___3"), List.copyOf(builder.referencedFields()));
    }

    @Test
    @DisplayName("Referenced fields are a snapshot")
    void testReferencedFieldsSnapshot() {
        LogicAstBuilder builder = new LogicAstBuilder();
        builder.visit(LogicParser.parseTree("[a] = 1"));
        Set<String> fields = builder.referencedFields();

        assertThrows(UnsupportedOperationException.class, () -> fields.add("b"));
        builder.visit(LogicParser.parseTree("[z] = 1"));
        assertEquals(Set.of("a"), fields);
        assertEquals(Set.of("a", "z"), builder.referencedFields());
    }

    @Test
    @DisplayName("Adapter output lowers to the same AST as the parser facade")
    void testAdapterRoundTrip() {
        String logic = "[a] <> '' and !([b] = 1 or [c] < [d])";
        LogicExpression viaAdapter = new LogicAstBuilder().visit(AntlrLogicParserAdapter.parse(logic));
        assertEquals(LogicParser.parse(logic), viaAdapter);
    }

    @Test
    void testParseField() {
        assertEquals(FieldRef.of("age"), LogicAstBuilder.parseField("[age]"));
        assertEquals(FieldRef.checkbox("race", "3"), LogicAstBuilder.parseField("[race(3)]"));
        assertEquals(FieldRef.checkbox("race", "-1"), LogicAstBuilder.parseField("[race(-1)]"));
        assertEquals("race____1", LogicAstBuilder.parseField("[race(-1)]").columnName());
        assertEquals("symptoms___ab", LogicAstBuilder.parseField("[symptoms(AB)]").columnName());
    }

    @Test
    void testParseFieldRejectsMalformedTokens() {
        assertThrows(LogicParseException.class, () -> LogicAstBuilder.parseField("age"));
        assertThrows(LogicParseException.class, () -> LogicAstBuilder.parseField("[]"));
        assertThrows(LogicParseException.class, () -> LogicAstBuilder.parseField("[race(3]"));
    }
}
