package com.viffx.Bnf.Grammar;

import com.viffx.Bnf.Symbols.NonTerminal;
import com.viffx.Bnf.Symbols.Terminal;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuleParserTest {

    private static Terminal t(String value) {
        return new Terminal(value);
    }

    private static NonTerminal nt(String value) {
        return new NonTerminal(value);
    }

    @Test
    void parsesTerminalsAndNonTerminals() {
        GrammarSymbol symbol = RuleParser.parse("<test> ::= \"a\" \"b\" \"c\" | \"c\" \"b\" \"a\" | <abc>");

        GrammarSymbol expected = new GrammarSymbol("test", Expression.of(
                Choice.of(t("a"), t("b"), t("c")),
                Choice.of(t("c"), t("b"), t("a")),
                Choice.of(nt("abc"))));
        assertEquals(expected, symbol);
    }

    @Test
    void literalsMayHoldRuleSyntax() {
        GrammarSymbol symbol = RuleParser.parse("<sym> ::= \"<\" | \"|\" | \">\" | \"::=\"");

        assertEquals(Expression.of(
                Choice.of(t("<")),
                Choice.of(t("|")),
                Choice.of(t(">")),
                Choice.of(t("::="))), symbol.expression());
    }

    @Test
    void whitespaceIsFreeBetweenElements() {
        GrammarSymbol symbol = RuleParser.parse("  <number>::=<digit>\n\t|   <number>  <number>  ");

        assertEquals("number", symbol.name());
        assertEquals(Expression.of(
                Choice.of(nt("digit")),
                Choice.of(nt("number"), nt("number"))), symbol.expression());
    }

    @Test
    void namesMayHoldDashesAndSpaces() {
        GrammarSymbol symbol = RuleParser.parse("<two-digits> ::= <digit> <second digit>");

        assertEquals("two-digits", symbol.name());
        assertEquals(Choice.of(nt("digit"), nt("second digit")), symbol.expression().get(0));
    }

    @Test
    void rejectsMalformedRules() {
        String[] malformed = {
                "",
                "test ::= \"a\"",
                "<> ::= \"a\"",
                "<test> \"a\"",
                "<test> := \"a\"",
                "<test> ::=",
                "<test> ::= \"a\" |",
                "<test> ::= | \"a\"",
                "<test> ::= \"a\" || \"b\"",
                "<test> ::= \"a",
                "<test> ::= <a",
                "<test> ::= a",
                "<test ::= \"a\"",
        };
        for (String rule : malformed) {
            assertThrows(MalformedRuleException.class, () -> RuleParser.parse(rule), rule);
        }
    }

    @Test
    void errorMessagesPointAtTheRule() {
        MalformedRuleException e = assertThrows(MalformedRuleException.class,
                () -> RuleParser.parse("<test> ::= \"a\" |"));
        assertTrue(e.getMessage().contains("<test> ::= \"a\" |"), e.getMessage());
    }

    @Test
    void multiCharacterLiteralsAreKept() {
        GrammarSymbol symbol = RuleParser.parse("<keyword> ::= \"if\"");
        assertEquals(Choice.of(t("if")), symbol.expression().get(0));
    }
}
