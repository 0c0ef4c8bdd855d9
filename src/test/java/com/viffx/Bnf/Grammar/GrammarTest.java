package com.viffx.Bnf.Grammar;

import com.viffx.Bnf.Compiler.SymbolizationLimitException;
import com.viffx.Bnf.Symbols.NonTerminal;
import com.viffx.Bnf.Tokens.NonTerminalToken;
import com.viffx.Bnf.Tokens.Token;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GrammarTest {
    private static final String DIGITS = "<digit> ::= \"1\" | \"2\" | \"3\" | \"4\" | \"5\" | \"6\" | \"7\" | \"8\" | \"9\" | \"0\"";

    private static Token node(String name, Token... children) {
        return Token.nonTerminal(name, List.of(children));
    }

    private static Token terminal(String value) {
        return Token.terminal(value);
    }

    private static Token digit(String value) {
        return node("digit", terminal(value));
    }

    private static Grammar arithmetic() {
        return Grammar.builder()
                .rule(0, DIGITS)
                .rule(0, "<number> ::= <digit> | <number> <number>")
                .rule(1, """
                        <quotient> ::= <number> "/" <number>
                        | <expression> "/" <number>
                        | <number> "/" <expression>
                        | <expression> "/" <expression>""")
                .rule(1, """
                        <product> ::= <number> "*" <number>
                        | <expression> "*" <number>
                        | <number> "*" <expression>
                        | <expression> "*" <expression>""")
                .rule(0, """
                        <sum> ::= <number> "+" <number>
                        | <expression> "+" <number>
                        | <number> "+" <expression>
                        | <expression> "+" <expression>""")
                .rule(0, """
                        <difference> ::= <number> "-" <number>
                        | <expression> "-" <number>
                        | <number> "-" <expression>
                        | <expression> "-" <expression>""")
                .rule(0, "<expression> ::= <quotient> | <product> | <sum> | <difference>")
                .build();
    }

    private static Grammar expressions() {
        return Grammar.builder()
                .rule(0, "<digit> ::= \"1\" | \"2\" | \"3\"")
                .rule(0, "<operator> ::= \"+\" | \"-\" | \"*\" | \"/\"")
                .rule(0, "<expression> ::= <digit> <operator> <digit>")
                .build();
    }

    private static String doubled(Token digit) {
        return String.valueOf(Integer.parseInt(digit.terminals()) * 2);
    }

    @Test
    void builderMatchesManualConstruction() {
        Grammar built = Grammar.builder()
                .rule(0, DIGITS)
                .rule(0, "<number> ::= <digit> | <number> <digit>")
                .build();

        Grammar manual = new Grammar();
        manual.addSymbol(GrammarSymbol.fromRule(DIGITS), 0);
        manual.addSymbolFromRule("<number> ::= <digit> | <number> <digit>", 0);

        assertEquals(manual, built);
        assertEquals(manual.hashCode(), built.hashCode());
        assertEquals(2, built.symbols().size());
        assertTrue(built.containsSymbol("number"));
        assertFalse(built.containsSymbol("sum"));
    }

    @Test
    void higherPriorityGroupsFirst() {
        Grammar grammar = Grammar.builder()
                .rule(0, "<digit> ::= \"1\" | \"2\"")
                .rule(0, "<sum> ::= <digit> \"+\" <digit>")
                .rule(1, "<product> ::= <digit> \"*\" <digit>")
                .build();

        assertEquals(List.of(node("product", digit("1"), terminal("*"), digit("2"))), grammar.symbolize("1*2"));
        assertEquals(List.of(node("sum", digit("1"), terminal("+"), digit("2"))), grammar.symbolize("1+2"));
    }

    @Test
    void symbolizesAProduct() {
        assertEquals(
                List.of(node("expression", node("product",
                        node("number", digit("2")),
                        terminal("*"),
                        node("number", digit("4"))))),
                arithmetic().symbolize("2*4"));
    }

    @Test
    void symbolizesNestedArithmetic() {
        Token twoTimesFortyFive = node("expression", node("product",
                node("number", digit("2")),
                terminal("*"),
                node("number", node("number", digit("4")), node("number", digit("5")))));

        Token expected = node("expression", node("sum",
                node("number", node("number", digit("1")), node("number", digit("2"))),
                terminal("+"),
                twoTimesFortyFive));

        assertEquals(List.of(expected), arithmetic().symbolize("12+2*45"));
    }

    @Test
    void arraysMergeWithThemselves() {
        Grammar grammar = Grammar.builder()
                .rule(0, DIGITS)
                .rule(0, "<number> ::= <digit> | <number> <number>")
                .build();

        assertEquals(List.of(node("number", node("number", digit("1")), node("number", digit("2")))),
                grammar.symbolize("12"));
    }

    @Test
    void arraysOverTheirOwnElementNeverMerge() {
        Grammar grammar = Grammar.builder()
                .rule(0, DIGITS)
                .rule(0, "<number> ::= <digit> | <number> <digit>")
                .build();

        // every <digit> is already a <number> when the recursive choice gets its turn
        assertEquals(List.of(node("number", digit("1")), node("number", digit("2"))), grammar.symbolize("12"));
        assertFalse(grammar.hasSingleRoot("12"));
    }

    @Test
    void sameNameMayBeRegisteredTwice() {
        Grammar grammar = Grammar.builder()
                .rule(0, "<letter> ::= \"a\"")
                .rule(0, "<letter> ::= \"b\"")
                .build();

        assertEquals(List.of(node("letter", terminal("a")), node("letter", terminal("b"))), grammar.symbolize("ab"));
    }

    @Test
    void unmatchedTextStaysTerminal() {
        List<Token> tokens = expressions().symbolize("1 ? 2");

        assertEquals(List.of(digit("1"), terminal(" "), terminal("?"), terminal(" "), digit("2")), tokens);
        assertEquals(List.of(), expressions().symbolize(""));
    }

    @Test
    void hasSingleRoot() {
        assertTrue(expressions().hasSingleRoot("2+3"));
        assertFalse(expressions().hasSingleRoot("2+"));
        assertFalse(expressions().hasSingleRoot(""));
        assertTrue(arithmetic().hasSingleRoot("12+2*45"));
    }

    @Test
    void compilesWithFunctions() {
        Grammar grammar = expressions();
        assertEquals(List.of(node("expression", digit("2"), node("operator", terminal("+")), digit("3"))),
                grammar.symbolize("2+3"));

        grammar.addCompileFunction("digit", (token, g) -> doubled(token));
        grammar.addCompileFunction("expression", (token, g) -> {
            List<String> digits = token.childrenOfType(new NonTerminal("digit")).stream()
                    .map(digit -> g.compileToken((NonTerminalToken) digit).orElseThrow())
                    .toList();
            return digits.get(0) + "<here comes the operator>" + digits.get(digits.size() - 1);
        });

        assertTrue(grammar.hasSingleRoot("2+3"));
        assertEquals("4<here comes the operator>6", grammar.compile("2+3"));
    }

    @Test
    void childrenAreNotCompiledImplicitly() {
        Grammar grammar = expressions();
        grammar.addCompileFunction("digit", (token, g) -> doubled(token));

        assertEquals("2+3", grammar.compile("2+3"));
        assertEquals("4+", grammar.compile("2+"));
        assertEquals("4", grammar.compile("2"));
    }

    @Test
    void builderRegistersFunctionsUnderTheRuleName() {
        Grammar grammar = Grammar.builder()
                .rule(0, "<digit> ::= \"1\" | \"2\"", (token, g) -> "d")
                .rule(0, "<pair> ::= <digit> <digit>", (token, g) -> "[" + token.terminals() + "]")
                .build();

        assertTrue(grammar.compileFunction("pair").isPresent());
        assertEquals("[12]", grammar.compile("12"));
        assertEquals("d", grammar.compile("1"));
        assertEquals(Optional.empty(), grammar.compileFunction("sum"));
    }

    @Test
    void laterFunctionReplacesEarlierOne() {
        Grammar grammar = expressions();
        grammar.addCompileFunction("digit", (token, g) -> "first");
        grammar.addCompileFunction("digit", (token, g) -> "second");

        assertEquals("second", grammar.compile("1"));
    }

    @Test
    void compileTokenIsEmptyWithoutFunction() {
        Grammar grammar = expressions();
        NonTerminalToken digit = (NonTerminalToken) digit("1");

        assertEquals(Optional.empty(), grammar.compileToken(digit));
        grammar.addCompileFunction("digit", (token, g) -> doubled(token));
        assertEquals(Optional.of("2"), grammar.compileToken(digit));
    }

    @Test
    void rejectsBadInput() {
        Grammar grammar = new Grammar();
        GrammarSymbol digit = GrammarSymbol.fromRule("<digit> ::= \"1\"");

        assertThrows(IllegalArgumentException.class, () -> grammar.addSymbol(digit, -1));
        assertThrows(MalformedRuleException.class, () -> grammar.addSymbolFromRule("<digit> ::=", 0));
        assertThrows(IllegalArgumentException.class, () -> grammar.withPassLimit(-1));
        assertTrue(grammar.symbols().isEmpty());

        GrammarBuilder builder = Grammar.builder()
                .rule(0, "<digit> ::= \"1\"")
                .rule(0, "<number> ::= <digit> |");
        assertThrows(MalformedRuleException.class, builder::build);
    }

    @Test
    void passLimitStopsRunawayGrammars() {
        Grammar grammar = Grammar.builder()
                .rule(0, "<a> ::= \"x\" | <b>")
                .rule(0, "<b> ::= <a>")
                .build()
                .withPassLimit(10);

        SymbolizationLimitException e = assertThrows(SymbolizationLimitException.class, () -> grammar.symbolize("x"));
        assertEquals(10, e.passLimit());
    }

    @Test
    void passLimitLeavesSettlingGrammarsAlone() {
        Grammar grammar = arithmetic().withPassLimit(10);
        assertEquals(10, grammar.passLimit());
        assertTrue(grammar.hasSingleRoot("12+2*45"));
    }

    @Test
    void passLimitCountsPassesNotMergeRounds() {
        Grammar grammar = Grammar.builder()
                .rule(0, "<digit> ::= \"1\"")
                .rule(0, "<number> ::= <digit> | <number> <number>")
                .build()
                .withPassLimit(3);
        String ones = "1".repeat(64);

        // the <number> merges need six rounds inside the second pass
        List<Token> tokens = grammar.symbolize(ones);
        assertEquals(1, tokens.size());
        assertEquals("number", tokens.get(0).symbol());
        assertEquals(ones, tokens.get(0).terminals());
    }

    @Test
    void passLimitStopsSelfMatchingChoices() {
        Grammar grammar = Grammar.builder()
                .rule(0, "<a> ::= \"x\" | <a>")
                .build()
                .withPassLimit(100);

        SymbolizationLimitException e = assertThrows(SymbolizationLimitException.class, () -> grammar.symbolize("xxx"));
        assertTrue(e.getMessage().contains("<a>"), e.getMessage());
    }

    @Test
    void printsOneLinePerRule() {
        Grammar grammar = Grammar.builder()
                .rule(0, "<digit> ::= \"1\" | \"2\"")
                .rule(1, "<product> ::= <digit> \"*\" <digit>")
                .build();

        assertEquals("""
                priority 0 => <digit> ::= "1" | "2"
                priority 1 => <product> ::= <digit> "*" <digit>
                """, grammar.toString());
    }
}
