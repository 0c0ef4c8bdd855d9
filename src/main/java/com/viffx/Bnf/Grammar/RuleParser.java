package com.viffx.Bnf.Grammar;

import com.viffx.Bnf.Symbols.NonTerminal;
import com.viffx.Bnf.Symbols.Terminal;
import com.viffx.Bnf.Utils.LexicalCharacterBuffer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import static java.lang.Character.isWhitespace;

/**
 * Parses rule text into a {@link GrammarSymbol}.
 * <p>
 * The accepted syntax is:
 * <pre>
 *   &lt;name&gt; ::= choice ( "|" choice )*
 * </pre>
 * where a choice is a whitespace separated, non-empty sequence of {@code "literal"} terminals
 * and {@code <name>} references. A literal holds any character but the double quote, so
 * angle brackets and pipes inside it are plain text. Whitespace, including line breaks, is
 * free between elements.
 */
public final class RuleParser {
    private static final Logger log = LogManager.getLogger(RuleParser.class);

    // ====== INSTANCE FIELDS ====== //
    private final String rule;
    private final LexicalCharacterBuffer lexer;
    private final Expression expression = new Expression();
    private Choice currentChoice = new Choice();

    // ====== CONSTRUCTORS ====== //
    private RuleParser(String rule) {
        this.rule = rule;
        this.lexer = new LexicalCharacterBuffer(rule);
    }

    /**
     * Parses a complete rule.
     *
     * @param rule rule text, for example {@code <digit> ::= "0" | "1"}
     * @return the parsed symbol
     * @throws MalformedRuleException if the text is not a valid rule; nothing is returned then
     */
    public static GrammarSymbol parse(String rule) {
        RuleParser parser = new RuleParser(rule);
        String name = parser.parseName();
        parser.parseReplacementOperator();
        parser.parseExpression();
        return new GrammarSymbol(name, parser.expression);
    }

    // ====== PARSING METHODS ====== //

    private String parseName() {
        ignoreWhiteSpace();
        if (lexer.crntChar() != '<') throw error("a rule must start with a <name>");
        return nonTerminal().value();
    }

    private void parseReplacementOperator() {
        ignoreWhiteSpace();
        for (char expected : new char[]{':', ':', '='}) {
            if (lexer.eof() || lexer.crntChar() != expected) {
                throw error("the replacement operator (::=) is missing or invalid");
            }
            lexer.nextChar();
        }
    }

    private void parseExpression() {
        while (true) {
            ignoreWhiteSpace();
            if (lexer.eof()) break;

            char c = lexer.crntChar();
            switch (c) {
                case '"' -> currentChoice.add(terminal());
                case '<' -> currentChoice.add(nonTerminal());
                case '|' -> {
                    finishChoice();
                    lexer.nextChar();
                }
                default -> throw error("unexpected character '" + c + "'");
            }
        }
        finishChoice();
    }

    private void finishChoice() {
        if (currentChoice.isEmpty()) throw error("choice " + (expression.size() + 1) + " is empty");
        expression.add(currentChoice);
        currentChoice = new Choice();
    }

    private Terminal terminal() {
        String value = readUntil('"', "unterminated literal, expected a closing '\"'");
        if (value.codePointCount(0, value.length()) != 1) {
            log.warn("literal \"{}\" in rule '{}' is not a single character and never matches a leaf", value, rule);
        }
        return new Terminal(value);
    }

    private NonTerminal nonTerminal() {
        String name = readUntil('>', "unclosed '<', expected a closing '>'");
        if (name.isBlank()) throw error("empty non-terminal name <>");
        if (name.indexOf('<') >= 0 || name.indexOf('"') >= 0) {
            throw error("illegal character in non-terminal name <" + name + ">");
        }
        return new NonTerminal(name);
    }

    // Consumes the opening delimiter at the current position and everything up to and including endChar
    private String readUntil(char endChar, String message) {
        int from = lexer.position() + 1;
        lexer.nextChar();
        while (!lexer.eof() && lexer.crntChar() != endChar) {
            lexer.nextChar();
        }
        if (lexer.eof()) throw error(message);
        String value = lexer.slice(from, lexer.position());
        lexer.nextChar();
        return value;
    }

    // ====== LEXICAL UTILITIES ====== //
    private void ignoreWhiteSpace() {
        while (!lexer.eof() && isWhitespace(lexer.crntChar())) {
            lexer.nextChar();
        }
    }

    // ====== ERROR REPORTING ====== //
    private MalformedRuleException error(String message) {
        return new MalformedRuleException(message + errorContext());
    }

    private String errorContext() {
        return "\n\tERROR: Rule: " + rule +
                "\n\tIndex: " + lexer.position() +
                "\n\tBuffer: " + lexer.buffer();
    }
}
