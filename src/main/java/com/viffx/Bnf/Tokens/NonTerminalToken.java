package com.viffx.Bnf.Tokens;

import com.viffx.Bnf.Symbols.NonTerminal;
import com.viffx.Bnf.Symbols.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A labeled interior node of the token tree.
 * <p>
 * The node owns its children exclusively. For the input {@code 2*4-4/5} a typical tree is:
 * <pre>
 *                 &lt;expression&gt;
 *              /       |        \
 *      &lt;expression&gt; &lt;operator&gt; &lt;expression&gt;
 *       /   |   \       |       /   |   \
 *     "2"  "*"  "4"    "-"    "4"  "/"  "5"
 * </pre>
 * All query methods are total: a miss is reported as an empty result, never as an exception.
 */
public final class NonTerminalToken implements Token {
    // ====== INSTANCE FIELDS ====== //
    private final String name;
    private final List<Token> children;

    // ====== CONSTRUCTORS ====== //
    public NonTerminalToken(String name, List<Token> children) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.children = new ArrayList<>(Objects.requireNonNull(children, "children cannot be null"));
    }

    // ====== PUBLIC API ====== //

    /**
     * Returns the label of this node, without angle brackets.
     */
    public String name() {
        return name;
    }

    /**
     * Returns the symbol reference this node would be matched by.
     */
    public NonTerminal type() {
        return new NonTerminal(name);
    }

    @Override
    public String symbol() {
        return name;
    }

    @Override
    public boolean isTerminal() {
        return false;
    }

    // Children

    public List<Token> children() {
        return Collections.unmodifiableList(children);
    }

    public int size() {
        return children.size();
    }

    @Override
    public Optional<List<TokenIndex>> childIndexes() {
        List<TokenIndex> indexes = new ArrayList<>(children.size());
        for (int i = 0; i < children.size(); i++) {
            indexes.add(TokenIndex.of(i));
        }
        return Optional.of(indexes);
    }

    // Path addressing

    @Override
    public Optional<Token> get(TokenIndex index) {
        if (index.isEmpty()) return Optional.empty();

        int head = index.head();
        if (head < 0 || head >= children.size()) return Optional.empty();

        Token child = children.get(head);
        if (index.depth() == 1) return Optional.of(child);

        // the target is a descendant of one of the children
        return child.get(index.tail());
    }

    /**
     * Replaces the descendant at {@code index} with {@code replacement}.
     *
     * @param index the path of the token to replace, relative to this node
     * @param replacement the token to put in its place
     * @return the token that was replaced, or empty if the path leads nowhere (nothing changes then)
     */
    public Optional<Token> replace(TokenIndex index, Token replacement) {
        Objects.requireNonNull(replacement, "replacement cannot be null");
        if (index.isEmpty()) return Optional.empty();

        int head = index.head();
        if (head < 0 || head >= children.size()) return Optional.empty();

        if (index.depth() == 1) return Optional.of(children.set(head, replacement));

        Token child = children.get(head);
        if (child instanceof NonTerminalToken node) return node.replace(index.tail(), replacement);
        return Optional.empty();
    }

    // Descendants

    /**
     * Returns every descendant of this node in left-to-right pre-order: a child is listed
     * before its own descendants. This node itself is not part of the result.
     * <p>
     * A label that nests into itself, like {@code <number> ::= <digit> | <number> <number>},
     * shows up several times. Use {@link #terminals()} to get the underlying text.
     */
    public List<Token> descendants() {
        List<Token> result = new ArrayList<>();
        collectDescendants(result);
        return result;
    }

    private void collectDescendants(List<Token> result) {
        for (Token child : children) {
            result.add(child);
            if (child instanceof NonTerminalToken node) node.collectDescendants(result);
        }
    }

    // Queries by symbol

    public List<Token> childrenOfType(Symbol symbol) {
        return children.stream().filter(symbol::matches).toList();
    }

    public List<Token> descendantsOfType(Symbol symbol) {
        return descendants().stream().filter(symbol::matches).toList();
    }

    public boolean containsChild(Symbol symbol) {
        return children.stream().anyMatch(symbol::matches);
    }

    public boolean containsDescendant(Symbol symbol) {
        return findDescendant(symbol).isPresent();
    }

    public Optional<Token> findChild(Symbol symbol) {
        return children.stream().filter(symbol::matches).findFirst();
    }

    /**
     * Returns the first descendant of type {@code symbol} in pre-order.
     */
    public Optional<Token> findDescendant(Symbol symbol) {
        for (Token child : children) {
            if (symbol.matches(child)) return Optional.of(child);
            if (child instanceof NonTerminalToken node) {
                Optional<Token> found = node.findDescendant(symbol);
                if (found.isPresent()) return found;
            }
        }
        return Optional.empty();
    }

    // Text

    @Override
    public String terminals() {
        StringBuilder builder = new StringBuilder();
        appendTerminals(builder);
        return builder.toString();
    }

    private void appendTerminals(StringBuilder builder) {
        for (Token child : children) {
            if (child instanceof NonTerminalToken node) {
                node.appendTerminals(builder);
            } else {
                builder.append(child.terminals());
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NonTerminalToken that = (NonTerminalToken) o;
        return name.equals(that.name) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, children);
    }

    @Override
    public String toString() {
        return "<" + name + ">" + children;
    }
}
