package com.sysmuse.fuzzy;

import com.sysmuse.fuzzy.util.LoggingUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.sysmuse.fuzzy.OperationRegistry.isAsciiDigit;
import static com.sysmuse.fuzzy.OperationRegistry.isAsciiLetter;

/**
 * Converts a raw expression into an ordered list of {@link Token}s.
 * <p>
 * At each position the lexer tries, in order: whitespace, a constant, a function name
 * immediately followed by '(', a number, a variable, an infix operator and finally
 * single-character punctuation. The rules resolving the ambiguous cases are:
 * <ul>
 *   <li>{@code 2x} is the number 2 followed by the variable x (names never start with a digit)</li>
 *   <li>{@code x2} is the variable x2, {@code x_2} the variable x_2</li>
 *   <li>{@code x2.0} is the variable x followed by the number 2.0 (warning)</li>
 *   <li>{@code pixel}, {@code pipi}, {@code ipi} are variables, {@code pi_5} too: a constant is
 *       only accepted when no letter or underscore follows it</li>
 *   <li>{@code pi4} is the constant pi followed by the number 4</li>
 *   <li>{@code cos (x)} does not call cos: there must be no space before the bracket</li>
 * </ul>
 * The lexer is case sensitive.
 */
public class Lexer {

    private final OperationRegistry registry;
    private final Diagnostics diagnostics;

    public Lexer(OperationRegistry registry, Diagnostics diagnostics) {
        this.registry = registry;
        this.diagnostics = diagnostics;
    }

    public Lexer(OperationRegistry registry) {
        this(registry, new Diagnostics());
    }

    /**
     * Result of a consume step: {@code input = head + tail}.
     * An empty head means nothing was consumed.
     */
    public static final class Match {
        private final String head;
        private final String tail;
        private final boolean ambiguous;

        Match(String head, String tail, boolean ambiguous) {
            this.head = head;
            this.tail = tail;
            this.ambiguous = ambiguous;
        }

        static Match of(String input, int length) {
            return new Match(input.substring(0, length), input.substring(length), false);
        }

        static Match none(String input) {
            return new Match("", input, false);
        }

        public String getHead() {
            return head;
        }

        public String getTail() {
            return tail;
        }

        public boolean isEmpty() {
            return head.isEmpty();
        }

        /**
         * Set when the split was accepted but may not be what the author meant.
         */
        public boolean isAmbiguous() {
            return ambiguous;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Match)) return false;
            Match other = (Match) o;
            return head.equals(other.head) && tail.equals(other.tail);
        }

        @Override
        public int hashCode() {
            return Objects.hash(head, tail);
        }

        @Override
        public String toString() {
            return "(\"" + head + "\", \"" + tail + "\")";
        }
    }

    public List<Token> tokenize(String input) {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;

        while (pos < input.length()) {
            pos += spaceLength(input, pos);
            if (pos >= input.length()) {
                break;
            }

            int n = constantLength(input, pos);
            if (n > 0) {
                tokens.add(Token.constant(input.substring(pos, pos + n), pos));
                pos += n;
                continue;
            }

            n = functionLength(input, pos);
            if (n > 0) {
                tokens.add(Token.function(input.substring(pos, pos + n), pos));
                tokens.add(Token.open(pos + n));
                pos += n + 1;
                continue;
            }

            n = numberLength(input, pos);
            if (n > 0) {
                tokens.add(Token.number(input.substring(pos, pos + n), pos));
                pos += n;
                continue;
            }

            Match variable = consumeVariable(input.substring(pos));
            if (!variable.isEmpty()) {
                if (variable.isAmbiguous()) {
                    diagnostics.ambiguity("variable '" + variable.getHead()
                            + "' is followed by a fractional number and read as a product", pos);
                }
                tokens.add(Token.variable(variable.getHead(), pos));
                pos += variable.getHead().length();
                continue;
            }

            n = detachedFunctionLength(input, pos);
            if (n > 0) {
                String name = input.substring(pos, pos + n);
                diagnostics.ambiguity("function '" + name + "' is not immediately followed by '(' and is read as a variable", pos);
                tokens.add(Token.variable(name, pos));
                pos += n;
                continue;
            }

            n = infixLength(input, pos);
            if (n > 0) {
                String symbol = input.substring(pos, pos + n);
                tokens.add(Token.infix(symbol, registry.getPriority(symbol), pos));
                pos += n;
                continue;
            }

            char c = input.charAt(pos);
            switch (c) {
                case '(':
                    tokens.add(Token.open(pos));
                    break;
                case ')':
                    tokens.add(Token.close(pos));
                    break;
                case ',':
                    tokens.add(Token.comma(pos));
                    break;
                default:
                    throw new LexerException("unexpected character '" + c + "'", pos);
            }
            pos++;
        }

        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("Tokens for '" + input + "': " + tokens);
        }
        return tokens;
    }

    // ---------------------------------------------------------------------
    // Consumers
    // ---------------------------------------------------------------------

    public Match consumeSpace(String input) {
        return Match.of(input, spaceLength(input, 0));
    }

    public Match consumeConstant(String input) {
        return Match.of(input, constantLength(input, 0));
    }

    /**
     * The head is the function name; the opening bracket is dropped from the tail.
     */
    public Match consumeFunction(String input) {
        int n = functionLength(input, 0);
        if (n == 0) {
            return Match.none(input);
        }
        return new Match(input.substring(0, n), input.substring(n + 1), false);
    }

    public Match consumeNumber(String input) {
        return Match.of(input, numberLength(input, 0));
    }

    /**
     * Longest plausible variable name at the start of the input. Reserved names are
     * never returned. When the name stops in front of a fractional number
     * ({@code x2.3}) the match is flagged ambiguous.
     */
    public Match consumeVariable(String input) {
        if (input.isEmpty()) {
            return Match.none(input);
        }
        char first = input.charAt(0);
        if (!isAsciiLetter(first) && first != '_') {
            return Match.none(input);
        }

        int n = 1;
        boolean ambiguous = false;
        while (n < input.length()) {
            char next = input.charAt(n);
            if (isAsciiLetter(next) || next == '_') {
                n++;
            } else if (isAsciiDigit(next)) {
                String suffix = input.substring(n, n + numberLength(input, n));
                if (suffix.indexOf('.') >= 0) {
                    ambiguous = true;
                    break;
                }
                n++;
            } else {
                break;
            }
        }

        String name = input.substring(0, n);
        if (registry.isReserved(name)) {
            return Match.none(input);
        }
        return new Match(name, input.substring(n), ambiguous);
    }

    public Match consumeInfix(String input) {
        return Match.of(input, infixLength(input, 0));
    }

    // ---------------------------------------------------------------------
    // Predicates
    // ---------------------------------------------------------------------

    /**
     * Digits with at most one dot. The integer or the fractional part may be omitted
     * ({@code 12.}, {@code .5}) but not both. Signs are never part of a number.
     */
    public static boolean isNumber(String text) {
        if (text == null || text.isEmpty() || text.equals(".")) {
            return false;
        }
        boolean dotSeen = false;
        for (char c : text.toCharArray()) {
            if (c == '.') {
                if (dotSeen) {
                    return false;
                }
                dotSeen = true;
            } else if (!isAsciiDigit(c)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Syntactically valid variable name that is not a reserved constant or function name.
     */
    public boolean isIdentifier(String text) {
        if (text == null || text.isEmpty() || registry.isReserved(text)) {
            return false;
        }
        char first = text.charAt(0);
        if (!isAsciiLetter(first) && first != '_') {
            return false;
        }
        for (char c : text.toCharArray()) {
            if (!isAsciiLetter(c) && !isAsciiDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }

    // ---------------------------------------------------------------------
    // Length scanners, all working from an offset into the full input
    // ---------------------------------------------------------------------

    private static int spaceLength(String input, int from) {
        int n = 0;
        while (from + n < input.length() && (input.charAt(from + n) == ' ' || input.charAt(from + n) == '\t')) {
            n++;
        }
        return n;
    }

    private int constantLength(String input, int from) {
        int remaining = input.length() - from;
        for (int n = 1; n <= remaining; n++) {
            String head = input.substring(from, from + n);
            if (!registry.isConstant(head)) {
                continue;
            }
            if (n == remaining) {
                return n;
            }
            char next = input.charAt(from + n);
            if (next == '_') {
                // an underscore turns the whole word into a variable name (pi_5)
                return 0;
            }
            if (!isAsciiLetter(next)) {
                return n;
            }
            // a letter follows: only a longer constant can still match (inf vs i)
        }
        return 0;
    }

    private int functionLength(String input, int from) {
        int best = 0;
        for (String name : registry.getFunctionNames()) {
            if (name.length() > best && input.startsWith(name + "(", from)) {
                best = name.length();
            }
        }
        return best;
    }

    private static int numberLength(String input, int from) {
        int n = 0;
        int best = 0;
        boolean dotSeen = false;
        while (from + n < input.length()) {
            char c = input.charAt(from + n);
            if (isAsciiDigit(c)) {
                n++;
                best = n;
            } else if (c == '.' && !dotSeen) {
                dotSeen = true;
                n++;
                // a lone dot is not a number, but ".5" is
                if (n > 1) {
                    best = n;
                }
            } else {
                break;
            }
        }
        return best;
    }

    /**
     * Length of a function name standing on its own, e.g. the "tan" in "tan (x)".
     */
    private int detachedFunctionLength(String input, int from) {
        int n = 0;
        while (from + n < input.length()) {
            char c = input.charAt(from + n);
            if (!isAsciiLetter(c) && !isAsciiDigit(c) && c != '_') {
                break;
            }
            n++;
        }
        return n > 0 && registry.isFunction(input.substring(from, from + n)) ? n : 0;
    }

    private int infixLength(String input, int from) {
        int best = 0;
        for (String symbol : registry.getInfixSymbols()) {
            if (symbol.length() > best && input.startsWith(symbol, from)) {
                best = symbol.length();
            }
        }
        return best;
    }
}
