package io.tisgrid.vm;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Longest-match tokenizer. Every rule of the table is tried at the current
 * position and the longest match wins. On an equal-length tie a label
 * reference never displaces a keyword, port, register or integer.
 * Tokens are produced lazily by {@link #iterator()}; {@link #tokenize()}
 * also checks that they cover the whole source.
 */
public class Lexer implements Iterable<Token> {

    // Characters allowed in label names and label references
    private static final String SYMBOL_CHAR = "[0-9A-Za-z~`$%^&*()_\\-+={}\\[\\]|\\\\;'\"<>.?/]";

    private static final class Rule {
        final TokenKind kind;
        final String literal;   // case-insensitive literal, or null
        final Pattern pattern;  // used when literal is null
        final Function<String, Object> converter;

        Rule(TokenKind kind, String literal, Function<String, Object> converter) {
            this.kind = kind;
            this.literal = literal;
            this.pattern = null;
            this.converter = converter;
        }

        Rule(TokenKind kind, Pattern pattern, Function<String, Object> converter) {
            this.kind = kind;
            this.literal = null;
            this.pattern = pattern;
            this.converter = converter;
        }

        /** Length of the match at pos, or -1. */
        int match(String source, int pos) {
            if (literal != null) {
                return source.regionMatches(true, pos, literal, 0, literal.length()) ? literal.length() : -1;
            }
            Matcher m = pattern.matcher(source);
            m.region(pos, source.length());
            return m.lookingAt() ? m.end() - pos : -1;
        }
    }

    private static final List<Rule> RULES = new ArrayList<>();
    static {
        for (Opcode op : Opcode.values()) {
            RULES.add(new Rule(TokenKind.INSTRUCTION, op.mnemonic(), s -> op));
        }
        RULES.add(new Rule(TokenKind.REGISTER, "acc", s -> "ACC"));
        RULES.add(new Rule(TokenKind.INTEGER, Pattern.compile("-?[1-9][0-9]*|0"), Lexer::toLong));
        for (Port port : Port.values()) {
            RULES.add(new Rule(TokenKind.PORT, port.mnemonic(), s -> port));
        }
        RULES.add(new Rule(TokenKind.NODE_SPECIFIER, Pattern.compile("@[0-9]+"), Lexer::toNodeId));
        RULES.add(new Rule(TokenKind.SEPARATOR, Pattern.compile(",+"), s -> s));
        RULES.add(new Rule(TokenKind.LABEL, Pattern.compile(SYMBOL_CHAR + "+:"),
                s -> s.substring(0, s.length() - 1)));
        RULES.add(new Rule(TokenKind.LABEL_REF, Pattern.compile(SYMBOL_CHAR + "+"), s -> s));
        RULES.add(new Rule(TokenKind.WHITESPACE, Pattern.compile("[ \t\r\n]+"), s -> s));
        RULES.add(new Rule(TokenKind.COMMENT, Pattern.compile("#[^\r\n]*"), s -> s));
    }

    private final String source;

    public Lexer(String source) {
        this.source = source;
    }

    /** Lexes the whole source, failing if any character is left unmatched. */
    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        int covered = 0;
        for (Token token : this) {
            if (token.span().start() != covered) {
                throw new LexException("Gap in token coverage at char " + covered, covered);
            }
            tokens.add(token);
            covered = token.span().end();
        }
        if (covered != source.length()) {
            throw new LexException(String.format(
                    "Was not able to lex the source past char %d of %d, near: %s",
                    covered, source.length(), peek(covered)), covered);
        }
        return tokens;
    }

    @Override
    public Iterator<Token> iterator() {
        return new Iterator<Token>() {
            private int pos = 0;
            private Token next = advance();

            private Token advance() {
                if (pos >= source.length()) {
                    return null;
                }
                Token token = firstToken(pos);
                if (token != null) {
                    pos = token.span().end();
                }
                return token;
            }

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public Token next() {
                if (next == null) {
                    throw new NoSuchElementException();
                }
                Token current = next;
                next = advance();
                return current;
            }
        };
    }

    /** The longest matching token at start, or null if no rule matches. */
    Token firstToken(int start) {
        Rule best = null;
        int bestLen = 0;
        for (Rule rule : RULES) {
            int len = rule.match(source, start);
            if (len <= 0 || len < bestLen) {
                continue;
            }
            if (len == bestLen && rule.kind == TokenKind.LABEL_REF && best.kind.outranksLabelRef()) {
                continue;
            }
            best = rule;
            bestLen = len;
        }
        if (best == null) {
            return null;
        }
        String text = source.substring(start, start + bestLen);
        Object value;
        try {
            value = best.converter.apply(text);
        } catch (NumberFormatException e) {
            throw new LexException("Number out of range: " + text, start);
        }
        return new Token(best.kind, value, new SourceSpan(start, start + bestLen));
    }

    private String peek(int at) {
        int from = Math.max(0, at - 10);
        int to = Math.min(source.length(), at + 10);
        return source.substring(from, to);
    }

    private static Object toLong(String s) {
        return Long.parseLong(s);
    }

    private static Object toNodeId(String s) {
        return Integer.parseInt(s.substring(1));
    }
}
