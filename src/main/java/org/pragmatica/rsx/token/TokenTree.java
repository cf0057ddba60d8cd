package org.pragmatica.rsx.token;

import org.pragmatica.rsx.tree.SourceSpan;

import java.util.List;

/**
 * Lexical token tree supplied by the host: an identifier, a punctuation mark, a literal,
 * or a delimited group holding a nested token sequence.
 */
public sealed interface TokenTree {
    SourceSpan span();

    /**
     * Canonical text of the token, without surrounding whitespace.
     */
    String text();

    /**
     * Whether the next punctuation mark follows without whitespace.
     */
    enum Spacing {
        ALONE,
        JOINT
    }

    enum LiteralKind {
        STRING,
        CHAR,
        NUMBER,
        BOOLEAN
    }

    enum Delimiter {
        BRACE('{', '}'),
        PAREN('(', ')'),
        BRACKET('[', ']');

        private final char open;
        private final char close;

        Delimiter(char open, char close) {
            this.open = open;
            this.close = close;
        }

        public char open() {
            return open;
        }

        public char close() {
            return close;
        }
    }

    record Ident(String name, SourceSpan span) implements TokenTree {
        public static Ident of(String name) {
            return new Ident(name, SourceSpan.UNKNOWN);
        }

        @Override
        public String text() {
            return name;
        }
    }

    record Punct(char ch, Spacing spacing, SourceSpan span) implements TokenTree {
        public static Punct alone(char ch) {
            return new Punct(ch, Spacing.ALONE, SourceSpan.UNKNOWN);
        }

        public static Punct joint(char ch) {
            return new Punct(ch, Spacing.JOINT, SourceSpan.UNKNOWN);
        }

        public boolean is(char c) {
            return ch == c;
        }

        public boolean isJoint() {
            return spacing == Spacing.JOINT;
        }

        @Override
        public String text() {
            return String.valueOf(ch);
        }
    }

    /**
     * @param text  verbatim source form, quotes included for strings and chars
     * @param value unescaped value
     */
    record Literal(LiteralKind kind, String text, String value, SourceSpan span) implements TokenTree {
        public static Literal string(String value) {
            return new Literal(LiteralKind.STRING, quote(value), value, SourceSpan.UNKNOWN);
        }

        public static Literal number(String digits) {
            return new Literal(LiteralKind.NUMBER, digits, digits, SourceSpan.UNKNOWN);
        }

        public boolean isString() {
            return kind == LiteralKind.STRING;
        }

        private static String quote(String value) {
            var sb = new StringBuilder(value.length() + 2);
            sb.append('"');
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                switch (c) {
                    case '"' -> sb.append("\\\"");
                    case '\\' -> sb.append("\\\\");
                    case '\n' -> sb.append("\\n");
                    case '\t' -> sb.append("\\t");
                    case '\r' -> sb.append("\\r");
                    default -> sb.append(c);
                }
            }
            return sb.append('"').toString();
        }
    }

    /**
     * @param openSpan  span of the opening delimiter
     * @param closeSpan span of the closing delimiter
     */
    record Group(Delimiter delimiter,
                 List<TokenTree> tokens,
                 SourceSpan span,
                 SourceSpan openSpan,
                 SourceSpan closeSpan) implements TokenTree {
        public Group {
            tokens = List.copyOf(tokens);
        }

        public static Group of(Delimiter delimiter, List<TokenTree> tokens) {
            return new Group(delimiter, tokens, SourceSpan.UNKNOWN, SourceSpan.UNKNOWN, SourceSpan.UNKNOWN);
        }

        public boolean isBrace() {
            return delimiter == Delimiter.BRACE;
        }

        @Override
        public String text() {
            return Tokens.toCanonicalString(List.of(this));
        }
    }
}
