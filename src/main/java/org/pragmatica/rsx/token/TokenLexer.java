package org.pragmatica.rsx.token;

import org.pragmatica.rsx.error.SyntaxException;
import org.pragmatica.rsx.tree.SourceLocation;
import org.pragmatica.rsx.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reference tokenizer turning markup source text into a token tree with full source positions.
 * <p>
 * Hosts with their own tokenizer build {@link TokenTree} values directly; this lexer exists so that
 * plain text can be parsed and so that raw text can be reconstructed with its original whitespace.
 */
public final class TokenLexer {
    private static final int MAX_INPUT_SIZE = 4_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private int pos;
    private int line;
    private int column;

    private TokenLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static TokenStream tokenize(String input) throws SyntaxException {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        var tokens = new TokenLexer(input).tokenizeAll();
        return TokenStream.of(tokens, new StringSourceText(input));
    }

    private List<TokenTree> tokenizeAll() throws SyntaxException {
        var open = new ArrayDeque<OpenGroup>();
        List<TokenTree> current = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                break;
            }
            var start = currentLocation();
            char c = peek();
            if (c == '{' || c == '(' || c == '[') {
                advance();
                open.push(new OpenGroup(delimiterFor(c), span(start), current));
                current = new ArrayList<>();
            }else if (c == '}' || c == ')' || c == ']') {
                advance();
                current = closeGroup(open, current, c, span(start));
            }else {
                current.add(nextToken(start));
            }
        }
        if (!open.isEmpty()) {
            var unclosed = open.peek();
            throw new SyntaxException("unclosed delimiter `" + unclosed.delimiter()
                                                                      .open() + "`", unclosed.openSpan());
        }
        return current;
    }

    private List<TokenTree> closeGroup(Deque<OpenGroup> open,
                                       List<TokenTree> current,
                                       char c,
                                       SourceSpan closeSpan) throws SyntaxException {
        if (open.isEmpty()) {
            throw new SyntaxException("unexpected closing delimiter `" + c + "`", closeSpan);
        }
        var group = open.pop();
        if (group.delimiter()
                 .close() != c) {
            throw new SyntaxException("mismatched closing delimiter `" + c + "`, expected `"
                                      + group.delimiter()
                                             .close() + "`", closeSpan);
        }
        var span = SourceSpan.of(group.openSpan()
                                      .start(), closeSpan.end());
        group.outer()
             .add(new TokenTree.Group(group.delimiter(), current, span, group.openSpan(), closeSpan));
        return group.outer();
    }

    private TokenTree nextToken(SourceLocation start) throws SyntaxException {
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        if (c == '"') {
            return scanStringLiteral(start);
        }
        if (c == '\'' && isCharLiteral()) {
            return scanCharLiteral(start);
        }
        return scanPunct(start);
    }

    private TokenTree scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        var name = sb.toString();
        if (name.equals("true") || name.equals("false")) {
            return new TokenTree.Literal(TokenTree.LiteralKind.BOOLEAN, name, name, span(start));
        }
        return new TokenTree.Ident(name, span(start));
    }

    private TokenTree scanNumber(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && (isIdentifierPart(peek()) || isFractionDot())) {
            sb.append(advance());
        }
        var text = sb.toString();
        return new TokenTree.Literal(TokenTree.LiteralKind.NUMBER, text, text, span(start));
    }

    private boolean isFractionDot() {
        return peek() == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1));
    }

    private TokenTree scanStringLiteral(SourceLocation start) throws SyntaxException {
        advance();
        // skip opening quote
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
                // skip backslash
                sb.append(scanEscapeSequence());
            }else {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            throw new SyntaxException("unterminated string literal", span(start));
        }
        advance();
        // skip closing quote
        var span = span(start);
        return new TokenTree.Literal(TokenTree.LiteralKind.STRING, span.extract(input), sb.toString(), span);
    }

    private boolean isCharLiteral() {
        if (pos + 2 >= input.length()) {
            return false;
        }
        if (input.charAt(pos + 1) == '\\') {
            return input.indexOf('\'', pos + 2) > pos + 2;
        }
        return input.charAt(pos + 2) == '\'';
    }

    private TokenTree scanCharLiteral(SourceLocation start) {
        advance();
        // skip opening quote
        char value = peek() == '\\'
                     ? escapeAfterBackslash()
                     : advance();
        while (!isAtEnd() && peek() != '\'') {
            advance();
        }
        if (!isAtEnd()) {
            advance();
        }
        var span = span(start);
        return new TokenTree.Literal(TokenTree.LiteralKind.CHAR, span.extract(input), String.valueOf(value), span);
    }

    private char escapeAfterBackslash() {
        advance();
        // skip backslash
        return scanEscapeSequence();
    }

    private TokenTree scanPunct(SourceLocation start) {
        char c = advance();
        var spacing = !isAtEnd() && isPunctChar(peek()) && !startsComment()
                      ? TokenTree.Spacing.JOINT
                      : TokenTree.Spacing.ALONE;
        return new TokenTree.Punct(c, spacing, span(start));
    }

    private char scanEscapeSequence() {
        if (isAtEnd()) return '\\';
        char c = advance();
        return switch (c) {
            case'n' -> '\n';
            case'r' -> '\r';
            case't' -> '\t';
            case'\\' -> '\\';
            case'\'' -> '\'';
            case'"' -> '"';
            case'0' -> '\0';
            case'x' -> scanHexEscape(2);
            // hex escape
            case'u' -> scanHexEscape(4);
            // unicode escape
            default -> c;
        };
    }

    private char scanHexEscape(int digits) {
        if (pos + digits > input.length()) {
            return (digits == 2)
                   ? 'x'
                   : 'u';
        }
        var hex = input.substring(pos, pos + digits);
        try{
            var value = Integer.parseInt(hex, 16);
            pos += digits;
            column += digits;
            return (char) value;
        } catch (NumberFormatException e) {
            return (digits == 2)
                   ? 'x'
                   : 'u';
        }
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            }else if (startsLineComment()) {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            }else if (startsBlockComment()) {
                advance();
                advance();
                while (!isAtEnd() && !(peek() == '*' && pos + 1 < input.length() && input.charAt(pos + 1) == '/')) {
                    advance();
                }
                if (!isAtEnd()) {
                    advance();
                    advance();
                }
            }else {
                break;
            }
        }
    }

    private boolean startsComment() {
        return startsLineComment() || startsBlockComment();
    }

    private boolean startsLineComment() {
        return peek() == '/' && pos + 1 < input.length() && input.charAt(pos + 1) == '/';
    }

    private boolean startsBlockComment() {
        return peek() == '/' && pos + 1 < input.length() && input.charAt(pos + 1) == '*';
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++ );
        if (c == '\n') {
            line++ ;
            column = 1;
        }else {
            column++ ;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static TokenTree.Delimiter delimiterFor(char c) {
        return switch (c) {
            case'{' -> TokenTree.Delimiter.BRACE;
            case'(' -> TokenTree.Delimiter.PAREN;
            default -> TokenTree.Delimiter.BRACKET;
        };
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isPunctChar(char c) {
        return !Character.isWhitespace(c) && !isIdentifierPart(c) && c != '"' && c != '\''
               && "{}()[]".indexOf(c) < 0;
    }

    private record OpenGroup(TokenTree.Delimiter delimiter, SourceSpan openSpan, List<TokenTree> outer) {}
}
