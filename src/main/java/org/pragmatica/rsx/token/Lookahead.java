package org.pragmatica.rsx.token;

import java.util.Optional;

/**
 * Decides which markup construct starts at a cursor, looking at no more than three tokens.
 */
public final class Lookahead {
    private Lookahead() {}

    public enum Construct {
        /** {@code <!doctype} */
        DOCTYPE,
        /** {@code <!--} */
        COMMENT,
        /** {@code <>} */
        FRAGMENT,
        /** {@code </>} */
        FRAGMENT_CLOSE,
        /** {@code </name} */
        CLOSE_TAG,
        /** {@code <name} */
        ELEMENT,
        /** {@code {...}} */
        BLOCK,
        /** quoted string literal */
        TEXT,
        /** anything else, up to the next boundary */
        RAW_TEXT,
        END
    }

    public static Construct classify(TokenCursor cursor) {
        var first = cursor.peek(0);
        if (first.isEmpty()) {
            return Construct.END;
        }
        var token = first.get();
        if (isPunct(first, '<')) {
            return classifyTag(cursor);
        }
        if (token instanceof TokenTree.Group group && group.isBrace()) {
            return Construct.BLOCK;
        }
        if (token instanceof TokenTree.Literal literal && literal.isString()) {
            return Construct.TEXT;
        }
        return Construct.RAW_TEXT;
    }

    /**
     * Whether a node other than raw text starts here: a tag, a block or a quoted literal.
     */
    public static boolean isNodeBoundary(TokenCursor cursor) {
        var construct = classify(cursor);
        return construct != Construct.RAW_TEXT && construct != Construct.END;
    }

    /**
     * Whether a close tag or fragment close starts here.
     */
    public static boolean isCloseTagStart(TokenCursor cursor) {
        return isPunct(cursor.peek(0), '<') && isPunct(cursor.peek(1), '/');
    }

    private static Construct classifyTag(TokenCursor cursor) {
        var second = cursor.peek(1);
        var third = cursor.peek(2);
        if (isPunct(second, '!')) {
            // `<!` then an identifier is a doctype, anything else is treated as a comment
            return third.filter(TokenTree.Ident.class::isInstance)
                        .isPresent()
                   ? Construct.DOCTYPE
                   : Construct.COMMENT;
        }
        if (isPunct(second, '/')) {
            return isPunct(third, '>')
                   ? Construct.FRAGMENT_CLOSE
                   : Construct.CLOSE_TAG;
        }
        if (isPunct(second, '>')) {
            return Construct.FRAGMENT;
        }
        return Construct.ELEMENT;
    }

    private static boolean isPunct(Optional<TokenTree> token, char ch) {
        return token.filter(t -> t instanceof TokenTree.Punct punct && punct.is(ch))
                    .isPresent();
    }
}
