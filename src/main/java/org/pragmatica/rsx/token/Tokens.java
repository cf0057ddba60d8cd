package org.pragmatica.rsx.token;

import org.pragmatica.rsx.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Helpers over token sequences.
 */
public final class Tokens {
    private Tokens() {}

    /**
     * Whitespace-normalized rendering: tokens separated by one space, except after a joint punctuation mark.
     * Groups render as {@code ( a b )}, or {@code ()} when empty. Nesting depth is not limited by the call stack.
     */
    public static String toCanonicalString(List<TokenTree> tokens) {
        var sb = new StringBuilder();
        var frames = new ArrayDeque<Frame>();
        frames.push(new Frame(tokens, null));
        while (!frames.isEmpty()) {
            var frame = frames.peek();
            if (frame.index == frame.tokens.size()) {
                frames.pop();
                if (frame.group != null) {
                    if (!frame.tokens.isEmpty()) {
                        sb.append(' ');
                    }
                    sb.append(frame.group.delimiter()
                                         .close());
                }
                continue;
            }
            var token = frame.tokens.get(frame.index++ );
            if (frame.previous != null && !(frame.previous instanceof TokenTree.Punct punct && punct.isJoint())) {
                sb.append(' ');
            }
            frame.previous = token;
            if (token instanceof TokenTree.Group group) {
                sb.append(group.delimiter()
                               .open());
                if (!group.tokens()
                          .isEmpty()) {
                    sb.append(' ');
                }
                frames.push(new Frame(group.tokens(), group));
            }else {
                sb.append(token.text());
            }
        }
        return sb.toString();
    }

    private static final class Frame {
        private final List<TokenTree> tokens;
        private final TokenTree.Group group;
        private int index;
        private TokenTree previous;

        private Frame(List<TokenTree> tokens, TokenTree.Group group) {
            this.tokens = tokens;
            this.group = group;
        }
    }

    /**
     * Span from the first to the last token, or {@link SourceSpan#UNKNOWN} for an empty sequence.
     */
    public static SourceSpan spanOf(List<TokenTree> tokens) {
        if (tokens.isEmpty()) {
            return SourceSpan.UNKNOWN;
        }
        return tokens.get(0)
                     .span()
                     .merge(tokens.get(tokens.size() - 1)
                                  .span());
    }
}
