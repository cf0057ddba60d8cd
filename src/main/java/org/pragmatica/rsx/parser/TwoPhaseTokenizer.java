package org.pragmatica.rsx.parser;

import org.pragmatica.rsx.token.Lookahead;
import org.pragmatica.rsx.token.TokenInput;
import org.pragmatica.rsx.token.TokenTree;
import org.pragmatica.rsx.tree.NodeName;
import org.pragmatica.rsx.tree.SourceSpan;

import java.util.List;
import java.util.function.Predicate;

/**
 * Token collection for constructs whose end marker can also appear inside their content.
 * <p>
 * Phase one copies tokens until a terminator, tested on a fork at every position, matches. Phase two re-parses
 * the copied run on its own input, so the terminator always wins over whatever the content parser would accept.
 */
final class TwoPhaseTokenizer {
    private TwoPhaseTokenizer() {}

    /**
     * Consume tokens until {@code terminator} matches or the input ends. The terminator itself is not consumed;
     * callers check {@link TokenInput#isEmpty()} to tell the two outcomes apart.
     */
    static List<TokenTree> collectUntil(TokenInput input, Predicate<TokenInput> terminator) {
        var start = input.cursor();
        while (!input.isEmpty() && !terminator.test(input.fork())) {
            input.skip();
        }
        return start.until(input.cursor());
    }

    /**
     * Input over a collected run for phase two. {@code endSpan} is reported for errors at the end of the run.
     */
    static TokenInput reparse(List<TokenTree> tokens, SourceSpan endSpan) {
        return TokenInput.of(tokens, endSpan);
    }

    /**
     * {@code >} or {@code />}.
     */
    static boolean isOpenTagEnd(TokenInput fork) {
        return fork.peekPunct('>') || fork.peekPunct('/') && fork.peekPunct(1, '>');
    }

    /**
     * Matches a close tag for {@code name}; any other close tag is content.
     */
    static Predicate<TokenInput> closeTagOf(NodeName name, NodeNameParser names) {
        return fork -> {
            if (!Lookahead.isCloseTagStart(fork.cursor())) {
                return false;
            }
            fork.skip();
            fork.skip();
            return names.parseStatic(fork)
                        .filter(found -> found.matches(name))
                        .isPresent() && fork.peekPunct('>');
        };
    }
}
