package org.pragmatica.rsx;

import org.pragmatica.rsx.error.RsxParseException;
import org.pragmatica.rsx.host.BlockTransform;
import org.pragmatica.rsx.host.HostExpressionParser;
import org.pragmatica.rsx.parser.MarkupEngine;
import org.pragmatica.rsx.parser.ParseOutcome;
import org.pragmatica.rsx.parser.Parser;
import org.pragmatica.rsx.parser.ParserConfig;
import org.pragmatica.rsx.token.TokenStream;
import org.pragmatica.rsx.tree.Node;
import org.pragmatica.rsx.tree.NodeKind;

import java.util.List;
import java.util.Set;

/**
 * Entry point for parsing markup.
 *
 * <p>Example usage:
 * <pre>{@code
 * var nodes = RsxParser.parse("<div class=\"x\">\"hello\"</div>");
 *
 * var outcome = RsxParser.builder()
 *                        .recoverInvalidBlocks(true)
 *                        .build()
 *                        .parseRecoverable("<div><open></close></div>");
 * outcome.diagnostics().forEach(d -> System.err.println(d.formatSimple()));
 * }</pre>
 */
public final class RsxParser {
    private RsxParser() {}

    /**
     * Create a parser with default configuration.
     */
    public static Parser create() {
        return create(ParserConfig.DEFAULT);
    }

    public static Parser create(ParserConfig config) {
        return MarkupEngine.create(config);
    }

    /**
     * Parse source text with default configuration, failing on the first error.
     */
    public static List<Node> parse(String source) throws RsxParseException {
        return create().parseStrict(source);
    }

    public static List<Node> parse(String source, ParserConfig config) throws RsxParseException {
        return create(config).parseStrict(source);
    }

    public static List<Node> parseStrict(TokenStream tokens, ParserConfig config) throws RsxParseException {
        return create(config).parseStrict(tokens);
    }

    /**
     * Parse source text with recovery and default configuration.
     */
    public static ParseOutcome<List<Node>> parseRecoverable(String source) {
        return create().parseRecoverable(source);
    }

    public static ParseOutcome<List<Node>> parseRecoverable(String source, ParserConfig config) {
        return create(config).parseRecoverable(source);
    }

    public static ParseOutcome<List<Node>> parseRecoverable(TokenStream tokens, ParserConfig config) {
        return create(config).parseRecoverable(tokens);
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder() {
        return new Builder(ParserConfig.DEFAULT);
    }

    /**
     * Builder starting from HTML conventions, see {@link ParserConfig#html()}.
     */
    public static Builder htmlBuilder() {
        return new Builder(ParserConfig.html());
    }

    public static final class Builder {
        private ParserConfig config;

        private Builder(ParserConfig config) {
            this.config = config;
        }

        public Builder flatTree(boolean flat) {
            this.config = config.withFlatTree(flat);
            return this;
        }

        public Builder topLevelCount(int count) {
            this.config = config.withTopLevelCount(count);
            return this;
        }

        public Builder topLevelKind(NodeKind kind) {
            this.config = config.withTopLevelKind(kind);
            return this;
        }

        public Builder selfClosing(String... names) {
            this.config = config.withSelfClosingNames(Set.of(names));
            return this;
        }

        public Builder rawText(String... names) {
            this.config = config.withRawTextNames(Set.of(names));
            return this;
        }

        public Builder recoverInvalidBlocks(boolean recover) {
            this.config = config.withRecoverInvalidBlocks(recover);
            return this;
        }

        public Builder strict(boolean strict) {
            this.config = config.withStrictMode(strict);
            return this;
        }

        public Builder blockTransform(BlockTransform transform) {
            this.config = config.withBlockTransform(transform);
            return this;
        }

        public Builder maxNestingDepth(int depth) {
            this.config = config.withMaxNestingDepth(depth);
            return this;
        }

        public Builder hostParser(HostExpressionParser parser) {
            this.config = config.withHostParser(parser);
            return this;
        }

        public ParserConfig config() {
            return config;
        }

        public Parser build() {
            return create(config);
        }
    }
}
