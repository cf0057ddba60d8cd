package org.pragmatica.rsx.parser;

import org.pragmatica.rsx.host.BlockTransform;
import org.pragmatica.rsx.host.HostExpressionParser;
import org.pragmatica.rsx.host.SimpleExpressionParser;
import org.pragmatica.rsx.tree.NodeKind;
import org.pragmatica.rsx.tree.NodeName;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Parser configuration options.
 *
 * @param flatTree             return every node in pre-order instead of a tree
 * @param topLevelCount        exact number of top-level nodes required
 * @param topLevelKind         kind every top-level node must have
 * @param selfClosingNames     element names that never have children, like {@code br}
 * @param rawTextNames         element names whose content is captured verbatim, like {@code script}
 * @param recoverInvalidBlocks keep blocks the host parser rejects instead of aborting
 * @param strictMode           stop at the first diagnostic
 * @param blockTransform       hook applied to block content before the host parser sees it
 * @param maxNestingDepth      deepest element or fragment nesting accepted
 * @param hostParser           parser of embedded host code
 */
public record ParserConfig(
    boolean flatTree,
    Optional<Integer> topLevelCount,
    Optional<NodeKind> topLevelKind,
    Set<String> selfClosingNames,
    Set<String> rawTextNames,
    boolean recoverInvalidBlocks,
    boolean strictMode,
    Optional<BlockTransform> blockTransform,
    int maxNestingDepth,
    HostExpressionParser hostParser
) {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 128;

    public static final ParserConfig DEFAULT = new ParserConfig(
        false,
        Optional.empty(),
        Optional.empty(),
        Set.of(),
        Set.of(),
        false,
        false,
        Optional.empty(),
        DEFAULT_MAX_NESTING_DEPTH,
        SimpleExpressionParser.INSTANCE
    );

    private static final Set<String> HTML_VOID_ELEMENTS = Set.of(
        "area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "param", "source", "track", "wbr"
    );

    private static final Set<String> HTML_RAW_TEXT_ELEMENTS = Set.of("script", "style");

    public ParserConfig {
        Objects.requireNonNull(topLevelCount, "topLevelCount");
        Objects.requireNonNull(topLevelKind, "topLevelKind");
        Objects.requireNonNull(blockTransform, "blockTransform");
        Objects.requireNonNull(hostParser, "hostParser");
        selfClosingNames = Set.copyOf(selfClosingNames);
        rawTextNames = Set.copyOf(rawTextNames);
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        if (topLevelCount.filter(count -> count < 0)
                         .isPresent()) {
            throw new IllegalArgumentException("topLevelCount must not be negative: " + topLevelCount.get());
        }
    }

    /**
     * Defaults plus HTML void elements as self-closing and {@code script}/{@code style} as raw text.
     */
    public static ParserConfig html() {
        return DEFAULT.withSelfClosingNames(HTML_VOID_ELEMENTS)
                      .withRawTextNames(HTML_RAW_TEXT_ELEMENTS);
    }

    public boolean isSelfClosing(NodeName name) {
        return !(name instanceof NodeName.Dynamic) && selfClosingNames.contains(name.toString());
    }

    public boolean isRawText(NodeName name) {
        return !(name instanceof NodeName.Dynamic) && rawTextNames.contains(name.toString());
    }

    public ParserConfig withFlatTree(boolean flatTree) {
        return new ParserConfig(flatTree, topLevelCount, topLevelKind, selfClosingNames, rawTextNames,
                                recoverInvalidBlocks, strictMode, blockTransform, maxNestingDepth, hostParser);
    }

    public ParserConfig withTopLevelCount(int count) {
        return new ParserConfig(flatTree, Optional.of(count), topLevelKind, selfClosingNames, rawTextNames,
                                recoverInvalidBlocks, strictMode, blockTransform, maxNestingDepth, hostParser);
    }

    public ParserConfig withTopLevelKind(NodeKind kind) {
        return new ParserConfig(flatTree, topLevelCount, Optional.of(kind), selfClosingNames, rawTextNames,
                                recoverInvalidBlocks, strictMode, blockTransform, maxNestingDepth, hostParser);
    }

    public ParserConfig withSelfClosingNames(Set<String> names) {
        return new ParserConfig(flatTree, topLevelCount, topLevelKind, names, rawTextNames,
                                recoverInvalidBlocks, strictMode, blockTransform, maxNestingDepth, hostParser);
    }

    public ParserConfig withRawTextNames(Set<String> names) {
        return new ParserConfig(flatTree, topLevelCount, topLevelKind, selfClosingNames, names,
                                recoverInvalidBlocks, strictMode, blockTransform, maxNestingDepth, hostParser);
    }

    public ParserConfig withRecoverInvalidBlocks(boolean recover) {
        return new ParserConfig(flatTree, topLevelCount, topLevelKind, selfClosingNames, rawTextNames,
                                recover, strictMode, blockTransform, maxNestingDepth, hostParser);
    }

    public ParserConfig withStrictMode(boolean strict) {
        return new ParserConfig(flatTree, topLevelCount, topLevelKind, selfClosingNames, rawTextNames,
                                recoverInvalidBlocks, strict, blockTransform, maxNestingDepth, hostParser);
    }

    public ParserConfig withBlockTransform(BlockTransform transform) {
        return new ParserConfig(flatTree, topLevelCount, topLevelKind, selfClosingNames, rawTextNames,
                                recoverInvalidBlocks, strictMode, Optional.of(transform), maxNestingDepth, hostParser);
    }

    public ParserConfig withMaxNestingDepth(int depth) {
        return new ParserConfig(flatTree, topLevelCount, topLevelKind, selfClosingNames, rawTextNames,
                                recoverInvalidBlocks, strictMode, blockTransform, depth, hostParser);
    }

    public ParserConfig withHostParser(HostExpressionParser parser) {
        return new ParserConfig(flatTree, topLevelCount, topLevelKind, selfClosingNames, rawTextNames,
                                recoverInvalidBlocks, strictMode, blockTransform, maxNestingDepth, parser);
    }
}
