package org.pragmatica.rsx.tree;

/**
 * Close tag {@code </name>}; {@code start} is the span of its {@code <}.
 */
public record CloseTag(NodeName name, SourceSpan span, SourceSpan start) {}
