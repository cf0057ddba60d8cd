package org.pragmatica.rsx.tree;

/**
 * Fragment close marker {@code </>}; {@code start} is the span of its {@code <}.
 */
public record FragmentClose(SourceSpan span, SourceSpan start) {}
