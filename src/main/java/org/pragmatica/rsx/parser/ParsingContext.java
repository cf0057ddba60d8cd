package org.pragmatica.rsx.parser;

import org.pragmatica.rsx.error.Diagnostic;
import org.pragmatica.rsx.error.DiagnosticKind;
import org.pragmatica.rsx.error.SyntaxException;
import org.pragmatica.rsx.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mutable state of one parse call: the configuration, the diagnostics sink and the nesting depth.
 * A context is created per call and never shared.
 */
public final class ParsingContext {
    private final ParserConfig config;
    private final List<Diagnostic> diagnostics;
    private boolean aborted;
    private int depth;

    private ParsingContext(ParserConfig config) {
        this.config = config;
        this.diagnostics = new ArrayList<>();
    }

    public static ParsingContext create(ParserConfig config) {
        return new ParsingContext(config);
    }

    public ParserConfig config() {
        return config;
    }

    // === Diagnostics ===

    /**
     * Record a diagnostic and continue. In strict mode the first diagnostic aborts the parse;
     * once aborted, further diagnostics are dropped.
     */
    public void record(Diagnostic diagnostic) {
        if (aborted) {
            return;
        }
        diagnostics.add(diagnostic);
        if (config.strictMode()) {
            aborted = true;
        }
    }

    public void record(DiagnosticKind kind, String message, SourceSpan span) {
        record(Diagnostic.error(kind, message, span));
    }

    /**
     * Record a diagnostic and stop the parse.
     */
    public void recordAndAbort(Diagnostic diagnostic) {
        record(diagnostic);
        aborted = true;
    }

    /**
     * Record a token-level error as a diagnostic of the given kind.
     */
    public void save(SyntaxException error, DiagnosticKind kind) {
        record(error.toDiagnostic(kind));
    }

    /**
     * Run a sub-parse, converting its failure into a diagnostic.
     */
    public <T> Optional<T> attempt(DiagnosticKind kind, SubParse<T> parse) {
        try{
            return Optional.of(parse.run());
        } catch (SyntaxException e) {
            save(e, kind);
            return Optional.empty();
        }
    }

    @FunctionalInterface
    public interface SubParse<T> {
        T run() throws SyntaxException;
    }

    public boolean isAborted() {
        return aborted;
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    // === Nesting ===

    /**
     * Enter an element or fragment. Returns false, and aborts the parse, when the depth limit is exceeded.
     */
    public boolean enter(SourceSpan span) {
        if (depth >= config.maxNestingDepth()) {
            recordAndAbort(Diagnostic.error(DiagnosticKind.NESTING_TOO_DEEP,
                                            "nesting is deeper than " + config.maxNestingDepth() + " levels",
                                            span)
                                     .withHelp("flatten the markup or raise the maximum nesting depth"));
            return false;
        }
        depth++ ;
        return true;
    }

    public void exit() {
        depth--;
    }

    public int depth() {
        return depth;
    }
}
