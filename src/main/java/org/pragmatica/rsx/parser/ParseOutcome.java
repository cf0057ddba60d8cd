package org.pragmatica.rsx.parser;

import org.pragmatica.rsx.error.Diagnostic;
import org.pragmatica.rsx.error.RsxParseException;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a recoverable parse.
 *
 * <p>{@link Ok} carries a value built without errors, {@link Partial} a best-effort value plus the diagnostics
 * recorded while building it, and {@link Failed} only diagnostics.
 */
public sealed interface ParseOutcome<T> {

    /**
     * Value, if one was produced.
     */
    Optional<T> value();

    /**
     * Diagnostics in the order they were recorded; empty for {@link Ok}.
     */
    List<Diagnostic> diagnostics();

    record Ok<T>(T result) implements ParseOutcome<T> {
        @Override
        public Optional<T> value() {
            return Optional.of(result);
        }

        @Override
        public List<Diagnostic> diagnostics() {
            return List.of();
        }
    }

    record Partial<T>(T result, List<Diagnostic> diagnostics) implements ParseOutcome<T> {
        public Partial {
            diagnostics = List.copyOf(diagnostics);
        }

        @Override
        public Optional<T> value() {
            return Optional.of(result);
        }
    }

    record Failed<T>(List<Diagnostic> diagnostics) implements ParseOutcome<T> {
        public Failed {
            diagnostics = List.copyOf(diagnostics);
            if (diagnostics.isEmpty()) {
                throw new IllegalArgumentException("Failed outcome requires at least one diagnostic");
            }
        }

        @Override
        public Optional<T> value() {
            return Optional.empty();
        }
    }

    /**
     * Value and diagnostics taken apart.
     */
    record Split<T>(Optional<T> value, List<Diagnostic> diagnostics) {}

    static <T> ParseOutcome<T> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * Assemble an outcome: a value without diagnostics is {@link Ok}, a value with diagnostics is {@link Partial},
     * and diagnostics alone are {@link Failed}.
     *
     * @throws IllegalArgumentException when there is neither a value nor a diagnostic
     */
    static <T> ParseOutcome<T> fromParts(Optional<T> value, List<Diagnostic> diagnostics) {
        if (value.isPresent()) {
            return diagnostics.isEmpty()
                   ? new Ok<>(value.get())
                   : new Partial<>(value.get(), diagnostics);
        }
        return new Failed<>(diagnostics);
    }

    default Split<T> split() {
        return new Split<>(value(), diagnostics());
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean hasErrors() {
        return diagnostics().stream()
                            .anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    default <R> ParseOutcome<R> map(Function<? super T, ? extends R> mapper) {
        return fromParts(value().map(mapper), diagnostics());
    }

    /**
     * Strict view: the value when no diagnostic was recorded, otherwise the first diagnostic as an exception.
     */
    default T orElseThrow() throws RsxParseException {
        if (this instanceof Ok<T> ok) {
            return ok.result();
        }
        throw new RsxParseException(diagnostics().get(0));
    }

    /**
     * Format all diagnostics in Rust style.
     */
    default String formatDiagnostics(String source, String filename) {
        var sb = new StringBuilder();
        for (var diagnostic : diagnostics()) {
            sb.append(diagnostic.format(source, filename));
            sb.append("\n");
        }
        return sb.toString();
    }
}
