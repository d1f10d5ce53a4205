package org.mmlc.compiler.diagnostics;

import org.mmlc.compiler.api.SourceSpan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting the semantic errors of one compilation.
 * <p>
 * This decouples error reporting from the stages producing them. Stages may report in any
 * order; {@link #sorted()} always yields the same order for the same input.
 */
public class DiagnosticsEngine {

    private final List<SemanticError> errors = new ArrayList<>();

    /**
     * Reports an error.
     * @param error The error.
     */
    public void report(SemanticError error) {
        errors.add(error);
    }

    /**
     * Reports several errors.
     * @param newErrors The errors.
     */
    public void reportAll(Collection<? extends SemanticError> newErrors) {
        errors.addAll(newErrors);
    }

    /**
     * Checks if errors have been reported.
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @return The number of reported errors.
     */
    public int count() {
        return errors.size();
    }

    /**
     * Returns all errors ordered by source span. The sort is stable, so errors at the same
     * span keep the order in which the stages reported them.
     * @return An unmodifiable, sorted list.
     */
    public List<SemanticError> sorted() {
        return errors.stream()
                .sorted(Comparator.comparing(SemanticError::span, SourceSpan::compareTo))
                .toList();
    }

    /**
     * Returns all collected errors as a single, formatted string in source order.
     * @return One line per error.
     */
    public String summary() {
        return sorted().stream()
                .map(DiagnosticsEngine::render)
                .collect(Collectors.joining("\n"));
    }

    /**
     * Renders one error as {@code [ERROR] file:line:col: message (stage)}.
     * @param error The error.
     * @return The rendered line.
     */
    public static String render(SemanticError error) {
        return String.format("[ERROR] %s: %s (%s)", error.span(), error.message(), shortPhase(error.phase()));
    }

    private static String shortPhase(String phase) {
        int dot = phase.lastIndexOf('.');
        return dot < 0 ? phase : phase.substring(dot + 1);
    }
}
