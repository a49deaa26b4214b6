package org.querylex.sql2.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the non-fatal diagnostics raised while scanning a single statement.
 * <p>
 * Fatal problems are reported by throwing an {@link org.querylex.sql2.api.InvalidQueryException};
 * this engine only records what the scanner chose to tolerate.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a warning.
     *
     * @param message   The warning message.
     * @param statement The statement being scanned.
     * @param offset    The offset at which the problem starts.
     */
    public void reportWarning(String message, String statement, int offset) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, statement, offset));
    }

    /**
     * @return true if at least one warning has been reported.
     */
    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }

    /**
     * @return An unmodifiable view of all collected diagnostics, in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return One line per diagnostic, or an empty string if there are none.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
