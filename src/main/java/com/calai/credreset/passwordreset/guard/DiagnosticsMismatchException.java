package com.calai.credreset.passwordreset.guard;

import java.util.List;

/**
 * The response about to be sent disagrees with the decision that produced it.
 * Thrown only when {@code app.password-reset.diagnostics.fail-on-mismatch=true}.
 */
public class DiagnosticsMismatchException extends IllegalStateException {

    private final List<String> fields;

    public DiagnosticsMismatchException(String requestId, List<String> fields) {
        super("RESET_DIAGNOSTICS_MISMATCH rid=" + requestId + " fields=" + fields);
        this.fields = List.copyOf(fields);
    }

    public List<String> fields() { return fields; }
}
