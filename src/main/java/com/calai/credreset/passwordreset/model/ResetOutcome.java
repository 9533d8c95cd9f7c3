package com.calai.credreset.passwordreset.model;

/**
 * What verify / reset hand to the response layer. There is exactly one
 * response-building path per operation, and it reads only this.
 *
 * @param message user-facing error text; defaults to the state's message
 * @param verdict the diagnostics exactly as the token state machine produced them;
 *                later steps may change state and reason but never the token facts
 */
public record ResetOutcome(ResetState state, ResetDiagnostics diagnostics, String message, ResetDiagnostics verdict) {

    public static ResetOutcome of(ResetDiagnostics diagnostics) {
        return derived(diagnostics, diagnostics, null);
    }

    public static ResetOutcome of(ResetDiagnostics diagnostics, String message) {
        return derived(diagnostics, diagnostics, message);
    }

    /** Outcome decided after the state machine (policy, consume, update). */
    public static ResetOutcome derived(ResetDiagnostics verdict, ResetDiagnostics diagnostics) {
        return derived(verdict, diagnostics, null);
    }

    public static ResetOutcome derived(ResetDiagnostics verdict, ResetDiagnostics diagnostics, String message) {
        return new ResetOutcome(diagnostics.state(), diagnostics,
                message == null ? diagnostics.state().message() : message, verdict);
    }

    public boolean isOk() {
        return state.isOk();
    }
}
