package org.javai.toolgen.diag;

import java.util.Objects;

/**
 * A non-fatal problem found in the input.
 *
 * @param kind what went wrong
 * @param severity how serious it is
 * @param location a hint to where it happened, e.g. {@code line 12, column 5} or a node path
 * @param message human-readable detail
 */
public record Diagnostic(DiagnosticKind kind, Severity severity, String location, String message) {

	public Diagnostic {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(message, "message must not be null");
		if (severity == null) {
			severity = kind.defaultSeverity();
		}
		if (location == null) {
			location = "";
		}
	}

	public static Diagnostic of(DiagnosticKind kind, String location, String message) {
		return new Diagnostic(kind, kind.defaultSeverity(), location, message);
	}

	public boolean isError() {
		return severity == Severity.ERROR;
	}

	@Override
	public String toString() {
		String where = location.isEmpty() ? "" : " at " + location;
		return severity + " " + kind + where + ": " + message;
	}
}
