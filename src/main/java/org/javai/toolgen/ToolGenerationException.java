package org.javai.toolgen;

import java.util.List;
import org.javai.toolgen.diag.Diagnostic;

/**
 * Thrown when a caller asks for a clean run and the run was not clean, or when the
 * configuration cannot be loaded.
 */
public class ToolGenerationException extends RuntimeException {

	private final List<Diagnostic> diagnostics;

	public ToolGenerationException(String message) {
		this(message, null, List.of());
	}

	public ToolGenerationException(String message, Throwable cause) {
		this(message, cause, List.of());
	}

	public ToolGenerationException(String message, Throwable cause, List<Diagnostic> diagnostics) {
		super(message, cause);
		this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
	}

	/**
	 * @return the diagnostics of the failed run, possibly empty
	 */
	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}
}
