package org.javai.toolgen.diag;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;

/**
 * Accumulates diagnostics for one pass. Not thread-safe; each pass owns its own instance.
 */
public final class Diagnostics {

	private final List<Diagnostic> entries = new ArrayList<>();
	private final Logger logger;

	/**
	 * @param logger where WARNING and ERROR entries are echoed; may be {@code null} for silence
	 */
	public Diagnostics(Logger logger) {
		this.logger = logger;
	}

	public Diagnostic report(DiagnosticKind kind, String location, String message) {
		return add(Diagnostic.of(kind, location, message));
	}

	public Diagnostic add(Diagnostic diagnostic) {
		entries.add(diagnostic);
		if (logger != null) {
			switch (diagnostic.severity()) {
				case ERROR, WARNING -> logger.warn("{}", diagnostic);
				case INFO -> logger.debug("{}", diagnostic);
			}
		}
		return diagnostic;
	}

	public void addAll(Collection<Diagnostic> diagnostics) {
		diagnostics.forEach(this::add);
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public boolean hasErrors() {
		return entries.stream().anyMatch(Diagnostic::isError);
	}

	/**
	 * @return an immutable snapshot in report order
	 */
	public List<Diagnostic> toList() {
		return List.copyOf(entries);
	}
}
