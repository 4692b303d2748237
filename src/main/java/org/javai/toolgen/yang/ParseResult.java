package org.javai.toolgen.yang;

import java.util.List;
import java.util.Objects;
import org.javai.toolgen.diag.Diagnostic;
import org.javai.toolgen.schema.SchemaModule;

/**
 * Outcome of parsing one schema text. Always carries a module, possibly empty.
 */
public record ParseResult(SchemaModule module, List<Diagnostic> diagnostics) {

	public ParseResult {
		Objects.requireNonNull(module, "module must not be null");
		diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
	}

	public boolean hasErrors() {
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}
}
