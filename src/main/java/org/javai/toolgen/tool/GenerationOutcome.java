package org.javai.toolgen.tool;

import java.util.List;
import org.javai.toolgen.diag.Diagnostic;

/**
 * Tools generated for one module, with the diagnostics raised on the way.
 */
public record GenerationOutcome(List<ToolSpec> tools, List<Diagnostic> diagnostics) {

	public GenerationOutcome {
		tools = tools != null ? List.copyOf(tools) : List.of();
		diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
	}
}
