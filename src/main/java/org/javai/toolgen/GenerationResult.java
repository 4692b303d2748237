package org.javai.toolgen;

import java.util.List;
import java.util.Objects;
import org.javai.toolgen.diag.Diagnostic;
import org.javai.toolgen.emit.ToolDefinitionAdapter;
import org.javai.toolgen.schema.SchemaModule;
import org.javai.toolgen.tool.ToolSpec;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Everything one pipeline run produced.
 *
 * @param module the schema the tools were generated from
 * @param tools the generated tools, in generation order
 * @param pythonSource the rendered tool module
 * @param manifest the rendered JSON manifest
 * @param diagnostics problems from every stage, in the order they were found
 */
public record GenerationResult(
		SchemaModule module,
		List<ToolSpec> tools,
		String pythonSource,
		String manifest,
		List<Diagnostic> diagnostics
) {

	public GenerationResult {
		Objects.requireNonNull(module, "module must not be null");
		tools = tools != null ? List.copyOf(tools) : List.of();
		pythonSource = pythonSource != null ? pythonSource : "";
		manifest = manifest != null ? manifest : "";
		diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
	}

	public boolean hasErrors() {
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}

	/**
	 * @return this result when it carries no ERROR diagnostics
	 * @throws ToolGenerationException otherwise
	 */
	public GenerationResult requireClean() {
		if (hasErrors()) {
			long errors = diagnostics.stream().filter(Diagnostic::isError).count();
			throw new ToolGenerationException(
					"Generation for module '%s' reported %d error(s)".formatted(module.name(), errors),
					null, diagnostics);
		}
		return this;
	}

	public List<ToolDefinition> toolDefinitions() {
		return ToolDefinitionAdapter.toToolDefinitions(tools);
	}
}
