package org.javai.toolgen.tool;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.toolgen.schema.Parameter;
import org.javai.toolgen.schema.SchemaEntity;

/**
 * A generated operation descriptor: one callable tool.
 *
 * @param name unique tool name, e.g. {@code add_m_endpoint_item}
 * @param description what the tool does
 * @param parameters call parameters, identity first, required before optional
 * @param source the schema entity the tool operates on
 * @param scopePath dotted path from the module to the entity's parent, e.g. {@code m.a}
 * @param operation the operation kind
 * @param result the result shape of an invoke tool (rpc output); empty otherwise
 */
public record ToolSpec(
		String name,
		String description,
		List<Parameter> parameters,
		SchemaEntity source,
		String scopePath,
		OperationKind operation,
		List<Parameter> result
) {

	public ToolSpec {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Tool name must not be blank");
		}
		Objects.requireNonNull(source, "source must not be null");
		Objects.requireNonNull(operation, "operation must not be null");
		description = description != null ? description : "";
		parameters = parameters != null ? List.copyOf(parameters) : List.of();
		scopePath = scopePath != null ? scopePath : "";
		result = result != null ? List.copyOf(result) : List.of();
	}

	public Optional<Parameter> parameter(String parameterName) {
		return parameters.stream().filter(p -> p.name().equals(parameterName)).findFirst();
	}

	public List<String> parameterNames() {
		return parameters.stream().map(Parameter::name).toList();
	}
}
