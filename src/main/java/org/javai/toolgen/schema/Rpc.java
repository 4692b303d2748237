package org.javai.toolgen.schema;

import java.util.List;

/**
 * A named procedure. Output parameters describe the result shape only.
 */
public record Rpc(
		String name,
		String description,
		List<Parameter> input,
		List<Parameter> output
) implements SchemaEntity {

	public Rpc {
		SchemaEntity.requireName(name);
		description = description != null ? description : "";
		input = input != null ? List.copyOf(input) : List.of();
		output = output != null ? List.copyOf(output) : List.of();
	}
}
