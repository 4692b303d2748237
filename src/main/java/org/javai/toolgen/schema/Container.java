package org.javai.toolgen.schema;

import java.util.List;

/**
 * A named grouping node without repetition semantics.
 */
public record Container(
		String name,
		String description,
		List<Parameter> parameters,
		List<Container> containers,
		List<ListNode> lists
) implements SchemaEntity {

	public Container {
		SchemaEntity.requireName(name);
		description = description != null ? description : "";
		parameters = parameters != null ? List.copyOf(parameters) : List.of();
		containers = containers != null ? List.copyOf(containers) : List.of();
		lists = lists != null ? List.copyOf(lists) : List.of();
	}

	public static Container empty(String name, String description) {
		return new Container(name, description, List.of(), List.of(), List.of());
	}
}
