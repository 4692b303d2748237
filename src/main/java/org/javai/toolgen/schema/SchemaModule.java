package org.javai.toolgen.schema;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * The root of a schema tree, produced by either the text parser or the reflective analyzer.
 *
 * <p>Groupings are kept apart from the tree: they are not expanded.</p>
 */
public record SchemaModule(
		String name,
		String namespace,
		String prefix,
		String description,
		List<Container> containers,
		List<ListNode> lists,
		List<Rpc> rpcs,
		List<Parameter> parameters,
		List<Container> groupings
) {

	public SchemaModule {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Module name must not be blank");
		}
		description = description != null ? description : "";
		containers = containers != null ? List.copyOf(containers) : List.of();
		lists = lists != null ? List.copyOf(lists) : List.of();
		rpcs = rpcs != null ? List.copyOf(rpcs) : List.of();
		parameters = parameters != null ? List.copyOf(parameters) : List.of();
		groupings = groupings != null ? List.copyOf(groupings) : List.of();
		Set<String> seen = new HashSet<>();
		Stream.of(containers.stream().map(Container::name), lists.stream().map(ListNode::name),
						rpcs.stream().map(Rpc::name), parameters.stream().map(Parameter::name))
				.flatMap(s -> s)
				.forEach(child -> {
					if (!seen.add(child)) {
						throw new IllegalArgumentException(
								"Duplicate child '%s' in module '%s'".formatted(child, name));
					}
				});
	}

	public static SchemaModule empty(String name) {
		return new SchemaModule(name, null, null, "", List.of(), List.of(), List.of(), List.of(), List.of());
	}

	public boolean isEmpty() {
		return containers.isEmpty() && lists.isEmpty() && rpcs.isEmpty() && parameters.isEmpty();
	}
}
