package org.javai.toolgen.schema;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A keyed, repeating entity.
 *
 * @param name schema name
 * @param description free text
 * @param key whitespace-separated key leaf names, or {@code null} for an unkeyed list
 * @param parameters every leaf of the list entry, key leafs included
 * @param containers nested containers
 * @param lists nested lists
 */
public record ListNode(
		String name,
		String description,
		String key,
		List<Parameter> parameters,
		List<Container> containers,
		List<ListNode> lists
) implements SchemaEntity {

	public ListNode {
		SchemaEntity.requireName(name);
		description = description != null ? description : "";
		key = key != null && !key.isBlank() ? key.trim() : null;
		parameters = parameters != null ? List.copyOf(parameters) : List.of();
		containers = containers != null ? List.copyOf(containers) : List.of();
		lists = lists != null ? List.copyOf(lists) : List.of();
		if (key != null) {
			Set<String> names = parameters.stream().map(Parameter::name).collect(Collectors.toSet());
			for (String keyName : key.split("\\s+")) {
				if (!names.contains(keyName)) {
					throw new IllegalArgumentException(
							"Key '%s' of list '%s' is not one of its parameters".formatted(keyName, name));
				}
			}
		}
	}

	public boolean isKeyed() {
		return key != null;
	}

	/**
	 * @return key leaf names in declaration order, empty for an unkeyed list
	 */
	public List<String> keyNames() {
		return key == null ? List.of() : Arrays.asList(key.split("\\s+"));
	}

	public boolean isKey(Parameter parameter) {
		return keyNames().contains(parameter.name());
	}
}
