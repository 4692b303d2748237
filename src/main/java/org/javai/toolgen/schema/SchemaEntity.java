package org.javai.toolgen.schema;

/**
 * A node of the schema tree that tools can be generated for.
 */
public sealed interface SchemaEntity permits Container, ListNode, Rpc {

	String name();

	String description();

	static void requireName(String name) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Schema node name must not be blank");
		}
	}
}
