package org.javai.toolgen.reflect;

import java.util.Objects;

/**
 * What the probes found out about one live node.
 *
 * @param name node name
 * @param kind classification
 * @param keyName key leaf name(s) of a list, or {@code null}
 * @param supportsCreate whether the node accepts new instances
 * @param supportsDelete whether the node can be deleted
 */
public record NodeCapabilities(
		String name,
		NodeKind kind,
		String keyName,
		boolean supportsCreate,
		boolean supportsDelete
) {

	public NodeCapabilities {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
		keyName = keyName != null && !keyName.isBlank() ? keyName.trim() : null;
	}

	public boolean isKeyed() {
		return kind == NodeKind.LIST;
	}
}
