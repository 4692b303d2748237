package org.javai.toolgen.reflect;

import java.util.Objects;
import org.javai.toolgen.schema.Container;
import org.javai.toolgen.schema.ListNode;
import org.javai.toolgen.schema.SchemaEntity;

/**
 * A top-level subtree found on the live root.
 *
 * @param name the subtree name
 * @param kind service or plain configuration
 * @param entity the subtree's structure, a {@link Container} or a {@link ListNode}
 * @param capabilities what the probes reported for the subtree root
 */
public record DiscoveredFragment(
		String name,
		FragmentKind kind,
		SchemaEntity entity,
		NodeCapabilities capabilities
) {

	public DiscoveredFragment {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(entity, "entity must not be null");
		if (!(entity instanceof Container) && !(entity instanceof ListNode)) {
			throw new IllegalArgumentException("Fragment '" + name + "' must be a container or a list");
		}
	}

	public boolean isService() {
		return kind == FragmentKind.SERVICE;
	}
}
