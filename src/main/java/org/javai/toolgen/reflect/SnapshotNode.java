package org.javai.toolgen.reflect;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link NavigableNode} over a JSON snapshot of a configuration tree.
 *
 * <p>Objects are containers, their fields children. An object carrying {@code "@key"}
 * is a keyed list whose instances are the objects in {@code "@entries"}; an array of
 * objects is a list without a key. {@code "@create"} and {@code "@delete"} flag the
 * capabilities (both default to {@code false}). Scalars and arrays of scalars are leafs.
 * Fields starting with {@code @} are metadata and never children.</p>
 *
 * <pre>
 * {
 *   "@module": "lab",
 *   "ospf": {
 *     "@key": "name", "@create": true, "@delete": true,
 *     "@entries": [ { "name": "core", "area": 0, "passive": false } ]
 *   }
 * }
 * </pre>
 */
public final class SnapshotNode implements NavigableNode {

	public static final String MODULE = "@module";
	public static final String KEY = "@key";
	public static final String ENTRIES = "@entries";
	public static final String CREATE = "@create";
	public static final String DELETE = "@delete";

	private final String name;
	private final JsonNode value;

	private SnapshotNode(String name, JsonNode value) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.value = Objects.requireNonNull(value, "value must not be null");
	}

	public static SnapshotNode of(String name, JsonNode value) {
		return new SnapshotNode(name, value);
	}

	/**
	 * @return the {@code "@module"} field of a snapshot root, or the fallback
	 */
	public static String moduleName(JsonNode tree, String fallback) {
		JsonNode module = tree.path(MODULE);
		return module.isTextual() && !module.textValue().isBlank() ? module.textValue() : fallback;
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public List<NavigableNode> children() {
		if (!value.isObject() || isKeyed()) {
			return List.of();
		}
		List<NavigableNode> children = new ArrayList<>();
		Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			if (!field.getKey().startsWith("@")) {
				children.add(new SnapshotNode(field.getKey(), field.getValue()));
			}
		}
		return children;
	}

	@Override
	public boolean isKeyed() {
		return (value.isObject() && value.has(KEY)) || isArrayOfObjects();
	}

	@Override
	public String keyName() {
		JsonNode key = value.path(KEY);
		return key.isTextual() ? key.textValue() : null;
	}

	@Override
	public List<NavigableNode> entries() {
		JsonNode entries = value.isArray() ? value : value.path(ENTRIES);
		List<NavigableNode> result = new ArrayList<>();
		for (JsonNode entry : entries) {
			if (entry.isObject()) {
				result.add(new SnapshotNode(name, entry));
			}
		}
		return result;
	}

	@Override
	public boolean supportsCreate() {
		return value.path(CREATE).asBoolean(false);
	}

	@Override
	public boolean supportsDelete() {
		return value.path(DELETE).asBoolean(false);
	}

	@Override
	public Object scalarValue() {
		if (value.isArray() && !isArrayOfObjects()) {
			List<String> items = new ArrayList<>();
			value.forEach(item -> items.add(item.asText()));
			return items;
		}
		if (!value.isValueNode() || value.isNull()) {
			return null;
		}
		if (value.isBoolean()) {
			return value.booleanValue();
		}
		if (value.isIntegralNumber()) {
			return value.canConvertToLong() ? (Object) value.longValue() : value.bigIntegerValue();
		}
		if (value.isNumber()) {
			return value.doubleValue();
		}
		return value.asText();
	}

	private boolean isArrayOfObjects() {
		return value.isArray() && !value.isEmpty() && value.get(0).isObject();
	}

	@Override
	public String toString() {
		return "SnapshotNode[" + name + "]";
	}
}
