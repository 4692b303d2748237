package org.javai.toolgen.schema;

import java.util.List;
import java.util.Objects;

/**
 * A leaf: one scalar (or leaf-list) configuration value.
 *
 * <p>Leafs built by the parsers never carry a default when they are required. Generated
 * tool parameters may, see the {@code confirm} flag of delete tools.</p>
 *
 * @param name schema name of the leaf
 * @param type canonical type
 * @param description free text, never {@code null}
 * @param required whether a caller must supply a value
 * @param defaultValue typed default ({@link ParameterType#accepts(Object)}), or {@code null}
 * @param choices enumerated values in declaration order; only allowed for strings
 * @param range numeric range expression such as {@code "1..65535"}, or {@code null}
 */
public record Parameter(
		String name,
		ParameterType type,
		String description,
		boolean required,
		Object defaultValue,
		List<String> choices,
		String range
) {

	public Parameter {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Parameter name must not be blank");
		}
		Objects.requireNonNull(type, "type must not be null");
		description = description != null ? description : "";
		choices = choices != null ? List.copyOf(choices) : List.of();
		if (!choices.isEmpty() && type != ParameterType.STRING) {
			throw new IllegalArgumentException(
					"Parameter '%s' has choices but type %s; choices require string".formatted(name, type.wireName()));
		}
		if (defaultValue != null && !type.accepts(defaultValue)) {
			throw new IllegalArgumentException(
					"Default %s of parameter '%s' does not match type %s".formatted(defaultValue, name, type.wireName()));
		}
		if (defaultValue instanceof List<?> list) {
			defaultValue = List.copyOf(list);
		}
	}

	/**
	 * Shorthand for an optional leaf with no default and no constraints.
	 */
	public static Parameter of(String name, ParameterType type, String description) {
		return new Parameter(name, type, description, false, null, List.of(), null);
	}

	public boolean hasDefault() {
		return defaultValue != null;
	}

	public Parameter withName(String newName) {
		return new Parameter(newName, type, description, required, defaultValue, choices, range);
	}

	/**
	 * @return a required copy; the default is dropped because a required value has no fallback
	 */
	public Parameter asRequired() {
		return new Parameter(name, type, description, true, null, choices, range);
	}

	public Parameter asOptional() {
		return new Parameter(name, type, description, false, defaultValue, choices, range);
	}
}
