package org.javai.toolgen.schema;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The five canonical parameter types every schema type is reduced to.
 */
public enum ParameterType {
	STRING,
	INTEGER,
	BOOLEAN,
	NUMBER,
	ARRAY;

	/**
	 * @return the lower-case name used in manifests and JSON schemas
	 */
	public String wireName() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Whether the given default value has the Java representation this type uses:
	 * {@link String}, {@link Long} ({@link BigInteger} beyond its range), {@link Boolean}, {@link Double}
	 * or a {@link List} of strings.
	 */
	public boolean accepts(Object value) {
		return switch (this) {
			case STRING -> value instanceof String;
			case INTEGER -> value instanceof Long || value instanceof BigInteger;
			case BOOLEAN -> value instanceof Boolean;
			case NUMBER -> value instanceof Double;
			case ARRAY -> value instanceof List<?> list && list.stream().allMatch(String.class::isInstance);
		};
	}

	/**
	 * Converts a literal taken from schema text into this type's representation.
	 *
	 * @return the converted value, or empty when the literal does not fit
	 */
	public Optional<Object> convert(String literal) {
		if (literal == null) {
			return Optional.empty();
		}
		String text = literal.trim();
		return switch (this) {
			case STRING -> Optional.of(literal);
			case ARRAY -> Optional.of(List.of(literal));
			case BOOLEAN -> {
				if ("true".equals(text)) {
					yield Optional.of(Boolean.TRUE);
				}
				if ("false".equals(text)) {
					yield Optional.of(Boolean.FALSE);
				}
				yield Optional.empty();
			}
			case INTEGER -> {
				try {
					BigInteger value = new BigInteger(text);
					yield Optional.of(value.bitLength() < Long.SIZE ? (Object) value.longValue() : value);
				} catch (NumberFormatException e) {
					yield Optional.empty();
				}
			}
			case NUMBER -> {
				try {
					double value = Double.parseDouble(text);
					yield Double.isFinite(value) ? Optional.of(value) : Optional.empty();
				} catch (NumberFormatException e) {
					yield Optional.empty();
				}
			}
		};
	}
}
