package org.javai.toolgen.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reduces schema type tokens and live sample values to {@link ParameterType}s.
 */
public final class TypeMapping {

	private static final Map<String, ParameterType> BUILT_IN = Map.ofEntries(
			Map.entry("string", ParameterType.STRING),
			Map.entry("binary", ParameterType.STRING),
			Map.entry("bits", ParameterType.STRING),
			Map.entry("enumeration", ParameterType.STRING),
			Map.entry("union", ParameterType.STRING),
			Map.entry("identityref", ParameterType.STRING),
			Map.entry("instance-identifier", ParameterType.STRING),
			Map.entry("leafref", ParameterType.STRING),
			Map.entry("int8", ParameterType.INTEGER),
			Map.entry("int16", ParameterType.INTEGER),
			Map.entry("int32", ParameterType.INTEGER),
			Map.entry("int64", ParameterType.INTEGER),
			Map.entry("uint8", ParameterType.INTEGER),
			Map.entry("uint16", ParameterType.INTEGER),
			Map.entry("uint32", ParameterType.INTEGER),
			Map.entry("uint64", ParameterType.INTEGER),
			Map.entry("boolean", ParameterType.BOOLEAN),
			Map.entry("empty", ParameterType.BOOLEAN),
			Map.entry("decimal64", ParameterType.NUMBER)
	);

	// ietf-inet-types and ietf-yang-types, matched after the prefix is stripped
	private static final Map<String, ParameterType> WELL_KNOWN = Map.ofEntries(
			Map.entry("ip-address", ParameterType.STRING),
			Map.entry("ipv4-address", ParameterType.STRING),
			Map.entry("ipv6-address", ParameterType.STRING),
			Map.entry("ip-prefix", ParameterType.STRING),
			Map.entry("ipv4-prefix", ParameterType.STRING),
			Map.entry("ipv6-prefix", ParameterType.STRING),
			Map.entry("ip-address-no-zone", ParameterType.STRING),
			Map.entry("domain-name", ParameterType.STRING),
			Map.entry("host", ParameterType.STRING),
			Map.entry("uri", ParameterType.STRING),
			Map.entry("mac-address", ParameterType.STRING),
			Map.entry("phys-address", ParameterType.STRING),
			Map.entry("date-and-time", ParameterType.STRING),
			Map.entry("object-identifier", ParameterType.STRING),
			Map.entry("yang-identifier", ParameterType.STRING),
			Map.entry("port-number", ParameterType.INTEGER),
			Map.entry("as-number", ParameterType.INTEGER),
			Map.entry("dscp", ParameterType.INTEGER),
			Map.entry("ipv6-flow-label", ParameterType.INTEGER),
			Map.entry("counter32", ParameterType.INTEGER),
			Map.entry("counter64", ParameterType.INTEGER),
			Map.entry("gauge32", ParameterType.INTEGER),
			Map.entry("gauge64", ParameterType.INTEGER),
			Map.entry("timeticks", ParameterType.INTEGER),
			Map.entry("timestamp", ParameterType.INTEGER)
	);

	private TypeMapping() {
	}

	/**
	 * @param token a type token as written in the schema, possibly prefixed ({@code inet:ipv4-address})
	 * @return the canonical type, or empty when the token is unknown
	 */
	public static Optional<ParameterType> forToken(String token) {
		if (token == null || token.isBlank()) {
			return Optional.empty();
		}
		ParameterType builtIn = BUILT_IN.get(token);
		if (builtIn != null) {
			return Optional.of(builtIn);
		}
		int colon = token.indexOf(':');
		String local = colon >= 0 ? token.substring(colon + 1) : token;
		return Optional.ofNullable(WELL_KNOWN.get(local));
	}

	/**
	 * Whether the token names a YANG built-in type (as opposed to a typedef).
	 */
	public static boolean isBuiltIn(String token) {
		return BUILT_IN.containsKey(token);
	}

	/**
	 * Types a live value by its runtime kind.
	 *
	 * @return the canonical type, or empty when there is no sample to inspect
	 */
	public static Optional<ParameterType> forSample(Object sample) {
		if (sample == null) {
			return Optional.empty();
		}
		if (sample instanceof Boolean) {
			return Optional.of(ParameterType.BOOLEAN);
		}
		if (sample instanceof Long || sample instanceof Integer || sample instanceof Short
				|| sample instanceof Byte || sample instanceof BigInteger
				|| sample instanceof AtomicInteger || sample instanceof AtomicLong) {
			return Optional.of(ParameterType.INTEGER);
		}
		if (sample instanceof Double || sample instanceof Float || sample instanceof BigDecimal) {
			return Optional.of(ParameterType.NUMBER);
		}
		if (sample instanceof Collection<?> || sample.getClass().isArray()) {
			return Optional.of(ParameterType.ARRAY);
		}
		return Optional.of(ParameterType.STRING);
	}
}
