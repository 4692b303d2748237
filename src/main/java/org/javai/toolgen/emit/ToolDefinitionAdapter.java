package org.javai.toolgen.emit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.util.List;
import org.javai.toolgen.schema.Parameter;
import org.javai.toolgen.schema.ParameterType;
import org.javai.toolgen.tool.ToolSpec;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Exposes generated tools to Spring AI as {@link ToolDefinition}s whose input schema is a
 * JSON Schema object derived from the tool parameters.
 */
public final class ToolDefinitionAdapter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private ToolDefinitionAdapter() {
	}

	public static List<ToolDefinition> toToolDefinitions(List<ToolSpec> tools) {
		return tools.stream().map(ToolDefinitionAdapter::toToolDefinition).toList();
	}

	public static ToolDefinition toToolDefinition(ToolSpec tool) {
		return DefaultToolDefinition.builder()
				.name(tool.name())
				.description(tool.description())
				.inputSchema(inputSchema(tool).toString())
				.build();
	}

	public static ObjectNode inputSchema(ToolSpec tool) {
		ObjectNode schema = mapper.createObjectNode();
		schema.put("$schema", "https://json-schema.org/draft/2020-12/schema");
		schema.put("type", "object");
		ObjectNode properties = schema.putObject("properties");
		ArrayNode required = schema.putArray("required");
		for (Parameter parameter : tool.parameters()) {
			properties.set(parameter.name(), propertySchema(parameter));
			if (parameter.required()) {
				required.add(parameter.name());
			}
		}
		schema.put("additionalProperties", false);
		return schema;
	}

	private static ObjectNode propertySchema(Parameter parameter) {
		ObjectNode property = mapper.createObjectNode();
		property.put("type", parameter.type().wireName());
		if (!parameter.description().isBlank()) {
			property.put("description", parameter.description());
		}
		if (parameter.type() == ParameterType.ARRAY) {
			property.putObject("items").put("type", "string");
		}
		if (!parameter.choices().isEmpty()) {
			ArrayNode values = property.putArray("enum");
			parameter.choices().forEach(values::add);
		}
		if (parameter.hasDefault()) {
			ToolManifestEmitter.putValue(property, "default", parameter.defaultValue());
		}
		if (parameter.range() != null) {
			applyRange(property, parameter.range());
		}
		return property;
	}

	/**
	 * Maps a single {@code lower..upper} range to minimum and maximum. Ranges with several
	 * parts, or bounds written as {@code min}/{@code max}, only constrain the side they name
	 * numerically.
	 */
	private static void applyRange(ObjectNode property, String range) {
		if (range.contains("|")) {
			return;
		}
		String[] bounds = range.split("\\.\\.", -1);
		BigDecimal lower = bound(bounds[0]);
		BigDecimal upper = bounds.length > 1 ? bound(bounds[1]) : lower;
		if (lower != null) {
			property.put("minimum", lower);
		}
		if (upper != null) {
			property.put("maximum", upper);
		}
	}

	private static BigDecimal bound(String text) {
		try {
			return new BigDecimal(text.trim());
		} catch (NumberFormatException e) {
			return null;
		}
	}
}
