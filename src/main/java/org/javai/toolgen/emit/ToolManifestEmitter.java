package org.javai.toolgen.emit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigInteger;
import java.util.List;
import org.javai.toolgen.schema.Parameter;
import org.javai.toolgen.tool.ToolSpec;

/**
 * Renders tools as the language-neutral JSON manifest.
 */
public final class ToolManifestEmitter {

	private static final ObjectMapper mapper = new ObjectMapper();

	// fixed line separator so the manifest is identical on every platform
	private static final ObjectWriter writer = mapper.writer(new DefaultPrettyPrinter()
			.withObjectIndenter(new DefaultIndenter("  ", "\n"))
			.withArrayIndenter(new DefaultIndenter("  ", "\n")));

	private ToolManifestEmitter() {
	}

	public static String emit(List<ToolSpec> tools) {
		try {
			return writer.writeValueAsString(toJsonArray(tools)) + "\n";
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render tool manifest", e);
		}
	}

	public static ArrayNode toJsonArray(List<ToolSpec> tools) {
		ArrayNode array = mapper.createArrayNode();
		for (ToolSpec tool : tools) {
			array.add(toJson(tool));
		}
		return array;
	}

	public static ObjectNode toJson(ToolSpec tool) {
		ObjectNode node = mapper.createObjectNode();
		node.put("name", tool.name());
		node.put("description", tool.description());
		node.put("operation", tool.operation().wireName());
		node.put("scope", tool.scopePath());
		node.put("entity", tool.source().name());
		ArrayNode params = node.putArray("parameters");
		tool.parameters().forEach(p -> params.add(toJson(p)));
		if (!tool.result().isEmpty()) {
			ArrayNode result = node.putArray("result");
			tool.result().forEach(p -> result.add(toJson(p)));
		}
		return node;
	}

	static ObjectNode toJson(Parameter parameter) {
		ObjectNode pNode = mapper.createObjectNode();
		pNode.put("name", parameter.name());
		pNode.put("type", parameter.type().wireName());
		pNode.put("description", parameter.description());
		pNode.put("required", parameter.required());
		putValue(pNode, "default", parameter.defaultValue());
		ArrayNode choices = pNode.putArray("choices");
		parameter.choices().forEach(choices::add);
		if (parameter.range() != null) {
			pNode.put("range", parameter.range());
		} else {
			pNode.putNull("range");
		}
		return pNode;
	}

	static void putValue(ObjectNode node, String field, Object value) {
		if (value == null) {
			node.putNull(field);
		} else if (value instanceof Boolean bool) {
			node.put(field, bool);
		} else if (value instanceof Long number) {
			node.put(field, number);
		} else if (value instanceof BigInteger number) {
			node.put(field, number);
		} else if (value instanceof Double number) {
			node.put(field, number);
		} else if (value instanceof List<?> list) {
			ArrayNode items = node.putArray(field);
			list.forEach(item -> items.add(String.valueOf(item)));
		} else {
			node.put(field, value.toString());
		}
	}
}
