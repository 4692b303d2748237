package org.javai.toolgen.emit;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.javai.toolgen.schema.Parameter;
import org.javai.toolgen.schema.ParameterType;
import org.javai.toolgen.tool.ToolSpec;

/**
 * Renders tools as a Python module of MCP tool functions.
 *
 * <p>Each tool becomes one function whose signature mirrors its parameters (required ones
 * without a default, optional ones with their default or {@code None}), a docstring, a
 * body that opens a backend session, hands the arguments to {@code _invoke} and reports
 * failures as a message, and an {@code mcp.add_tool(...)} registration. The output depends on
 * the tools alone: equal input gives byte-identical text.</p>
 */
public class PythonToolEmitter {

	public static final String DEFAULT_SERVER_NAME = "nso-tools";

	private static final String INDENT = "    ";

	/** Names the generated module binds at top level. */
	private static final Set<String> MODULE_NAMES = Set.of(
			"logging", "List", "Optional", "maapi", "maagic", "FastMCP", "logger", "mcp",
			"NSO_USER", "NSO_CONTEXT", "_invoke");

	/** Module names plus the locals of every function body. */
	private static final Set<String> FUNCTION_NAMES = Stream.concat(
			MODULE_NAMES.stream(), Stream.of("m", "result", "e")).collect(Collectors.toUnmodifiableSet());

	private final String serverName;

	public PythonToolEmitter() {
		this(DEFAULT_SERVER_NAME);
	}

	public PythonToolEmitter(String serverName) {
		this.serverName = Objects.requireNonNull(serverName, "serverName must not be null");
	}

	public String emit(List<ToolSpec> tools) {
		Objects.requireNonNull(tools, "tools must not be null");
		StringBuilder sb = new StringBuilder();
		appendHeader(sb);
		PythonNames functionNames = new PythonNames(MODULE_NAMES);
		for (ToolSpec tool : tools) {
			appendFunction(sb, tool, functionNames.unique(tool.name()));
		}
		return sb.toString();
	}

	private void appendHeader(StringBuilder sb) {
		sb.append("# Auto-generated MCP tools. Do not edit by hand; regenerate from the schema.\n");
		sb.append("\n");
		sb.append("import logging\n");
		sb.append("from typing import List, Optional\n");
		sb.append("\n");
		sb.append("import ncs.maapi as maapi\n");
		sb.append("import ncs.maagic as maagic\n");
		sb.append("from mcp.server.fastmcp import FastMCP\n");
		sb.append("\n");
		sb.append("logger = logging.getLogger(__name__)\n");
		sb.append("\n");
		sb.append("mcp = FastMCP(").append(stringLiteral(serverName)).append(")\n");
		sb.append("\n");
		sb.append("NSO_USER = 'admin'\n");
		sb.append("NSO_CONTEXT = 'toolgen'\n");
		sb.append("\n");
		sb.append("\n");
		sb.append("def _invoke(session, operation, path, arguments):\n");
		sb.append(INDENT).append("\"\"\"Performs one operation against the configuration tree.\"\"\"\n");
		sb.append(INDENT).append("with session.start_write_trans() as t:\n");
		sb.append(INDENT).append(INDENT).append("root = maagic.get_root(t)\n");
		sb.append(INDENT).append(INDENT)
				.append("raise NotImplementedError(f\"{operation} {path} is not bound to {root}\")\n");
	}

	private void appendFunction(StringBuilder sb, ToolSpec tool, String functionName) {
		PythonNames argumentNames = new PythonNames(FUNCTION_NAMES);
		List<String> arguments = new ArrayList<>();
		for (Parameter parameter : tool.parameters()) {
			arguments.add(argumentNames.unique(parameter.name()));
		}

		sb.append("\n\n");
		sb.append("def ").append(functionName).append("(");
		for (int i = 0; i < arguments.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			appendSignatureParameter(sb, tool.parameters().get(i), arguments.get(i));
		}
		sb.append(") -> str:\n");

		appendDocstring(sb, tool, arguments);

		String label = stringLiteral(tool.name());
		sb.append(INDENT).append("m = maapi.Maapi()\n");
		sb.append(INDENT).append("try:\n");
		sb.append(INDENT).append(INDENT).append("logger.info(\"Running %s\", ").append(label).append(")\n");
		sb.append(INDENT).append(INDENT).append("m.start_user_session(NSO_USER, NSO_CONTEXT)\n");
		sb.append(INDENT).append(INDENT).append("try:\n");
		sb.append(INDENT).append(INDENT).append(INDENT).append("result = _invoke(m, ")
				.append(stringLiteral(tool.operation().wireName())).append(", ")
				.append(stringLiteral(qualifiedPath(tool))).append(", {");
		for (int i = 0; i < arguments.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(stringLiteral(tool.parameters().get(i).name())).append(": ").append(arguments.get(i));
		}
		sb.append("})\n");
		sb.append(INDENT).append(INDENT).append("finally:\n");
		sb.append(INDENT).append(INDENT).append(INDENT).append("m.end_user_session()\n");
		sb.append(INDENT).append(INDENT).append("return f\"").append(fStringText(tool.name()))
				.append(" completed: {result}\"\n");
		sb.append(INDENT).append("except Exception as e:\n");
		sb.append(INDENT).append(INDENT).append("logger.exception(\"Error in %s\", ").append(label).append(")\n");
		sb.append(INDENT).append(INDENT).append("return f\"Error in ").append(fStringText(tool.name()))
				.append(": {e}\"\n");
		sb.append("\n");
		sb.append("\n");
		sb.append("mcp.add_tool(").append(functionName).append(")\n");
	}

	private void appendSignatureParameter(StringBuilder sb, Parameter parameter, String argument) {
		sb.append(argument).append(": ");
		if (parameter.required()) {
			sb.append(typeHint(parameter.type()));
			return;
		}
		sb.append("Optional[").append(typeHint(parameter.type())).append("] = ");
		sb.append(parameter.hasDefault() ? literal(parameter.defaultValue()) : "None");
	}

	private void appendDocstring(StringBuilder sb, ToolSpec tool, List<String> arguments) {
		sb.append(INDENT).append("\"\"\"").append(docText(tool.description())).append("\n");
		if (!arguments.isEmpty()) {
			sb.append("\n");
			sb.append(INDENT).append("Args:\n");
			for (int i = 0; i < arguments.size(); i++) {
				Parameter parameter = tool.parameters().get(i);
				sb.append(INDENT).append(INDENT).append(arguments.get(i))
						.append(" (").append(typeHint(parameter.type())).append("): ");
				if (!parameter.description().isBlank()) {
					sb.append(docText(parameter.description())).append(" ");
				}
				sb.append("(").append(parameter.required() ? "Required" : "Optional");
				if (parameter.hasDefault()) {
					sb.append(", default: ").append(docText(literal(parameter.defaultValue())));
				}
				sb.append(")");
				if (!parameter.choices().isEmpty()) {
					sb.append(" (choices: ").append(docText(String.join(", ", parameter.choices()))).append(")");
				}
				if (parameter.range() != null) {
					sb.append(" (range: ").append(docText(parameter.range())).append(")");
				}
				sb.append("\n");
			}
		}
		sb.append("\n");
		sb.append(INDENT).append("Returns:\n");
		sb.append(INDENT).append(INDENT).append("str: ");
		if (tool.result().isEmpty()) {
			sb.append("Result message");
		} else {
			sb.append("Result message carrying ").append(tool.result().stream()
					.map(p -> p.name() + " (" + typeHint(p.type()) + ")")
					.collect(Collectors.joining(", ")));
		}
		sb.append("\n");
		sb.append(INDENT).append("\"\"\"\n");
	}

	private static String qualifiedPath(ToolSpec tool) {
		return tool.scopePath().isEmpty() ? tool.source().name() : tool.scopePath() + "." + tool.source().name();
	}

	static String typeHint(ParameterType type) {
		return switch (type) {
			case STRING -> "str";
			case INTEGER -> "int";
			case BOOLEAN -> "bool";
			case NUMBER -> "float";
			case ARRAY -> "List[str]";
		};
	}

	/**
	 * Python literal of a typed default value.
	 */
	static String literal(Object value) {
		if (value == null) {
			return "None";
		}
		if (value instanceof Boolean bool) {
			return bool ? "True" : "False";
		}
		if (value instanceof Double number) {
			return Double.toString(number);
		}
		if (value instanceof Number number) {
			return number.toString();
		}
		if (value instanceof List<?> list) {
			return list.stream().map(PythonToolEmitter::literal).collect(Collectors.joining(", ", "[", "]"));
		}
		return stringLiteral(value.toString());
	}

	static String stringLiteral(String text) {
		StringBuilder sb = new StringBuilder("'");
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
				case '\\' -> sb.append("\\\\");
				case '\'' -> sb.append("\\'");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> sb.append(c);
			}
		}
		return sb.append('\'').toString();
	}

	private static String docText(String text) {
		return text.replace("\\", "\\\\").replace("\"\"\"", "\\\"\\\"\\\"").replaceAll("\\s+", " ").trim();
	}

	private static String fStringText(String text) {
		return text.replace("\\", "_").replace("\"", "_").replace("{", "{{").replace("}", "}}");
	}
}
