package org.javai.toolgen.yang;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.toolgen.diag.DiagnosticKind;
import org.javai.toolgen.diag.Diagnostics;
import org.javai.toolgen.schema.Container;
import org.javai.toolgen.schema.ListNode;
import org.javai.toolgen.schema.Parameter;
import org.javai.toolgen.schema.ParameterType;
import org.javai.toolgen.schema.Rpc;
import org.javai.toolgen.schema.SchemaModule;
import org.javai.toolgen.schema.TypeMapping;

/**
 * Builds the schema tree from scanned statements. Each block body is re-scanned when its
 * node is built; the recursion is bounded by {@link ParserOptions#maxDepth()}.
 */
class SchemaTreeBuilder {

	private final StatementScanner scanner;
	private final List<YangToken> tokens;
	private final Diagnostics diagnostics;
	private final ParserOptions options;

	private final Map<String, YangStatement> typedefs = new HashMap<>();
	private final Set<String> groupingNames = new HashSet<>();
	private final List<Container> groupings = new ArrayList<>();
	private String modulePrefix;

	SchemaTreeBuilder(StatementScanner scanner, Diagnostics diagnostics, ParserOptions options) {
		this.scanner = scanner;
		this.tokens = scanner.tokens();
		this.diagnostics = diagnostics;
		this.options = options;
	}

	SchemaModule build() {
		List<YangStatement> top = scanner.scan(0, tokens.size() - 1, true);
		YangStatement moduleStatement = top.stream()
				.filter(s -> (s.is("module") || s.is("submodule")) && s.hasBody())
				.findFirst()
				.orElse(null);

		String name;
		List<YangStatement> body;
		if (moduleStatement == null) {
			name = options.fallbackModuleName();
			body = top;
			diagnostics.report(DiagnosticKind.MISSING_MODULE, "line 1, column 1",
					"No 'module' statement found; top-level statements are read as module '" + name + "'");
		} else {
			name = moduleStatement.argument();
			if (name == null || name.isBlank()) {
				name = options.fallbackModuleName();
				diagnostics.report(DiagnosticKind.STRUCTURAL_PARSE_ERROR, moduleStatement.location(),
						"Module has no name; using '" + name + "'");
			}
			body = bodyOf(moduleStatement);
		}

		String namespace = null;
		String description = null;
		for (YangStatement statement : body) {
			switch (statement.keyword()) {
				case "namespace" -> namespace = statement.argument();
				case "prefix" -> modulePrefix = statement.argument();
				case "description" -> description = statement.argument();
				case "typedef" -> registerTypedef(statement);
				case "grouping" -> {
					if (statement.argument() != null) {
						groupingNames.add(statement.argument());
					}
				}
				default -> {
				}
			}
		}

		NodeCollector collector = new NodeCollector("module '" + name + "'");
		List<Rpc> rpcs = new ArrayList<>();
		for (YangStatement statement : body) {
			if (statement.is("rpc")) {
				Rpc rpc = buildRpc(statement, 1);
				if (rpc != null && collector.claim(rpc.name(), statement)) {
					rpcs.add(rpc);
				}
			} else {
				collect(statement, collector, 1, false);
			}
		}

		return new SchemaModule(name, namespace, modulePrefix, normalize(description),
				collector.containers, collector.lists, rpcs, collector.parameters, groupings);
	}

	private void collect(YangStatement statement, NodeCollector target, int depth, boolean optionalContext) {
		switch (statement.keyword()) {
			case "container" -> {
				Container container = buildContainer(statement, depth + 1);
				if (container != null && target.claim(container.name(), statement)) {
					target.containers.add(container);
				}
			}
			case "list" -> {
				ListNode list = buildList(statement, depth + 1);
				if (list != null && target.claim(list.name(), statement)) {
					target.lists.add(list);
				}
			}
			case "leaf", "leaf-list" -> {
				Parameter parameter = buildLeaf(statement, statement.is("leaf-list"), optionalContext);
				if (parameter != null && target.claim(parameter.name(), statement)) {
					target.parameters.add(parameter);
				}
			}
			case "choice", "case" -> {
				// members of a choice belong to the parent and are never mandatory on their own
				if (withinDepth(statement, depth + 1)) {
					for (YangStatement member : bodyOf(statement)) {
						collect(member, target, depth + 1, true);
					}
				}
			}
			case "uses" -> reportUses(statement, target);
			case "grouping" -> {
				Container grouping = buildContainer(statement, depth + 1);
				if (grouping != null) {
					groupings.add(grouping);
				}
			}
			case "typedef" -> {
				if (depth > 1) {
					registerTypedef(statement);
				}
			}
			default -> {
			}
		}
	}

	private Container buildContainer(YangStatement statement, int depth) {
		if (!hasName(statement) || !withinDepth(statement, depth)) {
			return null;
		}
		NodeCollector children = collectChildren(statement, depth);
		return new Container(statement.argument(), children.description,
				children.parameters, children.containers, children.lists);
	}

	private ListNode buildList(YangStatement statement, int depth) {
		if (!hasName(statement) || !withinDepth(statement, depth)) {
			return null;
		}
		NodeCollector children = collectChildren(statement, depth);
		String key = children.key;
		if (key != null) {
			Set<String> declared = new HashSet<>();
			children.parameters.forEach(p -> declared.add(p.name()));
			List<String> missing = new ArrayList<>();
			for (String keyName : key.trim().split("\\s+")) {
				if (!declared.contains(keyName)) {
					missing.add(keyName);
				}
			}
			if (!missing.isEmpty()) {
				diagnostics.report(DiagnosticKind.GENERATION_INVARIANT_VIOLATION, statement.location(),
						"Key %s of list '%s' is not declared as a leaf; the list is treated as unkeyed"
								.formatted(missing, statement.argument()));
				key = null;
			}
		}
		List<Parameter> parameters = children.parameters;
		if (key != null) {
			List<String> keyNames = List.of(key.trim().split("\\s+"));
			parameters = new ArrayList<>();
			for (Parameter parameter : children.parameters) {
				if (keyNames.contains(parameter.name())) {
					if (parameter.hasDefault()) {
						diagnostics.report(DiagnosticKind.INVALID_DEFAULT, statement.location(),
								"Key leaf '%s' of list '%s' declares a default; ignored"
										.formatted(parameter.name(), statement.argument()));
					}
					parameters.add(parameter.asRequired());
				} else {
					parameters.add(parameter);
				}
			}
		}
		return new ListNode(statement.argument(), children.description, key, parameters,
				children.containers, children.lists);
	}

	private Rpc buildRpc(YangStatement statement, int depth) {
		if (!hasName(statement) || !withinDepth(statement, depth + 1)) {
			return null;
		}
		String description = null;
		List<Parameter> input = List.of();
		List<Parameter> output = List.of();
		for (YangStatement child : bodyOf(statement)) {
			switch (child.keyword()) {
				case "description" -> description = child.argument();
				case "input" -> input = rpcParameters(child, depth + 1);
				case "output" -> output = rpcParameters(child, depth + 1);
				default -> {
				}
			}
		}
		return new Rpc(statement.argument(), normalize(description), input, output);
	}

	/**
	 * Leafs of an rpc {@code input} or {@code output}. Leafs of nested containers are flattened
	 * under their dotted path; nested lists have no flat form and are reported.
	 */
	private List<Parameter> rpcParameters(YangStatement block, int depth) {
		NodeCollector children = collectChildren(block, depth);
		List<Parameter> parameters = new ArrayList<>(children.parameters);
		Set<String> names = new HashSet<>();
		parameters.forEach(p -> names.add(p.name()));
		flattenInto(parameters, names, "", children.containers, children.lists, block);
		return parameters;
	}

	private void flattenInto(List<Parameter> parameters, Set<String> names, String prefix,
			List<Container> containers, List<ListNode> lists, YangStatement block) {
		for (ListNode list : lists) {
			diagnostics.report(DiagnosticKind.GENERATION_INVARIANT_VIOLATION, block.location(),
					"List '%s%s' in %s cannot be passed as flat parameters; skipped"
							.formatted(prefix, list.name(), block.describe()));
		}
		for (Container container : containers) {
			String path = prefix + container.name() + ".";
			for (Parameter parameter : container.parameters()) {
				String name = path + parameter.name();
				if (names.add(name)) {
					parameters.add(parameter.withName(name));
				} else {
					diagnostics.report(DiagnosticKind.DUPLICATE_NAME, block.location(),
							"Flattened leaf '%s' in %s clashes with a sibling; ignored".formatted(name, block.describe()));
				}
			}
			flattenInto(parameters, names, path, container.containers(), container.lists(), block);
		}
	}

	private NodeCollector collectChildren(YangStatement statement, int depth) {
		NodeCollector children = new NodeCollector(statement.describe());
		for (YangStatement child : bodyOf(statement)) {
			switch (child.keyword()) {
				case "description" -> children.description = normalize(child.argument());
				case "key" -> children.key = child.argument();
				default -> collect(child, children, depth, false);
			}
		}
		return children;
	}

	private Parameter buildLeaf(YangStatement statement, boolean leafList, boolean optionalContext) {
		if (!hasName(statement)) {
			return null;
		}
		String name = statement.argument();
		LeafClauses clauses = statement.hasBody()
				? LeafClauses.read(tokens, statement.bodyStart(), statement.bodyEnd())
				: new LeafClauses(null, null, List.of(), false, null, List.of());

		ResolvedType resolved = resolveType(clauses.type(), statement);
		ParameterType type = leafList ? ParameterType.ARRAY : resolved.type();
		String range = clauses.range() != null ? clauses.range() : resolved.range();
		List<String> enums = !clauses.enums().isEmpty() ? clauses.enums() : resolved.enums();
		List<String> choices = type == ParameterType.STRING && "enumeration".equals(resolved.baseToken())
				? enums
				: List.of();
		boolean required = clauses.mandatory() && !optionalContext;

		List<String> defaults = !clauses.defaults().isEmpty()
				? clauses.defaults()
				: resolved.defaultLiteral() != null ? List.of(resolved.defaultLiteral()) : List.of();
		Object defaultValue = convertDefault(name, type, defaults, choices, statement);
		if (required && defaultValue != null) {
			diagnostics.report(DiagnosticKind.INVALID_DEFAULT, statement.location(),
					"Mandatory leaf '" + name + "' declares a default; ignored");
			defaultValue = null;
		}
		return new Parameter(name, type, normalize(clauses.description()), required, defaultValue, choices, range);
	}

	private Object convertDefault(String name, ParameterType type, List<String> defaults, List<String> choices,
			YangStatement statement) {
		if (defaults.isEmpty()) {
			return null;
		}
		if (type == ParameterType.ARRAY) {
			return List.copyOf(defaults);
		}
		String literal = defaults.get(0);
		Optional<Object> converted = type.convert(literal);
		if (converted.isEmpty()) {
			diagnostics.report(DiagnosticKind.INVALID_DEFAULT, statement.location(),
					"Default '%s' of leaf '%s' is not a valid %s; ignored".formatted(literal, name, type.wireName()));
			return null;
		}
		if (!choices.isEmpty() && !choices.contains(literal)) {
			diagnostics.report(DiagnosticKind.INVALID_DEFAULT, statement.location(),
					"Default '%s' of leaf '%s' is not one of %s; ignored".formatted(literal, name, choices));
			return null;
		}
		return converted.get();
	}

	/**
	 * Follows typedefs down to a known type, then applies their restrictions from the base
	 * outwards so the innermost declaration wins.
	 */
	private ResolvedType resolveType(String token, YangStatement leaf) {
		List<LeafClauses> chain = new ArrayList<>();
		Set<String> visited = new HashSet<>();
		YangStatement owner = leaf;
		String current = token;
		ResolvedType resolved = null;
		while (resolved == null) {
			if (current == null) {
				diagnostics.report(DiagnosticKind.UNKNOWN_TYPE, owner.location(),
						"Leaf '" + owner.argument() + "' declares no type; string assumed");
				resolved = ResolvedType.of(ParameterType.STRING, null);
			} else if (TypeMapping.isBuiltIn(current)) {
				resolved = ResolvedType.of(TypeMapping.forToken(current).orElse(ParameterType.STRING), current);
			} else {
				YangStatement typedef = lookupTypedef(current);
				if (typedef != null && !visited.add(typedef.argument())) {
					diagnostics.report(DiagnosticKind.UNKNOWN_TYPE, typedef.location(),
							"Typedef '" + typedef.argument() + "' is defined in terms of itself; string assumed");
					resolved = ResolvedType.of(ParameterType.STRING, null);
				} else if (typedef != null) {
					LeafClauses definition = typedef.hasBody()
							? LeafClauses.read(tokens, typedef.bodyStart(), typedef.bodyEnd())
							: new LeafClauses(null, null, List.of(), false, null, List.of());
					chain.add(definition);
					owner = typedef;
					current = definition.type();
				} else {
					Optional<ParameterType> wellKnown = TypeMapping.forToken(current);
					if (wellKnown.isEmpty()) {
						diagnostics.report(DiagnosticKind.UNKNOWN_TYPE, owner.location(),
								"Unknown type '" + current + "' of '" + owner.argument() + "'; string assumed");
					}
					resolved = ResolvedType.of(wellKnown.orElse(ParameterType.STRING), current);
				}
			}
		}
		for (int i = chain.size() - 1; i >= 0; i--) {
			LeafClauses definition = chain.get(i);
			resolved = new ResolvedType(
					resolved.type(),
					resolved.baseToken(),
					definition.range() != null ? definition.range() : resolved.range(),
					!definition.enums().isEmpty() ? definition.enums() : resolved.enums(),
					!definition.defaults().isEmpty() ? definition.defaults().get(0) : resolved.defaultLiteral());
		}
		return resolved;
	}

	private YangStatement lookupTypedef(String token) {
		int colon = token.indexOf(':');
		if (colon < 0) {
			return typedefs.get(token);
		}
		String prefix = token.substring(0, colon);
		return prefix.equals(modulePrefix) ? typedefs.get(token.substring(colon + 1)) : null;
	}

	private void registerTypedef(YangStatement statement) {
		if (statement.argument() != null) {
			typedefs.putIfAbsent(statement.argument(), statement);
		}
	}

	private void reportUses(YangStatement statement, NodeCollector target) {
		String grouping = statement.argumentOr("?");
		int colon = grouping.indexOf(':');
		String local = colon >= 0 ? grouping.substring(colon + 1) : grouping;
		String known = groupingNames.contains(local) ? "" : "; no grouping of that name is declared in this module";
		diagnostics.report(DiagnosticKind.UNEXPANDED_GROUPING, statement.location(),
				"Grouping '%s' used by %s is not expanded%s".formatted(grouping, target.owner, known));
	}

	private boolean hasName(YangStatement statement) {
		if (statement.argument() == null || statement.argument().isBlank()) {
			diagnostics.report(DiagnosticKind.STRUCTURAL_PARSE_ERROR, statement.location(),
					"'" + statement.keyword() + "' without a name; skipped");
			return false;
		}
		return true;
	}

	private boolean withinDepth(YangStatement statement, int depth) {
		if (depth > options.maxDepth()) {
			diagnostics.report(DiagnosticKind.DEPTH_LIMIT_EXCEEDED, statement.location(),
					"Nesting exceeds %d levels; %s and its children are skipped"
							.formatted(options.maxDepth(), statement.describe()));
			return false;
		}
		return true;
	}

	private List<YangStatement> bodyOf(YangStatement statement) {
		return statement.hasBody() ? scanner.scan(statement.bodyStart(), statement.bodyEnd()) : List.of();
	}

	private static String normalize(String text) {
		return text == null ? "" : text.trim().replaceAll("\\s+", " ");
	}

	private record ResolvedType(ParameterType type, String baseToken, String range, List<String> enums,
			String defaultLiteral) {

		static ResolvedType of(ParameterType type, String baseToken) {
			return new ResolvedType(type, baseToken, null, List.of(), null);
		}
	}

	/**
	 * Children of one node, in declaration order, with sibling names kept unique.
	 */
	private final class NodeCollector {
		private final String owner;
		private final Set<String> names = new HashSet<>();
		private final List<Parameter> parameters = new ArrayList<>();
		private final List<Container> containers = new ArrayList<>();
		private final List<ListNode> lists = new ArrayList<>();
		private String description = "";
		private String key;

		private NodeCollector(String owner) {
			this.owner = owner;
		}

		private boolean claim(String name, YangStatement statement) {
			if (names.add(name)) {
				return true;
			}
			diagnostics.report(DiagnosticKind.DUPLICATE_NAME, statement.location(),
					"Duplicate %s in %s; later declaration ignored".formatted(statement.describe(), owner));
			return false;
		}
	}
}
