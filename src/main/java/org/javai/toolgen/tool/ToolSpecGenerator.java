package org.javai.toolgen.tool;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.javai.toolgen.diag.DiagnosticKind;
import org.javai.toolgen.diag.Diagnostics;
import org.javai.toolgen.schema.Container;
import org.javai.toolgen.schema.ListNode;
import org.javai.toolgen.schema.Parameter;
import org.javai.toolgen.schema.ParameterType;
import org.javai.toolgen.schema.Rpc;
import org.javai.toolgen.schema.SchemaEntity;
import org.javai.toolgen.schema.SchemaModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives tool descriptors from a schema tree.
 *
 * <p>Every container and list, at any depth, gets a get, a create (add-item for lists),
 * an optional update and a delete tool; every rpc gets an invoke tool. Entities are
 * visited pre-order, containers before lists at each level, rpcs last. Tool names are
 * qualified by the module name and the names of the enclosing nodes, so entities that
 * share a local name never collide.</p>
 *
 * <p>Parameter order is fixed: identity first, then required parameters in declaration
 * order, then optional parameters in declaration order.</p>
 */
public class ToolSpecGenerator {

	private static final Logger logger = LoggerFactory.getLogger(ToolSpecGenerator.class);

	public static final String CONFIRM_PARAMETER = "confirm";

	private final GeneratorOptions options;

	public ToolSpecGenerator() {
		this(GeneratorOptions.defaults());
	}

	public ToolSpecGenerator(GeneratorOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	public List<ToolSpec> generate(SchemaModule module) {
		return generateWithDiagnostics(module).tools();
	}

	/**
	 * @throws GenerationInvariantViolationException in strict mode, for a list without a key
	 */
	public GenerationOutcome generateWithDiagnostics(SchemaModule module) {
		Objects.requireNonNull(module, "module must not be null");
		Run run = new Run(new Diagnostics(logger));
		List<String> scope = List.of(module.name());
		for (Container container : module.containers()) {
			run.visitContainer(container, scope);
		}
		for (ListNode list : module.lists()) {
			run.visitList(list, scope);
		}
		for (Rpc rpc : module.rpcs()) {
			run.visitRpc(rpc, scope);
		}
		logger.info("Generated {} tools for module '{}'", run.tools.size(), module.name());
		return new GenerationOutcome(run.tools, run.diagnostics.toList());
	}

	/**
	 * Turns a schema name into a parameter name.
	 */
	public static String parameterName(String schemaName) {
		return schemaName.replace('-', '_');
	}

	private final class Run {

		private final Diagnostics diagnostics;
		private final List<ToolSpec> tools = new ArrayList<>();
		private final Set<String> toolNames = new HashSet<>();

		private Run(Diagnostics diagnostics) {
			this.diagnostics = diagnostics;
		}

		private void visitContainer(Container container, List<String> scope) {
			String path = path(scope, container);
			add("get", scope, container, "", OperationKind.GET,
					"Get the configuration of " + path, List.of(), List.of());
			add("create", scope, container, "", OperationKind.CREATE,
					"Create " + path, container.parameters(), List.of());
			if (options.includeUpdateTools()) {
				add("update", scope, container, "", OperationKind.UPDATE,
						"Update " + path + "; omitted parameters keep their current value",
						updateParameters(container.parameters(), List.of()), List.of());
			}
			addDelete(scope, container, path);

			List<String> inner = append(scope, container.name());
			container.containers().forEach(child -> visitContainer(child, inner));
			container.lists().forEach(child -> visitList(child, inner));
		}

		private void visitList(ListNode list, List<String> scope) {
			String path = path(scope, list);
			if (!list.isKeyed()) {
				String message = "List '" + list.name() + "' has no key; items cannot be addressed individually";
				if (options.strict()) {
					throw new GenerationInvariantViolationException(path, message);
				}
				diagnostics.report(DiagnosticKind.GENERATION_INVARIANT_VIOLATION, path,
						message + "; treated as unkeyed");
			}
			add("get", scope, list, "", OperationKind.GET,
					"Get the entries of list " + path, List.of(), List.of());
			add("add", scope, list, "_item", OperationKind.ADD_ITEM,
					"Add an item to list " + path, list.parameters(), List.of());
			if (options.includeUpdateTools()) {
				add("update", scope, list, "", OperationKind.UPDATE,
						"Update an item of list " + path + "; omitted parameters keep their current value",
						updateParameters(list.parameters(), list.keyNames()), List.of());
			}
			addDelete(scope, list, path);

			List<String> inner = append(scope, list.name());
			list.containers().forEach(child -> visitContainer(child, inner));
			list.lists().forEach(child -> visitList(child, inner));
		}

		private void visitRpc(Rpc rpc, List<String> scope) {
			add("invoke", scope, rpc, "", OperationKind.INVOKE,
					"Invoke rpc " + path(scope, rpc), rpc.input(), rpc.output());
		}

		private void addDelete(List<String> scope, SchemaEntity entity, String path) {
			Parameter confirm = new Parameter(CONFIRM_PARAMETER, ParameterType.BOOLEAN,
					"Must be true to confirm the deletion", true, Boolean.FALSE, List.of(), null);
			add("delete", scope, entity, "", OperationKind.DELETE, "Delete " + path, List.of(confirm), List.of());
		}

		private List<Parameter> updateParameters(List<Parameter> parameters, List<String> keyNames) {
			List<Parameter> update = new ArrayList<>();
			for (Parameter parameter : parameters) {
				update.add(keyNames.contains(parameter.name())
						? parameter.asRequired()
						: new Parameter(parameter.name(), parameter.type(), parameter.description(), false, null,
								parameter.choices(), parameter.range()));
			}
			return update;
		}

		private void add(String verb, List<String> scope, SchemaEntity entity, String suffix,
				OperationKind operation, String summary, List<Parameter> entityParameters, List<Parameter> result) {
			String name = uniqueName(verb + "_" + String.join("_", scope) + "_" + entity.name() + suffix);
			String description = entity.description().isBlank() ? summary : summary + ". " + entity.description();
			List<Parameter> parameters = order(entityParameters, name);
			tools.add(new ToolSpec(name, description, parameters, entity, String.join(".", scope), operation,
					normalized(result)));
			logger.debug("Generated {} tool {} with parameters {}", operation.wireName(), name,
					parameters.stream().map(Parameter::name).toList());
		}

		private List<Parameter> order(List<Parameter> entityParameters, String toolName) {
			List<Parameter> required = new ArrayList<>();
			List<Parameter> optional = new ArrayList<>();
			Set<String> seen = new HashSet<>();
			if (options.deviceScoped()) {
				seen.add(options.identityParameterName());
			}
			for (Parameter parameter : entityParameters) {
				String normalizedName = parameterName(parameter.name());
				if (!seen.add(normalizedName)) {
					String reason = normalizedName.equals(options.identityParameterName()) && options.deviceScoped()
							? "it shadows the identity parameter"
							: "another parameter has the same name";
					diagnostics.report(DiagnosticKind.DUPLICATE_NAME, toolName,
							"Parameter '%s' skipped: %s".formatted(parameter.name(), reason));
					continue;
				}
				Parameter renamed = parameter.withName(normalizedName);
				(renamed.required() ? required : optional).add(renamed);
			}
			List<Parameter> ordered = new ArrayList<>();
			if (options.deviceScoped()) {
				ordered.add(new Parameter(options.identityParameterName(), ParameterType.STRING,
						options.identityDescription(), true, null, List.of(), null));
			}
			ordered.addAll(required);
			ordered.addAll(optional);
			return ordered;
		}

		private String uniqueName(String candidate) {
			if (toolNames.add(candidate)) {
				return candidate;
			}
			int suffix = 2;
			while (!toolNames.add(candidate + "_" + suffix)) {
				suffix++;
			}
			String name = candidate + "_" + suffix;
			diagnostics.report(DiagnosticKind.DUPLICATE_NAME, candidate,
					"Tool name '%s' already generated; renamed to '%s'".formatted(candidate, name));
			return name;
		}
	}

	private static List<Parameter> normalized(List<Parameter> parameters) {
		return parameters.stream().map(p -> p.withName(parameterName(p.name()))).toList();
	}

	private static List<String> append(List<String> scope, String name) {
		List<String> inner = new ArrayList<>(scope);
		inner.add(name);
		return List.copyOf(inner);
	}

	private static String path(List<String> scope, SchemaEntity entity) {
		return String.join(".", scope) + "." + entity.name();
	}
}
