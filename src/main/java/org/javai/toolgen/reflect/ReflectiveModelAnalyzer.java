package org.javai.toolgen.reflect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.toolgen.diag.DiagnosticKind;
import org.javai.toolgen.diag.Diagnostics;
import org.javai.toolgen.schema.Container;
import org.javai.toolgen.schema.ListNode;
import org.javai.toolgen.schema.Parameter;
import org.javai.toolgen.schema.ParameterType;
import org.javai.toolgen.schema.SchemaEntity;
import org.javai.toolgen.schema.TypeMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers schema structure by walking a live configuration tree through
 * {@link NavigableNode}.
 *
 * <p>Every root child is probed and classified: keyed nodes are lists, nodes holding a
 * value (or offering nothing to descend into) are leafs, everything else is a container.
 * Lists learn the structure of their items from their first entry. A probe that throws
 * is recorded as a {@link DiagnosticKind#REFLECTION_ACCESS_ERROR} and only that node is
 * skipped; the walk always returns what it found.</p>
 */
public class ReflectiveModelAnalyzer {

	private static final Logger logger = LoggerFactory.getLogger(ReflectiveModelAnalyzer.class);

	private final AnalyzerOptions options;

	public ReflectiveModelAnalyzer() {
		this(AnalyzerOptions.defaults());
	}

	public ReflectiveModelAnalyzer(AnalyzerOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	public AnalysisResult analyze(NavigableNode root) {
		Objects.requireNonNull(root, "root must not be null");
		Walk walk = new Walk(new Diagnostics(logger));

		Map<String, DiscoveredFragment> fragments = new LinkedHashMap<>();
		Map<String, NodeCapabilities> rootStructure = new LinkedHashMap<>();
		List<Parameter> parameters = new ArrayList<>();

		for (NavigableNode child : walk.childrenOf(root, "")) {
			Probed probed = walk.probe(child, "");
			if (probed == null) {
				continue;
			}
			NodeCapabilities capabilities = probed.capabilities();
			if (rootStructure.containsKey(capabilities.name())) {
				walk.duplicate(probed);
				continue;
			}
			rootStructure.put(capabilities.name(), capabilities);
			switch (capabilities.kind()) {
				case LEAF -> parameters.add(walk.buildLeaf(probed));
				case CONTAINER -> {
					Container container = walk.buildContainer(probed, 1);
					if (container != null) {
						fragments.put(capabilities.name(), fragment(container.name(), container, capabilities));
					}
				}
				case LIST -> {
					ListNode list = walk.buildList(probed, 1);
					if (list != null) {
						fragments.put(capabilities.name(), fragment(list.name(), list, capabilities));
					}
				}
			}
		}

		AnalysisResult result = new AnalysisResult(fragments, rootStructure, parameters, walk.diagnostics.toList());
		logger.info("Analyzed live tree: {} fragments ({} services), {} root leafs, {} diagnostics",
				fragments.size(), result.services().size(), parameters.size(), result.diagnostics().size());
		return result;
	}

	private DiscoveredFragment fragment(String name, SchemaEntity entity,
			NodeCapabilities capabilities) {
		FragmentKind kind = options.classifier().isService(capabilities)
				? FragmentKind.SERVICE
				: FragmentKind.CONFIGURATION;
		logger.debug("Discovered {} fragment '{}' ({})", kind, name, capabilities.kind());
		return new DiscoveredFragment(name, kind, entity, capabilities);
	}

	/**
	 * A node whose probes all succeeded.
	 */
	private record Probed(
			NavigableNode node,
			String path,
			NodeCapabilities capabilities,
			Object sample,
			List<NavigableNode> children,
			List<NavigableNode> entries
	) {

		String name() {
			return capabilities.name();
		}
	}

	/**
	 * Leafs, containers and lists found under one node, in discovery order.
	 */
	private static final class Members {
		private final Set<String> names = new HashSet<>();
		private final List<Parameter> parameters = new ArrayList<>();
		private final List<Container> containers = new ArrayList<>();
		private final List<ListNode> lists = new ArrayList<>();
	}

	/**
	 * State of one walk: its diagnostics and the nodes on the current path.
	 */
	private final class Walk {

		private final Diagnostics diagnostics;
		private final Set<NavigableNode> onPath = Collections.newSetFromMap(new IdentityHashMap<>());

		private Walk(Diagnostics diagnostics) {
			this.diagnostics = diagnostics;
		}

		/**
		 * Runs every probe the classification needs. Returns {@code null} when the node is
		 * ignored or a probe failed.
		 */
		private Probed probe(NavigableNode node, String parentPath) {
			String path = parentPath + "/?";
			String step = "name";
			try {
				String name = node.name();
				if (name == null || name.isBlank()) {
					diagnostics.report(DiagnosticKind.REFLECTION_ACCESS_ERROR, path, "Node has no name; skipped");
					return null;
				}
				path = parentPath + "/" + name;
				if (options.ignores(name)) {
					logger.debug("Skipping bookkeeping node {}", path);
					return null;
				}
				step = "isKeyed";
				boolean keyed = node.isKeyed();
				String keyName = null;
				if (keyed) {
					step = "keyName";
					keyName = node.keyName();
				}
				step = "supportsCreate";
				boolean create = node.supportsCreate();
				step = "supportsDelete";
				boolean delete = node.supportsDelete();

				Object sample = null;
				List<NavigableNode> children = List.of();
				List<NavigableNode> entries = List.of();
				NodeKind kind;
				if (keyed) {
					step = "entries";
					entries = nonNull(node.entries());
					kind = NodeKind.LIST;
				} else {
					step = "scalarValue";
					sample = node.scalarValue();
					if (sample == null) {
						step = "children";
						children = nonNull(node.children());
					}
					kind = sample != null || children.isEmpty() ? NodeKind.LEAF : NodeKind.CONTAINER;
				}
				NodeCapabilities capabilities = new NodeCapabilities(name, kind, keyName, create, delete);
				return new Probed(node, path, capabilities, sample, children, entries);
			} catch (RuntimeException e) {
				accessFailed(path, step, e);
				return null;
			}
		}

		private List<NavigableNode> childrenOf(NavigableNode node, String path) {
			try {
				return nonNull(node.children());
			} catch (RuntimeException e) {
				accessFailed(path.isEmpty() ? "/" : path, "children", e);
				return List.of();
			}
		}

		private Container buildContainer(Probed probed, int depth) {
			if (!enter(probed, depth)) {
				return null;
			}
			try {
				Members members = collect(probed.children(), probed.path(), depth);
				return new Container(probed.name(), "", members.parameters, members.containers, members.lists);
			} finally {
				onPath.remove(probed.node());
			}
		}

		private ListNode buildList(Probed probed, int depth) {
			if (!enter(probed, depth)) {
				return null;
			}
			try {
				Members members;
				if (probed.entries().isEmpty()) {
					logger.debug("List {} has no entries; item structure unknown", probed.path());
					members = new Members();
				} else {
					NavigableNode representative = probed.entries().get(0);
					String entryPath = probed.path() + "[0]";
					if (onPath.contains(representative)) {
						cycle(entryPath);
						return null;
					}
					members = collect(childrenOf(representative, entryPath), entryPath, depth);
				}
				String key = probed.capabilities().keyName();
				List<Parameter> parameters = key != null
						? keyedParameters(key, members.parameters, probed.path())
						: members.parameters;
				if (key == null) {
					logger.debug("List {} reports no key name", probed.path());
				}
				return new ListNode(probed.name(), "", key, parameters, members.containers, members.lists);
			} finally {
				onPath.remove(probed.node());
			}
		}

		private List<Parameter> keyedParameters(String key, List<Parameter> discovered, String path) {
			List<String> keyNames = List.of(key.split("\\s+"));
			Set<String> seen = new HashSet<>();
			discovered.forEach(p -> seen.add(p.name()));
			List<Parameter> parameters = new ArrayList<>();
			for (String keyName : keyNames) {
				if (!seen.contains(keyName)) {
					diagnostics.report(DiagnosticKind.UNTYPED_VALUE, path,
							"Key '" + keyName + "' was not observed on any entry; string assumed");
					parameters.add(new Parameter(keyName, ParameterType.STRING, "", true, null, List.of(), null));
				}
			}
			for (Parameter parameter : discovered) {
				parameters.add(keyNames.contains(parameter.name()) ? parameter.asRequired() : parameter);
			}
			return parameters;
		}

		private Parameter buildLeaf(Probed probed) {
			Optional<ParameterType> type = TypeMapping.forSample(probed.sample());
			if (type.isEmpty()) {
				diagnostics.report(DiagnosticKind.UNTYPED_VALUE, probed.path(),
						"No value to inspect for leaf '" + probed.name() + "'; string assumed");
			}
			return Parameter.of(probed.name(), type.orElse(ParameterType.STRING), "");
		}

		private Members collect(List<NavigableNode> children, String path, int depth) {
			Members members = new Members();
			for (NavigableNode child : children) {
				Probed probed = probe(child, path);
				if (probed == null) {
					continue;
				}
				if (!members.names.add(probed.name())) {
					duplicate(probed);
					continue;
				}
				switch (probed.capabilities().kind()) {
					case LEAF -> members.parameters.add(buildLeaf(probed));
					case CONTAINER -> {
						Container container = buildContainer(probed, depth + 1);
						if (container != null) {
							members.containers.add(container);
						}
					}
					case LIST -> {
						ListNode list = buildList(probed, depth + 1);
						if (list != null) {
							members.lists.add(list);
						}
					}
				}
			}
			return members;
		}

		private boolean enter(Probed probed, int depth) {
			if (depth > options.maxDepth()) {
				diagnostics.report(DiagnosticKind.DEPTH_LIMIT_EXCEEDED, probed.path(),
						"Nesting exceeds %d levels; subtree skipped".formatted(options.maxDepth()));
				return false;
			}
			if (!onPath.add(probed.node())) {
				cycle(probed.path());
				return false;
			}
			return true;
		}

		private void cycle(String path) {
			diagnostics.report(DiagnosticKind.DEPTH_LIMIT_EXCEEDED, path,
					"Node refers back to one of its ancestors; subtree skipped");
		}

		private void duplicate(Probed probed) {
			diagnostics.report(DiagnosticKind.DUPLICATE_NAME, probed.path(),
					"Duplicate child '" + probed.name() + "'; later one ignored");
		}

		private void accessFailed(String path, String step, RuntimeException e) {
			logger.debug("Probe {}() failed at {}", step, path, e);
			diagnostics.report(DiagnosticKind.REFLECTION_ACCESS_ERROR, path,
					"Probe %s() failed: %s; node skipped".formatted(step, describe(e)));
		}
	}

	private static List<NavigableNode> nonNull(List<NavigableNode> nodes) {
		return nodes != null ? nodes : List.of();
	}

	private static String describe(RuntimeException e) {
		return e.getMessage() != null ? e.getClass().getSimpleName() + ": " + e.getMessage()
				: e.getClass().getSimpleName();
	}
}
