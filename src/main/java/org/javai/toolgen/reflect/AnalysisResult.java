package org.javai.toolgen.reflect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.toolgen.diag.Diagnostic;
import org.javai.toolgen.schema.Container;
import org.javai.toolgen.schema.ListNode;
import org.javai.toolgen.schema.Parameter;
import org.javai.toolgen.schema.SchemaModule;

/**
 * Outcome of one reflective walk. Partial results are kept whatever failed on the way.
 *
 * @param fragments top-level subtrees by name, in discovery order
 * @param rootStructure probe results of every analyzed root child, in discovery order
 * @param parameters leafs found directly on the root
 * @param diagnostics problems found on the way
 */
public record AnalysisResult(
		Map<String, DiscoveredFragment> fragments,
		Map<String, NodeCapabilities> rootStructure,
		List<Parameter> parameters,
		List<Diagnostic> diagnostics
) {

	public AnalysisResult {
		fragments = fragments != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fragments)) : Map.of();
		rootStructure = rootStructure != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(rootStructure))
				: Map.of();
		parameters = parameters != null ? List.copyOf(parameters) : List.of();
		diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
	}

	public List<DiscoveredFragment> services() {
		return fragments.values().stream().filter(DiscoveredFragment::isService).toList();
	}

	public List<DiscoveredFragment> configurations() {
		return fragments.values().stream().filter(f -> !f.isService()).toList();
	}

	public boolean hasErrors() {
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}

	/**
	 * Assembles the discovered fragments into a module, containers and lists each in
	 * discovery order.
	 */
	public SchemaModule toModule(String moduleName) {
		List<Container> containers = new ArrayList<>();
		List<ListNode> lists = new ArrayList<>();
		for (DiscoveredFragment fragment : fragments.values()) {
			if (fragment.entity() instanceof Container container) {
				containers.add(container);
			} else if (fragment.entity() instanceof ListNode list) {
				lists.add(list);
			}
		}
		return new SchemaModule(moduleName, null, null, "Discovered from a live configuration tree",
				containers, lists, List.of(), parameters, List.of());
	}
}
