package org.javai.toolgen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.javai.toolgen.diag.Diagnostic;
import org.javai.toolgen.diag.DiagnosticKind;
import org.javai.toolgen.reflect.AnalyzerOptions;
import org.javai.toolgen.reflect.NavigableNode;
import org.javai.toolgen.schema.ListNode;
import org.javai.toolgen.schema.Parameter;
import org.javai.toolgen.schema.ParameterType;
import org.javai.toolgen.schema.SchemaModule;
import org.javai.toolgen.tool.GenerationInvariantViolationException;
import org.javai.toolgen.tool.GeneratorOptions;
import org.javai.toolgen.tool.ToolSpec;
import org.javai.toolgen.yang.ParserOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.ai.tool.definition.ToolDefinition;

@DisplayName("ToolGenerationPipeline")
class ToolGenerationPipelineTest {

	private final ToolGenerationPipeline pipeline = new ToolGenerationPipeline();

	private static final ToolGenerationPipeline STRICT = new ToolGenerationPipeline(new ToolGenConfig(
			ParserOptions.defaults(), AnalyzerOptions.defaults(),
			GeneratorOptions.builder().strict(true).build(), null));

	static Path resource(String name) {
		try {
			return Path.of(ToolGenerationPipelineTest.class.getClassLoader().getResource(name).toURI());
		} catch (URISyntaxException e) {
			throw new IllegalStateException("Bad resource URI: " + name, e);
		}
	}

	@Nested
	@DisplayName("Schema input")
	class SchemaInput {

		@Test
		@DisplayName("Fixture schema generates tools, Python and manifest")
		void fromSchemaFile() {
			GenerationResult result = pipeline.fromSchemaFile(resource("schemas/ospf-service.yang"));

			assertThat(result.module().name()).isEqualTo("ospf-service");
			assertThat(result.tools()).hasSize(17);
			assertThat(result.tools().get(0).name()).isEqualTo("get_ospf-service_ospf");
			assertThat(result.pythonSource()).contains("def invoke_ospf_service_clear_process(");
			assertThat(result.manifest()).contains("\"name\" : \"invoke_ospf-service_clear-process\"");
			assertThat(result.diagnostics()).extracting(Diagnostic::kind)
					.containsExactly(DiagnosticKind.UNEXPANDED_GROUPING);
			assertThat(result.hasErrors()).isFalse();
		}

		@Test
		@DisplayName("Running twice gives identical output")
		void idempotent() {
			GenerationResult first = pipeline.fromSchemaFile(resource("schemas/ospf-service.yang"));
			GenerationResult second = pipeline.fromSchemaFile(resource("schemas/ospf-service.yang"));

			assertThat(second.pythonSource()).isEqualTo(first.pythonSource());
			assertThat(second.manifest()).isEqualTo(first.manifest());
			assertThat(second.tools()).isEqualTo(first.tools());
		}

		@Test
		@DisplayName("Broken sibling is reported while the others still generate")
		void partialResult() {
			GenerationResult result = pipeline.fromSchemaFile(resource("schemas/broken-siblings.yang"));

			assertThat(result.hasErrors()).isTrue();
			assertThat(result.tools()).extracting(ToolSpec::name)
					.contains("get_broken_first", "get_broken_third");
		}

		@Test
		@DisplayName("Unreadable file fails with the path")
		void missingFile(@TempDir Path dir) {
			Path missing = dir.resolve("absent.yang");

			assertThatThrownBy(() -> pipeline.fromSchemaFile(missing))
					.isInstanceOf(ToolGenerationException.class)
					.hasMessageContaining("absent.yang");
		}

		@Test
		@DisplayName("Tool definitions are exposed for Spring AI")
		void toolDefinitions() {
			GenerationResult result = pipeline.fromSchemaText("""
					module m {
					  container service { leaf service-name { type string; mandatory true; } }
					}
					""");

			List<ToolDefinition> definitions = result.toolDefinitions();
			assertThat(definitions).extracting(ToolDefinition::name)
					.containsExactly("get_m_service", "create_m_service", "update_m_service", "delete_m_service");
			assertThat(definitions.get(1).inputSchema()).contains("\"service_name\"");
		}
	}

	@Nested
	@DisplayName("Live input")
	class LiveInput {

		@Test
		@DisplayName("Snapshot file is analyzed under its @module name")
		void fromSnapshotFile() {
			GenerationResult result = pipeline.fromSnapshotFile(resource("snapshots/lab.json"));

			assertThat(result.module().name()).isEqualTo("lab");
			assertThat(result.tools()).extracting(ToolSpec::name)
					.contains("add_lab_ospf_item", "get_lab_system", "get_lab_system_ntp")
					.noneMatch(name -> name.contains("commit"));
			assertThat(result.diagnostics()).extracting(Diagnostic::kind)
					.containsExactly(DiagnosticKind.UNTYPED_VALUE);
		}

		@Test
		@DisplayName("Snapshot without @module is named after its file")
		void snapshotFileName(@TempDir Path dir) throws IOException {
			Path file = dir.resolve("edge-router.json");
			Files.writeString(file, "{\"dns\": {\"server\": \"192.0.2.53\"}}");

			GenerationResult result = pipeline.fromSnapshotFile(file);

			assertThat(result.module().name()).isEqualTo("edge-router");
			assertThat(result.tools()).extracting(ToolSpec::name).contains("get_edge-router_dns");
		}

		@Test
		@DisplayName("Snapshot that is not a JSON object is rejected")
		void invalidSnapshot(@TempDir Path dir) throws IOException {
			Path array = dir.resolve("array.json");
			Files.writeString(array, "[1, 2]");
			Path garbage = dir.resolve("garbage.json");
			Files.writeString(garbage, "{not json");

			assertThatThrownBy(() -> pipeline.fromSnapshotFile(array))
					.isInstanceOf(ToolGenerationException.class)
					.hasMessageContaining("must be a JSON object");
			assertThatThrownBy(() -> pipeline.fromSnapshotFile(garbage))
					.isInstanceOf(ToolGenerationException.class)
					.hasCauseInstanceOf(IOException.class);
		}

		@Test
		@DisplayName("Live tree is generated under the given module name")
		void fromLiveTree() {
			NavigableNode root = new NavigableNode() {
				@Override
				public String name() {
					return "root";
				}

				@Override
				public List<NavigableNode> children() {
					return List.of();
				}

				@Override
				public boolean isKeyed() {
					return false;
				}

				@Override
				public String keyName() {
					return null;
				}

				@Override
				public List<NavigableNode> entries() {
					return List.of();
				}

				@Override
				public boolean supportsCreate() {
					return false;
				}

				@Override
				public boolean supportsDelete() {
					return false;
				}

				@Override
				public Object scalarValue() {
					return null;
				}
			};

			GenerationResult result = pipeline.fromLiveTree(root, "empty");

			assertThat(result.module().name()).isEqualTo("empty");
			assertThat(result.tools()).isEmpty();
			assertThat(result.pythonSource()).contains("mcp = FastMCP('nso-tools')");
		}
	}

	@Nested
	@DisplayName("Strict mode")
	class StrictMode {

		@Test
		@DisplayName("Errors fail the run and carry the diagnostics")
		void errorsFail() {
			assertThatThrownBy(() -> STRICT.fromSchemaFile(resource("schemas/broken-siblings.yang")))
					.isInstanceOf(ToolGenerationException.class)
					.hasMessageContaining("module 'broken'")
					.satisfies(e -> assertThat(((ToolGenerationException) e).getDiagnostics())
							.extracting(Diagnostic::kind).contains(DiagnosticKind.STRUCTURAL_PARSE_ERROR));
		}

		@Test
		@DisplayName("Warnings do not fail the run")
		void warningsPass() {
			GenerationResult result = STRICT.fromSchemaText(
					"module m { container c { leaf x { type acme:widget; } } }");

			assertThat(result.diagnostics()).extracting(Diagnostic::kind).containsExactly(DiagnosticKind.UNKNOWN_TYPE);
			assertThat(result.tools()).hasSize(4);
		}

		@Test
		@DisplayName("Unkeyed list fails with the invariant violation as cause")
		void unkeyedList() {
			SchemaModule module = new SchemaModule("m", null, null, "", List.of(),
					List.of(new ListNode("log", "", null, List.of(Parameter.of("line", ParameterType.STRING, "")),
							List.of(), List.of())),
					List.of(), List.of(), List.of());

			assertThatThrownBy(() -> STRICT.fromModule(module))
					.isInstanceOf(ToolGenerationException.class)
					.hasMessageStartingWith("Strict generation failed for module 'm'")
					.hasCauseInstanceOf(GenerationInvariantViolationException.class);
		}
	}

	@Test
	@DisplayName("Base name drops the extension")
	void baseName() {
		assertThat(ToolGenerationPipeline.baseName(Path.of("dir", "lab.snapshot.json"))).isEqualTo("lab.snapshot");
		assertThat(ToolGenerationPipeline.baseName(Path.of(".hidden"))).isEqualTo(".hidden");
	}
}
