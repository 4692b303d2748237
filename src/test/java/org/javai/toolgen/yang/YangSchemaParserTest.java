package org.javai.toolgen.yang;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.math.BigInteger;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.toolgen.diag.Diagnostic;
import org.javai.toolgen.diag.DiagnosticKind;
import org.javai.toolgen.diag.Severity;
import org.javai.toolgen.schema.Container;
import org.javai.toolgen.schema.ListNode;
import org.javai.toolgen.schema.Parameter;
import org.javai.toolgen.schema.ParameterType;
import org.javai.toolgen.schema.Rpc;
import org.javai.toolgen.schema.SchemaModule;
import org.javai.toolgen.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("YangSchemaParser")
class YangSchemaParserTest {

	private final YangSchemaParser parser = new YangSchemaParser();

	private static Path resource(String name) {
		try {
			return Path.of(YangSchemaParserTest.class.getClassLoader().getResource(name).toURI());
		} catch (URISyntaxException e) {
			throw new IllegalStateException("Bad resource URI: " + name, e);
		}
	}

	private static List<DiagnosticKind> kinds(ParseResult result) {
		return result.diagnostics().stream().map(Diagnostic::kind).toList();
	}

	private static Parameter parameter(List<Parameter> parameters, String name) {
		return parameters.stream().filter(p -> p.name().equals(name)).findFirst()
				.orElseThrow(() -> new AssertionError("No parameter " + name));
	}

	@Nested
	@DisplayName("Module structure")
	class ModuleStructure {

		@Test
		@DisplayName("Empty module has no children and no diagnostics")
		void emptyModule() {
			ParseResult result = parser.parse("module m { }");

			assertThat(result.module().name()).isEqualTo("m");
			assertThat(result.module().isEmpty()).isTrue();
			assertThat(result.diagnostics()).isEmpty();
		}

		@Test
		@DisplayName("Fixture schema is parsed into the expected tree")
		void parsesFixtureSchema() {
			ParseResult result = parser.parse(resource("schemas/ospf-service.yang"));
			SchemaModule module = result.module();

			assertThat(module.name()).isEqualTo("ospf-service");
			assertThat(module.namespace()).isEqualTo("http://example.com/ospf-service");
			assertThat(module.prefix()).isEqualTo("ospf");
			assertThat(module.description()).isEqualTo(
					"OSPF service model used to exercise the generator: containers, keyed lists, typedefs, choices and rpcs.");
			assertThat(module.containers()).extracting(Container::name).containsExactly("ospf");
			assertThat(module.lists()).isEmpty();
			assertThat(module.rpcs()).extracting(Rpc::name).containsExactly("clear-process");
			assertThat(kinds(result)).containsExactly(DiagnosticKind.UNEXPANDED_GROUPING);

			Container ospf = module.containers().get(0);
			assertThat(ospf.description()).isEqualTo("Router-wide OSPF settings");
			assertThat(ospf.parameters()).extracting(Parameter::name)
					.containsExactly("router-id", "enabled", "reference-bandwidth");
			assertThat(parameter(ospf.parameters(), "router-id").required()).isTrue();
			assertThat(parameter(ospf.parameters(), "enabled").defaultValue()).isEqualTo(true);
			assertThat(parameter(ospf.parameters(), "reference-bandwidth").type()).isEqualTo(ParameterType.NUMBER);
			assertThat(parameter(ospf.parameters(), "reference-bandwidth").defaultValue()).isEqualTo(100.0);
			assertThat(ospf.containers()).extracting(Container::name).containsExactly("redistribute");
			assertThat(ospf.lists()).extracting(ListNode::name).containsExactly("area");
		}

		@Test
		@DisplayName("Keyed lists nest lists and resolve typedefs")
		void parsesNestedLists() {
			SchemaModule module = parser.parse(resource("schemas/ospf-service.yang")).module();
			ListNode area = module.containers().get(0).lists().get(0);

			assertThat(area.key()).isEqualTo("area-id");
			Parameter areaId = parameter(area.parameters(), "area-id");
			assertThat(areaId.type()).isEqualTo(ParameterType.INTEGER);
			assertThat(areaId.required()).isTrue();
			assertThat(areaId.range()).isEqualTo("0..4294967295");
			assertThat(parameter(area.parameters(), "stub").type()).isEqualTo(ParameterType.BOOLEAN);

			ListNode iface = area.lists().get(0);
			assertThat(iface.name()).isEqualTo("interface");
			assertThat(iface.keyNames()).containsExactly("name");
			Parameter network = parameter(iface.parameters(), "network");
			assertThat(network.choices()).containsExactly("point-to-point", "broadcast");
			assertThat(network.defaultValue()).isEqualTo("broadcast");
			Parameter cost = parameter(iface.parameters(), "cost");
			assertThat(cost.range()).isEqualTo("1..65535");
			assertThat(cost.defaultValue()).isEqualTo(10L);
			assertThat(parameter(iface.parameters(), "tags").type()).isEqualTo(ParameterType.ARRAY);
		}

		@Test
		@DisplayName("Groupings are kept apart from the tree")
		void groupingsAreNotAttached() {
			ParseResult result = parser.parse(resource("schemas/ospf-service.yang"));
			SchemaModule module = result.module();

			assertThat(module.groupings()).extracting(Container::name).containsExactly("timers");
			assertThat(module.groupings().get(0).parameters()).extracting(Parameter::name)
					.containsExactly("hello-interval", "dead-interval");
			assertThat(module.containers().get(0).parameters()).extracting(Parameter::name)
					.doesNotContain("hello-interval");
			assertThat(result.diagnostics()).singleElement().satisfies(d -> {
				assertThat(d.severity()).isEqualTo(Severity.INFO);
				assertThat(d.message()).contains("'timers'").doesNotContain("no grouping of that name");
			});
		}

		@Test
		@DisplayName("Unknown grouping reference is noted")
		void unknownGroupingIsNoted() {
			ParseResult result = parser.parse("module m { container c { uses other:timers; } }");

			assertThat(result.diagnostics()).singleElement().satisfies(d -> {
				assertThat(d.kind()).isEqualTo(DiagnosticKind.UNEXPANDED_GROUPING);
				assertThat(d.message()).contains("no grouping of that name");
			});
		}

		@Test
		@DisplayName("Text without a module statement uses the fallback name")
		void missingModuleUsesFallbackName() {
			ParseResult result = parser.parse("container a { leaf x { type string; } }");

			assertThat(result.module().name()).isEqualTo("unknown");
			assertThat(result.module().containers()).extracting(Container::name).containsExactly("a");
			assertThat(kinds(result)).containsExactly(DiagnosticKind.MISSING_MODULE);
		}

		@Test
		void fallbackNameIsConfigurable() {
			YangSchemaParser custom = new YangSchemaParser(ParserOptions.builder().fallbackModuleName("lab").build());

			assertThat(custom.parse("").module().name()).isEqualTo("lab");
		}

		@Test
		void rpcOutputsAreSeparateFromInputs() {
			ParseResult result = parser.parse("""
					module m {
					  rpc start-service {
					    description "Start it";
					    input {
					      container options {
					        container inner { leaf deep { type string; } }
					      }
					      leaf service-name { type string; mandatory true; }
					    }
					    output {
					      leaf result { type string; }
					    }
					  }
					}
					""");

			Rpc rpc = result.module().rpcs().get(0);
			assertThat(rpc.description()).isEqualTo("Start it");
			assertThat(rpc.input()).extracting(Parameter::name).containsExactly("service-name", "options.inner.deep");
			assertThat(rpc.input().get(0).required()).isTrue();
			assertThat(rpc.output()).extracting(Parameter::name).containsExactly("result");
			assertThat(result.diagnostics()).isEmpty();
		}

		@Test
		@DisplayName("Leafs of containers inside rpc input are flattened under their path")
		void nestedRpcInputLeafsAreFlattened() {
			ParseResult result = parser.parse("""
					module m {
					  rpc deploy {
					    input {
					      leaf name { type string; mandatory true; }
					      container options {
					        leaf dry-run { type boolean; default false; }
					      }
					    }
					    output {
					      container status { leaf code { type uint8; } }
					    }
					  }
					}
					""");

			Rpc rpc = result.module().rpcs().get(0);
			assertThat(rpc.input()).extracting(Parameter::name).containsExactly("name", "options.dry-run");
			Parameter dryRun = rpc.input().get(1);
			assertThat(dryRun.type()).isEqualTo(ParameterType.BOOLEAN);
			assertThat(dryRun.defaultValue()).isEqualTo(false);
			assertThat(rpc.output()).extracting(Parameter::name).containsExactly("status.code");
			assertThat(result.diagnostics()).isEmpty();
		}

		@Test
		@DisplayName("Lists inside rpc input are reported, not silently dropped")
		void nestedRpcInputListIsReported() {
			ParseResult result = parser.parse("""
					module m {
					  rpc deploy {
					    input {
					      leaf name { type string; }
					      list targets { key id; leaf id { type string; } }
					    }
					  }
					}
					""");

			assertThat(result.module().rpcs().get(0).input()).extracting(Parameter::name).containsExactly("name");
			assertThat(result.diagnostics()).singleElement().satisfies(d -> {
				assertThat(d.kind()).isEqualTo(DiagnosticKind.GENERATION_INVARIANT_VIOLATION);
				assertThat(d.message()).contains("targets");
			});
		}

		@Test
		void readsSchemaFromPath() {
			assertThat(parser.parse(resource("schemas/broken-siblings.yang")).module().name()).isEqualTo("broken");
		}

		@Test
		void unreadablePathThrowsSourceException() {
			assertThatThrownBy(() -> parser.parse(Path.of("does/not/exist.yang")))
					.isInstanceOf(SchemaSourceException.class)
					.hasMessageContaining("exist.yang");
		}

		@Test
		void logsDiagnosticsAsWarnings() {
			try (LogCaptorAppender captor = LogCaptorAppender.capture(YangSchemaParser.class, Level.DEBUG)) {
				parser.parse("module m { leaf a { type mystery; } }");

				assertThat(captor.messages(Level.WARN)).anyMatch(m -> m.contains("UNKNOWN_TYPE"));
				assertThat(captor.messages(Level.INFO)).anyMatch(m -> m.contains("Parsed module 'm'"));
			}
		}
	}

	@Nested
	@DisplayName("Leaf clauses")
	class LeafClauseHandling {

		private Parameter singleLeaf(ParseResult result) {
			assertThat(result.module().parameters()).hasSize(1);
			return result.module().parameters().get(0);
		}

		@Test
		void mandatoryLeafIsRequired() {
			Parameter leaf = singleLeaf(parser.parse("module m { leaf a { type string; mandatory true; } }"));

			assertThat(leaf.required()).isTrue();
			assertThat(leaf.hasDefault()).isFalse();
		}

		@Test
		void mandatoryLeafLosesItsDefault() {
			ParseResult result = parser.parse("module m { leaf a { type string; mandatory true; default x; } }");

			assertThat(singleLeaf(result).hasDefault()).isFalse();
			assertThat(kinds(result)).containsExactly(DiagnosticKind.INVALID_DEFAULT);
		}

		@Test
		void defaultThatDoesNotConvertIsDropped() {
			ParseResult result = parser.parse("module m { leaf port { type uint16; default eighty; } }");

			Parameter port = singleLeaf(result);
			assertThat(port.type()).isEqualTo(ParameterType.INTEGER);
			assertThat(port.hasDefault()).isFalse();
			assertThat(result.diagnostics()).singleElement().satisfies(d -> {
				assertThat(d.kind()).isEqualTo(DiagnosticKind.INVALID_DEFAULT);
				assertThat(d.message()).contains("eighty");
			});
		}

		@Test
		void enumerationDefaultMustBeAChoice() {
			ParseResult result = parser.parse(
					"module m { leaf mode { type enumeration { enum a; enum b; } default c; } }");

			Parameter mode = singleLeaf(result);
			assertThat(mode.choices()).containsExactly("a", "b");
			assertThat(mode.hasDefault()).isFalse();
			assertThat(kinds(result)).containsExactly(DiagnosticKind.INVALID_DEFAULT);
		}

		@Test
		void unknownTypeDefaultsToString() {
			ParseResult result = parser.parse("module m { leaf a { type vendor-magic; } }");

			assertThat(singleLeaf(result).type()).isEqualTo(ParameterType.STRING);
			assertThat(result.diagnostics()).singleElement().satisfies(d -> {
				assertThat(d.kind()).isEqualTo(DiagnosticKind.UNKNOWN_TYPE);
				assertThat(d.severity()).isEqualTo(Severity.WARNING);
			});
		}

		@Test
		void missingTypeIsReported() {
			ParseResult result = parser.parse("module m { leaf a { description \"untyped\"; } }");

			assertThat(singleLeaf(result).description()).isEqualTo("untyped");
			assertThat(kinds(result)).containsExactly(DiagnosticKind.UNKNOWN_TYPE);
		}

		@Test
		void typedefChainsAreFollowed() {
			ParseResult result = parser.parse("""
					module m {
					  prefix p;
					  typedef outer { type p:inner; }
					  typedef inner { type int32 { range "1..9"; } }
					  leaf a { type outer; default 5; }
					}
					""");

			Parameter a = singleLeaf(result);
			assertThat(a.type()).isEqualTo(ParameterType.INTEGER);
			assertThat(a.range()).isEqualTo("1..9");
			assertThat(a.defaultValue()).isEqualTo(5L);
			assertThat(result.diagnostics()).isEmpty();
		}

		@Test
		void typedefCycleIsReported() {
			ParseResult result = parser.parse("""
					module m {
					  typedef x { type y; }
					  typedef y { type x; }
					  leaf a { type x; }
					}
					""");

			assertThat(singleLeaf(result).type()).isEqualTo(ParameterType.STRING);
			assertThat(result.diagnostics()).singleElement()
					.satisfies(d -> assertThat(d.message()).contains("in terms of itself"));
		}

		@Test
		void longTypedefChainIsResolvedWithoutRecursion() {
			StringBuilder text = new StringBuilder("module m {\n");
			int links = 20_000;
			for (int i = 0; i < links; i++) {
				text.append("  typedef t").append(i).append(" { type t").append(i + 1).append("; }\n");
			}
			text.append("  typedef t").append(links).append(" { type uint16 { range \"1..10\"; } }\n");
			text.append("  leaf a { type t0; }\n}\n");

			ParseResult result = parser.parse(text.toString());

			Parameter a = singleLeaf(result);
			assertThat(a.type()).isEqualTo(ParameterType.INTEGER);
			assertThat(a.range()).isEqualTo("1..10");
			assertThat(result.diagnostics()).isEmpty();
		}

		@Test
		void uint64DefaultBeyondLongRangeIsKept() {
			Parameter counter = singleLeaf(parser.parse(
					"module m { leaf counter { type uint64; default 18446744073709551615; } }"));

			assertThat(counter.defaultValue()).isEqualTo(new BigInteger("18446744073709551615"));
		}

		@Test
		void leafListIsArrayWithListDefault() {
			Parameter tags = singleLeaf(parser.parse(
					"module m { leaf-list tags { type string; default a; default b; } }"));

			assertThat(tags.type()).isEqualTo(ParameterType.ARRAY);
			assertThat(tags.defaultValue()).isEqualTo(List.of("a", "b"));
		}

		@Test
		void wellKnownTypesAreMapped() {
			SchemaModule module = parser.parse("""
					module m {
					  leaf port { type inet:port-number; }
					  leaf address { type inet:ipv4-address; }
					  leaf ratio { type decimal64 { fraction-digits 2; } default 0.5; }
					}
					""").module();

			assertThat(module.parameters()).extracting(Parameter::type)
					.containsExactly(ParameterType.INTEGER, ParameterType.STRING, ParameterType.NUMBER);
			assertThat(module.parameters().get(2).defaultValue()).isEqualTo(0.5);
		}

		@Test
		void descriptionsAreNormalized() {
			Parameter leaf = singleLeaf(parser.parse("""
					module m {
					  leaf a {
					    type string;
					    description
					      "first line
					       second   line";
					  }
					}
					"""));

			assertThat(leaf.description()).isEqualTo("first line second line");
		}
	}

	@Nested
	@DisplayName("Nesting")
	class Nesting {

		@Test
		@DisplayName("Containers nesting containers keep every level")
		void sameKeywordNestedThreeLevels() {
			SchemaModule module = parser.parse("""
					module m {
					  container a {
					    container b {
					      container c {
					        leaf x { type string; }
					      }
					      leaf y { type string; }
					    }
					    leaf z { type string; }
					  }
					}
					""").module();

			Container a = module.containers().get(0);
			Container b = a.containers().get(0);
			Container c = b.containers().get(0);
			assertThat(a.parameters()).extracting(Parameter::name).containsExactly("z");
			assertThat(b.parameters()).extracting(Parameter::name).containsExactly("y");
			assertThat(c.parameters()).extracting(Parameter::name).containsExactly("x");
		}

		@Test
		void choiceMembersAreFlattenedAndOptional() {
			Container r = parser.parse("""
					module m {
					  container r {
					    choice source {
					      case a { leaf x { type boolean; mandatory true; } }
					      leaf y { type string; }
					    }
					  }
					}
					""").module().containers().get(0);

			assertThat(r.parameters()).extracting(Parameter::name).containsExactly("x", "y");
			assertThat(r.parameters()).noneMatch(Parameter::required);
		}

		@Test
		void keyLeafsAreRequiredWithoutDefault() {
			ParseResult result = parser.parse(
					"module m { list l { key id; leaf id { type string; default x; } leaf v { type int8; } } }");

			ListNode list = result.module().lists().get(0);
			assertThat(list.parameters().get(0).required()).isTrue();
			assertThat(list.parameters().get(0).hasDefault()).isFalse();
			assertThat(kinds(result)).containsExactly(DiagnosticKind.INVALID_DEFAULT);
		}

		@Test
		void undeclaredKeyMakesListUnkeyed() {
			ParseResult result = parser.parse("module m { list l { key id; leaf name { type string; } } }");

			assertThat(result.module().lists().get(0).isKeyed()).isFalse();
			assertThat(kinds(result)).containsExactly(DiagnosticKind.GENERATION_INVARIANT_VIOLATION);
		}

		@Test
		void duplicateSiblingIsDropped() {
			ParseResult result = parser.parse(
					"module m { container a { leaf x { type string; } leaf x { type int32; } } container a { } }");

			SchemaModule module = result.module();
			assertThat(module.containers()).hasSize(1);
			assertThat(module.containers().get(0).parameters()).singleElement()
					.satisfies(p -> assertThat(p.type()).isEqualTo(ParameterType.STRING));
			assertThat(kinds(result)).containsExactly(DiagnosticKind.DUPLICATE_NAME, DiagnosticKind.DUPLICATE_NAME);
		}

		@Test
		@DisplayName("Nesting beyond the depth guard is reported and skipped")
		void depthGuard() {
			YangSchemaParser shallow = new YangSchemaParser(ParserOptions.builder().maxDepth(3).build());
			ParseResult result = shallow.parse(
					"module m { container c1 { container c2 { container c3 { container c4 { } } } } }");

			Container c1 = result.module().containers().get(0);
			assertThat(c1.containers()).extracting(Container::name).containsExactly("c2");
			assertThat(c1.containers().get(0).containers()).isEmpty();
			assertThat(kinds(result)).containsExactly(DiagnosticKind.DEPTH_LIMIT_EXCEEDED);
		}

		@Test
		@DisplayName("Pathologically deep input yields a diagnostic, not a stack overflow")
		void pathologicalDepth() {
			int levels = 500;
			StringBuilder text = new StringBuilder("module m {");
			for (int i = 1; i <= levels; i++) {
				text.append(" container c").append(i).append(" {");
			}
			text.append(" }".repeat(levels)).append(" }");

			ParseResult result = parser.parse(text.toString());

			int depth = 0;
			List<Container> level = result.module().containers();
			while (!level.isEmpty()) {
				depth++;
				level = level.get(0).containers();
			}
			assertThat(depth).isEqualTo(ParserOptions.DEFAULT_MAX_DEPTH - 1);
			assertThat(kinds(result)).containsExactly(DiagnosticKind.DEPTH_LIMIT_EXCEEDED);
		}
	}

	@Nested
	@DisplayName("Recovery")
	class Recovery {

		@Test
		@DisplayName("One unterminated block among siblings loses only that block")
		void unterminatedSiblingIsDropped() {
			ParseResult result = parser.parse(resource("schemas/broken-siblings.yang"));

			assertThat(result.module().containers()).extracting(Container::name).containsExactly("first", "third");
			assertThat(kinds(result)).contains(DiagnosticKind.STRUCTURAL_PARSE_ERROR);
			assertThat(result.hasErrors()).isTrue();
		}

		@Test
		@DisplayName("Block cut off by end of input keeps earlier siblings")
		void blockCutOffAtEndOfInput() {
			ParseResult result = parser.parse("""
					module m {
					  container a { leaf x { type string; } }
					  container b { leaf y { type string; } }
					  container c {
					    leaf z { type string; }
					}
					""");

			assertThat(result.module().name()).isEqualTo("m");
			assertThat(result.module().containers()).extracting(Container::name).containsExactly("a", "b");
			assertThat(kinds(result)).containsExactly(DiagnosticKind.STRUCTURAL_PARSE_ERROR);
		}

		@Test
		@DisplayName("Unterminated module still yields its partial content")
		void unterminatedModuleKeepsPartialContent() {
			ParseResult result = parser.parse("module m {\n  container a { }\n");

			assertThat(result.module().name()).isEqualTo("m");
			assertThat(result.module().containers()).extracting(Container::name).containsExactly("a");
			assertThat(kinds(result)).containsExactly(DiagnosticKind.STRUCTURAL_PARSE_ERROR);
		}

		@Test
		@DisplayName("Braces inside quoted strings do not disturb block matching")
		void bracesInStrings() {
			ParseResult result = parser.parse("""
					module m {
					  container a {
					    description "opens { and closes } and opens { again";
					    leaf x { type string; description '}'; }
					  }
					  container b { }
					}
					""");

			assertThat(result.module().containers()).extracting(Container::name).containsExactly("a", "b");
			assertThat(result.module().containers().get(0).description()).isEqualTo("opens { and closes } and opens { again");
			assertThat(result.diagnostics()).isEmpty();
		}

		@Test
		@DisplayName("Blank container name loses only that container")
		void blankContainerNameIsSkipped() {
			ParseResult result = parser.parse("""
					module m {
					  container a { leaf x { type string; } }
					  container "" { leaf y { type string; } }
					  container b { leaf z { type string; } }
					}
					""");

			assertThat(result.module().name()).isEqualTo("m");
			assertThat(result.module().containers()).extracting(Container::name).containsExactly("a", "b");
			assertThat(kinds(result)).containsExactly(DiagnosticKind.STRUCTURAL_PARSE_ERROR);
		}

		@Test
		@DisplayName("Blank leaf name loses only that leaf")
		void blankLeafNameIsSkipped() {
			ParseResult result = parser.parse("""
					module m {
					  container c {
					    leaf x { type string; }
					    leaf " " { type string; }
					    leaf z { type string; }
					  }
					}
					""");

			assertThat(result.module().containers().get(0).parameters()).extracting(Parameter::name)
					.containsExactly("x", "z");
			assertThat(kinds(result)).containsExactly(DiagnosticKind.STRUCTURAL_PARSE_ERROR);
		}

		@Test
		@DisplayName("Blank module name falls back to the configured name")
		void blankModuleNameFallsBack() {
			ParseResult result = parser.parse("module \"\" { container a { } }");

			assertThat(result.module().name()).isEqualTo(ParserOptions.defaults().fallbackModuleName());
			assertThat(result.module().containers()).extracting(Container::name).containsExactly("a");
			assertThat(kinds(result)).containsExactly(DiagnosticKind.STRUCTURAL_PARSE_ERROR);
		}

		@Test
		@DisplayName("Garbage input never throws")
		void garbageNeverThrows() {
			for (String text : List.of("}}}", "{{{", "; ; ;", "\"", "module", "module {", "leaf { type",
					"/* x", "module m { leaf }", "module m { container { } }")) {
				ParseResult result = parser.parse(text);

				assertThat(result).isNotNull();
				assertThat(result.module()).isNotNull();
			}
		}
	}
}
