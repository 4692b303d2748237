package org.javai.toolgen;

import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.toolgen.emit.PythonToolEmitter;
import org.javai.toolgen.reflect.AnalyzerOptions;
import org.javai.toolgen.reflect.ServiceClassifier;
import org.javai.toolgen.tool.GeneratorOptions;
import org.javai.toolgen.yang.ParserOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Settings of every pipeline stage, read from YAML.
 *
 * <pre>
 * parser:
 *   max-depth: 64
 *   fallback-module-name: unknown
 * analyzer:
 *   max-depth: 64
 *   ignored-child-names: [commit-queue, log, modified, private]
 *   service-classifier: create-and-delete   # or: none
 * generator:
 *   identity-parameter: router_name
 *   identity-description: Name of the router to operate on
 *   device-scoped: true
 *   strict: false
 *   include-update-tools: true
 * emitter:
 *   server-name: nso-tools
 * </pre>
 *
 * Missing sections and keys keep their defaults.
 */
public record ToolGenConfig(
		ParserOptions parser,
		AnalyzerOptions analyzer,
		GeneratorOptions generator,
		String serverName
) {

	private static final Logger logger = LoggerFactory.getLogger(ToolGenConfig.class);

	public static final String CONFIG_PROPERTY = "toolgen.config";
	public static final String CLASSPATH_RESOURCE = "toolgen.yml";

	public ToolGenConfig {
		Objects.requireNonNull(parser, "parser must not be null");
		Objects.requireNonNull(analyzer, "analyzer must not be null");
		Objects.requireNonNull(generator, "generator must not be null");
		if (serverName == null || serverName.isBlank()) {
			serverName = PythonToolEmitter.DEFAULT_SERVER_NAME;
		}
	}

	public static ToolGenConfig defaults() {
		return new ToolGenConfig(ParserOptions.defaults(), AnalyzerOptions.defaults(), GeneratorOptions.defaults(),
				PythonToolEmitter.DEFAULT_SERVER_NAME);
	}

	/**
	 * Loads the file named by the {@code toolgen.config} system property, else the
	 * {@code toolgen.yml} classpath resource, else the defaults.
	 *
	 * @throws ToolGenerationException if the configuration cannot be read
	 */
	public static ToolGenConfig load() {
		String override = System.getProperty(CONFIG_PROPERTY);
		if (override != null && !override.isBlank()) {
			logger.debug("Loading configuration from {}", override);
			return load(Path.of(override));
		}
		try (InputStream in = ToolGenConfig.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
			if (in == null) {
				logger.debug("No {} on the classpath; using defaults", CLASSPATH_RESOURCE);
				return defaults();
			}
			return fromYaml(new Yaml().load(in));
		} catch (ToolGenerationException e) {
			throw e;
		} catch (Exception e) {
			throw new ToolGenerationException("Failed to load configuration from classpath: " + CLASSPATH_RESOURCE, e);
		}
	}

	public static ToolGenConfig load(Path path) {
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return fromYaml(new Yaml().load(reader));
		} catch (ToolGenerationException e) {
			throw e;
		} catch (Exception e) {
			throw new ToolGenerationException("Failed to load configuration from path: " + path, e);
		}
	}

	public static ToolGenConfig parse(String yamlContent) {
		try {
			return fromYaml(new Yaml().load(yamlContent));
		} catch (ToolGenerationException e) {
			throw e;
		} catch (Exception e) {
			throw new ToolGenerationException("Failed to parse configuration", e);
		}
	}

	private static ToolGenConfig fromYaml(Object loaded) {
		if (loaded == null) {
			return defaults();
		}
		Map<String, Object> data = section(loaded, "root");
		return new ToolGenConfig(
				parserOptions(section(data.get("parser"), "parser")),
				analyzerOptions(section(data.get("analyzer"), "analyzer")),
				generatorOptions(section(data.get("generator"), "generator")),
				string(section(data.get("emitter"), "emitter"), "server-name", PythonToolEmitter.DEFAULT_SERVER_NAME));
	}

	private static ParserOptions parserOptions(Map<String, Object> data) {
		return ParserOptions.builder()
				.maxDepth(integer(data, "max-depth", ParserOptions.DEFAULT_MAX_DEPTH))
				.fallbackModuleName(string(data, "fallback-module-name", ParserOptions.DEFAULT_FALLBACK_MODULE_NAME))
				.build();
	}

	private static AnalyzerOptions analyzerOptions(Map<String, Object> data) {
		Set<String> ignored = AnalyzerOptions.DEFAULT_IGNORED_CHILD_NAMES;
		Object names = data.get("ignored-child-names");
		if (names instanceof Collection<?> collection) {
			ignored = new LinkedHashSet<>();
			for (Object name : collection) {
				ignored.add(String.valueOf(name));
			}
		} else if (names != null) {
			throw new ToolGenerationException("analyzer.ignored-child-names must be a list");
		}
		String classifier = string(data, "service-classifier", "create-and-delete");
		return AnalyzerOptions.builder()
				.maxDepth(integer(data, "max-depth", AnalyzerOptions.DEFAULT_MAX_DEPTH))
				.ignoredChildNames(ignored)
				.classifier(switch (classifier) {
					case "create-and-delete" -> ServiceClassifier.createAndDelete();
					case "none" -> ServiceClassifier.none();
					default -> throw new ToolGenerationException(
							"Unknown analyzer.service-classifier '" + classifier + "'");
				})
				.build();
	}

	private static GeneratorOptions generatorOptions(Map<String, Object> data) {
		return GeneratorOptions.builder()
				.identityParameterName(string(data, "identity-parameter", GeneratorOptions.DEFAULT_IDENTITY_PARAMETER))
				.identityDescription(string(data, "identity-description",
						GeneratorOptions.DEFAULT_IDENTITY_DESCRIPTION))
				.deviceScoped(bool(data, "device-scoped", true))
				.strict(bool(data, "strict", false))
				.includeUpdateTools(bool(data, "include-update-tools", true))
				.build();
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> section(Object value, String name) {
		if (value == null) {
			return Map.of();
		}
		if (value instanceof Map<?, ?> map) {
			return (Map<String, Object>) map;
		}
		throw new ToolGenerationException("Configuration section '" + name + "' must be a mapping");
	}

	private static String string(Map<String, Object> data, String key, String fallback) {
		Object value = data.get(key);
		return value != null ? String.valueOf(value) : fallback;
	}

	private static int integer(Map<String, Object> data, String key, int fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Number number) {
			return number.intValue();
		}
		throw new ToolGenerationException("'" + key + "' must be a number, got: " + value);
	}

	private static boolean bool(Map<String, Object> data, String key, boolean fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Boolean flag) {
			return flag;
		}
		throw new ToolGenerationException("'" + key + "' must be true or false, got: " + value);
	}
}
