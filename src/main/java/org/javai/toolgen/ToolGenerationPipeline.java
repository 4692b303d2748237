package org.javai.toolgen;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.toolgen.diag.Diagnostic;
import org.javai.toolgen.emit.PythonToolEmitter;
import org.javai.toolgen.emit.ToolManifestEmitter;
import org.javai.toolgen.reflect.AnalysisResult;
import org.javai.toolgen.reflect.NavigableNode;
import org.javai.toolgen.reflect.ReflectiveModelAnalyzer;
import org.javai.toolgen.reflect.SnapshotNode;
import org.javai.toolgen.schema.SchemaModule;
import org.javai.toolgen.tool.GenerationInvariantViolationException;
import org.javai.toolgen.tool.GenerationOutcome;
import org.javai.toolgen.tool.ToolSpecGenerator;
import org.javai.toolgen.yang.ParseResult;
import org.javai.toolgen.yang.SchemaSourceException;
import org.javai.toolgen.yang.YangSchemaParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one input through parse-or-analyze, generation and emission.
 *
 * <p>Best-effort by default: problems are returned as diagnostics on the result. With
 * {@code generator.strict} set, a run that reports errors, or a list without a key,
 * fails with {@link ToolGenerationException}.</p>
 */
public class ToolGenerationPipeline {

	private static final Logger logger = LoggerFactory.getLogger(ToolGenerationPipeline.class);

	private static final ObjectMapper mapper = new ObjectMapper();

	private final ToolGenConfig config;
	private final YangSchemaParser parser;
	private final ReflectiveModelAnalyzer analyzer;
	private final ToolSpecGenerator generator;
	private final PythonToolEmitter pythonEmitter;

	public ToolGenerationPipeline() {
		this(ToolGenConfig.defaults());
	}

	public ToolGenerationPipeline(ToolGenConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.parser = new YangSchemaParser(config.parser());
		this.analyzer = new ReflectiveModelAnalyzer(config.analyzer());
		this.generator = new ToolSpecGenerator(config.generator());
		this.pythonEmitter = new PythonToolEmitter(config.serverName());
	}

	public GenerationResult fromSchemaText(String text) {
		ParseResult parsed = parser.parse(text);
		return generate(parsed.module(), parsed.diagnostics());
	}

	/**
	 * @throws ToolGenerationException if the file cannot be read
	 */
	public GenerationResult fromSchemaFile(Path path) {
		try {
			ParseResult parsed = parser.parse(path);
			return generate(parsed.module(), parsed.diagnostics());
		} catch (SchemaSourceException e) {
			throw new ToolGenerationException(e.getMessage(), e);
		}
	}

	public GenerationResult fromLiveTree(NavigableNode root, String moduleName) {
		Objects.requireNonNull(moduleName, "moduleName must not be null");
		AnalysisResult analysis = analyzer.analyze(root);
		return generate(analysis.toModule(moduleName), analysis.diagnostics());
	}

	/**
	 * Analyzes a JSON snapshot (see {@link SnapshotNode}). The module is named by the
	 * snapshot's {@code "@module"} field, else by the file name.
	 *
	 * @throws ToolGenerationException if the file cannot be read or is not JSON
	 */
	public GenerationResult fromSnapshotFile(Path path) {
		JsonNode tree;
		try {
			tree = mapper.readTree(path.toFile());
		} catch (IOException e) {
			throw new ToolGenerationException("Failed to read snapshot from path: " + path, e);
		}
		if (tree == null || !tree.isObject()) {
			throw new ToolGenerationException("Snapshot root must be a JSON object: " + path);
		}
		String moduleName = SnapshotNode.moduleName(tree, baseName(path));
		return fromLiveTree(SnapshotNode.of(moduleName, tree), moduleName);
	}

	/**
	 * Generates and emits tools for an already built module.
	 */
	public GenerationResult fromModule(SchemaModule module) {
		return generate(module, List.of());
	}

	private GenerationResult generate(SchemaModule module, List<Diagnostic> upstream) {
		List<Diagnostic> diagnostics = new ArrayList<>(upstream);
		GenerationOutcome outcome;
		try {
			outcome = generator.generateWithDiagnostics(module);
		} catch (GenerationInvariantViolationException e) {
			throw new ToolGenerationException(
					"Strict generation failed for module '" + module.name() + "': " + e.getMessage(), e, diagnostics);
		}
		diagnostics.addAll(outcome.diagnostics());

		String python = pythonEmitter.emit(outcome.tools());
		String manifest = ToolManifestEmitter.emit(outcome.tools());
		GenerationResult result = new GenerationResult(module, outcome.tools(), python, manifest, diagnostics);
		logger.info("Module '{}': {} tools, {} diagnostics ({} errors)", module.name(), result.tools().size(),
				diagnostics.size(), diagnostics.stream().filter(Diagnostic::isError).count());
		return config.generator().strict() ? result.requireClean() : result;
	}

	public ToolGenConfig config() {
		return config;
	}

	static String baseName(Path path) {
		String fileName = path.getFileName().toString();
		int dot = fileName.lastIndexOf('.');
		return dot > 0 ? fileName.substring(0, dot) : fileName;
	}
}
