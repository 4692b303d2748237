package org.javai.toolgen;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;
import org.javai.toolgen.diag.Diagnostic;
import org.javai.toolgen.tool.GenerationInvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <pre>
 * ToolGenCli &lt;input&gt; &lt;output-dir&gt;
 * </pre>
 *
 * A {@code .yang} input is parsed as schema text, a {@code .json} input is analyzed as a
 * configuration snapshot, and a directory is processed file by file in name order. Each
 * module writes {@code <module>_tools.py} and {@code <module>_tools.json}; when an earlier
 * input of the same run already used that name, the input file's own name is used instead.
 *
 * <p>Exit codes: 0 on success, 1 when a strict run reports errors, 2 on usage or I/O
 * errors.</p>
 */
public final class ToolGenCli {

	private static final Logger logger = LoggerFactory.getLogger(ToolGenCli.class);

	public static final int EXIT_OK = 0;
	public static final int EXIT_GENERATION_FAILED = 1;
	public static final int EXIT_USAGE = 2;

	private final ToolGenerationPipeline pipeline;
	private final PrintStream out;
	private final PrintStream err;

	public ToolGenCli(ToolGenerationPipeline pipeline, PrintStream out, PrintStream err) {
		this.pipeline = pipeline;
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		int code;
		try {
			code = new ToolGenCli(new ToolGenerationPipeline(ToolGenConfig.load()), System.out, System.err).run(args);
		} catch (ToolGenerationException e) {
			System.err.println("Invalid configuration: " + e.getMessage());
			code = EXIT_USAGE;
		}
		System.exit(code);
	}

	public int run(String[] args) {
		if (args == null || args.length != 2) {
			err.println("Usage: ToolGenCli <input.yang|input.json|directory> <output-dir>");
			return EXIT_USAGE;
		}
		Path input = Path.of(args[0]);
		Path outputDir = Path.of(args[1]);
		if (!Files.exists(input)) {
			err.println("Input not found: " + input);
			return EXIT_USAGE;
		}

		List<Path> inputs;
		try {
			inputs = inputs(input);
			Files.createDirectories(outputDir);
		} catch (IOException e) {
			err.println("I/O error: " + e.getMessage());
			return EXIT_USAGE;
		}
		if (inputs.isEmpty()) {
			err.println("No .yang or .json inputs in " + input);
			return EXIT_USAGE;
		}

		int code = EXIT_OK;
		Set<String> written = new HashSet<>();
		for (Path path : inputs) {
			code = Math.max(code, process(path, outputDir, written));
		}
		return code;
	}

	private String outputName(String moduleName, Path path, Set<String> written) {
		String preferred = safeName(moduleName) + "_tools";
		if (written.add(preferred)) {
			return preferred;
		}
		String fileName = path.getFileName().toString();
		int dot = fileName.lastIndexOf('.');
		String base = safeName(dot > 0 ? fileName.substring(0, dot) : fileName) + "_tools";
		String candidate = base;
		int suffix = 2;
		while (!written.add(candidate)) {
			candidate = base + "_" + suffix++;
		}
		err.printf("%s: module '%s' was already written by an earlier input; writing %s instead%n",
				path, moduleName, candidate);
		return candidate;
	}

	private static String safeName(String name) {
		return name.replaceAll("[^A-Za-z0-9_]", "_");
	}

	private int process(Path path, Path outputDir, Set<String> written) {
		GenerationResult result;
		try {
			result = isSnapshot(path) ? pipeline.fromSnapshotFile(path) : pipeline.fromSchemaFile(path);
		} catch (ToolGenerationException e) {
			err.println(path + ": " + e.getMessage());
			e.getDiagnostics().forEach(d -> err.println("  " + d));
			return isStrictFailure(e) ? EXIT_GENERATION_FAILED : EXIT_USAGE;
		}

		String baseName = outputName(result.module().name(), path, written);
		Path python = outputDir.resolve(baseName + ".py");
		Path manifest = outputDir.resolve(baseName + ".json");
		try {
			Files.writeString(python, result.pythonSource(), StandardCharsets.UTF_8);
			Files.writeString(manifest, result.manifest(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			err.println("Failed to write output for " + path + ": " + e.getMessage());
			return EXIT_USAGE;
		}

		for (Diagnostic diagnostic : result.diagnostics()) {
			err.println("  " + diagnostic);
		}
		out.printf("%s: %d tools -> %s, %s%n", path, result.tools().size(), python, manifest);
		logger.debug("Wrote {} and {}", python, manifest);
		return EXIT_OK;
	}

	/**
	 * A strict run fails with the diagnostics it collected or with an invariant violation;
	 * anything else means the input could not be read.
	 */
	private static boolean isStrictFailure(ToolGenerationException e) {
		return !e.getDiagnostics().isEmpty() || e.getCause() instanceof GenerationInvariantViolationException;
	}

	private static List<Path> inputs(Path input) throws IOException {
		if (!Files.isDirectory(input)) {
			return List.of(input);
		}
		List<Path> inputs = new ArrayList<>();
		try (Stream<Path> paths = Files.list(input)) {
			paths.filter(Files::isRegularFile)
					.filter(p -> isSchema(p) || isSnapshot(p))
					.sorted()
					.forEach(inputs::add);
		}
		return inputs;
	}

	private static boolean isSchema(Path path) {
		return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".yang");
	}

	private static boolean isSnapshot(Path path) {
		return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
	}
}
