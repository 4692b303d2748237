package org.javai.toolgen.yang;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.javai.toolgen.diag.DiagnosticKind;
import org.javai.toolgen.diag.Diagnostics;
import org.javai.toolgen.schema.SchemaModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses schema description text (a YANG subset) into a {@link SchemaModule}.
 *
 * <p>Parsing never fails on input data. Structurally invalid regions are reported as
 * diagnostics and skipped; the remaining siblings at the same level are still parsed.</p>
 *
 * <pre>
 * ParseResult result = new YangSchemaParser().parse(text);
 * SchemaModule module = result.module();
 * result.diagnostics().forEach(System.out::println);
 * </pre>
 */
public class YangSchemaParser {

	private static final Logger logger = LoggerFactory.getLogger(YangSchemaParser.class);

	private final ParserOptions options;

	public YangSchemaParser() {
		this(ParserOptions.defaults());
	}

	public YangSchemaParser(ParserOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	/**
	 * Parses a schema file. Malformed UTF-8 sequences are replaced, not rejected.
	 *
	 * @throws SchemaSourceException if the file cannot be read
	 */
	public ParseResult parse(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try {
			String text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
			return parse(text);
		} catch (IOException e) {
			throw new SchemaSourceException("Failed to read schema from path: " + path, e);
		}
	}

	/**
	 * Parses schema text.
	 *
	 * @param text full schema text; {@code null} is treated as empty
	 * @return the module and the diagnostics found on the way; never {@code null}
	 */
	public ParseResult parse(String text) {
		Diagnostics diagnostics = new Diagnostics(logger);
		SchemaModule module;
		try {
			List<YangToken> tokens = new YangTokenizer(text, diagnostics).tokenize();
			BraceMatcher braces = BraceMatcher.match(tokens);
			if (braces.recovered()) {
				logger.debug("Unbalanced braces; matched with indentation recovery");
			}
			StatementScanner scanner = new StatementScanner(tokens, braces, diagnostics);
			module = new SchemaTreeBuilder(scanner, diagnostics, options).build();
		} catch (RuntimeException e) {
			logger.error("Schema parsing aborted unexpectedly", e);
			diagnostics.report(DiagnosticKind.STRUCTURAL_PARSE_ERROR, "",
					"Parsing aborted: " + e.getMessage());
			module = SchemaModule.empty(options.fallbackModuleName());
		}
		ParseResult result = new ParseResult(module, diagnostics.toList());
		logger.info("Parsed module '{}': {} containers, {} lists, {} rpcs, {} diagnostics",
				module.name(), module.containers().size(), module.lists().size(), module.rpcs().size(),
				result.diagnostics().size());
		return result;
	}
}
