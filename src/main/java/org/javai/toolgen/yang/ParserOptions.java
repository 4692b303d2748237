package org.javai.toolgen.yang;

/**
 * Settings for {@link YangSchemaParser}.
 *
 * @param maxDepth deepest data-node nesting that is built; deeper subtrees are reported and skipped
 * @param fallbackModuleName module name used when the text has no {@code module} statement
 */
public record ParserOptions(
		int maxDepth,
		String fallbackModuleName
) {

	public static final int DEFAULT_MAX_DEPTH = 64;
	public static final String DEFAULT_FALLBACK_MODULE_NAME = "unknown";

	public ParserOptions {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be at least 1");
		}
		if (fallbackModuleName == null || fallbackModuleName.isBlank()) {
			fallbackModuleName = DEFAULT_FALLBACK_MODULE_NAME;
		}
	}

	public static ParserOptions defaults() {
		return new ParserOptions(DEFAULT_MAX_DEPTH, DEFAULT_FALLBACK_MODULE_NAME);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private int maxDepth = DEFAULT_MAX_DEPTH;
		private String fallbackModuleName = DEFAULT_FALLBACK_MODULE_NAME;

		private Builder() {}

		public Builder maxDepth(int maxDepth) {
			this.maxDepth = maxDepth;
			return this;
		}

		public Builder fallbackModuleName(String fallbackModuleName) {
			this.fallbackModuleName = fallbackModuleName;
			return this;
		}

		public ParserOptions build() {
			return new ParserOptions(maxDepth, fallbackModuleName);
		}
	}
}
