package org.javai.toolgen.diag;

/**
 * Classifies the problems recorded while parsing, analyzing or generating.
 */
public enum DiagnosticKind {

	/** Unbalanced or unterminated block; the block is skipped, siblings continue. */
	STRUCTURAL_PARSE_ERROR(Severity.ERROR),

	/** Type token absent from the mapping table; defaulted to string. */
	UNKNOWN_TYPE(Severity.WARNING),

	/** A capability probe or attribute read failed on a live node; the node is skipped. */
	REFLECTION_ACCESS_ERROR(Severity.ERROR),

	/** A generator invariant could not be honoured (e.g. a list without a key). */
	GENERATION_INVARIANT_VIOLATION(Severity.WARNING),

	/** A {@code uses} statement referenced a grouping that is not expanded. */
	UNEXPANDED_GROUPING(Severity.INFO),

	/** A default value that does not convert to the parameter's type, or conflicts with mandatory. */
	INVALID_DEFAULT(Severity.WARNING),

	/** Nesting deeper than the configured recursion guard. */
	DEPTH_LIMIT_EXCEEDED(Severity.ERROR),

	/** Two siblings, or two generated tools, share a name. */
	DUPLICATE_NAME(Severity.WARNING),

	/** No {@code module} statement was found. */
	MISSING_MODULE(Severity.ERROR),

	/** A value could not be typed from a sample and was defaulted to string. */
	UNTYPED_VALUE(Severity.INFO);

	private final Severity defaultSeverity;

	DiagnosticKind(Severity defaultSeverity) {
		this.defaultSeverity = defaultSeverity;
	}

	public Severity defaultSeverity() {
		return defaultSeverity;
	}
}
