package org.javai.toolgen.diag;

/**
 * How serious a {@link Diagnostic} is. Only {@link #ERROR} fails a strict run.
 */
public enum Severity {
	INFO,
	WARNING,
	ERROR
}
