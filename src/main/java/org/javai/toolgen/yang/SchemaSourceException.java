package org.javai.toolgen.yang;

/**
 * Thrown when schema text cannot be read at all. Malformed content never raises this;
 * it is reported as diagnostics instead.
 */
public class SchemaSourceException extends RuntimeException {

	public SchemaSourceException(String message) {
		super(message);
	}

	public SchemaSourceException(String message, Throwable cause) {
		super(message, cause);
	}
}
