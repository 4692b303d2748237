package org.javai.toolgen.tool;

/**
 * Thrown in strict mode when the schema breaks an assumption the generator relies on,
 * such as a list without a key.
 */
public class GenerationInvariantViolationException extends RuntimeException {

	private final String location;

	public GenerationInvariantViolationException(String location, String message) {
		super(message + " (" + location + ")");
		this.location = location;
	}

	public String getLocation() {
		return location;
	}
}
