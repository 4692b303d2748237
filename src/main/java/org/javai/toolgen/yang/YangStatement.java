package org.javai.toolgen.yang;

/**
 * One keyword-led statement: {@code keyword [argument] ;} or {@code keyword [argument] { body }}.
 *
 * <p>The body is kept as a token range so that callers re-scan it only when they need
 * its children.</p>
 *
 * @param keyword the statement keyword
 * @param argument the argument, or {@code null} when absent
 * @param line line of the keyword
 * @param column column of the keyword
 * @param bodyStart index of the first body token, or {@code -1} for a simple statement
 * @param bodyEnd index one past the last body token, or {@code -1} for a simple statement
 * @param terminated {@code false} when the block's closing brace is missing
 */
public record YangStatement(
		String keyword,
		String argument,
		int line,
		int column,
		int bodyStart,
		int bodyEnd,
		boolean terminated
) {

	public boolean hasBody() {
		return bodyStart >= 0;
	}

	public boolean is(String expected) {
		return keyword.equals(expected);
	}

	public String argumentOr(String fallback) {
		return argument != null ? argument : fallback;
	}

	public String location() {
		return "line " + line + ", column " + column;
	}

	/**
	 * @return e.g. {@code container 'interfaces'}
	 */
	public String describe() {
		return argument != null ? keyword + " '" + argument + "'" : keyword;
	}
}
