package org.javai.toolgen.emit;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Makes schema-derived names usable as Python identifiers.
 */
final class PythonNames {

	private static final Set<String> KEYWORDS = Set.of(
			"False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
			"def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
			"is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

	private final Set<String> used = new HashSet<>();

	/**
	 * @param reserved identifiers already bound in the enclosing code; {@link #unique(String)}
	 * never hands them out
	 */
	PythonNames(Collection<String> reserved) {
		used.addAll(reserved);
	}

	/**
	 * @return a valid identifier: other characters become {@code _}, a leading digit and a
	 * keyword get an extra {@code _}
	 */
	static String identifier(String name) {
		StringBuilder sb = new StringBuilder(name.length() + 1);
		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			boolean ascii = c < 128 && (Character.isLetterOrDigit(c) || c == '_');
			sb.append(ascii ? c : '_');
		}
		if (sb.length() == 0 || Character.isDigit(sb.charAt(0))) {
			sb.insert(0, '_');
		}
		String identifier = sb.toString();
		return KEYWORDS.contains(identifier) ? identifier + "_" : identifier;
	}

	/**
	 * Returns {@link #identifier(String)} of the name, suffixed with {@code _2}, {@code _3}...
	 * when an earlier call already handed it out.
	 */
	String unique(String name) {
		String base = identifier(name);
		String candidate = base;
		int suffix = 2;
		while (!used.add(candidate)) {
			candidate = base + "_" + suffix++;
		}
		return candidate;
	}
}
