package org.javai.toolgen.yang;

import java.util.ArrayList;
import java.util.List;
import org.javai.toolgen.yang.YangToken.TokenType;

/**
 * The clauses of a leaf, leaf-list or typedef body.
 *
 * <p>Leaf bodies are flat lists of clauses, except for the restrictions nested under
 * {@code type}; those ({@code range}, {@code enum}) are read at any depth, everything else
 * only at the body's own level.</p>
 *
 * @param type the type token, or {@code null} when the body has none
 * @param description the leaf description, or {@code null}
 * @param defaults every {@code default} literal in order (leaf-lists may repeat it)
 * @param mandatory whether {@code mandatory true} is present
 * @param range the first range expression, or {@code null}
 * @param enums enumeration names in declaration order
 */
public record LeafClauses(
		String type,
		String description,
		List<String> defaults,
		boolean mandatory,
		String range,
		List<String> enums
) {

	public LeafClauses {
		defaults = defaults != null ? List.copyOf(defaults) : List.of();
		enums = enums != null ? List.copyOf(enums) : List.of();
	}

	/**
	 * Reads clauses by keyword-led scanning of a body token range.
	 *
	 * @param tokens the whole token list
	 * @param from first body token (inclusive)
	 * @param to end of the body (exclusive)
	 */
	public static LeafClauses read(List<YangToken> tokens, int from, int to) {
		String type = null;
		String description = null;
		List<String> defaults = new ArrayList<>();
		boolean mandatory = false;
		String range = null;
		List<String> enums = new ArrayList<>();

		int depth = 0;
		for (int i = from; i < to; i++) {
			YangToken token = tokens.get(i);
			if (token.isType(TokenType.LBRACE)) {
				depth++;
				continue;
			}
			if (token.isType(TokenType.RBRACE)) {
				depth--;
				continue;
			}
			if (!token.isType(TokenType.WORD) || !startsClause(tokens, i, from)) {
				continue;
			}
			String argument = argumentAfter(tokens, i, to);
			switch (token.value()) {
				case "type" -> {
					if (depth == 0 && type == null) {
						type = argument;
					}
				}
				case "description" -> {
					if (depth == 0 && description == null) {
						description = argument;
					}
				}
				case "default" -> {
					if (depth == 0 && argument != null) {
						defaults.add(argument);
					}
				}
				case "mandatory" -> {
					if (depth == 0) {
						mandatory = "true".equals(argument);
					}
				}
				case "range" -> {
					if (range == null) {
						range = argument;
					}
				}
				case "enum" -> {
					if (argument != null) {
						enums.add(argument);
					}
				}
				default -> {
				}
			}
		}
		return new LeafClauses(type, description, defaults, mandatory, range, enums);
	}

	private static boolean startsClause(List<YangToken> tokens, int index, int from) {
		if (index == from) {
			return true;
		}
		TokenType previous = tokens.get(index - 1).type();
		return previous == TokenType.SEMICOLON || previous == TokenType.LBRACE || previous == TokenType.RBRACE;
	}

	private static String argumentAfter(List<YangToken> tokens, int keywordIndex, int to) {
		List<YangToken> argument = new ArrayList<>();
		for (int j = keywordIndex + 1; j < to; j++) {
			YangToken token = tokens.get(j);
			if (!token.isType(TokenType.WORD) && !token.isType(TokenType.STRING)) {
				break;
			}
			argument.add(token);
		}
		return StatementScanner.joinArgument(argument);
	}
}
