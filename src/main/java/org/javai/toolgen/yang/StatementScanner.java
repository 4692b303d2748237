package org.javai.toolgen.yang;

import java.util.ArrayList;
import java.util.List;
import org.javai.toolgen.diag.DiagnosticKind;
import org.javai.toolgen.diag.Diagnostics;
import org.javai.toolgen.yang.YangToken.TokenType;

/**
 * Splits a token range into sibling statements, slicing block bodies at the positions
 * found by {@link BraceMatcher}. A block with a missing closing brace is reported and
 * dropped; its later siblings are still scanned.
 */
public class StatementScanner {

	private final List<YangToken> tokens;
	private final BraceMatcher braces;
	private final Diagnostics diagnostics;

	public StatementScanner(List<YangToken> tokens, BraceMatcher braces, Diagnostics diagnostics) {
		this.tokens = tokens;
		this.braces = braces;
		this.diagnostics = diagnostics;
	}

	public List<YangToken> tokens() {
		return tokens;
	}

	/**
	 * Scans the statements of one nesting level. Unterminated blocks are dropped.
	 *
	 * @param from first token index (inclusive)
	 * @param to last token index (exclusive)
	 */
	public List<YangStatement> scan(int from, int to) {
		return scan(from, to, false);
	}

	/**
	 * Scans the statements of one nesting level.
	 *
	 * @param keepUnterminated when {@code true}, an unterminated block is still returned
	 * (flagged) with its partial body; it is reported either way
	 */
	public List<YangStatement> scan(int from, int to, boolean keepUnterminated) {
		List<YangStatement> statements = new ArrayList<>();
		int limit = Math.min(to, tokens.size() - 1);
		int i = from;
		while (i < limit) {
			YangToken token = tokens.get(i);
			switch (token.type()) {
				case SEMICOLON -> i++;
				case RBRACE -> {
					report(token.location(), "Unexpected '}' with no open block");
					i++;
				}
				case LBRACE -> {
					report(token.location(), "Block without a keyword");
					i = Math.max(i + 1, braces.resumeAt(i));
				}
				default -> i = scanStatement(i, limit, keepUnterminated, statements);
			}
		}
		return statements;
	}

	private int scanStatement(int start, int limit, boolean keepUnterminated, List<YangStatement> out) {
		YangToken keyword = tokens.get(start);
		int j = start + 1;
		List<YangToken> argumentTokens = new ArrayList<>();
		while (j < limit && isArgumentToken(tokens.get(j))) {
			argumentTokens.add(tokens.get(j));
			j++;
		}
		String argument = joinArgument(argumentTokens);
		String described = argument != null ? keyword.value() + " '" + argument + "'" : keyword.value();

		if (j >= limit || tokens.get(j).isType(TokenType.RBRACE) || tokens.get(j).isType(TokenType.EOF)) {
			report(keyword.location(), "Statement " + described + " is not terminated by ';'");
			out.add(new YangStatement(keyword.value(), argument, keyword.line(), keyword.column(), -1, -1, true));
			return j;
		}
		if (tokens.get(j).isType(TokenType.SEMICOLON)) {
			out.add(new YangStatement(keyword.value(), argument, keyword.line(), keyword.column(), -1, -1, true));
			return j + 1;
		}

		// '{' opens a block
		int bodyStart = j + 1;
		int bodyEnd = Math.min(braces.bodyEnd(j), limit);
		if (braces.isTerminated(j) && braces.bodyEnd(j) < limit) {
			out.add(new YangStatement(keyword.value(), argument, keyword.line(), keyword.column(),
					bodyStart, bodyEnd, true));
			return braces.resumeAt(j);
		}
		report(keyword.location(), "Block " + described + " is missing its closing '}'");
		if (keepUnterminated) {
			out.add(new YangStatement(keyword.value(), argument, keyword.line(), keyword.column(),
					bodyStart, Math.max(bodyStart, bodyEnd), false));
		}
		return Math.max(bodyStart, Math.min(braces.resumeAt(j), limit));
	}

	private static boolean isArgumentToken(YangToken token) {
		return token.isType(TokenType.WORD) || token.isType(TokenType.STRING);
	}

	/**
	 * Joins argument tokens; quoted strings separated by {@code +} are concatenated.
	 */
	static String joinArgument(List<YangToken> argumentTokens) {
		if (argumentTokens.isEmpty()) {
			return null;
		}
		StringBuilder sb = new StringBuilder();
		boolean concatenate = false;
		for (YangToken token : argumentTokens) {
			if (token.isWord("+") && sb.length() > 0) {
				concatenate = true;
				continue;
			}
			if (sb.length() > 0 && !concatenate) {
				sb.append(' ');
			}
			sb.append(token.value());
			concatenate = false;
		}
		return sb.toString();
	}

	private void report(String location, String message) {
		diagnostics.report(DiagnosticKind.STRUCTURAL_PARSE_ERROR, location, message);
	}
}
