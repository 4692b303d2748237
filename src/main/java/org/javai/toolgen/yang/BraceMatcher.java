package org.javai.toolgen.yang;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Depth-counting scanner that pairs every {@code '{'} with its {@code '}'}.
 *
 * <p>Open blocks are kept on an explicit stack, so arbitrarily deep input never recurses.
 * Balanced input is matched by counting alone. When the counts disagree, the matcher
 * re-runs with indentation recovery: inside an open block, a line-leading token at or left
 * of the block's own indentation (or a line-leading {@code '}'} strictly left of it)
 * means the block's closing brace is missing. Such a block is closed implicitly, marked
 * unterminated and scanning of its siblings resumes at that token.</p>
 */
public final class BraceMatcher {

	static final int UNTERMINATED = -1;

	private final int[] match;
	private final int[] resume;
	private final boolean recovered;

	private BraceMatcher(int[] match, int[] resume, boolean recovered) {
		this.match = match;
		this.resume = resume;
		this.recovered = recovered;
	}

	/**
	 * Matches the braces of a complete token list (ending with EOF).
	 */
	public static BraceMatcher match(List<YangToken> tokens) {
		return scan(tokens, !isBalanced(tokens));
	}

	private static BraceMatcher scan(List<YangToken> tokens, boolean recover) {
		int size = tokens.size();
		int[] match = new int[size];
		int[] resume = new int[size];
		Arrays.fill(match, UNTERMINATED);
		Arrays.fill(resume, UNTERMINATED);
		Map<Integer, Integer> lineIndent = lineIndentation(tokens);
		int eof = size - 1;

		Deque<int[]> open = new ArrayDeque<>(); // {index of '{', indentation of its line}
		for (int i = 0; i < size; i++) {
			YangToken token = tokens.get(i);
			if (recover && token.lineLeading()) {
				while (!open.isEmpty() && closesImplicitly(token, open.peek()[1])) {
					resume[open.pop()[0]] = i;
				}
			}
			switch (token.type()) {
				case LBRACE -> open.push(new int[] {i, lineIndent.getOrDefault(token.line(), token.column())});
				case RBRACE -> {
					if (!open.isEmpty()) {
						int opening = open.pop()[0];
						match[opening] = i;
						resume[opening] = i + 1;
					}
				}
				default -> {
				}
			}
		}
		while (!open.isEmpty()) {
			resume[open.pop()[0]] = eof;
		}
		return new BraceMatcher(match, resume, recover);
	}

	private static boolean closesImplicitly(YangToken token, int indent) {
		if (token.isType(YangToken.TokenType.EOF)) {
			return false;
		}
		if (token.isType(YangToken.TokenType.RBRACE)) {
			return token.column() < indent;
		}
		return token.column() <= indent;
	}

	private static Map<Integer, Integer> lineIndentation(List<YangToken> tokens) {
		Map<Integer, Integer> indent = new HashMap<>();
		for (YangToken token : tokens) {
			if (token.lineLeading()) {
				indent.putIfAbsent(token.line(), token.column());
			}
		}
		return indent;
	}

	private static boolean isBalanced(List<YangToken> tokens) {
		int depth = 0;
		for (YangToken token : tokens) {
			if (token.isType(YangToken.TokenType.LBRACE)) {
				depth++;
			} else if (token.isType(YangToken.TokenType.RBRACE)) {
				depth--;
				if (depth < 0) {
					return false;
				}
			}
		}
		return depth == 0;
	}

	/**
	 * @param openIndex index of a {@code '{'} token
	 * @return whether the block opened there has a closing brace
	 */
	public boolean isTerminated(int openIndex) {
		return match[openIndex] != UNTERMINATED;
	}

	/**
	 * @return index of the matching {@code '}'}, or the end of the block's partial content
	 * (exclusive) when it is unterminated
	 */
	public int bodyEnd(int openIndex) {
		return isTerminated(openIndex) ? match[openIndex] : resume[openIndex];
	}

	/**
	 * @return index of the first token after the block, where sibling scanning continues
	 */
	public int resumeAt(int openIndex) {
		return resume[openIndex];
	}

	/**
	 * Whether indentation recovery was needed to match this input.
	 */
	public boolean recovered() {
		return recovered;
	}
}
