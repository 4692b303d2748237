package org.javai.toolgen.yang;

import java.util.ArrayList;
import java.util.List;
import org.javai.toolgen.diag.DiagnosticKind;
import org.javai.toolgen.diag.Diagnostics;

/**
 * Converts schema text into tokens. Never throws: unterminated strings and comments are
 * closed at end of input and reported.
 */
public class YangTokenizer {

	private final String input;
	private final Diagnostics diagnostics;
	private int pos = 0;
	private int line = 1;
	private int column = 1;
	private int lastTokenLine = 0;

	public YangTokenizer(String input, Diagnostics diagnostics) {
		this.input = input != null ? input : "";
		this.diagnostics = diagnostics;
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return list of tokens, always ending with an EOF token
	 */
	public List<YangToken> tokenize() {
		List<YangToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespaceAndComments();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new YangToken(YangToken.TokenType.EOF, "", line, column, lastTokenLine != line));
		return tokens;
	}

	private YangToken nextToken() {
		int startLine = line;
		int startColumn = column;
		boolean leading = lastTokenLine != startLine;
		lastTokenLine = startLine;
		char c = peek();

		return switch (c) {
			case '{' -> {
				advance();
				yield new YangToken(YangToken.TokenType.LBRACE, "{", startLine, startColumn, leading);
			}
			case '}' -> {
				advance();
				yield new YangToken(YangToken.TokenType.RBRACE, "}", startLine, startColumn, leading);
			}
			case ';' -> {
				advance();
				yield new YangToken(YangToken.TokenType.SEMICOLON, ";", startLine, startColumn, leading);
			}
			case '"' -> scanDoubleQuoted(startLine, startColumn, leading);
			case '\'' -> scanSingleQuoted(startLine, startColumn, leading);
			default -> scanWord(startLine, startColumn, leading);
		};
	}

	private YangToken scanDoubleQuoted(int startLine, int startColumn, boolean leading) {
		advance(); // consume opening "

		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != '"') {
			char c = advance();
			if (c == '\\' && !isAtEnd()) {
				char next = advance();
				sb.append(switch (next) {
					case 'n' -> '\n';
					case 't' -> '\t';
					case '"' -> '"';
					case '\\' -> '\\';
					default -> next;
				});
			} else {
				sb.append(c);
			}
		}

		if (isAtEnd()) {
			report(startLine, startColumn, "Unterminated string");
		} else {
			advance(); // consume closing "
		}
		return new YangToken(YangToken.TokenType.STRING, sb.toString(), startLine, startColumn, leading);
	}

	private YangToken scanSingleQuoted(int startLine, int startColumn, boolean leading) {
		advance(); // consume opening '

		int start = pos;
		while (!isAtEnd() && peek() != '\'') {
			advance();
		}
		String value = input.substring(start, pos);

		if (isAtEnd()) {
			report(startLine, startColumn, "Unterminated string");
		} else {
			advance(); // consume closing '
		}
		return new YangToken(YangToken.TokenType.STRING, value, startLine, startColumn, leading);
	}

	private YangToken scanWord(int startLine, int startColumn, boolean leading) {
		int start = pos;

		while (!isAtEnd() && isWordChar(peek())) {
			advance();
		}

		String value = input.substring(start, pos);
		return new YangToken(YangToken.TokenType.WORD, value, startLine, startColumn, leading);
	}

	private void skipWhitespaceAndComments() {
		while (!isAtEnd()) {
			char c = peek();
			if (isWhitespace(c)) {
				advance();
			} else if (c == '/' && peekNext() == '/') {
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			} else if (c == '/' && peekNext() == '*') {
				skipBlockComment();
			} else {
				return;
			}
		}
	}

	private void skipBlockComment() {
		int startLine = line;
		int startColumn = column;
		advance();
		advance();
		while (!isAtEnd()) {
			if (peek() == '*' && peekNext() == '/') {
				advance();
				advance();
				return;
			}
			advance();
		}
		report(startLine, startColumn, "Unterminated comment");
	}

	private void report(int atLine, int atColumn, String message) {
		if (diagnostics != null) {
			diagnostics.report(DiagnosticKind.STRUCTURAL_PARSE_ERROR,
					"line " + atLine + ", column " + atColumn, message);
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char peekNext() {
		return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
	}

	private char advance() {
		char c = input.charAt(pos++);
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		return c;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == '\u00A0' || c == '\uFEFF';
	}

	private boolean isWordChar(char c) {
		return !isWhitespace(c) && c != '{' && c != '}' && c != ';' && c != '"' && c != '\'';
	}
}
