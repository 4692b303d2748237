package org.javai.toolgen.yang;

/**
 * A token of the schema description language.
 *
 * @param type the token type
 * @param value the token text; strings are unquoted and unescaped
 * @param line 1-based line of the first character
 * @param column 1-based column of the first character
 * @param lineLeading whether no other token precedes it on its line
 */
public record YangToken(TokenType type, String value, int line, int column, boolean lineLeading) {

	public enum TokenType {
		WORD,          // keywords and unquoted arguments
		STRING,        // "double" or 'single' quoted
		LBRACE,        // {
		RBRACE,        // }
		SEMICOLON,     // ;
		EOF            // end of input
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public boolean isWord(String expected) {
		return type == TokenType.WORD && value.equals(expected);
	}

	public String location() {
		return "line " + line + ", column " + column;
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + value + "\")";
			case WORD -> "WORD(" + value + ")";
			default -> type.toString();
		};
	}
}
