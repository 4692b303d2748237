package org.javai.toolgen.yang;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.javai.toolgen.diag.DiagnosticKind;
import org.javai.toolgen.diag.Diagnostics;
import org.javai.toolgen.yang.YangToken.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("YangTokenizer")
class YangTokenizerTest {

	private final Diagnostics diagnostics = new Diagnostics(null);

	private List<YangToken> tokenize(String input) {
		return new YangTokenizer(input, diagnostics).tokenize();
	}

	@Test
	void tokenizesStatementWithBlock() {
		List<YangToken> tokens = tokenize("container ospf { leaf id; }");

		assertThat(tokens).extracting(YangToken::type).containsExactly(
				TokenType.WORD, TokenType.WORD, TokenType.LBRACE, TokenType.WORD, TokenType.WORD,
				TokenType.SEMICOLON, TokenType.RBRACE, TokenType.EOF);
		assertThat(tokens.get(1).value()).isEqualTo("ospf");
	}

	@Test
	void emptyInputYieldsOnlyEof() {
		assertThat(tokenize("")).extracting(YangToken::type).containsExactly(TokenType.EOF);
		assertThat(tokenize(null)).extracting(YangToken::type).containsExactly(TokenType.EOF);
	}

	@Test
	void doubleQuotedStringsAreUnescaped() {
		List<YangToken> tokens = tokenize("description \"say \\\"hi\\\"\\n\\tnow\";");

		assertThat(tokens.get(1).type()).isEqualTo(TokenType.STRING);
		assertThat(tokens.get(1).value()).isEqualTo("say \"hi\"\n\tnow");
	}

	@Test
	void singleQuotedStringsAreLiteral() {
		List<YangToken> tokens = tokenize("pattern '[a-z]+\\d';");

		assertThat(tokens.get(1).value()).isEqualTo("[a-z]+\\d");
	}

	@Test
	void bracesInsideStringsAreNotTokens() {
		List<YangToken> tokens = tokenize("description \"a { b } c\";");

		assertThat(tokens).extracting(YangToken::type)
				.containsExactly(TokenType.WORD, TokenType.STRING, TokenType.SEMICOLON, TokenType.EOF);
	}

	@Test
	void commentsAreSkipped() {
		List<YangToken> tokens = tokenize("""
				// line comment {
				leaf a; /* block { comment
				   spanning lines } */ leaf b;
				""");

		assertThat(tokens).filteredOn(t -> t.isType(TokenType.WORD)).extracting(YangToken::value)
				.containsExactly("leaf", "a", "leaf", "b");
		assertThat(diagnostics.isEmpty()).isTrue();
	}

	@Test
	void recordsLineColumnAndLineLeading() {
		List<YangToken> tokens = tokenize("module m {\n  leaf x;\n}");

		YangToken leaf = tokens.get(3);
		assertThat(leaf.value()).isEqualTo("leaf");
		assertThat(leaf.line()).isEqualTo(2);
		assertThat(leaf.column()).isEqualTo(3);
		assertThat(leaf.lineLeading()).isTrue();
		assertThat(tokens.get(4).lineLeading()).isFalse();
		assertThat(leaf.location()).isEqualTo("line 2, column 3");
	}

	@Test
	void unterminatedStringIsReportedAndClosedAtEnd() {
		List<YangToken> tokens = tokenize("description \"never closed");

		assertThat(tokens.get(1).value()).isEqualTo("never closed");
		assertThat(tokens.get(tokens.size() - 1).type()).isEqualTo(TokenType.EOF);
		assertThat(diagnostics.toList()).singleElement()
				.satisfies(d -> {
					assertThat(d.kind()).isEqualTo(DiagnosticKind.STRUCTURAL_PARSE_ERROR);
					assertThat(d.message()).contains("Unterminated string");
				});
	}

	@Test
	void unterminatedCommentIsReported() {
		tokenize("leaf a; /* dangling");

		assertThat(diagnostics.toList()).singleElement()
				.satisfies(d -> assertThat(d.message()).contains("Unterminated comment"));
	}

	@Test
	void nonBreakingSpaceAndByteOrderMarkAreWhitespace() {
		List<YangToken> tokens = tokenize("\u00A0\uFEFFleaf\u00A0a;");

		assertThat(tokens).extracting(YangToken::value).containsExactly("leaf", "a", ";", "");
	}
}
