package com.glyphforge.compiler.lexer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TokenizerTest {

    private Tokenizer tokenizer;

    @BeforeEach
    void setUp() {
        tokenizer = new Tokenizer();
    }

    private static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream().map(Token::kind).toList();
    }

    @Test
    @DisplayName("Should lex a full statement with brackets, bridges, strings and EXEC")
    void testFullStatement() {
        List<Token> tokens = tokenizer.tokenize(
            "< hunt Track:sample [INIT GATHER = {param tag:button = (val \"[\",\"]\")}] ><EXEC>");

        assertThat(kinds(tokens)).containsExactly(
            TokenKind.ALPHA_OPEN, TokenKind.KEYWORD, TokenKind.KEYWORD, TokenKind.BRIDGE, TokenKind.IDENTIFIER,
            TokenKind.BETA_OPEN, TokenKind.KEYWORD, TokenKind.KEYWORD, TokenKind.ASSIGN,
            TokenKind.GAMMA_OPEN, TokenKind.KEYWORD, TokenKind.KEYWORD, TokenKind.BRIDGE, TokenKind.IDENTIFIER,
            TokenKind.ASSIGN, TokenKind.DELTA_OPEN, TokenKind.KEYWORD, TokenKind.STRING, TokenKind.COMMA,
            TokenKind.STRING, TokenKind.DELTA_CLOSE, TokenKind.GAMMA_CLOSE, TokenKind.BETA_CLOSE,
            TokenKind.ALPHA_CLOSE, TokenKind.ALPHA_OPEN, TokenKind.KEYWORD, TokenKind.ALPHA_CLOSE, TokenKind.EOF);
        assertThat(tokens.get(4).text()).isEqualTo("sample");
        assertThat(tokens.get(17).text()).isEqualTo("[");
        assertThat(tokens.get(19).text()).isEqualTo("]");
    }

    @Test
    @DisplayName("Should emit one INDENT or DEDENT per indent unit")
    void testIndentation() {
        List<Token> tokens = tokenizer.tokenize("<hunt\n    [INIT\n        {tag:x}\n]>");

        List<Token> layout = tokens.stream().filter(t -> t.kind().isLayout()).toList();
        assertThat(kinds(layout)).containsExactly(
            TokenKind.INDENT, TokenKind.INDENT, TokenKind.DEDENT, TokenKind.DEDENT);
        assertThat(layout).extracting(Token::line).containsExactly(2, 3, 4, 4);
        assertThat(tokens.get(tokens.size() - 1).kind()).isEqualTo(TokenKind.EOF);
    }

    @Test
    @DisplayName("Should close pending indentation before EOF")
    void testTrailingDedent() {
        List<Token> tokens = tokenizer.tokenize("<hunt\n    [INIT]>");

        assertThat(kinds(tokens).subList(tokens.size() - 2, tokens.size()))
            .containsExactly(TokenKind.DEDENT, TokenKind.EOF);
        assertThat(tokens.get(tokens.size() - 1).line()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should skip blank and comment lines without changing indentation")
    void testCommentsAndBlankLines() {
        List<Token> tokens = tokenizer.tokenize("# header\n\n        # indented comment\n<hunt>");

        assertThat(kinds(tokens)).containsExactly(
            TokenKind.ALPHA_OPEN, TokenKind.KEYWORD, TokenKind.ALPHA_CLOSE, TokenKind.EOF);
        assertThat(tokens.get(0).line()).isEqualTo(4);
    }

    @ParameterizedTest
    @ValueSource(strings = {"hunt", "HARVEST", "RACK", "COOK", "skin", "req", "prohib", "true"})
    @DisplayName("Should recognize reserved words as keywords")
    void testKeywords(String word) {
        assertThat(tokenizer.tokenize(word).get(0).kind()).isEqualTo(TokenKind.KEYWORD);
    }

    @Test
    @DisplayName("Should treat other words as identifiers")
    void testIdentifiers() {
        List<Token> tokens = tokenizer.tokenize("field_text1 Hunt _x");

        assertThat(kinds(tokens)).containsExactly(
            TokenKind.IDENTIFIER, TokenKind.IDENTIFIER, TokenKind.IDENTIFIER, TokenKind.EOF);
        assertThat(tokens).extracting(Token::text).startsWith("field_text1", "Hunt", "_x");
    }

    @Test
    @DisplayName("Should turn unknown characters into CHAR tokens and @@ into CHAIN")
    void testTolerantLexing() {
        List<Token> tokens = tokenizer.tokenize("! @ @@ 7");

        assertThat(kinds(tokens)).containsExactly(
            TokenKind.CHAR, TokenKind.CHAR, TokenKind.CHAIN, TokenKind.CHAR, TokenKind.EOF);
        assertThat(tokens).extracting(Token::text).startsWith("!", "@", "@@", "7");
    }

    @Test
    @DisplayName("Should lex both quote styles and run unterminated strings to end of line")
    void testStrings() {
        List<Token> tokens = tokenizer.tokenize("'say \"hi\"' \"open\n\"abc");

        assertThat(tokens).filteredOn(t -> t.kind() == TokenKind.STRING)
            .extracting(Token::text)
            .containsExactly("say \"hi\"", "open", "abc");
    }

    @Test
    @DisplayName("Should produce only EOF for empty input")
    void testEmptyInput() {
        List<Token> tokens = tokenizer.tokenize("");

        assertThat(tokens).containsExactly(new Token(TokenKind.EOF, "", 1));
    }
}
