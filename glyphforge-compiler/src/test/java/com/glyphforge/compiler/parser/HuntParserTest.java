package com.glyphforge.compiler.parser;

import com.glyphforge.api.exceptions.ParseException;
import com.glyphforge.compiler.ast.AlphaBracket;
import com.glyphforge.compiler.ast.AstPrinter;
import com.glyphforge.compiler.ast.ExecParam;
import com.glyphforge.compiler.ast.GammaBracket;
import com.glyphforge.compiler.ast.Literal;
import com.glyphforge.compiler.ast.Program;
import com.glyphforge.compiler.lexer.Token;
import com.glyphforge.compiler.lexer.TokenSerializer;
import com.glyphforge.compiler.lexer.Tokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HuntParserTest {

    private static final String SAMPLE =
        "< hunt Track:sample [INIT GATHER = {param tag:button = (val \"[\",\"]\")}] ><EXEC>";

    private HuntParser parser;

    @BeforeEach
    void setUp() {
        parser = new HuntParser();
    }

    @Test
    @DisplayName("Should build the four-level tree for a statement")
    void testParseSample() {
        Program program = parser.parse(SAMPLE);

        assertThat(AstPrinter.print(program)).isEqualTo(
            "(alpha hunt +Track :sample (beta INIT +GATHER =_ "
                + "(gamma param +tag :button =_ (delta val \"[\" \"]\"))) (exec))");

        AlphaBracket alpha = program.statements().get(0);
        assertThat(alpha.hasModifier("Track")).isTrue();
        assertThat(alpha.bridgeTarget()).isEqualTo("sample");
        assertThat(alpha.exec()).isNotNull();
        assertThat(alpha.exec().params()).isEmpty();

        GammaBracket gamma = alpha.children().get(0).children().get(0);
        assertThat(gamma.children().get(0).values())
            .containsExactly(Literal.string("["), Literal.string("]"));
    }

    @Test
    @DisplayName("Should yield the same tree after re-serializing the token stream")
    void testTokenRoundTrip() {
        List<Token> tokens = new Tokenizer().tokenize(SAMPLE);
        String expected = AstPrinter.print(parser.parse(tokens));

        String reserialized = TokenSerializer.serialize(tokens);
        String first = AstPrinter.print(new HuntParser().parse(reserialized));
        String second = AstPrinter.print(new HuntParser().parse(
            TokenSerializer.serialize(new Tokenizer().tokenize(reserialized))));

        assertThat(first).isEqualTo(expected);
        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Should report the missing closing bracket of a truncated statement")
    void testTruncatedStatement() {
        assertThatThrownBy(() -> parser.parse("<hunt [param=val {pluck:data}]"))
            .isInstanceOf(ParseException.class)
            .hasMessage("Expected ALPHA_CLOSE but found EOF at line 1");
    }

    @Test
    @DisplayName("Should reject brackets outside their enclosing level")
    void testMisnestedBrackets() {
        assertThatThrownBy(() -> parser.parse("<hunt>[param=val]{pluck:data}</hunt"))
            .isInstanceOfSatisfying(ParseException.class, e -> {
                assertThat(e.getExpected()).isEqualTo("ALPHA_OPEN");
                assertThat(e.getActual()).isEqualTo("BETA_OPEN");
                assertThat(e.getLine()).isEqualTo(1);
            });
    }

    @Test
    @DisplayName("Should reject empty source")
    void testEmptySource() {
        assertThatThrownBy(() -> parser.parse("# nothing here"))
            .isInstanceOf(ParseException.class)
            .hasMessage("Expected ALPHA_OPEN but found EOF at line 1");
    }

    @Test
    @DisplayName("Should reject a missing value after an assignment")
    void testMissingValue() {
        assertThatThrownBy(() -> parser.parse("<hunt [INIT = , ]>"))
            .isInstanceOf(ParseException.class)
            .hasMessage("Expected VALUE but found COMMA at line 1");
    }

    @Test
    @DisplayName("Should report the source line of an error in indented source")
    void testErrorLine() {
        String source = "<hunt\n    [INIT\n        {tag:x = (val \"a\" \"b\")}]>";

        assertThatThrownBy(() -> parser.parse(source))
            .isInstanceOf(ParseException.class)
            .hasMessage("Expected DELTA_CLOSE but found STRING at line 3");
    }

    @Test
    @DisplayName("Should parse chained EXEC parameters with values and nested gammas")
    void testExecParameters() {
        Program program = parser.parse("<hunt> <EXEC:req@@mode=strict {tag:t = (val \"x\")}>");

        List<ExecParam> params = program.statements().get(0).exec().params();
        assertThat(params).extracting(ExecParam::name).containsExactly("req", "mode");
        assertThat(params.get(0).value()).isNull();
        assertThat(params.get(1).value()).isEqualTo(Literal.identifier("strict"));
        assertThat(params.get(1).nested().command()).isEqualTo("tag");
    }

    @Test
    @DisplayName("Should accept a bare EXEC trailer and several statements")
    void testMultipleStatements() {
        Program program = parser.parse("<Track:a> EXEC:prohib\n<Track:b>");

        assertThat(program.statements()).extracting(AlphaBracket::bridgeTarget).containsExactly("a", "b");
        assertThat(program.statements().get(0).exec().params()).extracting(ExecParam::name)
            .containsExactly("prohib");
        assertThat(program.statements().get(1).exec()).isNull();
    }

    @Test
    @DisplayName("Should allow leading and trailing commas in value lists")
    void testDeltaCommas() {
        Program program = parser.parse("<hunt [INIT {tag:t (val, \"a\", \"b\", )}]>");

        GammaBracket gamma = program.statements().get(0).children().get(0).children().get(0);
        assertThat(gamma.assigned()).isFalse();
        assertThat(gamma.children().get(0).values()).extracting(Literal::text).containsExactly("a", "b");
    }
}
