package de.mirkosertic.cardsearch.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ClauseParser} together with the {@link ValueParser} it delegates to.
 */
@DisplayName("ClauseParser Tests")
class ClauseParserTest {

    private final FieldRegistry registry = FieldRegistry.defaults();
    private final ClauseParser parser = new ClauseParser(registry, new ValueParser(new RegexCache()));

    private Clause parse(final String token) throws QueryParseException {
        return parser.parse(new QueryToken(token, 0));
    }

    private ParseErrorKind errorOf(final String token) {
        try {
            parser.parse(new QueryToken(token, 0));
        } catch (final QueryParseException e) {
            return e.getKind();
        }
        throw new AssertionError("Expected " + token + " to be rejected");
    }

    @Nested
    @DisplayName("Operators")
    class Operators {

        @ParameterizedTest(name = "{0}")
        @CsvSource({
                "level:4, EQ",
                "level=4, EQ",
                "level==4, EQ",
                "level!=4, NE",
                "level<4, LT",
                "level<=4, LE",
                "level>4, GT",
                "level>=4, GE"
        })
        @DisplayName("Lexemes map to operators, longest match first")
        void testLexemes(final String token, final Operator expected) throws QueryParseException {
            final Clause clause = parse(token);

            assertThat(clause.operator()).isEqualTo(expected);
            assertThat(clause.value()).isEqualTo(new Value.IntegerValue(4));
        }

        @Test
        @DisplayName("The first operator in the token wins")
        void testFirstOperatorWins() throws QueryParseException {
            final Clause clause = parse("o:a=b");

            assertThat(clause.field().canonicalName()).isEqualTo("text");
            assertThat(clause.value()).isEqualTo(new Value.TextValue("a=b"));
        }

        @Test
        @DisplayName("Comparison on a text field is rejected")
        void testComparisonOnText() {
            assertThat(errorOf("text:>=5")).isEqualTo(ParseErrorKind.OPERATOR_FIELD_MISMATCH);
            assertThat(errorOf("t>dragon")).isEqualTo(ParseErrorKind.OPERATOR_FIELD_MISMATCH);
            assertThat(errorOf("name<=a")).isEqualTo(ParseErrorKind.OPERATOR_FIELD_MISMATCH);
        }

        @Test
        @DisplayName("Colon followed by an operator takes that operator")
        void testColonQualifiedOperator() throws QueryParseException {
            final Clause clause = parse("atk:>=2500");

            assertThat(clause.operator()).isEqualTo(Operator.GE);
            assertThat(clause.value()).isEqualTo(new Value.IntegerValue(2500));
            assertThat(parse("l:!=12").operator()).isEqualTo(Operator.NE);
        }

        @Test
        @DisplayName("Negative numbers are accepted")
        void testNegativeNumber() throws QueryParseException {
            assertThat(parse("atk>-1").value()).isEqualTo(new Value.IntegerValue(-1));
        }
    }

    @Nested
    @DisplayName("Fields")
    class Fields {

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {"text", "effect", "eff", "e", "o", "TEXT", "Effect"})
        @DisplayName("All aliases of a field produce the same clause")
        void testAliasInvariance(final String alias) throws QueryParseException {
            assertThat(parse(alias + ":destroy")).isEqualTo(parse("text:destroy"));
        }

        @Test
        @DisplayName("Unknown field is rejected")
        void testUnknownField() {
            assertThat(errorOf("rarity:secret")).isEqualTo(ParseErrorKind.UNKNOWN_FIELD);
        }

        @Test
        @DisplayName("Missing field name is rejected")
        void testMissingFieldName() {
            assertThat(errorOf(":fire")).isEqualTo(ParseErrorKind.UNKNOWN_FIELD);
        }

        @Test
        @DisplayName("Bare term searches the name")
        void testBareTerm() throws QueryParseException {
            final Clause clause = parse("Blue-Eyes");

            assertThat(clause.field()).isEqualTo(registry.nameField());
            assertThat(clause.operator()).isEqualTo(Operator.EQ);
            assertThat(clause.value()).isEqualTo(new Value.TextValue("blue-eyes"));
        }

        @Test
        @DisplayName("Quoted bare term may contain an operator character")
        void testQuotedBareTerm() throws QueryParseException {
            final Clause clause = parse("\"dark magician: girl\"");

            assertThat(clause.field()).isEqualTo(registry.nameField());
            assertThat(clause.value()).isEqualTo(new Value.TextValue("dark magician: girl"));
        }
    }

    @Nested
    @DisplayName("Values")
    class Values {

        @Test
        @DisplayName("Quoted value keeps its spaces")
        void testQuotedValue() throws QueryParseException {
            assertThat(parse("effect:\"destroy that target\"").value())
                    .isEqualTo(new Value.TextValue("destroy that target"));
        }

        @Test
        @DisplayName("Partially quoted value with spaces is rejected")
        void testUnquotedSpaces() {
            assertThat(errorOf("effect:destroy\" that\"")).isEqualTo(ParseErrorKind.UNQUOTED_SPACES);
        }

        @Test
        @DisplayName("Quotes around a value without spaces are stripped")
        void testQuotesStripped() throws QueryParseException {
            assertThat(parse("t:\"Dragon\"").value()).isEqualTo(new Value.TextValue("dragon"));
        }

        @Test
        @DisplayName("Text values are folded to lower case")
        void testCaseFolding() throws QueryParseException {
            assertThat(parse("type:DRAGON")).isEqualTo(parse("type:dragon"));
        }

        @Test
        @DisplayName("Missing value is rejected")
        void testEmptyValue() {
            assertThat(errorOf("a:")).isEqualTo(ParseErrorKind.EMPTY_VALUE);
            assertThat(errorOf("a:\"\"")).isEqualTo(ParseErrorKind.EMPTY_VALUE);
        }

        @Test
        @DisplayName("Non-integer on a numeric field is rejected")
        void testNotANumber() {
            assertThat(errorOf("level:four")).isEqualTo(ParseErrorKind.NOT_A_NUMBER);
            assertThat(errorOf("atk>=2.5")).isEqualTo(ParseErrorKind.NOT_A_NUMBER);
            assertThat(errorOf("level:?")).isEqualTo(ParseErrorKind.NOT_A_NUMBER);
        }

        @Test
        @DisplayName("Unknown marker on ATK and DEF")
        void testUnknownMarker() throws QueryParseException {
            assertThat(parse("atk:?").value()).isEqualTo(Value.UnknownValue.INSTANCE);
            assertThat(parse("def!=?").value()).isEqualTo(Value.UnknownValue.INSTANCE);
            assertThat(errorOf("atk>=?")).isEqualTo(ParseErrorKind.OPERATOR_FIELD_MISMATCH);
        }

        @Test
        @DisplayName("Alternatives become a set in input order")
        void testSet() throws QueryParseException {
            assertThat(parse("level:3|6|9").value()).isEqualTo(new Value.SetValue(List.of(
                    new Value.IntegerValue(3), new Value.IntegerValue(6), new Value.IntegerValue(9))));
            assertThat(parse("a!=Light|\"dark\"").value()).isEqualTo(new Value.SetValue(List.of(
                    new Value.TextValue("light"), new Value.TextValue("dark"))));
        }

        @Test
        @DisplayName("Pipe inside quotes or escaped does not split")
        void testProtectedPipe() throws QueryParseException {
            assertThat(parse("o:\"a|b\"").value()).isEqualTo(new Value.TextValue("a|b"));
            assertThat(parse("o:a\\|b").value()).isEqualTo(new Value.TextValue("a|b"));
        }

        @Test
        @DisplayName("Empty alternatives are rejected")
        void testEmptyAlternative() {
            assertThat(errorOf("level:3||9")).isEqualTo(ParseErrorKind.EMPTY_ALTERNATIVE);
            assertThat(errorOf("a:fire|")).isEqualTo(ParseErrorKind.EMPTY_ALTERNATIVE);
            assertThat(errorOf("a:|fire")).isEqualTo(ParseErrorKind.EMPTY_ALTERNATIVE);
        }

        @Test
        @DisplayName("Set members are checked individually")
        void testBadSetMember() {
            assertThat(errorOf("level:3|x")).isEqualTo(ParseErrorKind.NOT_A_NUMBER);
            assertThat(errorOf("atk:?|0")).isEqualTo(ParseErrorKind.NOT_A_NUMBER);
        }

        @Test
        @DisplayName("Pipe under a comparison is not a set")
        void testPipeUnderComparison() {
            assertThat(errorOf("level>=3|6")).isEqualTo(ParseErrorKind.NOT_A_NUMBER);
        }
    }

    @Nested
    @DisplayName("Regular expressions")
    class Regexes {

        @Test
        @DisplayName("Regex on a text field compiles case-insensitively")
        void testRegex() throws QueryParseException {
            final Value value = parse("o:/draw \\d+ card/").value();

            assertThat(value).isInstanceOf(Value.RegexValue.class);
            final Value.RegexValue regex = (Value.RegexValue) value;
            assertThat(regex.source()).isEqualTo("draw \\d+ card");
            assertThat(regex.pattern().matcher("Draw 2 Cards").find()).isTrue();
        }

        @Test
        @DisplayName("Escaped slash is part of the pattern")
        void testEscapedSlash() throws QueryParseException {
            final Value.RegexValue regex = (Value.RegexValue) parse("name:/d\\/d/").value();

            assertThat(regex.source()).isEqualTo("d/d");
        }

        @Test
        @DisplayName("Malformed pattern is rejected with the pattern in the message")
        void testMalformedPattern() {
            assertThatThrownBy(() -> parse("o:/draw (/"))
                    .isInstanceOf(QueryParseException.class)
                    .hasMessageContaining("/draw (/")
                    .extracting(e -> ((QueryParseException) e).getKind())
                    .isEqualTo(ParseErrorKind.INVALID_REGEX);
        }

        @Test
        @DisplayName("Trailing flags are rejected")
        void testTrailingCharacters() {
            assertThat(errorOf("o:/draw/i")).isEqualTo(ParseErrorKind.INVALID_REGEX);
        }

        @Test
        @DisplayName("Regex on a non-text field is rejected")
        void testRegexOnNonText() {
            assertThat(errorOf("level:/4/")).isEqualTo(ParseErrorKind.INVALID_REGEX);
            assertThat(errorOf("t:/dragon/")).isEqualTo(ParseErrorKind.INVALID_REGEX);
        }

        @Test
        @DisplayName("Regex inside a set is rejected")
        void testRegexInSet() {
            assertThat(errorOf("o:draw|/destroy/")).isEqualTo(ParseErrorKind.INVALID_REGEX);
        }

        @Test
        @DisplayName("Negated regex is accepted")
        void testNegatedRegex() throws QueryParseException {
            final Clause clause = parse("o!=/banish/");

            assertThat(clause.operator()).isEqualTo(Operator.NE);
            assertThat(clause.value()).isInstanceOf(Value.RegexValue.class);
        }
    }

    @Test
    @DisplayName("Error positions are relative to the whole query")
    void testErrorPosition() {
        assertThatThrownBy(() -> parser.parse(new QueryToken("level:x", 10)))
                .isInstanceOf(QueryParseException.class)
                .extracting(e -> ((QueryParseException) e).getPosition())
                .isEqualTo(16);
    }
}
