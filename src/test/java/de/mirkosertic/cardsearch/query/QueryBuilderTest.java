package de.mirkosertic.cardsearch.query;

import de.mirkosertic.cardsearch.filter.CardRecord;
import de.mirkosertic.cardsearch.filter.CompiledQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link QueryBuilder}.
 */
@DisplayName("QueryBuilder Tests")
class QueryBuilderTest {

    private final QueryBuilder builder = new QueryBuilder();

    @Test
    @DisplayName("One clause per token, in input order")
    void testClausesInOrder() throws QueryParseException {
        final Query query = builder.parse("c:fusion l!=12 blue-eyes");

        assertThat(query.clauses())
                .extracting(clause -> clause.field().canonicalName())
                .containsExactly("type", "level", "name");
        assertThat(query.clauses())
                .extracting(Clause::operator)
                .containsExactly(Operator.EQ, Operator.NE, Operator.EQ);
    }

    @Test
    @DisplayName("Unquoted words after a field value become name searches")
    void testUnquotedWordsSplit() throws QueryParseException {
        final Query query = builder.parse("effect:destroy that target");

        assertThat(query.clauses())
                .extracting(clause -> clause.field().canonicalName())
                .containsExactly("text", "name", "name");
        assertThat(query.toQueryString()).isEqualTo("text:destroy name:that name:target");
        assertThat(builder.parse("effect:\"destroy that target\"").clauses()).hasSize(1);
    }

    @Test
    @DisplayName("Blank query is empty and matches every card")
    void testBlankQuery() throws QueryParseException {
        final CompiledQuery query = builder.compile("   ");

        assertThat(query.query().isEmpty()).isTrue();
        assertThat(query.test(CardRecord.of("name", "Kuriboh"))).isTrue();
        assertThat(query.query().describe()).isEqualTo("any card");
    }

    @Test
    @DisplayName("First invalid clause rejects the whole query")
    void testWholeQueryRejected() {
        assertThatThrownBy(() -> builder.parse("a:fire rarity:secret level:x"))
                .isInstanceOf(QueryParseException.class)
                .extracting(e -> ((QueryParseException) e).getKind())
                .isEqualTo(ParseErrorKind.UNKNOWN_FIELD);
    }

    @Test
    @DisplayName("Too many clauses are rejected at the first surplus token")
    void testTooManyClauses() {
        final QueryBuilder small = new QueryBuilder(FieldRegistry.defaults(), new RegexCache(), 2);

        assertThatThrownBy(() -> small.parse("a:fire l:4 t:dragon"))
                .isInstanceOf(QueryParseException.class)
                .satisfies(e -> {
                    final QueryParseException parseException = (QueryParseException) e;
                    assertThat(parseException.getKind()).isEqualTo(ParseErrorKind.TOO_MANY_CLAUSES);
                    assertThat(parseException.getToken()).isEqualTo("t:dragon");
                    assertThat(parseException.getPosition()).isEqualTo(11);
                });
    }

    @Test
    @DisplayName("Clause limit must be positive")
    void testInvalidClauseLimit() {
        assertThatThrownBy(() -> new QueryBuilder(FieldRegistry.defaults(), new RegexCache(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Parse errors carry position and token in the message")
    void testErrorMessage() {
        assertThatThrownBy(() -> builder.parse("l:4 atk:lots"))
                .isInstanceOf(QueryParseException.class)
                .hasMessageContaining("NOT_A_NUMBER at position 8")
                .hasMessageContaining("lots");
    }

    @Nested
    @DisplayName("Canonical form")
    class CanonicalForm {

        @Test
        @DisplayName("Aliases, operators and case are normalized")
        void testCanonicalSerialization() throws QueryParseException {
            final Query query = builder.parse("C:Fusion L==8 ATK>=3000 o:\"Dragon monster\" a:light|Dark");

            assertThat(query.toQueryString())
                    .isEqualTo("type:fusion level:8 atk>=3000 text:\"dragon monster\" attribute:light|dark");
        }

        @Test
        @DisplayName("Regex keeps its source and escapes slashes")
        void testRegexSerialization() throws QueryParseException {
            assertThat(builder.parse("name:/d\\/d/ o:/draw \\d+/").toQueryString())
                    .isEqualTo("name:/d\\/d/ text:/draw \\d+/");
        }

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {
                "a:fire def:200",
                "c:fusion l!=12 blue-eyes",
                "level:3|6|9 atk:? def!=?",
                "o:/draw \\d+ card/ effect!=\"destroy that target\"",
                "\"dark magician\" t:spellcaster|dragon",
                "name:\"a \\\"quoted\\\" name\" o:\"x|y\" o:a\\|b",
                "name:\"c:d\" name:\"1/2\" p<=5 legal:0|1 y>2019",
                "o!=/^you can only/ lr>=3 s:lob|sdk"
        })
        @DisplayName("Re-parsing the canonical form yields the same query")
        void testIdempotence(final String raw) throws QueryParseException {
            final Query first = builder.parse(raw);
            final Query second = builder.parse(first.toQueryString());

            assertThat(second).isEqualTo(first);
            assertThat(second.toQueryString()).isEqualTo(first.toQueryString());
        }
    }

    @Nested
    @DisplayName("Description")
    class Description {

        @Test
        @DisplayName("Clauses are described in plain words")
        void testDescribe() throws QueryParseException {
            assertThat(builder.parse("l>=4 a:dark|light o:draw o!=/banish/ atk:?").describe())
                    .isEqualTo("level is at least 4 and attribute is one of “dark”, “light”"
                            + " and text contains “draw” and text does not match /banish/ and atk is unknown");
        }

        @Test
        @DisplayName("Compiled query exposes the parsed query")
        void testCompiledQuery() throws QueryParseException {
            final CompiledQuery compiled = builder.compile("a:fire");

            assertThat(compiled.query().clauses()).hasSize(1);
            assertThat(compiled.evaluator()).isSameAs(builder.getEvaluator());
            assertThat(List.of(CardRecord.of("attribute", "FIRE"), CardRecord.of("attribute", "Water")))
                    .filteredOn(compiled)
                    .hasSize(1);
        }
    }
}
