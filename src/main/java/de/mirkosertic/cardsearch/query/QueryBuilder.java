package de.mirkosertic.cardsearch.query;

import de.mirkosertic.cardsearch.filter.CompiledQuery;
import de.mirkosertic.cardsearch.filter.FilterEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the query language: tokenizes, parses every clause and assembles the result.
 *
 * <h2>Example</h2>
 * <pre>
 * QueryBuilder builder = new QueryBuilder();
 * CompiledQuery query = builder.compile("c:fusion l!=12 blue-eyes");
 * cards.stream().filter(query).toList();
 * </pre>
 *
 * The first error rejects the whole query; there is no partial execution.
 * Instances are immutable and may be shared between threads.
 */
public class QueryBuilder {

    private static final Logger logger = LoggerFactory.getLogger(QueryBuilder.class);

    /**
     * Default maximum number of clauses per query.
     */
    public static final int DEFAULT_MAX_CLAUSES = 32;

    private final QueryTokenizer tokenizer;
    private final ClauseParser clauseParser;
    private final FilterEvaluator evaluator;
    private final int maxClauses;

    public QueryBuilder() {
        this(FieldRegistry.defaults(), new RegexCache(), DEFAULT_MAX_CLAUSES);
    }

    public QueryBuilder(final FieldRegistry registry, final RegexCache regexCache, final int maxClauses) {
        this(new QueryTokenizer(), new ClauseParser(registry, new ValueParser(regexCache)),
                new FilterEvaluator(), maxClauses);
    }

    public QueryBuilder(final QueryTokenizer tokenizer, final ClauseParser clauseParser,
                        final FilterEvaluator evaluator, final int maxClauses) {
        if (maxClauses < 1) {
            throw new IllegalArgumentException("maxClauses must be positive, was " + maxClauses);
        }
        this.tokenizer = tokenizer;
        this.clauseParser = clauseParser;
        this.evaluator = evaluator;
        this.maxClauses = maxClauses;
    }

    /**
     * Parses a raw query. A blank query yields an empty {@link Query}, which matches every card.
     *
     * @param rawQuery the text as typed by the user
     * @return the parsed query
     * @throws QueryParseException on the first invalid token
     */
    public Query parse(final String rawQuery) throws QueryParseException {
        try {
            final List<QueryToken> tokens = tokenizer.tokenize(rawQuery);
            if (tokens.size() > maxClauses) {
                final QueryToken first = tokens.get(maxClauses);
                throw new QueryParseException(ParseErrorKind.TOO_MANY_CLAUSES, first.text(), first.position(),
                        "A query may have at most " + maxClauses + " clauses, got " + tokens.size());
            }
            final List<Clause> clauses = new ArrayList<>(tokens.size());
            for (final QueryToken token : tokens) {
                clauses.add(clauseParser.parse(token));
            }
            return new Query(clauses);
        } catch (final QueryParseException e) {
            logger.debug("Rejected query “{}”: {}", rawQuery, e.getMessage());
            throw e;
        }
    }

    /**
     * Parses a raw query and binds it to the evaluator.
     *
     * @throws QueryParseException on the first invalid token
     */
    public CompiledQuery compile(final String rawQuery) throws QueryParseException {
        return new CompiledQuery(parse(rawQuery), evaluator);
    }

    public FilterEvaluator getEvaluator() {
        return evaluator;
    }
}
