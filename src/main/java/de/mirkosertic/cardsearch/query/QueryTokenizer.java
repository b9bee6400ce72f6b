package de.mirkosertic.cardsearch.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a raw query into clause tokens on ASCII whitespace.
 * <p>
 * Whitespace inside a double-quoted span ({@code o:"draw 2 cards"}) or a regex span
 * ({@code o:/draw \d+ card/}) does not split. Quotes and slashes are kept in the token;
 * the {@link ValueParser} strips them once it knows the target field.
 * <p>
 * Outside such spans every space ends a clause: {@code o:destroy that target} is three clauses,
 * a text search for destroy and name searches for that and target. Multi-word values need quotes.
 */
public class QueryTokenizer {

    public List<QueryToken> tokenize(final String query) throws QueryParseException {
        final List<QueryToken> tokens = new ArrayList<>();
        int index = 0;
        while (index < query.length()) {
            if (Literals.isWhitespace(query.charAt(index))) {
                index++;
                continue;
            }
            final int tokenStart = index;
            while (index < query.length() && !Literals.isWhitespace(query.charAt(index))) {
                final char c = query.charAt(index);
                if (c == Literals.QUOTE || Literals.opensRegex(query, index, tokenStart)) {
                    final int close = Literals.closingDelimiter(query, index);
                    if (close < 0) {
                        throw new QueryParseException(ParseErrorKind.UNTERMINATED_LITERAL,
                                query.substring(tokenStart), index,
                                c == Literals.QUOTE ? "Missing closing quote" : "Missing closing slash of regex");
                    }
                    index = close + 1;
                } else if (c == Literals.ESCAPE) {
                    index = Math.min(index + 2, query.length());
                } else {
                    index++;
                }
            }
            tokens.add(new QueryToken(query.substring(tokenStart, index), tokenStart));
        }
        return tokens;
    }
}
