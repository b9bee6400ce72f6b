package de.mirkosertic.cardsearch;

import de.mirkosertic.cardsearch.card.CardDataLoader;
import de.mirkosertic.cardsearch.config.ApplicationConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("CardSearchApplication Tests")
class CardSearchApplicationTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    private CardSearchApplication app;

    @BeforeEach
    void setUp() throws IOException {
        app = new CardSearchApplication(new CardSearchService(ApplicationConfig.defaults()), out);
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("cards-sample.json")) {
            app.index(new CardDataLoader().load(in));
        }
    }

    @AfterEach
    void tearDown() {
        app.shutdown();
    }

    private List<String> lines() {
        return buffer.toString(StandardCharsets.UTF_8).lines().toList();
    }

    @Test
    @DisplayName("Prints a summary followed by id and name of every match")
    void testPrintsMatches() {
        assertThat(app.runQuery("  a:dark ")).isTrue();

        final List<String> lines = lines();
        assertThat(lines.get(0)).startsWith("Showing 2 results where attribute is “dark”");
        assertThat(lines.subList(1, lines.size()))
                .containsExactly("16178681\tOdd-Eyes Pendulum Dragon", "1861629\tDecode Talker");
    }

    @Test
    @DisplayName("Results keep the original spelling of the name")
    void testOriginalSpelling() {
        app.runQuery("des");

        assertThat(lines()).contains("2326738\tDes Lacooda");
    }

    @Test
    @DisplayName("Invalid query prints the reason and reports failure")
    void testInvalidQuery() {
        assertThat(app.runQuery("text:>=5")).isFalse();

        assertThat(lines()).singleElement()
                .satisfies(line -> assertThat(line)
                        .startsWith("Could not parse query: ")
                        .contains("OPERATOR_FIELD_MISMATCH"));
    }

    @Test
    @DisplayName("Running several queries counts the failures")
    void testRunCountsFailures() {
        final int failures = app.run(List.of("t:spell", "rarity:secret", "legal:0", "o:\"draw"));

        assertThat(failures).isEqualTo(2);
        assertThat(lines()).contains("55144522\tPot of Greed");
    }

    @Test
    @DisplayName("Cards are loaded from the configured file")
    void testInitFromFile(@TempDir final Path dir) throws IOException {
        final Path file = dir.resolve("cards.json");
        Files.writeString(file, """
                {"data": [{"id": 7, "name": "Kuriboh", "type": "Effect Monster", "desc": "", "race": "Fiend"}]}
                """);
        final ApplicationConfig config = mock(ApplicationConfig.class);
        when(config.getCardsFile()).thenReturn(file.toString());

        app.init(config);
        app.runQuery("kuriboh");

        assertThat(lines()).contains("7\tKuriboh");
    }

    @Test
    @DisplayName("Release years come from the configured set list")
    void testInitWithSetsFile(@TempDir final Path dir) throws IOException {
        final Path cardsFile = dir.resolve("cards.json");
        Files.writeString(cardsFile, """
                {"data": [
                  {"id": 7, "name": "Kuriboh", "type": "Effect Monster", "desc": "", "race": "Fiend",
                   "card_sets": [{"set_name": "Metal Raiders", "set_code": "MRD-071"}]},
                  {"id": 8, "name": "Winged Kuriboh", "type": "Effect Monster", "desc": "", "race": "Fairy",
                   "card_sets": [{"set_name": "The Lost Millennium", "set_code": "TLM-EN005"}]}
                ]}
                """);
        final Path setsFile = dir.resolve("cardsets.json");
        Files.writeString(setsFile, """
                [{"set_name": "Metal Raiders", "tcg_date": "2002-06-26"},
                 {"set_name": "The Lost Millennium", "tcg_date": "2005-06-01"}]
                """);
        final ApplicationConfig config = mock(ApplicationConfig.class);
        when(config.getCardsFile()).thenReturn(cardsFile.toString());
        when(config.getSetsFile()).thenReturn(setsFile.toString());

        app.init(config);
        app.runQuery("kuriboh y>2004");

        assertThat(lines().subList(1, lines().size())).containsExactly("8\tWinged Kuriboh");
    }
}
