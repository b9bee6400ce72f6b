package de.mirkosertic.cardsearch.card;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One card as found in the card dump.
 * <p>
 * ATK and DEF are absent for monsters printed with {@code ?}; level also holds the rank
 * of Xyz monsters.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Card(
        long id,
        String name,
        @JsonProperty("type") @Nullable String cardType,
        @JsonProperty("desc") @Nullable String text,
        @Nullable Integer atk,
        @Nullable Integer def,
        @Nullable Integer level,
        @JsonProperty("linkval") @Nullable Integer linkRating,
        @Nullable String attribute,
        @JsonProperty("race") @Nullable String race,
        @JsonProperty("card_sets") @Nullable List<CardSet> cardSets,
        @JsonProperty("banlist_info") @Nullable BanlistInfo banlistInfo
) {

    public Card {
        cardSets = cardSets == null ? List.of() : List.copyOf(cardSets);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CardSet(
            @JsonProperty("set_name") String setName,
            @JsonProperty("set_code") String setCode,
            @JsonProperty("set_rarity") @Nullable String setRarity,
            @JsonProperty("set_price") @Nullable String setPrice
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BanlistInfo(@JsonProperty("ban_tcg") @Nullable String banTcg) {

        /**
         * Number of copies allowed in a deck under the TCG list.
         */
        public int copies() {
            if (banTcg == null) {
                return 3;
            }
            return switch (banTcg) {
                case "Banned" -> 0;
                case "Limited" -> 1;
                case "Semi-Limited" -> 2;
                default -> 3;
            };
        }
    }
}
