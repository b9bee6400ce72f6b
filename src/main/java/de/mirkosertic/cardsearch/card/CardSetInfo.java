package de.mirkosertic.cardsearch.card;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * One entry of the set list. The TCG date is an ISO date, absent for sets not released in the TCG.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CardSetInfo(
        @JsonProperty("set_name") @Nullable String setName,
        @JsonProperty("tcg_date") @Nullable String tcgDate
) {
}
