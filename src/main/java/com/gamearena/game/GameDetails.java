package com.gamearena.game;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Game-specific part of a {@link GameResult}.
 * Exported with a "game" discriminator taken from each implementation's type name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "game")
public interface GameDetails {

    /**
     * How the match was decided, e.g. "showdown", "KO" or "profit".
     */
    String winMethod();
}
