package com.wordduel.word;

import com.wordduel.domain.DomainModels.Difficulty;

import java.util.Optional;

public interface WordSource {
    /**
     * A random word for the tier, or empty when the tier has no words.
     */
    Optional<String> randomWord(Difficulty difficulty);
}
