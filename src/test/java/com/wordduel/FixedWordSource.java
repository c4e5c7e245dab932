package com.wordduel;

import com.wordduel.domain.DomainModels.Difficulty;
import com.wordduel.word.WordSource;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

public class FixedWordSource implements WordSource {
    private final AtomicReference<String> word = new AtomicReference<>("GAME");

    public void use(String next) {
        word.set(next);
    }

    @Override
    public Optional<String> randomWord(Difficulty difficulty) {
        return Optional.ofNullable(word.get());
    }
}
