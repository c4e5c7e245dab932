package com.wordduel.word;

import com.wordduel.domain.DomainModels.Difficulty;
import com.wordduel.repository.WordBankJdbcRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Random;

@Component
public class WordBankWordSource implements WordSource {
    private final WordBankJdbcRepository repository;
    private final Random random;

    public WordBankWordSource(WordBankJdbcRepository repository, Random random) {
        this.repository = repository;
        this.random = random;
    }

    @Override
    public Optional<String> randomWord(Difficulty difficulty) {
        List<String> words = repository.wordsFor(difficulty);
        if (words.isEmpty()) return Optional.empty();
        return Optional.of(words.get(random.nextInt(words.size())));
    }
}
