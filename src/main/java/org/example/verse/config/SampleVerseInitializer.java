package org.example.verse.config;

import org.example.verse.entity.VerseEntity;
import org.example.verse.repository.VerseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Profile("dev")
@Order(1) // Run before CorpusStartupCheck
public class SampleVerseInitializer implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(SampleVerseInitializer.class);

    private final VerseRepository verseRepository;

    public SampleVerseInitializer(VerseRepository verseRepository) {
        this.verseRepository = verseRepository;
    }

    @Override
    public void run(String... args) {
        // Only initialize if database is empty
        if (verseRepository.count() > 0) {
            log.info("Database already contains verses, skipping sample corpus");
            return;
        }

        List<VerseEntity> samples = List.of(
            new VerseEntity("Genesis", 1, 1,
                "In the beginning God created the heaven and the earth."),
            new VerseEntity("Genesis", 1, 3,
                "And God said, Let there be light: and there was light."),
            new VerseEntity("Psalms", 23, 1,
                "The LORD is my shepherd; I shall not want."),
            new VerseEntity("Psalms", 119, 105,
                "Thy word is a lamp unto my feet, and a light unto my path."),
            new VerseEntity("Proverbs", 3, 5,
                "Trust in the LORD with all thine heart; and lean not unto thine own understanding."),
            new VerseEntity("Isaiah", 40, 31,
                "But they that wait upon the LORD shall renew their strength; they shall mount up with wings as eagles; they shall run, and not be weary; and they shall walk, and not faint."),
            new VerseEntity("John", 1, 1,
                "In the beginning was the Word, and the Word was with God, and the Word was God."),
            new VerseEntity("John", 3, 16,
                "For God so loved the world, that he gave his only begotten Son, that whosoever believeth in him should not perish, but have everlasting life."),
            new VerseEntity("Romans", 8, 28,
                "And we know that all things work together for good to them that love God, to them who are the called according to his purpose."),
            new VerseEntity("Philippians", 4, 13,
                "I can do all things through Christ which strengtheneth me.")
        );
        verseRepository.saveAll(samples);

        log.info("Sample corpus initialized: {} verses", verseRepository.count());
    }
}
