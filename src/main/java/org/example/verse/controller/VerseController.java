package org.example.verse.controller;

import org.example.verse.model.Selection;
import org.example.verse.model.Verse;
import org.example.verse.service.VerseCorpusEmptyException;
import org.example.verse.service.VerseCorpusExhaustedException;
import org.example.verse.service.VerseSelectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;

@RestController
@RequestMapping("/verse")
public class VerseController {

    private static final Logger log = LoggerFactory.getLogger(VerseController.class);

    private final VerseSelectionService verseSelectionService;

    public VerseController(VerseSelectionService verseSelectionService) {
        this.verseSelectionService = verseSelectionService;
    }

    @GetMapping("/today")
    public DailyVerse today() {
        try {
            Selection selection = verseSelectionService.resolveToday();
            return DailyVerse.from(selection);
        } catch (VerseCorpusExhaustedException e) {
            log.error("Cannot resolve verse for {}: {}", e.getDate(), e.getMessage());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Verse corpus exhausted", e);
        }
    }

    @GetMapping("/random")
    public RandomVerse random() {
        try {
            return RandomVerse.from(verseSelectionService.pickRandomVerse());
        } catch (VerseCorpusEmptyException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No verses loaded", e);
        }
    }

    public record DailyVerse(
            LocalDate date,
            String reference,
            String book,
            int chapter,
            int verse,
            String kjv
    ) {
        static DailyVerse from(Selection selection) {
            Verse verse = selection.verse();
            return new DailyVerse(
                    selection.date(),
                    verse.reference(),
                    verse.book(),
                    verse.chapter(),
                    verse.verseNumber(),
                    verse.text()
            );
        }
    }

    public record RandomVerse(
            String reference,
            String book,
            int chapter,
            int verse,
            String kjv
    ) {
        static RandomVerse from(Verse verse) {
            return new RandomVerse(verse.reference(), verse.book(), verse.chapter(), verse.verseNumber(), verse.text());
        }
    }
}
