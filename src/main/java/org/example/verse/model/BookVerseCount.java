package org.example.verse.model;

public record BookVerseCount(String book, Long verseCount) {}
