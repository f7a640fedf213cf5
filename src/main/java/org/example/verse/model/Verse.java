package org.example.verse.model;

public record Verse(
    String id,
    String book,
    int chapter,
    int verseNumber,
    String text
) {
    public String reference() {
        return book + " " + chapter + ":" + verseNumber;
    }

    public boolean isSameChapterAs(Verse other) {
        return other != null && book.equals(other.book) && chapter == other.chapter;
    }
}
