package org.example.verse.entity;

import jakarta.persistence.*;

@Entity
@Table(
        name = "verses",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_book_chapter_verse",
                columnNames = {"book", "chapter", "verse_number"}),
        indexes = @Index(name = "idx_verses_book_chapter", columnList = "book, chapter")
)
public class VerseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 64)
    private String book;

    @Column(nullable = false)
    private int chapter;

    @Column(name = "verse_number", nullable = false)
    private int verseNumber;

    @Column(name = "text_kjv", nullable = false, length = 2000)
    private String textKjv;

    public VerseEntity() {}

    public VerseEntity(String book, int chapter, int verseNumber, String textKjv) {
        this.book = book;
        this.chapter = chapter;
        this.verseNumber = verseNumber;
        this.textKjv = textKjv;
    }

    // Getters and setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getBook() { return book; }
    public void setBook(String book) { this.book = book; }

    public int getChapter() { return chapter; }
    public void setChapter(int chapter) { this.chapter = chapter; }

    public int getVerseNumber() { return verseNumber; }
    public void setVerseNumber(int verseNumber) { this.verseNumber = verseNumber; }

    public String getTextKjv() { return textKjv; }
    public void setTextKjv(String textKjv) { this.textKjv = textKjv; }
}
