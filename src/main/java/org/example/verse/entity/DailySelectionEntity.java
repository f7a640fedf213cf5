package org.example.verse.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Binding of one calendar date to the verse chosen for it. Rows are written once and
 * never updated; the unique date constraint is what serializes concurrent resolutions.
 */
@Entity
@Table(
        name = "daily_selections",
        uniqueConstraints = @UniqueConstraint(name = "uq_selection_date", columnNames = {"selection_date"}),
        indexes = @Index(name = "idx_daily_selections_verse", columnList = "verse_id")
)
public class DailySelectionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "selection_date", nullable = false)
    private LocalDate selectionDate;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "verse_id", nullable = false)
    private VerseEntity verse;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    public DailySelectionEntity() {
    }

    public DailySelectionEntity(LocalDate selectionDate, VerseEntity verse) {
        this.selectionDate = selectionDate;
        this.verse = verse;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public LocalDate getSelectionDate() {
        return selectionDate;
    }

    public void setSelectionDate(LocalDate selectionDate) {
        this.selectionDate = selectionDate;
    }

    public VerseEntity getVerse() {
        return verse;
    }

    public void setVerse(VerseEntity verse) {
        this.verse = verse;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
