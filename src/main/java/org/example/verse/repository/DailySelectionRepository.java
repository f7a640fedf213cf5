package org.example.verse.repository;

import org.example.verse.entity.DailySelectionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface DailySelectionRepository extends JpaRepository<DailySelectionEntity, String> {

    boolean existsBySelectionDate(LocalDate selectionDate);

    @Query("SELECT s FROM DailySelectionEntity s JOIN FETCH s.verse WHERE s.selectionDate = :date")
    Optional<DailySelectionEntity> findBySelectionDateWithVerse(@Param("date") LocalDate date);

    @Query("SELECT s FROM DailySelectionEntity s JOIN FETCH s.verse ORDER BY s.selectionDate")
    List<DailySelectionEntity> findAllWithVerseOrderBySelectionDate();

    // Latest selection strictly before the given date, whatever the calendar gap.
    @Query("SELECT s FROM DailySelectionEntity s JOIN FETCH s.verse "
            + "WHERE s.selectionDate < :date ORDER BY s.selectionDate DESC LIMIT 1")
    Optional<DailySelectionEntity> findLatestBefore(@Param("date") LocalDate date);

    @Query("SELECT s.verse.id FROM DailySelectionEntity s")
    List<String> findSelectedVerseIds();

    @Query("SELECT COUNT(DISTINCT s.verse.id) FROM DailySelectionEntity s")
    long countDistinctSelectedVerses();

    Optional<DailySelectionEntity> findFirstByOrderBySelectionDateAsc();

    Optional<DailySelectionEntity> findFirstByOrderBySelectionDateDesc();

    @Query("SELECT s FROM DailySelectionEntity s JOIN FETCH s.verse ORDER BY s.selectionDate DESC LIMIT 10")
    List<DailySelectionEntity> findTenMostRecentWithVerse();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM DailySelectionEntity s WHERE s.selectionDate BETWEEN :from AND :to")
    int deleteBySelectionDateBetween(@Param("from") LocalDate from, @Param("to") LocalDate to);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM DailySelectionEntity s")
    int deleteAllSelections();
}
