package org.example.verse.repository;

import org.example.verse.entity.VerseEntity;
import org.example.verse.model.BookVerseCount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface VerseRepository extends JpaRepository<VerseEntity, String> {

    List<VerseEntity> findAllByOrderByBookAscChapterAscVerseNumberAsc();

    boolean existsByBookAndChapterAndVerseNumber(String book, int chapter, int verseNumber);

    @Query("SELECT COUNT(DISTINCT v.book) FROM VerseEntity v")
    long countDistinctBooks();

    @Query("SELECT new org.example.verse.model.BookVerseCount(v.book, COUNT(v)) "
            + "FROM VerseEntity v GROUP BY v.book ORDER BY v.book")
    List<BookVerseCount> countVersesByBook();
}
