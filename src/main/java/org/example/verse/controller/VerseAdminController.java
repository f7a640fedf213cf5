package org.example.verse.controller;

import org.example.verse.model.CorpusStatistics;
import org.example.verse.service.CorpusStatisticsService;
import org.example.verse.service.HistoryAdminService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/verse")
public class VerseAdminController {

    private final CorpusStatisticsService corpusStatisticsService;
    private final HistoryAdminService historyAdminService;

    public VerseAdminController(
            CorpusStatisticsService corpusStatisticsService,
            HistoryAdminService historyAdminService) {
        this.corpusStatisticsService = corpusStatisticsService;
        this.historyAdminService = historyAdminService;
    }

    @GetMapping("/stats")
    public CorpusStatistics stats() {
        return corpusStatisticsService.snapshot();
    }

    @DeleteMapping("/history")
    public ResetResponse resetHistory() {
        return new ResetResponse(historyAdminService.resetHistory());
    }

    public record ResetResponse(int deletedCount) {}
}
