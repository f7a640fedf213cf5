package org.example.verse.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.verse.config.RequestCorrelation;
import org.example.verse.service.CorpusStatisticsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RestController
public class HealthController {

    private final CorpusStatisticsService corpusStatisticsService;

    public HealthController(CorpusStatisticsService corpusStatisticsService) {
        this.corpusStatisticsService = corpusStatisticsService;
    }

    @GetMapping("/health")
    public Health health() {
        return new Health("ok");
    }

    @GetMapping("/health/details")
    public HealthDetails healthDetails(HttpServletRequest request) {
        long verseCount = corpusStatisticsService.verseCount();
        boolean corpusLoaded = verseCount > 0;
        return new HealthDetails(
                corpusLoaded ? "ok" : "degraded",
                corpusLoaded,
                verseCount,
                RequestCorrelation.resolveRequestId(request),
                LocalDateTime.now()
        );
    }

    public record Health(String status) {}

    public record HealthDetails(
            String status,
            boolean corpusLoaded,
            long verseCount,
            String requestId,
            LocalDateTime asOf
    ) {
    }
}
