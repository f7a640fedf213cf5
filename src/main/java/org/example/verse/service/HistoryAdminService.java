package org.example.verse.service;

import org.example.verse.repository.DailySelectionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Operator-driven recovery for an exhausted corpus. Selection never resets history on its own.
 */
@Service
public class HistoryAdminService {

    private static final Logger log = LoggerFactory.getLogger(HistoryAdminService.class);

    private final DailySelectionRepository selectionRepository;

    public HistoryAdminService(DailySelectionRepository selectionRepository) {
        this.selectionRepository = selectionRepository;
    }

    @Transactional
    public int resetHistory() {
        int deleted = selectionRepository.deleteAllSelections();
        log.warn("Selection history reset; {} selections deleted", deleted);
        return deleted;
    }
}
