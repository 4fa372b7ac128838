package com.flagship.cash_ledger.observability;

import com.flagship.cash_ledger.review.ExceptionRecordRepository;
import com.flagship.cash_ledger.review.ExceptionStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Size of the open review queue across tenants.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReviewQueueMetrics {

    private final ExceptionRecordRepository exceptionRepository;
    private final MeterRegistry meterRegistry;

    private final AtomicLong openExceptions = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("cash_ledger.exceptions.open", openExceptions, AtomicLong::get)
                .description("Exceptions waiting for review")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            openExceptions.set(exceptionRepository.countByStatus(ExceptionStatus.OPEN));
        } catch (DataAccessException e) {
            log.warn("Failed to refresh review queue metrics: {}", e.getMessage());
        }
    }
}
