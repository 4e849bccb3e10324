package com.wirecrest.scraper.schedule.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wirecrest.scraper.schedule.persistence.JobRunJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;

@Service
public class OperatorAlertService {
    private static final Logger log = LoggerFactory.getLogger(OperatorAlertService.class);

    private final AlertThrottle throttle;
    private final JobRunJdbcRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OperatorAlertService(AlertThrottle throttle, JobRunJdbcRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.throttle = throttle;
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Raises an operator alert unless one with the same key went out within the throttle window.
     * Returns true if the alert was emitted.
     */
    public boolean raise(String key, String title, Map<String, ?> details) {
        if (!throttle.tryAcquire(key)) {
            log.debug("Alert {} throttled", key);
            return false;
        }
        String detailJson = toJson(details);
        log.error("Operator alert [{}] {} {}", key, title, detailJson);
        try {
            repository.insertAlert(key, title, detailJson, clock.instant());
        } catch (DataAccessException e) {
            log.warn("Failed to persist operator alert {}", key, e);
        }
        return true;
    }

    public List<Map<String, Object>> recentAlerts(int limit) {
        return repository.findRecentAlerts(limit);
    }

    private String toJson(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            return String.valueOf(details);
        }
    }
}
