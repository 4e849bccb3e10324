package com.wirecrest.scraper.schedule.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ScheduleNotFoundException extends RuntimeException {
    public ScheduleNotFoundException(long entryId) {
        super("Schedule entry " + entryId + " not found");
    }
}
