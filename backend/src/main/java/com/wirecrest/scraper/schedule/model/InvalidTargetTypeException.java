package com.wirecrest.scraper.schedule.model;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidTargetTypeException extends RuntimeException {
    public InvalidTargetTypeException(String message) {
        super(message);
    }
}
