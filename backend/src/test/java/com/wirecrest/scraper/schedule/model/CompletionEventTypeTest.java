package com.wirecrest.scraper.schedule.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CompletionEventTypeTest {

    @Test
    void parsesDottedAndBareForms() {
        assertThat(CompletionEventType.parse("ACTOR.RUN.SUCCEEDED")).isEqualTo(CompletionEventType.SUCCEEDED);
        assertThat(CompletionEventType.parse("ACTOR.RUN.TIMED_OUT")).isEqualTo(CompletionEventType.TIMED_OUT);
        assertThat(CompletionEventType.parse("test")).isEqualTo(CompletionEventType.TEST);
        assertThat(CompletionEventType.parse("ACTOR.BUILD.CREATED")).isEqualTo(CompletionEventType.UNKNOWN);
        assertThat(CompletionEventType.parse(null)).isEqualTo(CompletionEventType.UNKNOWN);
    }

    @Test
    void onlyTerminalErrorsCountAsFailure() {
        assertThat(CompletionEventType.ABORTED.isFailure()).isTrue();
        assertThat(CompletionEventType.SUCCEEDED.isFailure()).isFalse();
        assertThat(CompletionEventType.TEST.isFailure()).isFalse();
    }
}
