package com.netdesk.ticket.repository;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Ticket search pattern")
class TicketQueryRepositoryTest {

    @Test
    @DisplayName("wraps the trimmed text so it matches anywhere")
    void matchesAnywhere() {
        assertThat(TicketQueryRepository.containsPattern("  no internet ")).isEqualTo("%no internet%");
    }

    @Test
    @DisplayName("percent and underscore typed by the user match literally")
    void escapesWildcards() {
        assertThat(TicketQueryRepository.containsPattern("50%_off")).isEqualTo("%50\\%\\_off%");
    }
}
