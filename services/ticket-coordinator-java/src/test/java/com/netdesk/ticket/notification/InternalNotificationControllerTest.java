package com.netdesk.ticket.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import java.net.InetSocketAddress;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.netdesk.ticket.SecurityConfig;

@WebFluxTest(controllers = InternalNotificationController.class)
@Import(SecurityConfig.class)
@DisplayName("Internal notification endpoint")
class InternalNotificationControllerTest {

    @Autowired
    private WebTestClient webClient;

    @MockBean
    private LiveUpdateBroadcaster broadcaster;

    @MockBean
    private ReactiveJwtDecoder jwtDecoder;

    @Test
    @DisplayName("broadcasts a refresh signal built from query parameters without authentication")
    void broadcastsFromQuery() {
        webClient.post()
            .uri(uri -> uri.path("/api/internal/notify-monitor-update")
                .queryParam("message", "Database restored")
                .queryParam("level", "warning")
                .queryParam("ticket_id", "abc")
                .build())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("broadcast_sent")
            .jsonPath("$.payload.type").isEqualTo("db_updated")
            .jsonPath("$.payload.ticket_id").isEqualTo("abc")
            .jsonPath("$.payload.notification").isEqualTo("Database restored")
            .jsonPath("$.payload.level").isEqualTo("warning");

        ArgumentCaptor<TicketEvent> event = ArgumentCaptor.forClass(TicketEvent.class);
        verify(broadcaster).broadcast(event.capture());
        assertThat(event.getValue().type()).isEqualTo(TicketEventType.DB_UPDATED);
    }

    @Test
    @DisplayName("keeps the type of an event posted by the fallback transport")
    void broadcastsEventBody() {
        webClient.post()
            .uri("/api/internal/notify-monitor-update?level=error")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("""
                {"type":"ticket_created","ticket_id":"t-1","notification":"New ticket #7: No internet","level":"info"}""")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.payload.type").isEqualTo("ticket_created")
            .jsonPath("$.payload.ticket_id").isEqualTo("t-1")
            .jsonPath("$.payload.level").isEqualTo("info");

        ArgumentCaptor<TicketEvent> event = ArgumentCaptor.forClass(TicketEvent.class);
        verify(broadcaster).broadcast(event.capture());
        assertThat(event.getValue().notification()).isEqualTo("New ticket #7: No internet");
    }

    @Test
    @DisplayName("only loopback callers are accepted")
    void loopbackCheck() {
        assertThat(InternalNotificationController.isLoopback(new InetSocketAddress("127.0.0.1", 51000))).isTrue();
        assertThat(InternalNotificationController.isLoopback(new InetSocketAddress("::1", 51000))).isTrue();
        assertThat(InternalNotificationController.isLoopback(new InetSocketAddress("10.20.0.7", 51000))).isFalse();
    }
}
