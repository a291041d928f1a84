package io.ussopmm.ems.query.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.WebFilterChainProxy;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.ArgumentMatchers.any;

@ExtendWith(MockitoExtension.class)
class WebSecurityConfigTest {

    @Mock
    AccessGate accessGate;

    WebTestClient client;

    @BeforeEach
    void setUp() {
        WebSecurityConfig config = new WebSecurityConfig();
        SecurityWebFilterChain chain = config.securityWebFilterChain(
                ServerHttpSecurity.http(), config.accessGateAuthenticationManager(accessGate));
        client = WebTestClient.bindToController(new StubController())
                .webFilter(new WebFilterChainProxy(chain))
                .build();
    }

    @Test
    void request_withoutCredentials_isUnauthorized() {
        client.get().uri("/api/v1/series").exchange().expectStatus().isUnauthorized();

        verify(accessGate, never()).authenticate(any(), any());
    }

    @Test
    void request_withRejectedCredentials_isUnauthorized() {
        when(accessGate.authenticate("admin", "wrong")).thenReturn(false);

        client.get().uri("/api/v1/series")
                .headers(headers -> headers.setBasicAuth("admin", "wrong"))
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    void request_withAcceptedCredentials_reachesHandler() {
        when(accessGate.authenticate("admin", "s3cret")).thenReturn(true);

        client.get().uri("/api/v1/series")
                .headers(headers -> headers.setBasicAuth("admin", "s3cret"))
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("ok");
    }

    @Test
    void health_isOpen() {
        client.get().uri("/actuator/health").exchange().expectStatus().isOk();
    }

    @RestController
    static class StubController {

        @GetMapping("/api/v1/series")
        String series() {
            return "ok";
        }

        @GetMapping("/actuator/health")
        String health() {
            return "UP";
        }
    }
}
