package com.acme.notification.web;

import com.acme.notification.core.BrokerUnavailableException;
import com.acme.notification.health.HealthService;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.test.annotation.MockBean;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@MicronautTest(transactional = false)
class HealthControllerTest {

    @Inject
    @Client("/")
    HttpClient client;

    @Inject
    HealthService healthService;

    @MockBean(HealthService.class)
    HealthService healthService() {
        return mock(HealthService.class);
    }

    @Test
    void testLiveIsAlwaysUp() {
        doThrow(new BrokerUnavailableException("RabbitMQ недоступен", null)).when(healthService).checkHealth();

        HttpResponse<Map> response = client.toBlocking().exchange(HttpRequest.GET("/health/live"), Map.class);

        assertEquals(HttpStatus.OK, response.getStatus());
        assertEquals("UP", response.body().get("status"));
    }

    @Test
    void testReadyWhenBrokerReachable() {
        doNothing().when(healthService).checkHealth();

        HttpResponse<Map> response = client.toBlocking().exchange(HttpRequest.GET("/health/ready"), Map.class);

        assertEquals(HttpStatus.OK, response.getStatus());
        assertEquals("UP", response.body().get("status"));
    }

    @Test
    void testNotReadyWhenBrokerUnavailable() {
        doThrow(new BrokerUnavailableException("RabbitMQ недоступен", null)).when(healthService).checkHealth();

        var ex = assertThrows(HttpClientResponseException.class,
            () -> client.toBlocking().exchange(HttpRequest.GET("/health/ready"), Map.class));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, ex.getStatus());
        Map<?, ?> body = ex.getResponse().getBody(Map.class).orElseThrow();
        assertEquals("DOWN", body.get("status"));
        assertEquals("RabbitMQ недоступен", body.get("error"));
    }
}
