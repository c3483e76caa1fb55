package com.portLogistics.aiAssistant.agent.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Client for the port backend endpoints used by the built-in agents.
 *
 * Forwards the caller's Authorization header and the trace id ({@code x-request-id}). Every
 * failure surfaces as a {@link BackendServiceException} carrying the HTTP status.
 */
@Slf4j
@Service
public class PortBackendClient {

    private static final String REQUEST_ID_HEADER = "x-request-id";
    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    public PortBackendClient(@Value("${assistant.backend.base-url:http://localhost:3000/api}") String baseUrl,
                             @Value("${assistant.backend.timeout:10s}") Duration timeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(3))
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);

        this.restClient = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    PortBackendClient(RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * Fetches a booking by its reference.
     *
     * @param bookingRef Booking reference (digits)
     * @param authToken  Authorization header value, may be null
     * @param traceId    Trace id
     * @return Booking as returned by the backend
     */
    public Map<String, Object> getBooking(String bookingRef, String authToken, String traceId) {
        return call("getBooking", traceId, () -> restClient.get()
                .uri("/bookings/{ref}", bookingRef)
                .headers(headers -> applyHeaders(headers, authToken, traceId))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw new BackendServiceException(response.getStatusCode().value(),
                            "Booking lookup failed with status " + response.getStatusCode().value());
                })
                .body(JSON_OBJECT));
    }

    /**
     * Fetches slot availability for a terminal and day.
     *
     * @param terminal  Terminal code
     * @param date      ISO date
     * @param gate      Gate code, may be null
     * @param authToken Authorization header value, may be null
     * @param traceId   Trace id
     * @return Availability payload as returned by the backend
     */
    public Map<String, Object> getSlotAvailability(String terminal, String date, String gate, String authToken, String traceId) {
        return call("getSlotAvailability", traceId, () -> restClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/slots/availability")
                            .queryParam("terminal", terminal)
                            .queryParam("date", date);
                    if (gate != null && !gate.isBlank()) {
                        uriBuilder.queryParam("gate", gate);
                    }
                    return uriBuilder.build();
                })
                .headers(headers -> applyHeaders(headers, authToken, traceId))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw new BackendServiceException(response.getStatusCode().value(),
                            "Availability lookup failed with status " + response.getStatusCode().value());
                })
                .body(JSON_OBJECT));
    }

    /**
     * Creates a booking.
     *
     * @param payload   Booking fields (terminal, date, and optionally gate, slot_id, carrier_id)
     * @param authToken Authorization header value
     * @param traceId   Trace id
     * @return Created booking as returned by the backend
     */
    public Map<String, Object> createBooking(Map<String, Object> payload, String authToken, String traceId) {
        return call("createBooking", traceId, () -> restClient.post()
                .uri("/bookings")
                .headers(headers -> applyHeaders(headers, authToken, traceId))
                .body(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw new BackendServiceException(response.getStatusCode().value(),
                            "Booking creation failed with status " + response.getStatusCode().value());
                })
                .body(JSON_OBJECT));
    }

    /**
     * Fetches the blockchain proof recorded for a booking.
     *
     * @param bookingRef Booking reference (digits)
     * @param authToken  Authorization header value, may be null
     * @param traceId    Trace id
     * @return Proof payload as returned by the backend
     */
    public Map<String, Object> getBlockchainProof(String bookingRef, String authToken, String traceId) {
        return call("getBlockchainProof", traceId, () -> restClient.get()
                .uri("/blockchain/bookings/{ref}/proof", bookingRef)
                .headers(headers -> applyHeaders(headers, authToken, traceId))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw new BackendServiceException(response.getStatusCode().value(),
                            "Proof lookup failed with status " + response.getStatusCode().value());
                })
                .body(JSON_OBJECT));
    }

    private Map<String, Object> call(String operation, String traceId, Supplier<Map<String, Object>> request) {
        try {
            Map<String, Object> body = request.get();
            log.debug("Backend call succeeded - traceId: {}, operation: {}", traceId, operation);
            return body != null ? body : Map.of();
        } catch (BackendServiceException e) {
            log.warn("Backend call failed - traceId: {}, operation: {}, status: {}", traceId, operation, e.getStatusCode());
            throw e;
        } catch (ResourceAccessException e) {
            log.error("Backend unreachable - traceId: {}, operation: {}, error: {}", traceId, operation, e.getMessage());
            throw new BackendServiceException(BackendServiceException.SERVICE_UNAVAILABLE,
                    "Cannot connect to port backend", e);
        }
    }

    private static void applyHeaders(HttpHeaders headers, String authToken, String traceId) {
        if (authToken != null && !authToken.isBlank()) {
            headers.set(HttpHeaders.AUTHORIZATION, authToken);
        }
        if (traceId != null) {
            headers.set(REQUEST_ID_HEADER, traceId);
        }
    }
}
