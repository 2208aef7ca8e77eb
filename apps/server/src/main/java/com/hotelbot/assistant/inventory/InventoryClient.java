package com.hotelbot.assistant.inventory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the external hotel inventory ({@code GET /rooms}, {@code POST /book}).
 * Holds no state. Room listing is retried on transport errors and 5xx; booking is
 * sent exactly once because the upstream call is not idempotent.
 */
@Component
public class InventoryClient {
    private static final Logger log = LoggerFactory.getLogger(InventoryClient.class);

    private final String baseUrl;
    private final int maxAttempts;
    private final RestTemplate http;
    private final ObjectMapper mapper = new ObjectMapper();

    @Autowired
    public InventoryClient(@Value("${inventory.baseUrl:https://bot9assignement.deno.dev}") String baseUrl,
                           @Value("${inventory.http.connectTimeoutMs:3000}") int connectTimeoutMs,
                           @Value("${inventory.http.readTimeoutMs:10000}") int readTimeoutMs,
                           @Value("${inventory.http.maxAttempts:2}") int maxAttempts) {
        this(baseUrl, maxAttempts, buildHttp(connectTimeoutMs, readTimeoutMs));
        log.info("Inventory HTTP: base={}, connect={}ms, read={}ms, maxAttempts={}", baseUrl, connectTimeoutMs, readTimeoutMs, maxAttempts);
    }

    InventoryClient(String baseUrl, int maxAttempts, RestTemplate http) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.http = http;
    }

    private static RestTemplate buildHttp(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }

    public record Room(Integer id, String name, String description, BigDecimal price) {}

    public record InventoryBooking(String bookingId, BigDecimal totalPrice, Map<String, Object> payload) {}

    public List<Room> listRooms() {
        String url = baseUrl + "/rooms";
        InventoryException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                ResponseEntity<String> res = http.getForEntity(url, String.class);
                return parseRooms(res.getBody());
            } catch (Exception e) {
                last = translate("GET " + url, e);
                if (last.isRejected()) {
                    break;
                }
                log.warn("Inventory GET /rooms attempt {}/{} failed: {}", attempt, maxAttempts, e.toString());
            }
        }
        throw last;
    }

    public InventoryBooking book(int roomId, String fullName, String email, int nights) {
        String url = baseUrl + "/book";
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("roomId", roomId);
        body.put("fullName", fullName);
        body.put("email", email);
        body.put("nights", nights);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String responseBody;
        try {
            String json = mapper.writeValueAsString(body);
            log.debug("Inventory POST {} roomId={} nights={}", url, roomId, nights);
            ResponseEntity<String> res = http.postForEntity(url, new HttpEntity<>(json, headers), String.class);
            responseBody = res.getBody();
        } catch (Exception e) {
            throw translate("POST " + url, e);
        }
        return parseBooking(responseBody);
    }

    private InventoryException translate(String call, Exception e) {
        if (e instanceof InventoryException) {
            return (InventoryException) e;
        }
        if (e instanceof HttpClientErrorException) {
            HttpClientErrorException ce = (HttpClientErrorException) e;
            log.warn("Inventory {} rejected: status={} body={}", call, ce.getStatusCode().value(), ce.getResponseBodyAsString());
            return new InventoryException("Inventory rejected request", true, ce.getStatusCode().value(), e);
        }
        Integer status = e instanceof RestClientResponseException
                ? ((RestClientResponseException) e).getStatusCode().value()
                : null;
        log.warn("Inventory {} failed: {}", call, e.toString());
        return new InventoryException("Inventory unavailable", false, status, e);
    }

    private List<Room> parseRooms(String body) {
        try {
            JsonNode root = mapper.readTree(body == null ? "[]" : body);
            JsonNode items = root.isArray() ? root : root.path("rooms");
            List<Room> out = new ArrayList<>();
            for (JsonNode r : items) {
                JsonNode id = r.hasNonNull("id") ? r.get("id") : r.path("roomId");
                JsonNode price = r.hasNonNull("price") ? r.get("price") : r.path("pricePerNight");
                out.add(new Room(
                        id.isMissingNode() || id.isNull() ? null : id.asInt(),
                        r.path("name").asText(null),
                        r.path("description").asText(null),
                        price.isNumber() ? price.decimalValue() : null
                ));
            }
            return out;
        } catch (Exception e) {
            throw new InventoryException("Malformed rooms payload", false, null, e);
        }
    }

    private InventoryBooking parseBooking(String body) {
        Map<String, Object> payload;
        try {
            payload = mapper.readValue(body == null ? "{}" : body, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (Exception e) {
            throw new InventoryException("Malformed booking payload", false, null, e);
        }
        Object id = payload.get("bookingId");
        if (id == null || String.valueOf(id).isBlank()) {
            log.warn("Inventory booking response without bookingId: {}", payload);
            throw new InventoryException("Booking payload missing bookingId", false, null, null);
        }
        Object price = payload.get("totalPrice");
        BigDecimal total = null;
        if (price instanceof Number) {
            total = new BigDecimal(price.toString());
        } else if (price instanceof String && !((String) price).isBlank()) {
            try {
                total = new BigDecimal(((String) price).trim());
            } catch (NumberFormatException e) {
                log.warn("Unparseable totalPrice '{}' for booking {}, amount left unset", price, id);
            }
        }
        return new InventoryBooking(String.valueOf(id), total, payload);
    }
}
