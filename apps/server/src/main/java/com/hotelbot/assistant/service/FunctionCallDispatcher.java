package com.hotelbot.assistant.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hotelbot.assistant.error.BookingUpstreamException;
import com.hotelbot.assistant.error.NotFoundException;
import com.hotelbot.assistant.error.ValidationException;
import com.hotelbot.assistant.inventory.InventoryClient;
import com.hotelbot.assistant.inventory.InventoryException;
import com.hotelbot.assistant.model.Booking;
import com.hotelbot.assistant.payment.PaymentMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes the functions the model may call and turns each outcome, success or error,
 * into the JSON content of a function turn. Errors the model can act on (bad arguments,
 * rejected or failed bookings, unknown bookings) are returned as {@code {"error": ...}};
 * anything else propagates.
 */
@Service
public class FunctionCallDispatcher {
    private static final Logger log = LoggerFactory.getLogger(FunctionCallDispatcher.class);

    public static final String GET_ROOMS = "get_rooms";
    public static final String BOOK_ROOM = "book_room";
    public static final String PROCESS_PAYMENT = "process_payment";

    private final InventoryClient inventory;
    private final BookingService bookingService;
    private final PaymentService paymentService;
    private final ObjectMapper mapper;

    public FunctionCallDispatcher(InventoryClient inventory,
                                  BookingService bookingService,
                                  PaymentService paymentService,
                                  ObjectMapper mapper) {
        this.inventory = inventory;
        this.bookingService = bookingService;
        this.paymentService = paymentService;
        this.mapper = mapper;
    }

    public record DispatchResult(String name, String arguments, String content, boolean error) {}

    public List<Map<String, Object>> functionDefinitions() {
        List<Map<String, Object>> defs = new ArrayList<>();
        defs.add(Map.of(
                "name", GET_ROOMS,
                "description", "Get available hotel rooms",
                "parameters", Map.of("type", "object", "properties", Map.of())
        ));
        defs.add(Map.of(
                "name", BOOK_ROOM,
                "description", "Book a hotel room",
                "parameters", Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "roomId", Map.of("type", "number"),
                                "fullName", Map.of("type", "string"),
                                "email", Map.of("type", "string"),
                                "nights", Map.of("type", "number")
                        ),
                        "required", List.of("roomId", "fullName", "email", "nights")
                )
        ));
        defs.add(Map.of(
                "name", PROCESS_PAYMENT,
                "description", "Process payment for a booking",
                "parameters", Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "bookingId", Map.of("type", "string"),
                                "amount", Map.of("type", "number"),
                                "method", Map.of("type", "string", "enum", PaymentMethod.codes())
                        ),
                        "required", List.of("bookingId", "amount", "method")
                )
        ));
        return defs;
    }

    public DispatchResult dispatch(String userId, LlmService.FunctionCall call) {
        String name = call.name();
        String rawArgs = call.arguments() == null || call.arguments().isBlank() ? "{}" : call.arguments();
        JsonNode args;
        try {
            args = mapper.readTree(rawArgs);
        } catch (Exception e) {
            log.warn("Unparseable arguments for {}: {}", name, rawArgs);
            return error(name, rawArgs, "Arguments must be a JSON object");
        }
        if (args == null || !args.isObject()) {
            return error(name, rawArgs, "Arguments must be a JSON object");
        }
        log.info("Dispatching function call: user={}, function={}", userId, name);
        switch (name) {
            case GET_ROOMS:
                return ok(name, rawArgs, Map.of("rooms", listRooms()));
            case BOOK_ROOM:
                return bookRoom(userId, rawArgs, args);
            case PROCESS_PAYMENT:
                return processPayment(rawArgs, args);
            default:
                log.warn("Model called unknown function {}", name);
                return error(name, rawArgs, "Unknown function: " + name);
        }
    }

    private List<InventoryClient.Room> listRooms() {
        try {
            return inventory.listRooms();
        } catch (InventoryException e) {
            log.warn("get_rooms degraded to empty list: {}", e.getMessage());
            return List.of();
        }
    }

    private DispatchResult bookRoom(String userId, String rawArgs, JsonNode args) {
        List<String> missing = new ArrayList<>();
        Integer roomId = intArg(args, "roomId");
        String fullName = textArg(args, "fullName");
        String email = textArg(args, "email");
        Integer nights = intArg(args, "nights");
        if (roomId == null) missing.add("roomId");
        if (fullName == null) missing.add("fullName");
        if (email == null) missing.add("email");
        if (nights == null) missing.add("nights");
        if (!missing.isEmpty()) {
            return error(BOOK_ROOM, rawArgs, "Missing or invalid required fields: " + String.join(", ", missing));
        }
        try {
            BookingService.BookingResult result = bookingService.book(userId,
                    new BookingService.BookingRequest(roomId, fullName, email, nights));
            return ok(BOOK_ROOM, rawArgs, bookingSummary(result.booking()));
        } catch (ValidationException e) {
            return error(BOOK_ROOM, rawArgs, e.getReason());
        } catch (BookingUpstreamException e) {
            return error(BOOK_ROOM, rawArgs, e.getKind() == BookingUpstreamException.Kind.REJECTED
                    ? "The booking system rejected this booking."
                    : "The booking system is unavailable. Please try again later.");
        }
    }

    private DispatchResult processPayment(String rawArgs, JsonNode args) {
        List<String> missing = new ArrayList<>();
        String bookingId = textArg(args, "bookingId");
        BigDecimal amount = decimalArg(args, "amount");
        String method = textArg(args, "method");
        if (bookingId == null) missing.add("bookingId");
        if (amount == null) missing.add("amount");
        if (method == null) missing.add("method");
        if (!missing.isEmpty()) {
            return error(PROCESS_PAYMENT, rawArgs, "Missing or invalid required fields: " + String.join(", ", missing));
        }
        if (PaymentMethod.fromCode(method).isEmpty()) {
            return error(PROCESS_PAYMENT, rawArgs, "method must be one of " + PaymentMethod.codes());
        }
        try {
            return ok(PROCESS_PAYMENT, rawArgs, paymentService.processPayment(bookingId, amount, method));
        } catch (ValidationException | NotFoundException e) {
            return error(PROCESS_PAYMENT, rawArgs, e.getReason());
        }
    }

    private Map<String, Object> bookingSummary(Booking b) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("bookingId", b.getBookingId());
        m.put("roomId", b.getRoomId());
        m.put("fullName", b.getGuestName());
        m.put("email", b.getGuestEmail());
        m.put("nights", b.getNights());
        m.put("checkInDate", b.getCheckInDate().toString());
        m.put("checkOutDate", b.getCheckOutDate().toString());
        m.put("totalAmount", b.getTotalAmount());
        m.put("isPaid", b.isPaid());
        return m;
    }

    private static String textArg(JsonNode args, String field) {
        JsonNode n = args.get(field);
        if (n == null || n.isNull()) return null;
        String v = n.isTextual() ? n.asText() : (n.isNumber() ? n.asText() : null);
        return v == null || v.isBlank() ? null : v.trim();
    }

    private static Integer intArg(JsonNode args, String field) {
        JsonNode n = args.get(field);
        if (n == null || n.isNull()) return null;
        if (n.isIntegralNumber()) return n.canConvertToInt() ? n.asInt() : null;
        if (n.isNumber()) {
            double d = n.asDouble();
            // out-of-range values are invalid, never clamped
            if (d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) return null;
            return (int) d;
        }
        if (n.isTextual()) {
            try { return Integer.parseInt(n.asText().trim()); } catch (NumberFormatException e) { return null; }
        }
        return null;
    }

    private static BigDecimal decimalArg(JsonNode args, String field) {
        JsonNode n = args.get(field);
        if (n == null || n.isNull()) return null;
        if (n.isNumber()) return n.decimalValue();
        if (n.isTextual()) {
            try { return new BigDecimal(n.asText().trim()); } catch (NumberFormatException e) { return null; }
        }
        return null;
    }

    private DispatchResult ok(String name, String rawArgs, Object payload) {
        return new DispatchResult(name, rawArgs, toJson(payload), false);
    }

    private DispatchResult error(String name, String rawArgs, String message) {
        return new DispatchResult(name, rawArgs, toJson(Map.of("error", message == null ? "error" : message)), true);
    }

    private String toJson(Object payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (Exception e) {
            throw new IllegalStateException("Serializing function result failed", e);
        }
    }
}
