package com.hotelbot.assistant.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hotelbot.assistant.error.BookingUpstreamException;
import com.hotelbot.assistant.error.NotFoundException;
import com.hotelbot.assistant.inventory.InventoryClient;
import com.hotelbot.assistant.inventory.InventoryException;
import com.hotelbot.assistant.model.Booking;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class FunctionCallDispatcherTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private InventoryClient inventory;
    private BookingService bookings;
    private PaymentService payments;
    private FunctionCallDispatcher dispatcher;

    @BeforeEach
    public void setUp() {
        inventory = mock(InventoryClient.class);
        bookings = mock(BookingService.class);
        payments = mock(PaymentService.class);
        dispatcher = new FunctionCallDispatcher(inventory, bookings, payments, mapper);
    }

    @Test
    public void shouldDeclareThreeFunctions() {
        List<Map<String, Object>> defs = dispatcher.functionDefinitions();
        Assertions.assertEquals(List.of("get_rooms", "book_room", "process_payment"),
                defs.stream().map(d -> d.get("name")).toList());
    }

    @Test
    public void shouldListRooms() throws Exception {
        when(inventory.listRooms()).thenReturn(List.of(
                new InventoryClient.Room(1, "Deluxe", "Sea view", new BigDecimal("150"))));

        FunctionCallDispatcher.DispatchResult result = dispatch("get_rooms", "{}");

        Assertions.assertFalse(result.error());
        JsonNode rooms = mapper.readTree(result.content()).path("rooms");
        Assertions.assertEquals(1, rooms.size());
        Assertions.assertEquals("Deluxe", rooms.get(0).path("name").asText());
    }

    @Test
    public void shouldDegradeToEmptyRoomListWhenInventoryDown() throws Exception {
        when(inventory.listRooms()).thenThrow(new InventoryException("Inventory unavailable", false, 503, null));

        FunctionCallDispatcher.DispatchResult result = dispatch("get_rooms", "");

        Assertions.assertEquals(0, mapper.readTree(result.content()).path("rooms").size());
    }

    @Test
    public void shouldReportMissingBookingFields() throws Exception {
        FunctionCallDispatcher.DispatchResult result = dispatch("book_room", "{\"roomId\":1,\"nights\":2}");

        Assertions.assertTrue(result.error());
        Assertions.assertEquals("Missing or invalid required fields: fullName, email",
                mapper.readTree(result.content()).path("error").asText());
        verifyNoInteractions(bookings);
    }

    @Test
    public void shouldRejectIntegersOutsideIntRange() throws Exception {
        FunctionCallDispatcher.DispatchResult result = dispatch("book_room",
                "{\"roomId\":1,\"fullName\":\"Ada\",\"email\":\"ada@example.com\",\"nights\":3000000000}");

        Assertions.assertTrue(result.error());
        Assertions.assertEquals("Missing or invalid required fields: nights",
                mapper.readTree(result.content()).path("error").asText());

        result = dispatch("book_room",
                "{\"roomId\":4.0E10,\"fullName\":\"Ada\",\"email\":\"ada@example.com\",\"nights\":2}");

        Assertions.assertEquals("Missing or invalid required fields: roomId",
                mapper.readTree(result.content()).path("error").asText());
        verifyNoInteractions(bookings);
    }

    @Test
    public void shouldBookRoomForCaller() throws Exception {
        Booking b = new Booking();
        b.setBookingId("BK-7");
        b.setRoomId(1);
        b.setGuestName("Ada");
        b.setGuestEmail("ada@example.com");
        b.setNights(2);
        b.setCheckInDate(LocalDate.of(2024, 5, 1));
        b.setCheckOutDate(LocalDate.of(2024, 5, 3));
        b.setTotalAmount(new BigDecimal("300"));
        when(bookings.book(eq("user-1"), any(BookingService.BookingRequest.class)))
                .thenReturn(new BookingService.BookingResult(b, Map.of()));

        FunctionCallDispatcher.DispatchResult result = dispatch("book_room",
                "{\"roomId\":\"1\",\"fullName\":\"Ada\",\"email\":\"ada@example.com\",\"nights\":2}");

        Assertions.assertFalse(result.error());
        JsonNode content = mapper.readTree(result.content());
        Assertions.assertEquals("BK-7", content.path("bookingId").asText());
        Assertions.assertEquals("2024-05-03", content.path("checkOutDate").asText());
        Assertions.assertFalse(content.path("isPaid").asBoolean());
    }

    @Test
    public void shouldTurnRejectedBookingIntoErrorResult() throws Exception {
        when(bookings.book(eq("user-1"), any(BookingService.BookingRequest.class)))
                .thenThrow(new BookingUpstreamException(BookingUpstreamException.Kind.REJECTED, null));

        FunctionCallDispatcher.DispatchResult result = dispatch("book_room",
                "{\"roomId\":99,\"fullName\":\"Ada\",\"email\":\"ada@example.com\",\"nights\":2}");

        Assertions.assertTrue(result.error());
        Assertions.assertTrue(mapper.readTree(result.content()).path("error").asText().contains("rejected"));
    }

    @Test
    public void shouldRejectUnsupportedPaymentMethodBeforeCharging() throws Exception {
        FunctionCallDispatcher.DispatchResult result = dispatch("process_payment",
                "{\"bookingId\":\"BK-7\",\"amount\":300,\"method\":\"bitcoin\"}");

        Assertions.assertTrue(result.error());
        Assertions.assertTrue(mapper.readTree(result.content()).path("error").asText().startsWith("method must be one of"));
        verifyNoInteractions(payments);
    }

    @Test
    public void shouldReportUnknownBookingOnPayment() throws Exception {
        when(payments.processPayment(eq("nope"), any(BigDecimal.class), anyString()))
                .thenThrow(new NotFoundException("Booking not found"));

        FunctionCallDispatcher.DispatchResult result = dispatch("process_payment",
                "{\"bookingId\":\"nope\",\"amount\":10,\"method\":\"paypal\"}");

        Assertions.assertEquals("Booking not found", mapper.readTree(result.content()).path("error").asText());
    }

    @Test
    public void shouldPassPaymentResultThrough() throws Exception {
        when(payments.processPayment(eq("BK-7"), any(BigDecimal.class), eq("credit_card")))
                .thenReturn(new PaymentService.PaymentResult("success", "Payment of $300 processed", "TXN1"));

        FunctionCallDispatcher.DispatchResult result = dispatch("process_payment",
                "{\"bookingId\":\"BK-7\",\"amount\":300,\"method\":\"credit_card\"}");

        JsonNode content = mapper.readTree(result.content());
        Assertions.assertEquals("success", content.path("status").asText());
        Assertions.assertEquals("TXN1", content.path("transactionId").asText());
        Assertions.assertFalse(content.has("success"));
    }

    @Test
    public void shouldReportUnknownFunction() throws Exception {
        FunctionCallDispatcher.DispatchResult result = dispatch("cancel_everything", "{}");

        Assertions.assertTrue(result.error());
        Assertions.assertEquals("Unknown function: cancel_everything", mapper.readTree(result.content()).path("error").asText());
    }

    @Test
    public void shouldReportMalformedArguments() {
        FunctionCallDispatcher.DispatchResult result = dispatch("book_room", "{roomId: oops");

        Assertions.assertTrue(result.error());
        verifyNoInteractions(bookings);
    }

    private FunctionCallDispatcher.DispatchResult dispatch(String name, String args) {
        return dispatcher.dispatch("user-1", new LlmService.FunctionCall(name, args));
    }
}
