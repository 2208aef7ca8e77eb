package com.hotelbot.assistant.service;

import com.hotelbot.assistant.model.Turn;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class LlmServiceTest {

    private static final String URL = "http://llm.test/v1/chat/completions";
    private static final List<Map<String, Object>> FUNCTIONS = List.of(Map.of("name", "get_rooms"));

    private LlmService llm;
    private MockRestServiceServer server;

    @BeforeEach
    public void setUp() {
        llm = new LlmService();
        ReflectionTestUtils.setField(llm, "openaiApiKey", "sk-test");
        ReflectionTestUtils.setField(llm, "openaiBaseUrl", "http://llm.test");
        ReflectionTestUtils.setField(llm, "openaiModel", "gpt-3.5-turbo");
        ReflectionTestUtils.setField(llm, "maxAttempts", 2);
        RestTemplate rt = new RestTemplate();
        server = MockRestServiceServer.bindTo(rt).build();
        llm.setHttp(rt);
    }

    @Test
    public void shouldReturnAssistantContent() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andExpect(jsonPath("$.model").value("gpt-3.5-turbo"))
                .andExpect(jsonPath("$.function_call").value("auto"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"Hello!\"}}]}",
                        MediaType.APPLICATION_JSON));

        Optional<LlmService.ModelReply> reply = llm.complete("persona", List.of(Turn.user("Hi")), FUNCTIONS, true);

        Assertions.assertTrue(reply.isPresent());
        Assertions.assertEquals("Hello!", reply.get().content());
        Assertions.assertFalse(reply.get().hasFunctionCall());
        server.verify();
    }

    @Test
    public void shouldParseFunctionCall() {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.function_call").value("none"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":null,"
                                + "\"function_call\":{\"name\":\"book_room\",\"arguments\":\"{\\\"roomId\\\":1}\"}}}]}",
                        MediaType.APPLICATION_JSON));

        LlmService.ModelReply reply = llm.complete("persona", List.of(Turn.user("Book room 1")), FUNCTIONS, false).orElseThrow();

        Assertions.assertTrue(reply.hasFunctionCall());
        Assertions.assertEquals("book_room", reply.functionCall().name());
        Assertions.assertEquals("{\"roomId\":1}", reply.functionCall().arguments());
    }

    @Test
    public void shouldFallBackToToolCalls() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"tool_calls\":[{\"type\":\"function\","
                                + "\"function\":{\"name\":\"get_rooms\",\"arguments\":\"{}\"}}]}}]}",
                        MediaType.APPLICATION_JSON));

        LlmService.ModelReply reply = llm.complete("persona", List.of(Turn.user("Rooms?")), FUNCTIONS, true).orElseThrow();

        Assertions.assertEquals("get_rooms", reply.functionCall().name());
    }

    @Test
    public void shouldRetryServerErrorOnce() {
        server.expect(ExpectedCount.once(), requestTo(URL)).andRespond(withServerError());
        server.expect(ExpectedCount.once(), requestTo(URL))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"Back online\"}}]}",
                        MediaType.APPLICATION_JSON));

        Optional<LlmService.ModelReply> reply = llm.complete("persona", List.of(Turn.user("Hi")), FUNCTIONS, true);

        Assertions.assertEquals("Back online", reply.orElseThrow().content());
        server.verify();
    }

    @Test
    public void shouldGiveUpOnClientError() {
        server.expect(ExpectedCount.once(), requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        Assertions.assertTrue(llm.complete("persona", List.of(Turn.user("Hi")), FUNCTIONS, true).isEmpty());
        server.verify();
    }

    @Test
    public void shouldSkipCallWithoutApiKey() {
        ReflectionTestUtils.setField(llm, "openaiApiKey", "");

        Assertions.assertTrue(llm.complete("persona", List.of(Turn.user("Hi")), FUNCTIONS, true).isEmpty());
        server.verify();
    }

    @Test
    public void shouldNotDoubleVersionPrefix() {
        ReflectionTestUtils.setField(llm, "openaiBaseUrl", "http://llm.test/v1/");
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}", MediaType.APPLICATION_JSON));

        Assertions.assertTrue(llm.complete("persona", List.of(Turn.user("Hi")), FUNCTIONS, true).isPresent());
        server.verify();
    }

    @Test
    public void shouldReplayFunctionTurnAsCallAndResult() {
        List<Map<String, Object>> wire = llm.toWireMessages("persona", List.of(
                Turn.user("Rooms?"),
                Turn.functionResult("get_rooms", "{}", "{\"rooms\":[]}"),
                Turn.assistant("None free.")));

        Assertions.assertEquals(5, wire.size());
        Assertions.assertEquals("system", wire.get(0).get("role"));
        Assertions.assertEquals("assistant", wire.get(2).get("role"));
        Assertions.assertEquals(Map.of("name", "get_rooms", "arguments", "{}"), wire.get(2).get("function_call"));
        Assertions.assertEquals("function", wire.get(3).get("role"));
        Assertions.assertEquals("get_rooms", wire.get(3).get("name"));
        Assertions.assertEquals("{\"rooms\":[]}", wire.get(3).get("content"));
    }
}
