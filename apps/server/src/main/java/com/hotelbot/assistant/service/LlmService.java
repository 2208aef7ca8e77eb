package com.hotelbot.assistant.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hotelbot.assistant.model.Turn;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * OpenAI-compatible chat completion with declared functions. Returns empty when the model
 * is not configured, unreachable, or answers with nothing usable.
 */
@Service
public class LlmService {
    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    @Value("${llm.openai.apiKey:}")
    private String openaiApiKey;

    @Value("${llm.openai.baseUrl:https://api.openai.com}")
    private String openaiBaseUrl;

    @Value("${llm.openai.model:gpt-3.5-turbo}")
    private String openaiModel;

    @Value("${llm.http.connectTimeoutMs:3000}")
    private int httpConnectTimeoutMs;

    @Value("${llm.http.readTimeoutMs:30000}")
    private int httpReadTimeoutMs;

    // transport errors and 5xx only
    @Value("${llm.http.maxAttempts:2}")
    private int maxAttempts;

    private RestTemplate http;
    private final ObjectMapper mapper = new ObjectMapper();

    public LlmService() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(2000);
        factory.setReadTimeout(15000);
        this.http = new RestTemplate(factory);
    }

    @PostConstruct
    public void initHttp() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(httpConnectTimeoutMs);
        factory.setReadTimeout(httpReadTimeoutMs);
        this.http = new RestTemplate(factory);
        log.info("LLM HTTP timeouts: connect={}ms, read={}ms, maxAttempts={}", httpConnectTimeoutMs, httpReadTimeoutMs, maxAttempts);
    }

    void setHttp(RestTemplate http) {
        this.http = http;
    }

    public record FunctionCall(String name, String arguments) {}

    public record ModelReply(String content, FunctionCall functionCall) {
        public boolean hasFunctionCall() {
            return functionCall != null && functionCall.name() != null && !functionCall.name().isBlank();
        }
    }

    /**
     * @param allowFunctionCall {@code function_call: "auto"} when true, {@code "none"} otherwise
     */
    public Optional<ModelReply> complete(String systemPrompt,
                                         List<Turn> transcript,
                                         List<Map<String, Object>> functions,
                                         boolean allowFunctionCall) {
        if (openaiApiKey == null || openaiApiKey.isBlank()) {
            log.warn("OPENAI API KEY not configured, skipping LLM call");
            return Optional.empty();
        }
        String url = completionsUrl();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", openaiModel);
        body.put("messages", toWireMessages(systemPrompt, transcript));
        if (functions != null && !functions.isEmpty()) {
            body.put("functions", functions);
            body.put("function_call", allowFunctionCall ? "auto" : "none");
        }

        String jsonBody;
        try {
            jsonBody = mapper.writeValueAsString(body);
        } catch (Exception e) {
            log.warn("Serializing LLM request failed: {}", e.toString());
            return Optional.empty();
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(openaiApiKey);
        log.debug("LLM POST {} model={} turns={}", url, openaiModel, transcript.size());

        int attempts = Math.max(1, maxAttempts);
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                ResponseEntity<String> res = http.postForEntity(url, new HttpEntity<>(jsonBody, headers), String.class);
                return parseReply(res.getBody());
            } catch (HttpServerErrorException | ResourceAccessException e) {
                log.warn("LLM call attempt {}/{} failed: {}", attempt, attempts, e.toString());
            } catch (HttpClientErrorException e) {
                log.warn("LLM rejected request: status={} body={}", e.getStatusCode().value(), e.getResponseBodyAsString());
                return Optional.empty();
            } catch (Exception e) {
                log.warn("LLM call failed: {}", e.toString());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private String completionsUrl() {
        String base = openaiBaseUrl == null ? "https://api.openai.com" : openaiBaseUrl.trim();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return base.endsWith("/v1") ? base + "/chat/completions" : base + "/v1/chat/completions";
    }

    // a function turn is replayed as the assistant's call followed by the function's answer
    List<Map<String, Object>> toWireMessages(String systemPrompt, List<Turn> transcript) {
        List<Map<String, Object>> out = new ArrayList<>();
        out.add(Map.of("role", "system", "content", systemPrompt == null ? "" : systemPrompt));
        for (Turn t : transcript) {
            String content = t.getContent() == null ? "" : t.getContent();
            if (Turn.FUNCTION.equals(t.getRole())) {
                Map<String, Object> call = new HashMap<>();
                call.put("role", "assistant");
                call.put("content", null);
                call.put("function_call", Map.of(
                        "name", t.getName() == null ? "" : t.getName(),
                        "arguments", t.getArguments() == null ? "{}" : t.getArguments()));
                out.add(call);
                out.add(Map.of("role", "function", "name", t.getName() == null ? "" : t.getName(), "content", content));
            } else {
                String role = (t.getRole() == null || t.getRole().isBlank()) ? Turn.USER : t.getRole();
                out.add(Map.of("role", role, "content", content));
            }
        }
        return out;
    }

    private Optional<ModelReply> parseReply(String body) throws Exception {
        JsonNode message = mapper.readTree(body == null ? "{}" : body).path("choices").path(0).path("message");
        String content = message.path("content").isTextual() ? message.path("content").asText() : null;
        FunctionCall call = null;
        JsonNode fc = message.path("function_call");
        if (fc.isMissingNode() || fc.isNull()) {
            // some compatible backends only speak the tools format
            fc = message.path("tool_calls").path(0).path("function");
        }
        if (fc.hasNonNull("name")) {
            JsonNode args = fc.path("arguments");
            String arguments = args.isTextual() ? args.asText() : (args.isMissingNode() || args.isNull() ? "{}" : args.toString());
            call = new FunctionCall(fc.get("name").asText(), arguments);
        }
        if (call == null && (content == null || content.isBlank())) {
            log.warn("LLM returned empty content");
            return Optional.empty();
        }
        return Optional.of(new ModelReply(content, call));
    }
}
