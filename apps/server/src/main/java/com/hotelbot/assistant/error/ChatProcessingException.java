package com.hotelbot.assistant.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ChatProcessingException extends ResponseStatusException {
    // internal only, never sent to the client
    private final String diagnostic;

    public ChatProcessingException(String diagnostic) {
        this(diagnostic, null);
    }

    public ChatProcessingException(String diagnostic, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "Error processing chat", cause);
        this.diagnostic = diagnostic;
    }

    public String getDiagnostic() { return diagnostic; }
}
