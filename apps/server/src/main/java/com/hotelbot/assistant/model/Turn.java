package com.hotelbot.assistant.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One entry of a conversation transcript. Function turns carry the name and raw
 * arguments of the call they answer, so the call can be replayed to the model.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Turn {
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String FUNCTION = "function";

    private String role;
    private String content;
    private String name;
    private String arguments;

    public Turn() {}

    public Turn(String role, String content) {
        this.role = role;
        this.content = content;
    }

    public static Turn user(String content) { return new Turn(USER, content); }

    public static Turn assistant(String content) { return new Turn(ASSISTANT, content); }

    public static Turn functionResult(String name, String arguments, String content) {
        Turn t = new Turn(FUNCTION, content);
        t.setName(name);
        t.setArguments(arguments);
        return t;
    }

    public String getRole() { return role; }
    public void setRole(String role) { this.role = role; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getArguments() { return arguments; }
    public void setArguments(String arguments) { this.arguments = arguments; }
}
