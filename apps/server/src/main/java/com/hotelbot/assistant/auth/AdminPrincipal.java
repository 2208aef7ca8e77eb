package com.hotelbot.assistant.auth;

public class AdminPrincipal {
    private final String username;
    private final String role;

    public AdminPrincipal(String username, String role) {
        this.username = username;
        this.role = role;
    }

    public String getUsername() { return username; }
    public String getRole() { return role; }
}
