package com.hotelbot.assistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HotelBotApplication {
    public static void main(String[] args) {
        SpringApplication.run(HotelBotApplication.class, args);
    }
}
