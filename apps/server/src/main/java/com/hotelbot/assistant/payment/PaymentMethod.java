package com.hotelbot.assistant.payment;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

public enum PaymentMethod {
    CREDIT_CARD("credit_card"),
    DEBIT_CARD("debit_card"),
    PAYPAL("paypal");

    private final String code;

    PaymentMethod(String code) {
        this.code = code;
    }

    public String getCode() { return code; }

    public static Optional<PaymentMethod> fromCode(String code) {
        if (code == null) return Optional.empty();
        String c = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(m -> m.code.equals(c)).findFirst();
    }

    public static List<String> codes() {
        return Arrays.stream(values()).map(PaymentMethod::getCode).collect(Collectors.toList());
    }
}
