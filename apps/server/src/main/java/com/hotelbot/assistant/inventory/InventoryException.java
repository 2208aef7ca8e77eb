package com.hotelbot.assistant.inventory;

/**
 * A call to the inventory service failed. {@code rejected} is true only when the
 * inventory answered with a 4xx, i.e. it refused the request rather than failing.
 */
public class InventoryException extends RuntimeException {
    private final boolean rejected;
    private final Integer httpStatus;

    public InventoryException(String message, boolean rejected, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.rejected = rejected;
        this.httpStatus = httpStatus;
    }

    public boolean isRejected() { return rejected; }
    public Integer getHttpStatus() { return httpStatus; }
}
