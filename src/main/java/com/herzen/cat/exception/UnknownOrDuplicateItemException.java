package com.herzen.cat.exception;

public class UnknownOrDuplicateItemException extends RuntimeException {

    private final String itemId;

    public UnknownOrDuplicateItemException(String itemId, String message) {
        super(message);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
