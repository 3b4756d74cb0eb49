package com.herzen.cat.exception;

public class ItemPoolEmptyException extends RuntimeException {

    private final String topic;

    public ItemPoolEmptyException(String topic) {
        super(topic == null || topic.isBlank()
                ? "No items available in the item bank"
                : "No items available for topic '" + topic + "'");
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }
}
