package io.relayhive.core.publisher;

import io.relayhive.core.RelayException;

/**
 * Raised synchronously when an envelope cannot be serialised or handed to the broker.
 */
public class PublishException extends RelayException {

    private final String topic;

    public PublishException(String topic, String message, Throwable cause) {
        super(message, cause);
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }
}
