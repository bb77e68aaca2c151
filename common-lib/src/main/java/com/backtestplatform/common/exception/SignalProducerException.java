package com.backtestplatform.common.exception;

public class SignalProducerException extends RuntimeException {
    private final String producerId;

    public SignalProducerException(String producerId, String message) {
        super("[" + producerId + "] " + message);
        this.producerId = producerId;
    }

    public SignalProducerException(String producerId, String message, Throwable cause) {
        super("[" + producerId + "] " + message, cause);
        this.producerId = producerId;
    }

    public String getProducerId() {
        return producerId;
    }
}
