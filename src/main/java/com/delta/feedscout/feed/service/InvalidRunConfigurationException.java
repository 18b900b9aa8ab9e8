package com.delta.feedscout.feed.service;

public class InvalidRunConfigurationException extends IllegalArgumentException {
    public InvalidRunConfigurationException(String message) {
        super(message);
    }
}
