package com.linlay.calendarassistant.service;

public class ThreadNotFoundException extends RuntimeException {

    private final String threadId;

    public ThreadNotFoundException(String threadId) {
        super("thread not found: " + threadId);
        this.threadId = threadId;
    }

    public String getThreadId() {
        return threadId;
    }
}
