package com.streamsupervisor.model;

public enum StreamStatus {
    STOPPED,
    RUNNING
}
