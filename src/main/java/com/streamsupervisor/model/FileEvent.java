package com.streamsupervisor.model;

import lombok.Value;

import java.nio.file.Path;

@Value
public class FileEvent {
    public enum Kind { CREATED, MODIFIED, REMOVED }

    Kind kind;
    Path path;
}
