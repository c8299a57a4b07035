package com.streamsupervisor.model;

public enum ErrorKind {
    NOT_FOUND, // unknown stream id
    NAMING_COLLISION, // two source files sanitize to the same id
    PROCESS_SPAWN_FAILURE, // encoder could not be launched
    PROCESS_CRASH, // encoder exited while it was expected to run
    WATCHER_FAILURE // directory subscription died
}
