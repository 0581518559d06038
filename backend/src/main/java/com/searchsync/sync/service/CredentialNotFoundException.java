package com.searchsync.sync.service;

import java.nio.file.Path;

public class CredentialNotFoundException extends SyncException {
    private final Path path;

    public CredentialNotFoundException(Path path) {
        super("Credential file not found: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
