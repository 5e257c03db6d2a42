package com.prospect.leadengine.qualify.playlist;

public class PlaylistPersistenceException extends RuntimeException {
    public PlaylistPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
