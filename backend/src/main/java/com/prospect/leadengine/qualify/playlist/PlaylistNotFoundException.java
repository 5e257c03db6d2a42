package com.prospect.leadengine.qualify.playlist;

public class PlaylistNotFoundException extends RuntimeException {
    public PlaylistNotFoundException(long playlistId) {
        super("Playlist not found: " + playlistId);
    }
}
