package com.prospect.leadengine.qualify.playlist;

/**
 * A fresh membership row from an active playlist, considered for today's recommendations.
 */
public record DailyCandidate(PlaylistMember member, String playlistName) {
}
