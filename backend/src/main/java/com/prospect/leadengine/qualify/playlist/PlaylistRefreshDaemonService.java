package com.prospect.leadengine.qualify.playlist;

import com.prospect.leadengine.config.LeadEngineProperties;
import com.prospect.leadengine.qualify.daemon.ScheduledDaemon;
import org.springframework.stereotype.Service;

@Service
public class PlaylistRefreshDaemonService extends ScheduledDaemon {
    private final PlaylistService playlistService;

    public PlaylistRefreshDaemonService(PlaylistService playlistService, LeadEngineProperties properties) {
        super("playlist-refresh-daemon", () -> properties.getPlaylists().getDaemon());
        this.playlistService = playlistService;
    }

    @Override
    protected void runOnce() {
        playlistService.refreshDue();
    }
}
