package com.prospect.leadengine.qualify.playlist;

import com.prospect.leadengine.config.LeadEngineProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class PlaylistRefreshDaemonServiceTest {

    @Mock
    private PlaylistService playlistService;

    private PlaylistRefreshDaemonService daemon;

    @AfterEach
    void tearDown() {
        if (daemon != null) {
            daemon.stop();
        }
    }

    @Test
    void disabledDaemonStaysIdle() {
        daemon = new PlaylistRefreshDaemonService(playlistService, new LeadEngineProperties());

        daemon.startIfEnabled();
        daemon.runCycle();

        assertThat(daemon.isRunning()).isFalse();
        verifyNoInteractions(playlistService);
    }

    @Test
    void enabledDaemonRefreshesDuePlaylists() {
        LeadEngineProperties properties = new LeadEngineProperties();
        properties.getPlaylists().getDaemon().setEnabled(true);
        daemon = new PlaylistRefreshDaemonService(playlistService, properties);

        daemon.startIfEnabled();

        assertThat(daemon.isRunning()).isTrue();
        verify(playlistService, timeout(5000)).refreshDue();
    }
}
