package com.prospect.leadengine.qualify.api;

import com.prospect.leadengine.qualify.jobchange.JobChangeDaemonService;
import com.prospect.leadengine.qualify.playlist.PlaylistRefreshDaemonService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/daemon")
public class DaemonController {
    private final JobChangeDaemonService jobChangeDaemon;
    private final PlaylistRefreshDaemonService playlistRefreshDaemon;

    public DaemonController(JobChangeDaemonService jobChangeDaemon, PlaylistRefreshDaemonService playlistRefreshDaemon) {
        this.jobChangeDaemon = jobChangeDaemon;
        this.playlistRefreshDaemon = playlistRefreshDaemon;
    }

    @PostMapping("/start")
    public DaemonStatusResponse start() {
        jobChangeDaemon.start();
        playlistRefreshDaemon.start();
        return status();
    }

    @PostMapping("/stop")
    public DaemonStatusResponse stop() {
        jobChangeDaemon.stop();
        playlistRefreshDaemon.stop();
        return status();
    }

    @GetMapping("/status")
    public DaemonStatusResponse status() {
        return new DaemonStatusResponse(jobChangeDaemon.isRunning(), playlistRefreshDaemon.isRunning());
    }
}
