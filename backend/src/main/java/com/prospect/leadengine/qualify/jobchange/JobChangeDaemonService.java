package com.prospect.leadengine.qualify.jobchange;

import com.prospect.leadengine.config.LeadEngineProperties;
import com.prospect.leadengine.qualify.daemon.ScheduledDaemon;
import org.springframework.stereotype.Service;

/**
 * Runs a job-change poll and inactivity expiry on a fixed interval.
 */
@Service
public class JobChangeDaemonService extends ScheduledDaemon {
    private final JobChangeMonitorService monitorService;

    public JobChangeDaemonService(JobChangeMonitorService monitorService, LeadEngineProperties properties) {
        super("job-change-daemon", () -> properties.getJobChange().getDaemon());
        this.monitorService = monitorService;
    }

    @Override
    protected void runOnce() {
        monitorService.pollOnce();
        monitorService.expireInactiveContacts();
    }
}
