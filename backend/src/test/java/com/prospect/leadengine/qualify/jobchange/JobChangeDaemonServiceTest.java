package com.prospect.leadengine.qualify.jobchange;

import com.prospect.leadengine.config.LeadEngineProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class JobChangeDaemonServiceTest {

    @Mock
    private JobChangeMonitorService monitorService;

    private JobChangeDaemonService daemon;

    @AfterEach
    void tearDown() {
        if (daemon != null) {
            daemon.stop();
        }
    }

    @Test
    void cyclePollsThenExpiresInactiveContacts() {
        daemon = new JobChangeDaemonService(monitorService, new LeadEngineProperties());

        daemon.start();

        verify(monitorService, timeout(5000)).pollOnce();
        verify(monitorService, timeout(5000)).expireInactiveContacts();
    }
}
