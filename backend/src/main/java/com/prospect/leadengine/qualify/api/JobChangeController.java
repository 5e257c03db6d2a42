package com.prospect.leadengine.qualify.api;

import com.prospect.leadengine.qualify.jobchange.AlertStatus;
import com.prospect.leadengine.qualify.jobchange.JobChangeMonitorService;
import com.prospect.leadengine.qualify.jobchange.JobChangeView;
import com.prospect.leadengine.qualify.jobchange.OpportunityAlert;
import com.prospect.leadengine.qualify.jobchange.PollSummary;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/job-changes")
public class JobChangeController {
    private final JobChangeMonitorService monitorService;

    public JobChangeController(JobChangeMonitorService monitorService) {
        this.monitorService = monitorService;
    }

    @PostMapping("/poll")
    public PollSummary poll(@RequestParam(name = "limit", required = false) Integer limit) {
        return limit == null ? monitorService.pollOnce() : monitorService.pollOnce(Math.max(1, limit));
    }

    @GetMapping("/recent")
    public List<JobChangeView> recent(
        @RequestParam(name = "days", required = false, defaultValue = "30") int days,
        @RequestParam(name = "minScore", required = false, defaultValue = "0") double minScore
    ) {
        return monitorService.recentChanges(Math.max(1, days), minScore);
    }

    @GetMapping("/alerts")
    public List<OpportunityAlert> alerts(
        @RequestParam(name = "days", required = false, defaultValue = "7") int days,
        @RequestParam(name = "minScore", required = false, defaultValue = "60") double minScore
    ) {
        return monitorService.alerts(Math.max(1, days), minScore);
    }

    @PostMapping("/{id}/status")
    public Map<String, Object> updateStatus(
        @PathVariable("id") long id,
        @RequestParam(name = "status") String status
    ) {
        AlertStatus parsed = AlertStatus.fromValue(status);
        if (parsed == null) {
            throw new ResponseStatusException(BAD_REQUEST, "Unsupported alert status: " + status);
        }
        if (!monitorService.updateAlertStatus(id, parsed)) {
            throw new ResponseStatusException(NOT_FOUND, "Job change event not found: " + id);
        }
        return Map.of("id", id, "status", parsed.value());
    }

    @PostMapping("/maintenance")
    public Map<String, Integer> maintenance() {
        int expired = monitorService.expireInactiveContacts();
        int purged = monitorService.purgeEvents();
        return Map.of("contactsExpired", expired, "eventsPurged", purged);
    }
}
