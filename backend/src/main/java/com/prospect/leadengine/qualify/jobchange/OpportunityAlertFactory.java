package com.prospect.leadengine.qualify.jobchange;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class OpportunityAlertFactory {

    public OpportunityAlert create(JobChangeView view) {
        JobChangeEvent event = view.event();
        return new OpportunityAlert(
            event.id() == null ? 0L : event.id(),
            AlertPriority.fromScore(event.opportunityScore()),
            view.contactName(),
            view.profileUrl(),
            event.previousCompany(),
            event.newCompany(),
            event.newRole(),
            event.changeType(),
            event.opportunityScore(),
            event.detectedAt(),
            message(view),
            actionItems(event.opportunityScore())
        );
    }

    String message(JobChangeView view) {
        JobChangeEvent event = view.event();
        String name = view.contactName() == null ? "A tracked contact" : view.contactName();
        if (event.changeType() == ChangeType.COMPANY) {
            return name + " moved from " + event.previousCompany() + " to " + event.newCompany()
                + " as " + event.newRole();
        }
        if (event.changeType() == ChangeType.ROLE) {
            return name + " was promoted to " + event.newRole() + " at " + event.newCompany();
        }
        return name + " joined " + event.newCompany() + " as " + event.newRole();
    }

    List<String> actionItems(double score) {
        List<String> actions = new ArrayList<>();
        actions.add("Send a congratulations message");
        actions.add("Check whether the new company is a qualified prospect");
        AlertPriority priority = AlertPriority.fromScore(score);
        if (priority == AlertPriority.HIGH) {
            actions.add("Schedule a cloud discovery meeting");
            actions.add("Share similar customer case studies");
        } else if (priority == AlertPriority.MEDIUM) {
            actions.add("Assess fit with cloud solutions");
        }
        return actions;
    }
}
