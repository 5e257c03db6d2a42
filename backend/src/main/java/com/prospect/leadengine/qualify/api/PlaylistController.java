package com.prospect.leadengine.qualify.api;

import com.prospect.leadengine.qualify.playlist.DailyLeadRecommendation;
import com.prospect.leadengine.qualify.playlist.LeadEngagement;
import com.prospect.leadengine.qualify.playlist.MemberStatus;
import com.prospect.leadengine.qualify.playlist.Playlist;
import com.prospect.leadengine.qualify.playlist.PlaylistDraft;
import com.prospect.leadengine.qualify.playlist.PlaylistMember;
import com.prospect.leadengine.qualify.playlist.PlaylistPerformance;
import com.prospect.leadengine.qualify.playlist.PlaylistRecommendation;
import com.prospect.leadengine.qualify.playlist.PlaylistRefreshResult;
import com.prospect.leadengine.qualify.playlist.PlaylistService;
import com.prospect.leadengine.qualify.playlist.PlaylistTemplate;
import com.prospect.leadengine.qualify.playlist.PlaylistTemplateCatalog;
import com.prospect.leadengine.qualify.playlist.RecommendationEngine;
import com.prospect.leadengine.qualify.playlist.UserPreferences;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/playlists")
public class PlaylistController {
    private final PlaylistService playlistService;
    private final RecommendationEngine recommendationEngine;

    public PlaylistController(PlaylistService playlistService, RecommendationEngine recommendationEngine) {
        this.playlistService = playlistService;
        this.recommendationEngine = recommendationEngine;
    }

    @PostMapping
    public Playlist create(@RequestBody PlaylistDraft draft) {
        return playlistService.create(draft);
    }

    @GetMapping
    public List<Playlist> list(
        @RequestParam(name = "includeArchived", required = false, defaultValue = "false") boolean includeArchived
    ) {
        return playlistService.list(includeArchived);
    }

    @GetMapping("/templates")
    public List<PlaylistTemplate> templates() {
        return PlaylistTemplateCatalog.templates();
    }

    @PostMapping("/templates/{key}")
    public Playlist createFromTemplate(
        @PathVariable("key") String key,
        @RequestParam(name = "ownerId", required = false) String ownerId
    ) {
        return playlistService.createFromTemplate(key, ownerId);
    }

    @GetMapping("/recommendations")
    public List<PlaylistRecommendation> recommendations(
        @RequestParam(name = "userId", required = false, defaultValue = "default") String userId
    ) {
        return recommendationEngine.recommendTemplates(userId);
    }

    @GetMapping("/daily")
    public List<DailyLeadRecommendation> daily(
        @RequestParam(name = "userId", required = false, defaultValue = "default") String userId,
        @RequestParam(name = "limit", required = false, defaultValue = "10") int limit
    ) {
        return recommendationEngine.dailyRecommendations(userId, limit);
    }

    @GetMapping("/preferences")
    public UserPreferences preferences(
        @RequestParam(name = "userId", required = false, defaultValue = "default") String userId
    ) {
        return recommendationEngine.preferencesFor(userId);
    }

    @PutMapping("/preferences")
    public UserPreferences savePreferences(@RequestBody UserPreferences preferences) {
        return recommendationEngine.savePreferences(preferences);
    }

    @PostMapping("/refresh-due")
    public List<PlaylistRefreshResult> refreshDue() {
        return playlistService.refreshDue();
    }

    @GetMapping("/{id}")
    public Playlist get(@PathVariable("id") long id) {
        return playlistService.get(id);
    }

    @GetMapping("/{id}/members")
    public List<PlaylistMember> members(@PathVariable("id") long id) {
        return playlistService.members(id);
    }

    @PostMapping("/{id}/members")
    public Map<String, Integer> addMembers(@PathVariable("id") long id, @RequestBody List<Long> leadIds) {
        return Map.of("added", playlistService.addMembers(id, leadIds));
    }

    @PostMapping("/{id}/members/{leadId}/status")
    public Map<String, Object> updateMemberStatus(
        @PathVariable("id") long id,
        @PathVariable("leadId") long leadId,
        @RequestParam(name = "status") String status
    ) {
        MemberStatus parsed = MemberStatus.fromValue(status);
        if (parsed == null) {
            throw new ResponseStatusException(BAD_REQUEST, "Unsupported member status: " + status);
        }
        if (!playlistService.updateMemberStatus(id, leadId, parsed)) {
            throw new ResponseStatusException(NOT_FOUND, "Lead " + leadId + " is not in playlist " + id);
        }
        return Map.of("playlistId", id, "leadId", leadId, "status", parsed.value());
    }

    @PostMapping("/{id}/members/{leadId}/engagement")
    public LeadEngagement trackEngagement(
        @PathVariable("id") long id,
        @PathVariable("leadId") long leadId,
        @RequestBody EngagementRequest request
    ) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "Engagement body is required");
        }
        return playlistService.trackEngagement(
                id,
                leadId,
                request.userId(),
                request.actionType(),
                request.outcome(),
                request.notes()
            )
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Lead " + leadId + " is not in playlist " + id));
    }

    @PostMapping("/{id}/refresh")
    public PlaylistRefreshResult refresh(@PathVariable("id") long id) {
        return playlistService.refresh(id);
    }

    @PostMapping("/{id}/archive")
    public Playlist archive(@PathVariable("id") long id) {
        return playlistService.archive(id);
    }

    @GetMapping("/{id}/performance")
    public PlaylistPerformance performance(@PathVariable("id") long id) {
        return playlistService.performance(id);
    }
}
