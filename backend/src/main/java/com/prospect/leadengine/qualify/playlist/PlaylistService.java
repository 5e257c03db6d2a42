package com.prospect.leadengine.qualify.playlist;

import com.prospect.leadengine.config.LeadEngineProperties;
import com.prospect.leadengine.qualify.jobchange.JobChangeEvent;
import com.prospect.leadengine.qualify.jobchange.JobChangeView;
import com.prospect.leadengine.qualify.jobchange.OpportunityScorer;
import com.prospect.leadengine.qualify.model.Lead;
import com.prospect.leadengine.qualify.persistence.LeadRepository;
import com.prospect.leadengine.qualify.persistence.PlaylistRepository;
import com.prospect.leadengine.qualify.persistence.TrackedContactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Service
public class PlaylistService {
    private static final Logger log = LoggerFactory.getLogger(PlaylistService.class);

    private final PlaylistRepository playlistRepository;
    private final LeadRepository leadRepository;
    private final TrackedContactRepository trackedContactRepository;
    private final PlaylistMatcher matcher;
    private final OpportunityScorer opportunityScorer;
    private final LeadEngineProperties properties;

    public PlaylistService(
        PlaylistRepository playlistRepository,
        LeadRepository leadRepository,
        TrackedContactRepository trackedContactRepository,
        PlaylistMatcher matcher,
        OpportunityScorer opportunityScorer,
        LeadEngineProperties properties
    ) {
        this.playlistRepository = playlistRepository;
        this.leadRepository = leadRepository;
        this.trackedContactRepository = trackedContactRepository;
        this.matcher = matcher;
        this.opportunityScorer = opportunityScorer;
        this.properties = properties;
    }

    /**
     * Persists a playlist. Dynamic playlists are populated straight away; static ones get the listed leads.
     */
    public Playlist create(PlaylistDraft draft) {
        if (draft == null || draft.name() == null || draft.name().isBlank()) {
            throw new IllegalArgumentException("playlist name is required");
        }
        PlaylistType type = draft.type() == null ? PlaylistType.DYNAMIC : draft.type();
        int targetSize = draft.targetSize() == null || draft.targetSize() <= 0
            ? properties.getPlaylists().getDefaultTargetSize()
            : draft.targetSize();
        int refreshHours = draft.refreshHours() == null || draft.refreshHours() <= 0
            ? properties.getPlaylists().getRefreshHours()
            : draft.refreshHours();
        Playlist playlist = new Playlist(
            null,
            draft.name().trim(),
            draft.description(),
            type,
            draft.criteria() == null ? PlaylistCriteria.any() : draft.criteria(),
            targetSize,
            refreshHours,
            draft.ownerId(),
            PlaylistStatus.ACTIVE,
            Instant.now(),
            null
        );
        Playlist saved;
        try {
            saved = playlistRepository.insert(playlist);
        } catch (DataAccessException e) {
            throw new PlaylistPersistenceException("Playlist creation failed: " + playlist.name(), e);
        }
        log.info("Created {} playlist '{}' with id {}", type.value(), saved.name(), saved.id());
        if (saved.isDynamic()) {
            refresh(saved);
        } else if (!draft.leadIds().isEmpty()) {
            addMembers(saved.id(), draft.leadIds());
        }
        return get(saved.id());
    }

    public Playlist createFromTemplate(String templateKey, String ownerId) {
        PlaylistTemplate template = PlaylistTemplateCatalog.byKey(templateKey)
            .orElseThrow(() -> new IllegalArgumentException("Unknown playlist template: " + templateKey));
        return create(new PlaylistDraft(
            template.name(),
            template.description(),
            PlaylistType.DYNAMIC,
            template.criteria(),
            null,
            null,
            ownerId,
            List.of()
        ));
    }

    public Playlist get(long playlistId) {
        return playlistRepository.findById(playlistId).orElseThrow(() -> new PlaylistNotFoundException(playlistId));
    }

    public List<Playlist> list(boolean includeArchived) {
        return playlistRepository.findAll(includeArchived);
    }

    public List<PlaylistMember> members(long playlistId) {
        get(playlistId);
        return playlistRepository.findMembers(playlistId);
    }

    public PlaylistRefreshResult refresh(long playlistId) {
        return refresh(get(playlistId));
    }

    /**
     * Re-evaluates a dynamic playlist against the whole lead pool and swaps its membership. Static and archived
     * playlists are left untouched.
     */
    PlaylistRefreshResult refresh(Playlist playlist) {
        if (!playlist.isDynamic() || !playlist.isActive()) {
            List<PlaylistMember> current = playlistRepository.findMembers(playlist.id());
            return new PlaylistRefreshResult(playlist.id(), playlist.name(), false, current.size(), playlist.lastRefreshedAt());
        }
        Instant now = Instant.now();
        PlaylistCriteria criteria = playlist.criteria();
        Set<String> jobChangeCompanies = criteria.requiresJobChanges() ? jobChangeCompanies(criteria, now) : Set.of();
        List<Lead> members = matcher.match(leadRepository.findAll(), criteria, jobChangeCompanies);
        if (criteria.limit() == null && members.size() > playlist.targetSize()) {
            members = members.subList(0, playlist.targetSize());
        }
        int count;
        try {
            count = playlistRepository.replaceMembers(playlist.id(), members, now);
        } catch (DataAccessException e) {
            throw new PlaylistPersistenceException("Playlist refresh failed: " + playlist.id(), e);
        }
        log.info("Refreshed playlist '{}' ({}): {} leads", playlist.name(), playlist.id(), count);
        return new PlaylistRefreshResult(playlist.id(), playlist.name(), true, count, now);
    }

    /**
     * Companies tracked contacts moved to inside the criteria's window, keyed with {@link PlaylistMatcher#companyKey}.
     */
    private Set<String> jobChangeCompanies(PlaylistCriteria criteria, Instant now) {
        Instant since = now.minus(Duration.ofDays(criteria.jobChangeWithinDays()));
        Set<String> companies = new HashSet<>();
        for (JobChangeView view : trackedContactRepository.findRecentChanges(since, 0.0)) {
            JobChangeEvent event = view.event();
            if (event.newCompany() == null || event.newCompany().isBlank()) {
                continue;
            }
            if (Boolean.TRUE.equals(criteria.seniorJobChangesOnly()) && !opportunityScorer.isSeniorTitle(event.newRole())) {
                continue;
            }
            companies.add(PlaylistMatcher.companyKey(event.newCompany()));
        }
        return companies;
    }

    /**
     * Refreshes every active dynamic playlist whose cadence has elapsed. One failing playlist does not stop the
     * others.
     */
    public List<PlaylistRefreshResult> refreshDue() {
        Instant now = Instant.now();
        List<PlaylistRefreshResult> results = new ArrayList<>();
        for (Playlist playlist : playlistRepository.findActiveDynamic()) {
            if (!playlist.isDueForRefresh(now)) {
                continue;
            }
            try {
                results.add(refresh(playlist));
            } catch (PlaylistPersistenceException e) {
                log.warn("Skipping playlist {} after refresh failure", playlist.id(), e);
            }
        }
        log.info("Refreshed {} due playlists", results.size());
        return results;
    }

    public int addMembers(long playlistId, List<Long> leadIds) {
        Playlist playlist = get(playlistId);
        if (playlist.isDynamic()) {
            throw new IllegalArgumentException("Members of dynamic playlist " + playlistId + " are derived from its criteria");
        }
        List<Lead> leads = leadRepository.findByIds(leadIds);
        try {
            int added = playlistRepository.addMembers(playlistId, leads, Instant.now());
            log.info("Added {} leads to static playlist {}", added, playlistId);
            return added;
        } catch (DataAccessException e) {
            throw new PlaylistPersistenceException("Adding members failed for playlist " + playlistId, e);
        }
    }

    public Playlist archive(long playlistId) {
        get(playlistId);
        playlistRepository.updateStatus(playlistId, PlaylistStatus.ARCHIVED);
        log.info("Archived playlist {}", playlistId);
        return get(playlistId);
    }

    public boolean updateMemberStatus(long playlistId, long leadId, MemberStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("member status is required");
        }
        get(playlistId);
        return playlistRepository.updateMemberStatus(playlistId, leadId, status);
    }

    /**
     * Records an outreach action on a playlist member. Empty when the lead is not in the playlist.
     */
    public Optional<LeadEngagement> trackEngagement(
        long playlistId,
        long leadId,
        String userId,
        String actionType,
        String outcome,
        String notes
    ) {
        if (actionType == null || actionType.isBlank()) {
            throw new IllegalArgumentException("engagement action type is required");
        }
        get(playlistId);
        if (!playlistRepository.isMember(playlistId, leadId)) {
            return Optional.empty();
        }
        LeadEngagement engagement = new LeadEngagement(
            null,
            playlistId,
            leadId,
            userId,
            actionType.trim().toLowerCase(Locale.ROOT),
            outcome == null || outcome.isBlank() ? null : outcome.trim().toLowerCase(Locale.ROOT),
            notes,
            Instant.now()
        );
        LeadEngagement stored;
        try {
            stored = playlistRepository.insertEngagement(engagement);
        } catch (DataAccessException e) {
            throw new PlaylistPersistenceException("Recording engagement failed for playlist " + playlistId, e);
        }
        log.info("Recorded {} on lead {} in playlist {}", stored.actionType(), leadId, playlistId);
        return Optional.of(stored);
    }

    public PlaylistPerformance performance(long playlistId) {
        return playlistRepository.performance(playlistId).orElseThrow(() -> new PlaylistNotFoundException(playlistId));
    }
}
