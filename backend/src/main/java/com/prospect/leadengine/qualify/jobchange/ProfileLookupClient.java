package com.prospect.leadengine.qualify.jobchange;

import java.util.Optional;

public interface ProfileLookupClient {
    /**
     * Current company and role for a profile, or empty when nothing could be read. Implementations must not throw
     * for collaborator failures.
     */
    Optional<ProfileSnapshot> lookup(String profileUrl);
}
