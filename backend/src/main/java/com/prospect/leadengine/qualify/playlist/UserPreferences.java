package com.prospect.leadengine.qualify.playlist;

import com.prospect.leadengine.qualify.model.CompanySize;
import com.prospect.leadengine.qualify.model.Sector;

import java.util.List;

public record UserPreferences(
    String userId,
    List<Sector> preferredSectors,
    List<CompanySize> preferredCompanySizes,
    double minScore,
    int maxLeadsPerDay
) {
    public UserPreferences {
        preferredSectors = preferredSectors == null
            ? List.of()
            : preferredSectors.stream().filter(sector -> sector != null).distinct().toList();
        preferredCompanySizes = preferredCompanySizes == null
            ? List.of()
            : preferredCompanySizes.stream().filter(size -> size != null).distinct().toList();
        maxLeadsPerDay = Math.max(1, maxLeadsPerDay);
    }

    public boolean hasSectorPreferences() {
        return !preferredSectors.isEmpty();
    }
}
