package com.prospect.leadengine.qualify.playlist;

import com.prospect.leadengine.qualify.model.CloudMaturity;
import com.prospect.leadengine.qualify.model.CompanySize;
import com.prospect.leadengine.qualify.model.Sector;

import java.util.List;
import java.util.Optional;

public final class PlaylistTemplateCatalog {
    private static final List<PlaylistTemplate> TEMPLATES = List.of(
        new PlaylistTemplate(
            "hot-migration",
            "Hot AWS Migration Prospects",
            "Companies on Azure or GCP with high potential for migration to AWS",
            PlaylistCriteria.builder()
                .competitorClouds("azure", "gcp")
                .minScore(75)
                .sectors(Sector.BANKING, Sector.RETAIL, Sector.MANUFACTURING)
                .build(),
            "Companies already running on a competing cloud are the easiest to convert"
        ),
        new PlaylistTemplate(
            "banking-transformation",
            "Banking Digital Transformation",
            "Banks and fintechs in the middle of a digital transformation",
            PlaylistCriteria.builder()
                .sectors(Sector.BANKING, Sector.FINTECH)
                .minScore(70)
                .companySizes(CompanySize.LARGE, CompanySize.ENTERPRISE)
                .cloudMaturities(CloudMaturity.EXPLORING, CloudMaturity.ADOPTING)
                .build(),
            "Banking is a priority sector with budget for large projects"
        ),
        new PlaylistTemplate(
            "scale-up-tech",
            "Scale-up Tech Companies",
            "Growing technology companies that need to scale",
            PlaylistCriteria.builder()
                .sectors(Sector.TECHNOLOGY)
                .companySizes(CompanySize.MEDIUM, CompanySize.LARGE)
                .minScore(65)
                .hasWebsite(true)
                .build(),
            "Growing tech companies need scalable infrastructure"
        ),
        new PlaylistTemplate(
            "industry-4",
            "Industry 4.0 Manufacturers",
            "Manufacturers modernizing with IoT and data",
            PlaylistCriteria.builder()
                .sectors(Sector.MANUFACTURING)
                .minScore(60)
                .technologyKeywords("iot", "data", "analytics", "automation")
                .build(),
            "Industry 4.0 needs elastic infrastructure for IoT and analytics"
        ),
        new PlaylistTemplate(
            "ecommerce-growth",
            "E-commerce Growth Opportunities",
            "Online stores without a CDN or cloud scalability",
            PlaylistCriteria.builder()
                .sectors(Sector.RETAIL, Sector.ECOMMERCE)
                .minScore(55)
                .painPointKeywords("performance", "scalability", "traffic")
                .build(),
            "E-commerce needs performance and scalability to grow"
        ),
        new PlaylistTemplate(
            "new-decision-makers",
            "New Decision Makers",
            "Companies where a tracked contact recently moved into a leadership role",
            PlaylistCriteria.builder()
                .minScore(50)
                .jobChangeWithinDays(90)
                .seniorJobChangesOnly(true)
                .build(),
            "New decision makers are more open to change"
        )
    );

    private PlaylistTemplateCatalog() {
    }

    public static List<PlaylistTemplate> templates() {
        return TEMPLATES;
    }

    public static Optional<PlaylistTemplate> byKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (PlaylistTemplate template : TEMPLATES) {
            if (template.key().equalsIgnoreCase(key.trim())) {
                return Optional.of(template);
            }
        }
        return Optional.empty();
    }
}
