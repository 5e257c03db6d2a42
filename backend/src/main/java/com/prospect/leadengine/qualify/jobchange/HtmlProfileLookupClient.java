package com.prospect.leadengine.qualify.jobchange;

import com.prospect.leadengine.qualify.http.HttpFetchResult;
import com.prospect.leadengine.qualify.http.PoliteHttpClient;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Reads the first experience entry of a public profile page. Falls back to the headline for the role when the
 * experience section is missing.
 */
@Service
public class HtmlProfileLookupClient implements ProfileLookupClient {
    private static final Logger log = LoggerFactory.getLogger(HtmlProfileLookupClient.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";

    private final PoliteHttpClient httpClient;

    public HtmlProfileLookupClient(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public Optional<ProfileSnapshot> lookup(String profileUrl) {
        if (profileUrl == null || profileUrl.isBlank()) {
            return Optional.empty();
        }
        HttpFetchResult fetch = httpClient.get(profileUrl, HTML_ACCEPT);
        if (!fetch.isSuccessful() || fetch.body() == null) {
            log.warn(
                "Profile lookup failed for {}: {}",
                profileUrl,
                fetch.errorCode() != null ? fetch.errorCode() : "status " + fetch.statusCode()
            );
            return Optional.empty();
        }
        ProfileSnapshot snapshot = parse(fetch.body(), fetch.finalUrlOrRequested());
        return snapshot.isEmpty() ? Optional.empty() : Optional.of(snapshot);
    }

    ProfileSnapshot parse(String html, String baseUrl) {
        Document document = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
        String company = null;
        String role = null;
        Element experience = document.selectFirst("[data-section=experience] ul li");
        if (experience != null) {
            role = textOf(experience.selectFirst("h3"));
            company = textOf(experience.selectFirst("h4 a"));
        }
        if (role == null) {
            role = textOf(document.selectFirst(".top-card-layout__headline"));
        }
        return new ProfileSnapshot(company, role);
    }

    private String textOf(Element element) {
        if (element == null) {
            return null;
        }
        String text = element.text().trim();
        return text.isEmpty() ? null : text;
    }
}
