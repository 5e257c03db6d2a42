package com.prospect.leadengine.qualify.techno;

import com.prospect.leadengine.qualify.http.HttpFetchResult;
import com.prospect.leadengine.qualify.http.PoliteHttpClient;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fetches a company's homepage and collects technology signals from headers, markup and script sources.
 * Any fetch failure yields an empty profile.
 */
@Service
public class WebsiteTechInspector {
    private static final Logger log = LoggerFactory.getLogger(WebsiteTechInspector.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";

    private final PoliteHttpClient httpClient;

    public WebsiteTechInspector(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public TechnologyProfile inspect(String website) {
        if (website == null || website.isBlank()) {
            return TechnologyProfile.empty();
        }
        HttpFetchResult fetch = httpClient.get(website, HTML_ACCEPT);
        if (fetch.errorCode() != null) {
            log.warn("Website inspection failed for {}: {} {}", website, fetch.errorCode(), fetch.errorMessage());
            return TechnologyProfile.empty();
        }
        if (fetch.statusCode() != 200 || fetch.body() == null) {
            log.debug("Website inspection skipped for {}: status {}", website, fetch.statusCode());
            return TechnologyProfile.empty();
        }
        return analyze(fetch.body(), fetch.headerText(), fetch.finalUrlOrRequested());
    }

    TechnologyProfile analyze(String html, String headerText, String baseUrl) {
        TechnologyProfile.Builder profile = TechnologyProfile.builder();
        String lowerBody = html == null ? "" : html.toLowerCase(Locale.ROOT);
        String lowerHeaders = headerText == null ? "" : headerText.toLowerCase(Locale.ROOT);

        for (TechSignature signature : TechSignatureCatalog.signatures()) {
            if (signature.matchesHeaders(lowerHeaders) || signature.matchesBody(lowerBody)) {
                profile.add(signature.name(), signature.category());
            }
        }
        for (Map.Entry<String, List<String>> service : TechSignatureCatalog.targetServiceIndicators().entrySet()) {
            for (String indicator : service.getValue()) {
                if (lowerBody.contains(indicator)) {
                    profile.addTargetService(service.getKey());
                    break;
                }
            }
        }

        Document document = Jsoup.parse(html == null ? "" : html, baseUrl == null ? "" : baseUrl);
        Element generator = document.selectFirst("meta[name=generator]");
        if (generator != null) {
            String content = generator.attr("content").toLowerCase(Locale.ROOT);
            for (String cms : TechSignatureCatalog.GENERATOR_CMS) {
                if (content.contains(cms)) {
                    profile.add(cms, TechCategory.CMS);
                }
            }
        }
        for (Element script : document.select("script[src]")) {
            String src = script.attr("src").toLowerCase(Locale.ROOT);
            for (String library : TechSignatureCatalog.SCRIPT_LIBRARIES) {
                if (src.contains(library)) {
                    if (TechSignatureCatalog.MODERN_FRONTENDS.contains(library)) {
                        profile.add(library, TechCategory.FRONTEND);
                    } else {
                        profile.add(library, TechCategory.LIBRARY);
                    }
                    break;
                }
            }
        }
        return profile.build();
    }
}
