package com.localdeals.ingestion.service;

import com.localdeals.ingestion.config.IngestionProperties;
import com.localdeals.ingestion.dto.CanonicalBusiness;
import com.localdeals.ingestion.dto.ScrapedExtras;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Best-effort scrape of a business's own website for its meta description and menu links.
 */
@Service
public class WebsiteScraperService {

    private static final Logger log = LoggerFactory.getLogger(WebsiteScraperService.class);

    static final int MAX_MENU_LINKS = 3;

    private final ProviderRateLimiter rateLimiter;
    private final int timeoutMillis;
    private final String userAgent;

    public WebsiteScraperService(ProviderRateLimiter rateLimiter, IngestionProperties properties) {
        this.rateLimiter = rateLimiter;
        this.timeoutMillis = (int) properties.getScraper().getTimeout().toMillis();
        this.userAgent = properties.getScraper().getUserAgent();
    }

    /**
     * @param url website URL, may be null or the unknown marker
     * @return extracted extras, or empty when there is nothing to fetch or the fetch failed
     */
    public Optional<ScrapedExtras> fetch(String url) {
        if (!CanonicalBusiness.isKnown(url)) {
            return Optional.empty();
        }

        try {
            rateLimiter.acquire(ProviderChannel.WEBSITE);
            Document document = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout(timeoutMillis)
                    .followRedirects(true)
                    .get();
            return Optional.of(extract(document));

        } catch (HttpStatusException e) {
            log.debug("Scrape of {} returned HTTP {}", url, e.getStatusCode());
        } catch (IOException e) {
            log.debug("Scrape of {} failed: {}", url, e.getMessage());
        } catch (IllegalArgumentException e) {
            log.debug("Skipping malformed website URL {}: {}", url, e.getMessage());
        }
        return Optional.empty();
    }

    ScrapedExtras extract(Document document) {
        String description = null;
        Element meta = document.selectFirst("meta[name=description]");
        if (meta != null) {
            String content = meta.attr("content").trim();
            description = content.isEmpty() ? null : content;
        }

        List<String> menuLinks = new ArrayList<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("href");
            if (!href.toLowerCase(Locale.ROOT).contains("menu")) {
                continue;
            }
            String absolute = anchor.absUrl("href");
            menuLinks.add(absolute.isEmpty() ? href : absolute);
            if (menuLinks.size() == MAX_MENU_LINKS) {
                break;
            }
        }

        return new ScrapedExtras(description, menuLinks);
    }
}
