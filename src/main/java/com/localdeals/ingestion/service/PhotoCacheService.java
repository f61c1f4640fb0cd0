package com.localdeals.ingestion.service;

import com.localdeals.ingestion.config.IngestionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

/**
 * Local photo cache keyed by Google place id. Cache-first, and never throws:
 * anything that goes wrong resolves to the shared placeholder.
 */
@Service
public class PhotoCacheService {

    private static final Logger log = LoggerFactory.getLogger(PhotoCacheService.class);

    private static final int PLACEHOLDER_GRAY = 0xCCCCCC;

    private final Path cacheDir;
    private final Path placeholderPath;
    private final int maxWidth;
    private final Duration timeout;
    private final GooglePlacesApiService placesApiService;
    private final ProviderRateLimiter rateLimiter;
    private final HttpClient httpClient;

    @Autowired
    public PhotoCacheService(IngestionProperties properties,
                             GooglePlacesApiService placesApiService,
                             ProviderRateLimiter rateLimiter) {
        this(properties, placesApiService, rateLimiter, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    PhotoCacheService(IngestionProperties properties,
                      GooglePlacesApiService placesApiService,
                      ProviderRateLimiter rateLimiter,
                      HttpClient httpClient) {
        IngestionProperties.Photos photos = properties.getPhotos();
        this.cacheDir = Paths.get(photos.getCacheDir());
        this.placeholderPath = cacheDir.resolve(photos.getPlaceholderName());
        this.maxWidth = photos.getMaxWidth();
        this.timeout = photos.getTimeout();
        this.placesApiService = placesApiService;
        this.rateLimiter = rateLimiter;
        this.httpClient = httpClient;

        log.info("PhotoCacheService initialized with cache directory: {}", cacheDir.toAbsolutePath());
    }

    /**
     * @param photoReference first photo reference of the place, may be null
     * @param externalId     Google place id, used as the cache key
     * @return path of the cached photo, or of the placeholder
     */
    public String fetch(String photoReference, String externalId) {
        Path target = cacheDir.resolve(sanitizeFileName(externalId) + ".jpg");
        if (Files.exists(target)) {
            log.debug("Photo cache hit for {}", externalId);
            return target.toString();
        }

        if (photoReference == null || photoReference.isBlank()) {
            return placeholder();
        }

        String photoUrl = placesApiService.getPhotoUrl(photoReference, maxWidth);
        if (photoUrl == null) {
            return placeholder();
        }

        try {
            rateLimiter.acquire(ProviderChannel.PRIMARY);
            if (download(photoUrl, target)) {
                log.debug("Saved photo for {} to {}", externalId, target);
                return target.toString();
            }
        } catch (IOException e) {
            log.warn("Error downloading photo for {}: {}", externalId, e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid photo URL for {}: {}", externalId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Photo download interrupted for {}", externalId);
        }

        return placeholder();
    }

    public String getPlaceholderPath() {
        return placeholderPath.toString();
    }

    private boolean download(String photoUrl, Path target) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(photoUrl))
                .timeout(timeout)
                .header("User-Agent", "Mozilla/5.0 (compatible; LocalDealsBatch/1.0)")
                .GET()
                .build();

        HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());

        try (InputStream in = response.body()) {
            if (response.statusCode() != 200) {
                log.warn("Failed to download photo, status: {}", response.statusCode());
                return false;
            }

            Files.createDirectories(cacheDir);
            Path partial = target.resolveSibling(target.getFileName() + ".part");
            try {
                Files.copy(in, partial, StandardCopyOption.REPLACE_EXISTING);
                Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(partial);
            }
            return true;
        }
    }

    /**
     * Shared placeholder, written on first use.
     */
    private String placeholder() {
        if (!Files.exists(placeholderPath)) {
            try {
                Files.createDirectories(cacheDir);
                BufferedImage image = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
                image.setRGB(0, 0, PLACEHOLDER_GRAY);
                ImageIO.write(image, "png", placeholderPath.toFile());
                log.info("Created photo placeholder at {}", placeholderPath);
            } catch (IOException e) {
                log.warn("Could not create photo placeholder {}: {}", placeholderPath, e.getMessage());
            }
        }
        return placeholderPath.toString();
    }

    private String sanitizeFileName(String name) {
        if (name == null || name.isEmpty()) {
            return "unknown";
        }
        return name.replaceAll("[^a-zA-Z0-9._-]", "_");
    }
}
