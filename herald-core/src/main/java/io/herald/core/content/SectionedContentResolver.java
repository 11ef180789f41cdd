package io.herald.core.content;

import io.herald.core.model.ContentType;
import io.herald.core.model.TemplateConfig;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds newsletter content section by section. Optional sections that fail are dropped with a warning;
 * a failing mandatory section fails the whole resolution.
 */
public final class SectionedContentResolver implements ContentResolver {
    private static final Logger LOG = LoggerFactory.getLogger(SectionedContentResolver.class);

    private final ContentSource source;
    private final String serverName;
    private final String serverUrl;
    private final String baseUrl;
    private final Clock clock;

    public SectionedContentResolver(ContentSource source, String serverName, String serverUrl, String baseUrl, Clock clock) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.serverName = serverName == null ? "" : serverName;
        this.serverUrl = serverUrl == null ? "" : serverUrl;
        this.baseUrl = baseUrl == null ? "" : baseUrl.replaceAll("/+$", "");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public ContentData resolve(ContentType type, TemplateConfig config, String userId, ZoneId zone)
        throws ContentResolutionException {
        if (type == null) {
            throw new ContentResolutionException("newsletter content type is required");
        }
        if (type.requiresUser() && (userId == null || userId.isBlank())) {
            throw new ContentResolutionException(type.wireName() + " newsletters need a user recipient");
        }

        TemplateConfig effective = config == null ? TemplateConfig.defaults() : config;
        Instant now = clock.instant();
        DateRange range = DateRange.lookback(effective, now, zone == null ? ZoneId.of("UTC") : zone);
        ContentQuery query = new ContentQuery(range.start(), range.end(), effective.effectiveMaxItems(), userId);

        Map<String, Object> sections = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        for (ContentSection section : optionalSections(type, effective)) {
            try {
                Object value = source.fetch(section, query);
                if (value != null) {
                    sections.put(section.key(), limit(value, query.limit()));
                }
            } catch (IOException | RuntimeException e) {
                LOG.warn("Skipping {} section for {} newsletter: {}", section.key(), type.wireName(), e.getMessage());
                warnings.add(section.key() + ": " + e.getMessage());
            }
        }

        ContentSection mandatory = mandatorySection(type);
        if (mandatory != null) {
            Object value;
            try {
                value = source.fetch(mandatory, query);
            } catch (IOException | RuntimeException e) {
                throw new ContentResolutionException(
                    "failed to load " + mandatory.key() + " for " + type.wireName() + " newsletter: " + e.getMessage(),
                    e
                );
            }
            if (value == null) {
                throw new ContentResolutionException("no " + mandatory.key() + " data available for " + type.wireName() + " newsletter");
            }
            sections.put(mandatory.key(), limit(value, query.limit()));
        }

        return new ContentData(
            serverName,
            serverUrl,
            baseUrl.isEmpty() ? "" : baseUrl + "/newsletters",
            baseUrl.isEmpty() ? "" : baseUrl + "/newsletters/unsubscribe",
            now,
            range,
            sections,
            warnings
        );
    }

    static List<ContentSection> optionalSections(ContentType type, TemplateConfig config) {
        List<ContentSection> sections = new ArrayList<>();
        switch (type) {
            case RECENTLY_ADDED -> addRecentlyAdded(sections, config);
            case WEEKLY_DIGEST -> {
                addRecentlyAdded(sections, config);
                sections.add(ContentSection.TOP_MOVIES);
                sections.add(ContentSection.TOP_SHOWS);
                sections.add(ContentSection.STATS);
            }
            case MONTHLY_STATS -> {
                sections.add(ContentSection.STATS);
                sections.add(ContentSection.TOP_MOVIES);
                sections.add(ContentSection.TOP_SHOWS);
            }
            case CUSTOM -> {
                addRecentlyAdded(sections, config);
                if (config.includeTopContent()) {
                    sections.add(ContentSection.TOP_MOVIES);
                    sections.add(ContentSection.TOP_SHOWS);
                }
                if (config.includeStats()) {
                    sections.add(ContentSection.STATS);
                }
            }
            case USER_ACTIVITY, RECOMMENDATIONS, SERVER_HEALTH -> {
                // only the mandatory section
            }
        }
        return sections;
    }

    static ContentSection mandatorySection(ContentType type) {
        return switch (type) {
            case USER_ACTIVITY -> ContentSection.USER;
            case RECOMMENDATIONS -> ContentSection.RECOMMENDATIONS;
            case SERVER_HEALTH -> ContentSection.HEALTH;
            default -> null;
        };
    }

    private static void addRecentlyAdded(List<ContentSection> sections, TemplateConfig config) {
        if (config.includeMovies()) {
            sections.add(ContentSection.NEW_MOVIES);
        }
        if (config.includeShows()) {
            sections.add(ContentSection.NEW_SHOWS);
        }
        if (config.includeMusic()) {
            sections.add(ContentSection.NEW_MUSIC);
        }
    }

    private static Object limit(Object value, int max) {
        if (value instanceof List<?> list && list.size() > max) {
            return new ArrayList<>(list.subList(0, max));
        }
        return value;
    }
}
