package io.herald.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TemplateConfig(
    int timeFrame,
    TimeFrameUnit timeFrameUnit,
    boolean includeMovies,
    boolean includeShows,
    boolean includeMusic,
    boolean includeStats,
    boolean includeTopContent,
    int maxItems,
    boolean personalizeForUser
) {

    public TemplateConfig {
        timeFrameUnit = timeFrameUnit == null ? TimeFrameUnit.DAYS : timeFrameUnit;
    }

    public static TemplateConfig defaults() {
        return new TemplateConfig(7, TimeFrameUnit.DAYS, true, true, true, true, true, 10, false);
    }

    public int effectiveMaxItems() {
        return maxItems > 0 ? maxItems : 10;
    }
}
