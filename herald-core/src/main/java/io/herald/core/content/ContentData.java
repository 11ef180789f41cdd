package io.herald.core.content;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ContentData(
    String serverName,
    String serverUrl,
    String newsletterUrl,
    String unsubscribeUrl,
    Instant generatedAt,
    DateRange dateRange,
    Map<String, Object> sections,
    List<String> warnings
) {

    public ContentData {
        sections = sections == null ? Map.of() : Map.copyOf(sections);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public Object section(ContentSection section) {
        return sections.get(section.key());
    }

    /**
     * Flattens the data into the name space templates see.
     */
    public Map<String, Object> toModel() {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("server_name", serverName);
        model.put("server_url", serverUrl);
        model.put("newsletter_url", newsletterUrl);
        model.put("unsubscribe_url", unsubscribeUrl);
        model.put("generated_at", generatedAt == null ? "" : generatedAt.toString());
        if (dateRange != null) {
            model.put("date_range_start", dateRange.start().toString());
            model.put("date_range_end", dateRange.end().toString());
            model.put("date_range_display", dateRange.display());
        }
        model.putAll(sections);
        return model;
    }
}
