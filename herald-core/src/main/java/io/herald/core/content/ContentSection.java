package io.herald.core.content;

public enum ContentSection {
    NEW_MOVIES("new_movies", true),
    NEW_SHOWS("new_shows", true),
    NEW_MUSIC("new_music", true),
    TOP_MOVIES("top_movies", true),
    TOP_SHOWS("top_shows", true),
    STATS("stats", false),
    USER("user", false),
    RECOMMENDATIONS("recommendations", true),
    HEALTH("health", false);

    private final String key;
    private final boolean listValued;

    ContentSection(String key, boolean listValued) {
        this.key = key;
        this.listValued = listValued;
    }

    public String key() {
        return key;
    }

    public boolean listValued() {
        return listValued;
    }
}
