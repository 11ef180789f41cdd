package io.herald.core.content;

import java.time.Instant;

public record ContentQuery(Instant rangeStart, Instant rangeEnd, int limit, String userId) {
}
