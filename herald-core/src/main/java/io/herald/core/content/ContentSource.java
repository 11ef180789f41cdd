package io.herald.core.content;

import java.io.IOException;

/**
 * Supplies the raw data behind one newsletter section. List sections return a {@code List}, the others a
 * {@code Map}; both must be made of plain JSON-like values.
 */
public interface ContentSource {

    Object fetch(ContentSection section, ContentQuery query) throws IOException;
}
