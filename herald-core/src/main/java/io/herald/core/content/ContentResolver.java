package io.herald.core.content;

import io.herald.core.model.ContentType;
import io.herald.core.model.TemplateConfig;
import java.time.ZoneId;

public interface ContentResolver {

    ContentData resolve(ContentType type, TemplateConfig config, String userId, ZoneId zone)
        throws ContentResolutionException;
}
