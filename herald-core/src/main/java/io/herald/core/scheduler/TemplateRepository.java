package io.herald.core.scheduler;

import io.herald.core.model.NewsletterTemplate;
import java.io.IOException;
import java.util.Optional;

public interface TemplateRepository {

    Optional<NewsletterTemplate> findTemplate(String id) throws IOException;

    void saveTemplate(NewsletterTemplate template) throws IOException;
}
