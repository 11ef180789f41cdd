package io.herald.core.template;

import io.herald.core.content.ContentData;
import io.herald.core.model.NewsletterTemplate;

public interface TemplateRenderer {

    RenderedContent render(NewsletterTemplate template, ContentData content) throws TemplateRenderException;
}
