package com.channelcast.gateway.content;

import com.channelcast.gateway.job.JobPayload;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves each payload variant through its backend.
 * <p>
 * Backends are optional; a payload whose backend is not configured fails
 * resolution instead of publishing nothing.
 */
@Slf4j
public class PayloadContentResolver implements ContentResolver {

    private final TextGenerator textGenerator;
    private final MarketContentSource marketSource;
    private final TemplateCatalog templates;

    public PayloadContentResolver(TextGenerator textGenerator, MarketContentSource marketSource,
            TemplateCatalog templates) {
        this.textGenerator = textGenerator;
        this.marketSource = marketSource;
        this.templates = templates != null ? templates : TemplateCatalog.empty();
    }

    @Override
    public String resolve(JobPayload payload) throws ContentResolutionException {
        if (payload == null) {
            throw new ContentResolutionException("Job has no payload");
        }
        if (payload instanceof JobPayload.StaticContent s) {
            return s.text();
        }
        if (payload instanceof JobPayload.GeneratedContent g) {
            if (textGenerator == null) {
                throw new ContentResolutionException("No text generator configured");
            }
            log.debug("Generating content (maxTokens={}, temperature={})", g.maxTokens(), g.temperature());
            return textGenerator.generate(g.prompt(), g.maxTokens(), g.temperature());
        }
        if (payload instanceof JobPayload.MarketDerived m) {
            if (marketSource == null) {
                throw new ContentResolutionException("No market content source configured");
            }
            if (m.market() == null) {
                throw new ContentResolutionException("Market payload has no market kind");
            }
            return marketSource.render(m.market());
        }
        if (payload instanceof JobPayload.TemplateRotation r) {
            return templates.next(r.templateSet());
        }
        throw new ContentResolutionException("Unsupported payload: " + payload.getClass().getSimpleName());
    }
}
