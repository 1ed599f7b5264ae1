package com.channelcast.gateway.content;

import com.channelcast.gateway.job.JobPayload;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PayloadContentResolverTest {

    @Test
    void resolve_static_returnsText() throws Exception {
        PayloadContentResolver resolver = new PayloadContentResolver(null, null, null);

        assertEquals("hello", resolver.resolve(new JobPayload.StaticContent("hello")));
    }

    @Test
    void resolve_generated_passesTuningToGenerator() throws Exception {
        List<String> seen = new ArrayList<>();
        TextGenerator generator = (prompt, maxTokens, temperature) -> {
            seen.add(prompt + "|" + maxTokens + "|" + temperature);
            return "generated";
        };
        PayloadContentResolver resolver = new PayloadContentResolver(generator, null, null);

        assertEquals("generated", resolver.resolve(new JobPayload.GeneratedContent("tip", null, null)));
        assertEquals(List.of("tip|220|0.8"), seen);
    }

    @Test
    void resolve_generatedWithoutGenerator_fails() {
        PayloadContentResolver resolver = new PayloadContentResolver(null, null, null);

        assertThrows(ContentResolutionException.class,
                () -> resolver.resolve(new JobPayload.GeneratedContent("tip", 100, 0.5)));
    }

    @Test
    void resolve_market_delegatesByKind() throws Exception {
        MarketContentSource source = kind -> kind == JobPayload.MarketKind.WHALE ? "" : "report " + kind;
        PayloadContentResolver resolver = new PayloadContentResolver(null, source, null);

        assertEquals("report TRENDING", resolver.resolve(new JobPayload.MarketDerived(JobPayload.MarketKind.TRENDING)));
        assertEquals("", resolver.resolve(new JobPayload.MarketDerived(JobPayload.MarketKind.WHALE)));
    }

    @Test
    void resolve_marketWithoutSource_fails() {
        PayloadContentResolver resolver = new PayloadContentResolver(null, null, null);

        assertThrows(ContentResolutionException.class,
                () -> resolver.resolve(new JobPayload.MarketDerived(JobPayload.MarketKind.DIGEST)));
    }

    @Test
    void resolve_rotation_advancesPerCall() throws Exception {
        TemplateCatalog catalog = new TemplateCatalog(Map.of("set", List.of("a", "b")));
        PayloadContentResolver resolver = new PayloadContentResolver(null, null, catalog);
        JobPayload payload = new JobPayload.TemplateRotation("set");

        assertEquals("a", resolver.resolve(payload));
        assertEquals("b", resolver.resolve(payload));
        assertEquals("a", resolver.resolve(payload));
    }

    @Test
    void resolve_nullPayload_fails() {
        assertThrows(ContentResolutionException.class,
                () -> new PayloadContentResolver(null, null, null).resolve(null));
    }
}
