package com.ailab.core.template;

import com.ailab.core.error.TemplateNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredTemplateCatalogTest {

    @Test
    void builtInTemplatesWhenNothingConfigured() {
        var catalog = new ConfiguredTemplateCatalog(new TemplateProperties());

        assertEquals(List.of("pytorch-jupyter", "tensorflow-jupyter", "vscode", "multi-gpu"),
                catalog.list().stream().map(EnvironmentTemplate::id).toList());
        assertEquals(4, catalog.get("multi-gpu").defaultGpus());
    }

    @Test
    void configuredTemplatesReplaceBuiltIns() {
        var properties = new TemplateProperties();
        var template = new TemplateProperties.Template();
        template.setImage("ghcr.io/lab/rstudio:4.4");
        template.setPorts(List.of(8787));
        template.setGpus(0);
        properties.getTemplates().put("rstudio", template);

        var catalog = new ConfiguredTemplateCatalog(properties);

        EnvironmentTemplate rstudio = catalog.get("rstudio");
        assertEquals("rstudio", rstudio.name());
        assertEquals(List.of(8787), rstudio.containerPorts());
        assertEquals(16384, rstudio.defaultMemoryMb());
        assertEquals(1, catalog.list().size());
    }

    @Test
    void templateWithoutImageIsRejected() {
        var properties = new TemplateProperties();
        properties.getTemplates().put("broken", new TemplateProperties.Template());

        assertThrows(IllegalStateException.class, () -> new ConfiguredTemplateCatalog(properties));
    }

    @Test
    void unknownTemplate() {
        var catalog = new ConfiguredTemplateCatalog(new TemplateProperties());

        assertThrows(TemplateNotFoundException.class, () -> catalog.get("does-not-exist"));
        assertThrows(TemplateNotFoundException.class, () -> catalog.get(null));
    }
}
