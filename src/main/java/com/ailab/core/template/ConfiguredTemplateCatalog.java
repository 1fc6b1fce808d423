package com.ailab.core.template;

import com.ailab.core.error.TemplateNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Template catalog backed by {@code ailab.templates}. Falls back to the built-in lab
 * templates when nothing is configured.
 */
public class ConfiguredTemplateCatalog implements TemplateCatalog {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredTemplateCatalog.class);

    private final Map<String, EnvironmentTemplate> templates;

    public ConfiguredTemplateCatalog(TemplateProperties properties) {
        var configured = properties.getTemplates();
        if (configured == null || configured.isEmpty()) {
            this.templates = builtIn();
            log.info("No templates configured, using {} built-in templates", templates.size());
        } else {
            var byId = new LinkedHashMap<String, EnvironmentTemplate>();
            configured.forEach((id, t) -> {
                if (t.getImage() == null || t.getImage().isBlank()) {
                    throw new IllegalStateException("Template '" + id + "' has no image");
                }
                byId.put(id, new EnvironmentTemplate(id, t.getName() != null ? t.getName() : id,
                        t.getImage(), t.getPorts(), t.getCpu(), t.getMemoryMb(), t.getGpus()));
            });
            this.templates = byId;
            log.info("Loaded {} templates: {}", templates.size(), templates.keySet());
        }
    }

    public ConfiguredTemplateCatalog(List<EnvironmentTemplate> templates) {
        var byId = new LinkedHashMap<String, EnvironmentTemplate>();
        templates.forEach(t -> byId.put(t.id(), t));
        this.templates = byId;
    }

    @Override
    public EnvironmentTemplate get(String templateId) {
        EnvironmentTemplate template = templateId == null ? null : templates.get(templateId);
        if (template == null) {
            throw new TemplateNotFoundException(templateId);
        }
        return template;
    }

    @Override
    public List<EnvironmentTemplate> list() {
        return List.copyOf(templates.values());
    }

    static Map<String, EnvironmentTemplate> builtIn() {
        var byId = new LinkedHashMap<String, EnvironmentTemplate>();
        byId.put("pytorch-jupyter", new EnvironmentTemplate("pytorch-jupyter", "PyTorch + JupyterLab",
                "ai-lab-jupyter", List.of(8888), 4.0, 16384, 1));
        byId.put("tensorflow-jupyter", new EnvironmentTemplate("tensorflow-jupyter", "TensorFlow + JupyterLab",
                "ai-lab-jupyter", List.of(8888), 4.0, 16384, 1));
        byId.put("vscode", new EnvironmentTemplate("vscode", "VS Code Development",
                "ai-lab-vscode", List.of(8080), 2.0, 8192, 1));
        byId.put("multi-gpu", new EnvironmentTemplate("multi-gpu", "Multi-GPU Training",
                "ai-lab-jupyter", List.of(8888), 8.0, 32768, 4));
        return byId;
    }
}
