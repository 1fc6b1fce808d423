package com.ailab.core.template;

import com.ailab.core.error.TemplateNotFoundException;

import java.util.List;

/**
 * Source of environment blueprints.
 */
public interface TemplateCatalog {

    /**
     * @throws TemplateNotFoundException if no template has this id
     */
    EnvironmentTemplate get(String templateId);

    List<EnvironmentTemplate> list();
}
