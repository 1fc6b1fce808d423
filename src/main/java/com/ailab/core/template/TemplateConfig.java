package com.ailab.core.template;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TemplateConfig {

    @Bean
    public TemplateCatalog templateCatalog(TemplateProperties properties) {
        return new ConfiguredTemplateCatalog(properties);
    }
}
