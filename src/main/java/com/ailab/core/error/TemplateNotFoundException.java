package com.ailab.core.error;

public class TemplateNotFoundException extends EnvironmentException {

    public TemplateNotFoundException(String templateId) {
        super(ErrorCode.TEMPLATE_NOT_FOUND, null, "Unknown environment template: " + templateId);
    }
}
