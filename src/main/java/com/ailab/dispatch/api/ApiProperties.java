package com.ailab.dispatch.api;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ailab.api")
public class ApiProperties {

    /** Host name users reach published environment ports on. */
    private String publicHost = "localhost";

    public String getPublicHost() { return publicHost; }
    public void setPublicHost(String publicHost) { this.publicHost = publicHost; }
}
