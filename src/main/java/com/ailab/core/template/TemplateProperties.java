package com.ailab.core.template;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "ailab")
public class TemplateProperties {

    private Map<String, Template> templates = new LinkedHashMap<>();

    public Map<String, Template> getTemplates() { return templates; }
    public void setTemplates(Map<String, Template> templates) { this.templates = templates; }

    public static class Template {
        private String name;
        private String image;
        private List<Integer> ports = new ArrayList<>();
        private double cpu = 4.0;
        private int memoryMb = 16384;
        private int gpus = 1;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public List<Integer> getPorts() { return ports; }
        public void setPorts(List<Integer> ports) { this.ports = ports; }
        public double getCpu() { return cpu; }
        public void setCpu(double cpu) { this.cpu = cpu; }
        public int getMemoryMb() { return memoryMb; }
        public void setMemoryMb(int memoryMb) { this.memoryMb = memoryMb; }
        public int getGpus() { return gpus; }
        public void setGpus(int gpus) { this.gpus = gpus; }
    }
}
