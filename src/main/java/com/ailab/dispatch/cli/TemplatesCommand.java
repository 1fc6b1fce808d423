package com.ailab.dispatch.cli;

import com.ailab.core.template.EnvironmentTemplate;
import com.ailab.core.template.TemplateCatalog;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: ailab templates
 */
@Command(name = "templates", mixinStandardHelpOptions = true, description = "List environment templates")
@Component
public class TemplatesCommand implements Runnable {

    private final TemplateCatalog templateCatalog;

    public TemplatesCommand(TemplateCatalog templateCatalog) {
        this.templateCatalog = templateCatalog;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<EnvironmentTemplate> templates = templateCatalog.list();
        ConsoleOutput.info("Templates (" + templates.size() + "):");
        System.out.println();
        System.out.printf("  %-20s %-26s %-16s %-8s %-6s %-8s %s%n",
                "ID", "NAME", "IMAGE", "PORTS", "CPU", "MEMORY", "GPUS");
        System.out.println("  " + "-".repeat(94));
        for (EnvironmentTemplate t : templates) {
            System.out.printf("  %-20s %-26s %-16s %-8s %-6s %-8s %d%n",
                    t.id(), t.name(), t.image(), t.containerPorts(),
                    t.defaultCpu(), t.defaultMemoryMb() + "MB", t.defaultGpus());
        }
    }
}
