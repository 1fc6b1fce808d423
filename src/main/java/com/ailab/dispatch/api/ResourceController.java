package com.ailab.dispatch.api;

import com.ailab.core.allocator.Availability;
import com.ailab.core.allocator.ResourceAllocator;
import com.ailab.core.model.Caller;
import com.ailab.core.quota.QuotaEngine;
import com.ailab.core.quota.UserUsage;
import com.ailab.core.security.CallerResolver;
import com.ailab.core.template.EnvironmentTemplate;
import com.ailab.core.template.TemplateCatalog;
import com.ailab.core.telemetry.GpuTelemetry;
import com.ailab.runtime.RuntimeAdapter;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for quota usage, free capacity and the template catalog.
 */
@RestController
@RequestMapping("/api/v1/resources")
public class ResourceController {

    private final QuotaEngine quotaEngine;
    private final ResourceAllocator allocator;
    private final RuntimeAdapter runtime;
    private final GpuTelemetry gpuTelemetry;
    private final TemplateCatalog templateCatalog;
    private final CallerResolver callerResolver;

    public ResourceController(QuotaEngine quotaEngine,
                              ResourceAllocator allocator,
                              RuntimeAdapter runtime,
                              GpuTelemetry gpuTelemetry,
                              TemplateCatalog templateCatalog,
                              CallerResolver callerResolver) {
        this.quotaEngine = quotaEngine;
        this.allocator = allocator;
        this.runtime = runtime;
        this.gpuTelemetry = gpuTelemetry;
        this.templateCatalog = templateCatalog;
        this.callerResolver = callerResolver;
    }

    /**
     * GET /api/v1/resources/usage: The caller's current usage against their tier.
     */
    @GetMapping("/usage")
    public UserUsage usage(@RequestHeader(value = EnvironmentController.USER_HEADER, required = false) String userId) {
        Caller caller = callerResolver.resolve(userId);
        return quotaEngine.usage(caller.userId());
    }

    /**
     * GET /api/v1/resources/availability: Free host ports and per-GPU availability.
     */
    @GetMapping("/availability")
    public Availability availability(@RequestHeader(value = EnvironmentController.USER_HEADER, required = false) String userId) {
        callerResolver.resolve(userId);
        return allocator.availability(runtime.boundHostPorts(), gpuTelemetry.utilization());
    }

    @GetMapping("/templates")
    public List<EnvironmentTemplate> templates() {
        return templateCatalog.list();
    }
}
