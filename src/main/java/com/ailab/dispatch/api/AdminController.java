package com.ailab.dispatch.api;

import com.ailab.core.lifecycle.LifecycleManager;
import com.ailab.core.model.Caller;
import com.ailab.core.reconcile.Reconciler;
import com.ailab.core.reconcile.ReconciliationReport;
import com.ailab.core.security.CallerResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for operators listed in {@code ailab.security.admins}.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final LifecycleManager lifecycleManager;
    private final Reconciler reconciler;
    private final CallerResolver callerResolver;
    private final ApiProperties apiProperties;

    public AdminController(LifecycleManager lifecycleManager,
                           Reconciler reconciler,
                           CallerResolver callerResolver,
                           ApiProperties apiProperties) {
        this.lifecycleManager = lifecycleManager;
        this.reconciler = reconciler;
        this.callerResolver = callerResolver;
        this.apiProperties = apiProperties;
    }

    /**
     * GET /api/v1/admin/environments: Every environment of every user.
     */
    @GetMapping("/environments")
    public List<EnvironmentView> listAll(@RequestHeader(value = EnvironmentController.USER_HEADER, required = false) String userId) {
        Caller caller = callerResolver.resolve(userId);
        return lifecycleManager.listAll(caller).stream()
                .map(e -> EnvironmentView.of(e, apiProperties.getPublicHost()))
                .toList();
    }

    /**
     * POST /api/v1/admin/environments/{id}/claim: Assign an adopted environment to a user.
     */
    @PostMapping("/environments/{id}/claim")
    public EnvironmentView claim(@RequestHeader(value = EnvironmentController.USER_HEADER, required = false) String userId,
                                 @PathVariable String id,
                                 @Valid @RequestBody ClaimRequest request) {
        Caller caller = callerResolver.resolve(userId);
        return EnvironmentView.of(lifecycleManager.claim(id, request.ownerId(), caller), apiProperties.getPublicHost());
    }

    /**
     * POST /api/v1/admin/reconcile: Run a reconciliation pass now and return its report.
     */
    @PostMapping("/reconcile")
    public ReconciliationReport reconcile(@RequestHeader(value = EnvironmentController.USER_HEADER, required = false) String userId) {
        lifecycleManager.requireAdmin(callerResolver.resolve(userId), "reconcile");
        return reconciler.reconcile();
    }

    public record ClaimRequest(@NotBlank String ownerId) {}
}
