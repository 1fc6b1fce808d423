package com.ailab.dispatch.api;

import com.ailab.core.lifecycle.CreateEnvironmentRequest;
import com.ailab.core.lifecycle.LifecycleManager;
import com.ailab.core.model.Caller;
import com.ailab.core.model.Environment;
import com.ailab.core.security.CallerResolver;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for a user's own environments. The caller is the user id the
 * authenticating reverse proxy puts in {@value #USER_HEADER}.
 */
@RestController
@RequestMapping("/api/v1/environments")
public class EnvironmentController {

    static final String USER_HEADER = "X-User-Id";

    private static final Logger log = LoggerFactory.getLogger(EnvironmentController.class);

    private final LifecycleManager lifecycleManager;
    private final CallerResolver callerResolver;
    private final ApiProperties apiProperties;

    public EnvironmentController(LifecycleManager lifecycleManager,
                                 CallerResolver callerResolver,
                                 ApiProperties apiProperties) {
        this.lifecycleManager = lifecycleManager;
        this.callerResolver = callerResolver;
        this.apiProperties = apiProperties;
    }

    /**
     * POST /api/v1/environments: Create and start an environment. Returns once it is running.
     */
    @PostMapping
    public ResponseEntity<EnvironmentView> create(@RequestHeader(value = USER_HEADER, required = false) String userId,
                                                  @Valid @RequestBody CreateEnvironmentRequest request) {
        Caller caller = callerResolver.resolve(userId);
        log.info("Create request from {} for template {}", caller.userId(), request.templateId());
        Environment env = lifecycleManager.create(caller.userId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(view(env));
    }

    /**
     * GET /api/v1/environments: The caller's environments only.
     */
    @GetMapping
    public List<EnvironmentView> list(@RequestHeader(value = USER_HEADER, required = false) String userId) {
        Caller caller = callerResolver.resolve(userId);
        return lifecycleManager.listForUser(caller.userId()).stream().map(this::view).toList();
    }

    @GetMapping("/{id}")
    public EnvironmentView get(@RequestHeader(value = USER_HEADER, required = false) String userId,
                               @PathVariable String id) {
        return view(lifecycleManager.get(id, callerResolver.resolve(userId)));
    }

    @PostMapping("/{id}/stop")
    public EnvironmentView stop(@RequestHeader(value = USER_HEADER, required = false) String userId,
                                @PathVariable String id) {
        return view(lifecycleManager.stop(id, callerResolver.resolve(userId)));
    }

    @PostMapping("/{id}/start")
    public EnvironmentView start(@RequestHeader(value = USER_HEADER, required = false) String userId,
                                 @PathVariable String id) {
        return view(lifecycleManager.start(id, callerResolver.resolve(userId)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> destroy(@RequestHeader(value = USER_HEADER, required = false) String userId,
                                        @PathVariable String id) {
        lifecycleManager.destroy(id, callerResolver.resolve(userId));
        return ResponseEntity.noContent().build();
    }

    private EnvironmentView view(Environment env) {
        return EnvironmentView.of(env, apiProperties.getPublicHost());
    }
}
