package com.optionengine.api.controller;

import com.optionengine.session.SessionLifecycle;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session operations.
 *
 * <ul>
 *   <li>POST /api/session/close-all -- exits every tracked position at market</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/session")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionLifecycle sessionLifecycle;

    public SessionController(SessionLifecycle sessionLifecycle) {
        this.sessionLifecycle = sessionLifecycle;
    }

    @PostMapping("/close-all")
    public ResponseEntity<Map<String, Object>> closeAll() {
        log.warn("Close-all requested via API");
        int closed = sessionLifecycle.closeAll();
        return ResponseEntity.ok(Map.of("closed", closed));
    }
}
