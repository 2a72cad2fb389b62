package com.meridian.platformapi.api;

import com.meridian.platformapi.infrastructure.web.CurrentIdentity;
import com.meridian.security.identity.Identity;
import com.meridian.security.identity.IdentitySummary;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probe that also reports who the caller is, if anyone.
 *
 * <p>{@code /ping} answers anonymous callers; {@code /ping/auth} requires a valid token.
 */
@RestController
@RequestMapping("/api/v1/ping")
public class PingController {

    @GetMapping
    public PingResponse ping(@CurrentIdentity(required = false) Identity identity) {
        return new PingResponse("ok", identity != null ? identity.summary() : null);
    }

    @GetMapping("/auth")
    public PingResponse pingAuthenticated(@CurrentIdentity Identity identity) {
        return new PingResponse("ok", identity.summary());
    }

    public record PingResponse(String status, IdentitySummary identity) {
    }
}
