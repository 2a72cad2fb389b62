package com.meridian.security.token;

import java.net.URI;
import java.time.Duration;

/**
 * Settings consumed by {@link TokenResolver}.
 *
 * @param openidConfigUrl      OIDC discovery endpoint used to locate the signing keys
 * @param verificationDisabled skip signature checks entirely; local development only
 * @param leeway               clock skew tolerated on {@code exp}, {@code iat} and {@code nbf}
 */
public record TokenVerificationSettings(
        URI openidConfigUrl,
        boolean verificationDisabled,
        Duration leeway
) {

    public static final Duration DEFAULT_LEEWAY = Duration.ofSeconds(30);

    public TokenVerificationSettings {
        if (openidConfigUrl == null && !verificationDisabled) {
            throw new IllegalArgumentException("openidConfigUrl is required when verification is enabled");
        }
        if (leeway == null || leeway.isNegative()) {
            leeway = DEFAULT_LEEWAY;
        }
    }

    /** Verification enabled against the given discovery endpoint with the default leeway. */
    public static TokenVerificationSettings verifying(URI openidConfigUrl) {
        return new TokenVerificationSettings(openidConfigUrl, false, DEFAULT_LEEWAY);
    }

    /** Verification disabled. */
    public static TokenVerificationSettings unverified() {
        return new TokenVerificationSettings(null, true, DEFAULT_LEEWAY);
    }
}
