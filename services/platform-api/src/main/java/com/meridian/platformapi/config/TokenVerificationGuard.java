package com.meridian.platformapi.config;

import java.util.Arrays;

/** Refuses to start a production deployment with token verification disabled. */
public final class TokenVerificationGuard {

    private TokenVerificationGuard() {
        // utility class
    }

    /**
     * @throws IllegalStateException if verification is disabled while the environment or an
     *     active Spring profile is {@code production}
     */
    public static void check(boolean verificationDisabled, String environment, String... activeProfiles) {
        if (!verificationDisabled) {
            return;
        }
        boolean production =
                PlatformApiProperties.PRODUCTION.equalsIgnoreCase(environment)
                        || Arrays.stream(activeProfiles)
                                .anyMatch(PlatformApiProperties.PRODUCTION::equalsIgnoreCase);
        if (production) {
            throw new IllegalStateException(
                    "meridian.auth.disable-token-verification must not be enabled in production");
        }
    }
}
