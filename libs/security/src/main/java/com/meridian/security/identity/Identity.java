package com.meridian.security.identity;

import com.meridian.observability.SensitiveDataRedactor;
import com.meridian.security.Action;
import com.meridian.security.AuthorizationException;
import com.meridian.security.EntityType;
import com.meridian.security.policy.PolicyEvaluator;
import com.meridian.security.token.Claims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The authenticated caller of one request: its token claims plus a private
 * {@link PolicyEvaluator} in which the token's roles are granted to the username.
 * <p>
 * Instances are built by {@link IdentityFactory} and are confined to the request thread.
 */
public final class Identity {

    private static final Logger log = LoggerFactory.getLogger(Identity.class);
    private static final SensitiveDataRedactor REDACTOR = new SensitiveDataRedactor();

    private final Claims claims;
    private final PolicyEvaluator evaluator;
    private final AccessRoles accessRoles;
    private final boolean admin;

    Identity(Claims claims, PolicyEvaluator evaluator, AccessRoles accessRoles) {
        this.claims = claims;
        this.evaluator = evaluator;
        this.accessRoles = accessRoles;
        this.admin = evaluator.hasRole(claims.username(), accessRoles.admin().qualified());
    }

    public String username() {
        return claims.username();
    }

    public Claims claims() {
        return claims;
    }

    /** Whether the caller holds the admin role, directly or through the role hierarchy. */
    public boolean isAdmin() {
        return admin;
    }

    /** Whether the caller may use the API at all: admins, and holders of the basic-access role. */
    public boolean isEnabled() {
        return admin || evaluator.hasRole(username(), accessRoles.basicAccess().qualified());
    }

    /** All roles held by the caller after hierarchy expansion, sorted. */
    public List<String> roles() {
        List<String> roles = new ArrayList<>(evaluator.implicitRoles(username()));
        Collections.sort(roles);
        return Collections.unmodifiableList(roles);
    }

    /**
     * Policy decision for this caller, without admin bypass.
     */
    public boolean isAllowed(String object, String action) {
        boolean allowed = evaluator.enforce(username(), object, action);
        log.debug("Enforce sub='{}' obj='{}' act='{}' -> {}", username(), object, action, allowed);
        return allowed;
    }

    public boolean isAllowed(EntityType object, Action action) {
        return isAllowed(object.value(), action.value());
    }

    /**
     * Throws unless the policy allows the pair. Admins always pass.
     *
     * @throws AuthorizationException if denied
     */
    public void enforceOrDeny(EntityType object, Action action) {
        enforceOrDeny(object.value(), action.value(), true);
    }

    public void enforceOrDeny(EntityType object, Action action, boolean adminBypass) {
        enforceOrDeny(object.value(), action.value(), adminBypass);
    }

    /**
     * Throws unless the policy allows the pair.
     *
     * @param adminBypass when true, admins pass without consulting the rules
     * @throws AuthorizationException if denied
     */
    public void enforceOrDeny(String object, String action, boolean adminBypass) {
        if (adminBypass && admin) {
            log.debug("Admin '{}' is allowed to '{}' on '{}'", username(), action, object);
            return;
        }
        if (!isAllowed(object, action)) {
            throw new AuthorizationException(username(), object, action);
        }
    }

    /**
     * Picks {@code adminValue} for admins and {@code value} for everyone else. Handy for
     * filters that admins should not get.
     */
    public <T> T applyAdminBypass(T value, T adminValue) {
        return admin ? adminValue : value;
    }

    /**
     * The owner to restrict queries to: empty for admins, the username otherwise.
     */
    public Optional<String> ownerFilter() {
        return admin ? Optional.empty() : Optional.of(username());
    }

    public IdentitySummary summary() {
        return new IdentitySummary(username(), admin, isEnabled(), roles(), REDACTOR.redact(claims.raw()));
    }

    @Override
    public String toString() {
        return "Identity[username=" + username() + ", admin=" + admin + "]";
    }
}
