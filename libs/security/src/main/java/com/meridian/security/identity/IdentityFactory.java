package com.meridian.security.identity;

import com.meridian.security.AccessDisabledException;
import com.meridian.security.AuthenticationException;
import com.meridian.security.policy.PolicyEvaluator;
import com.meridian.security.policy.PolicyModel;
import com.meridian.security.token.Claims;
import com.meridian.security.token.RoleName;
import com.meridian.security.token.TokenResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Builds an {@link Identity} from an Authorization header.
 * <p>
 * Each call resolves the token, creates a fresh {@link PolicyEvaluator} over the shared
 * {@link PolicyModel}, grants every role from the token to the username in that evaluator,
 * and rejects callers that are neither admins nor basic-access holders.
 */
public class IdentityFactory {

    private static final Logger log = LoggerFactory.getLogger(IdentityFactory.class);

    private final TokenResolver tokenResolver;
    private final PolicyModel policyModel;
    private final AccessRoles accessRoles;

    public IdentityFactory(TokenResolver tokenResolver, PolicyModel policyModel, AccessRoles accessRoles) {
        this.tokenResolver = tokenResolver;
        this.policyModel = policyModel;
        this.accessRoles = accessRoles;
    }

    /**
     * Builds the identity for a request that must be authenticated.
     *
     * @throws AuthenticationException  if the token is missing or rejected
     * @throws AccessDisabledException  if the caller lacks both access roles
     */
    public Identity require(String authorizationHeader) {
        return fromClaims(tokenResolver.resolve(authorizationHeader));
    }

    /**
     * Builds the identity for a request where authentication is optional. Any failure,
     * including a missing header, yields empty.
     */
    public Optional<Identity> optional(String authorizationHeader) {
        try {
            return Optional.of(require(authorizationHeader));
        } catch (AuthenticationException e) {
            log.debug("Continuing anonymously: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Builds the identity for already-resolved claims.
     *
     * @throws AccessDisabledException if the caller lacks both access roles
     */
    public Identity fromClaims(Claims claims) {
        PolicyEvaluator evaluator = new PolicyEvaluator(policyModel);
        for (RoleName role : claims.effectiveRoles()) {
            evaluator.addRoleForSubject(claims.username(), role.qualified());
        }

        Identity identity = new Identity(claims, evaluator, accessRoles);
        if (log.isDebugEnabled()) {
            log.debug("Effective policy for user '{}':\n{}", claims.username(), evaluator.describe());
        }
        if (!identity.isEnabled()) {
            throw new AccessDisabledException(claims.username());
        }
        return identity;
    }

    public AccessRoles accessRoles() {
        return accessRoles;
    }
}
