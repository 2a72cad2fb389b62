package com.meridian.security.token;

import com.meridian.security.AuthenticationException;
import com.meridian.security.BearerTokenExtractor;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.factories.DefaultJWSVerifierFactory;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWT;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import com.nimbusds.jwt.PlainJWT;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.Key;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Turns a bearer token into {@link Claims}.
 * <p>
 * With verification enabled the token must be a JWS whose {@code kid} is published in
 * the JWK set behind the configured discovery URL; the signature, {@code exp} and
 * {@code iat} (both required) and {@code nbf} (if present) are checked. Audience is never
 * checked. With verification disabled the payload is trusted as is, except that a
 * present and elapsed {@code exp} still rejects the token.
 * <p>
 * Every failure is reported as {@link AuthenticationException}; key fetch failures as its
 * subclass {@link com.meridian.security.UpstreamUnavailableException}.
 */
public class TokenResolver {

    private static final Logger log = LoggerFactory.getLogger(TokenResolver.class);

    private final TokenVerificationSettings settings;
    private final JwkSetSource keys;
    private final Clock clock;
    private final DefaultJWSVerifierFactory verifierFactory = new DefaultJWSVerifierFactory();

    public TokenResolver(TokenVerificationSettings settings, JwkSetSource keys) {
        this(settings, keys, Clock.systemUTC());
    }

    public TokenResolver(TokenVerificationSettings settings, JwkSetSource keys, Clock clock) {
        if (!settings.verificationDisabled() && keys == null) {
            throw new IllegalArgumentException("keys must not be null when verification is enabled");
        }
        this.settings = settings;
        this.keys = keys;
        this.clock = clock;
        if (settings.verificationDisabled()) {
            log.warn("Token signature verification is DISABLED; bearer tokens are trusted without checks");
        }
    }

    /**
     * Resolves the claims of the token carried by an Authorization header value.
     *
     * @param authorizationHeader raw header value, may be null
     * @throws AuthenticationException if the header is absent or the token is rejected
     */
    public Claims resolve(String authorizationHeader) {
        String token = BearerTokenExtractor.extract(authorizationHeader)
                .orElseThrow(() -> new AuthenticationException("Missing or malformed Authorization header"));
        return decode(token);
    }

    /**
     * Decodes (and, unless disabled, verifies) a raw compact-serialized token.
     *
     * @throws AuthenticationException if the token is rejected
     */
    public Claims decode(String token) {
        JWT jwt;
        try {
            jwt = JWTParser.parse(token);
        } catch (ParseException e) {
            throw new AuthenticationException("Malformed token: " + e.getMessage(), e);
        }

        JWTClaimsSet claims = settings.verificationDisabled() ? unverified(jwt) : verified(jwt);
        return Claims.from(claims.toJSONObject());
    }

    private JWTClaimsSet unverified(JWT jwt) {
        log.debug("Decoding token without verification");
        if (!(jwt instanceof SignedJWT) && !(jwt instanceof PlainJWT)) {
            throw new AuthenticationException("Encrypted tokens are not supported");
        }
        JWTClaimsSet claims = claimsOf(jwt);
        Date exp = claims.getExpirationTime();
        if (exp != null && exp.toInstant().plus(settings.leeway()).isBefore(clock.instant())) {
            throw new AuthenticationException("Token has expired");
        }
        return claims;
    }

    private JWTClaimsSet verified(JWT jwt) {
        if (!(jwt instanceof SignedJWT signed)) {
            throw new AuthenticationException("Token is not signed");
        }

        JWSHeader header = signed.getHeader();
        String kid = header.getKeyID();
        if (kid == null || kid.isBlank()) {
            throw new AuthenticationException("Token header has no key id");
        }

        JWK jwk = findKey(kid);
        try {
            if (!signed.verify(verifierFor(header, jwk))) {
                throw new AuthenticationException("Invalid token signature");
            }
        } catch (JOSEException e) {
            throw new AuthenticationException("Unable to verify token signature: " + e.getMessage(), e);
        }

        JWTClaimsSet claims = claimsOf(signed);
        checkTimestamps(claims);
        return claims;
    }

    private JWK findKey(String kid) {
        JWK jwk = keys.get(settings.openidConfigUrl()).getKeyByKeyId(kid);
        if (jwk == null && keys.refresh(settings.openidConfigUrl())) {
            log.debug("No signing key '{}' in cached JWK set, re-fetching", kid);
            jwk = keys.get(settings.openidConfigUrl()).getKeyByKeyId(kid);
        }
        if (jwk == null) {
            throw new AuthenticationException("No signing key matches key id '%s'".formatted(kid));
        }
        return jwk;
    }

    private JWSVerifier verifierFor(JWSHeader header, JWK jwk) throws JOSEException {
        if (jwk.getKeyUse() != null && !KeyUse.SIGNATURE.equals(jwk.getKeyUse())) {
            throw new AuthenticationException("Key '%s' is not a signing key".formatted(jwk.getKeyID()));
        }
        if (jwk.getAlgorithm() != null && !jwk.getAlgorithm().getName().equals(header.getAlgorithm().getName())) {
            throw new AuthenticationException("Token algorithm %s does not match key '%s'"
                    .formatted(header.getAlgorithm(), jwk.getKeyID()));
        }

        Key key;
        if (jwk instanceof RSAKey rsa) {
            key = rsa.toRSAPublicKey();
        } else if (jwk instanceof ECKey ec) {
            key = ec.toECPublicKey();
        } else {
            throw new AuthenticationException("Unsupported key type " + jwk.getKeyType());
        }
        return verifierFactory.createJWSVerifier(header, key);
    }

    private void checkTimestamps(JWTClaimsSet claims) {
        Instant now = clock.instant();
        Date exp = claims.getExpirationTime();
        Date iat = claims.getIssueTime();
        Date nbf = claims.getNotBeforeTime();

        if (exp == null) {
            throw new AuthenticationException("Token has no 'exp' claim");
        }
        if (iat == null) {
            throw new AuthenticationException("Token has no 'iat' claim");
        }
        if (exp.toInstant().plus(settings.leeway()).isBefore(now)) {
            throw new AuthenticationException("Token has expired");
        }
        if (now.plus(settings.leeway()).isBefore(iat.toInstant())) {
            throw new AuthenticationException("Token was issued in the future");
        }
        if (nbf != null && now.plus(settings.leeway()).isBefore(nbf.toInstant())) {
            throw new AuthenticationException("Token is not yet valid");
        }
    }

    private static JWTClaimsSet claimsOf(JWT jwt) {
        try {
            JWTClaimsSet claims = jwt.getJWTClaimsSet();
            if (claims == null) {
                throw new AuthenticationException("Token has no claims");
            }
            return claims;
        } catch (ParseException e) {
            throw new AuthenticationException("Malformed token claims: " + e.getMessage(), e);
        }
    }
}
