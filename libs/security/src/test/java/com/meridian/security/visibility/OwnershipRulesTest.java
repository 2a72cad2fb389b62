package com.meridian.security.visibility;

import com.meridian.security.identity.Identity;
import com.meridian.security.identity.IdentityFactory;
import com.meridian.security.policy.PolicyModel;
import com.meridian.security.policy.RoleGrant;
import com.meridian.security.testing.TestTokens;
import com.meridian.security.token.Claims;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OwnershipRules")
class OwnershipRulesTest {

    private final IdentityFactory factory = new IdentityFactory(
            null, PolicyModel.of(List.of(), List.<RoleGrant>of()), TestTokens.ACCESS_ROLES);

    private final Identity alice = identity("alice", "api_basic_access");
    private final Identity bob = identity("bob", "api_basic_access");
    private final Identity admin = identity("root", "api_admin");

    private Identity identity(String username, String clientRole) {
        return factory.fromClaims(Claims.from(Map.of(
                Claims.PREFERRED_USERNAME, username,
                Claims.RESOURCE_ACCESS, Map.of(TestTokens.CLIENT_ID, Map.of(Claims.ROLES, List.of(clientRole))))));
    }

    @Test
    @DisplayName("access requests are approved by the asset owner or an admin")
    void approve() {
        assertThat(OwnershipRules.canApproveAccessRequest(alice, "alice")).isTrue();
        assertThat(OwnershipRules.canApproveAccessRequest(admin, "alice")).isTrue();
        assertThat(OwnershipRules.canApproveAccessRequest(bob, "alice")).isFalse();
        assertThat(OwnershipRules.canApproveAccessRequest(bob, null)).isFalse();
        assertThat(OwnershipRules.canApproveAccessRequest(null, "alice")).isFalse();
    }

    @Test
    @DisplayName("workflows run on own, public, or approved assets")
    void runWorkflow() {
        assertThat(OwnershipRules.canRunWorkflowOnAsset(bob, "alice", AssetAccessLevel.PRIVATE, false)).isFalse();
        assertThat(OwnershipRules.canRunWorkflowOnAsset(bob, "alice", AssetAccessLevel.PRIVATE, true)).isTrue();
        assertThat(OwnershipRules.canRunWorkflowOnAsset(bob, "alice", AssetAccessLevel.PUBLIC, false)).isTrue();
        assertThat(OwnershipRules.canRunWorkflowOnAsset(alice, "alice", AssetAccessLevel.PRIVATE, false)).isTrue();
        assertThat(OwnershipRules.canRunWorkflowOnAsset(admin, "alice", AssetAccessLevel.PRIVATE, false)).isTrue();
    }

    @Test
    @DisplayName("public objects are downloadable anonymously, others need ownership or approval")
    void download() {
        assertThat(OwnershipRules.canDownloadAssetObject(null, "alice", AssetAccessLevel.PUBLIC, false)).isTrue();
        assertThat(OwnershipRules.canDownloadAssetObject(null, "alice", AssetAccessLevel.VISIBLE, false)).isFalse();
        assertThat(OwnershipRules.canDownloadAssetObject(bob, "alice", AssetAccessLevel.VISIBLE, false)).isFalse();
        assertThat(OwnershipRules.canDownloadAssetObject(bob, "alice", AssetAccessLevel.VISIBLE, true)).isTrue();
    }

    @Test
    @DisplayName("access levels parse case-insensitively")
    void parseLevel() {
        assertThat(AssetAccessLevel.fromValue("Visible")).isEqualTo(AssetAccessLevel.VISIBLE);
    }
}
