package com.meridian.platformapi.api;

import com.meridian.platformapi.domain.AccessRequest;
import com.meridian.platformapi.domain.AccessRequestRepository;
import com.meridian.platformapi.domain.Asset;
import com.meridian.platformapi.domain.AssetRepository;
import com.meridian.platformapi.domain.ResourceNotFoundException;
import com.meridian.platformapi.infrastructure.web.CurrentIdentity;
import com.meridian.security.Action;
import com.meridian.security.AuthorizationException;
import com.meridian.security.EntityType;
import com.meridian.security.identity.Identity;
import com.meridian.security.visibility.OwnershipRules;
import com.meridian.security.visibility.RowFilter;
import com.meridian.security.visibility.RowVisibility;
import jakarta.validation.Valid;
import java.net.URI;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Access requests: a caller asks the owner of an asset for permission to use it, and the owner
 * (or an admin) decides.
 */
@RestController
@RequestMapping("/api/v1/access-requests")
public class AccessRequestController {

    private static final Logger log = LoggerFactory.getLogger(AccessRequestController.class);

    private static final String ENTITY = "Access request";
    static final String APPROVE = "approve";

    private final AccessRequestRepository accessRequests;
    private final AssetRepository assets;
    private final Clock clock;

    public AccessRequestController(AccessRequestRepository accessRequests, AssetRepository assets, Clock clock) {
        this.accessRequests = accessRequests;
        this.assets = assets;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<AccessRequest> create(
            @CurrentIdentity Identity identity, @Valid @RequestBody AccessRequestCreateRequest request) {
        identity.enforceOrDeny(EntityType.ACCESS_REQUEST, Action.CREATE);
        long assetId = request.assetId();
        Asset asset =
                assets.findById(assetId, RowVisibility.assetsVisible(identity))
                        .orElseThrow(() -> new ResourceNotFoundException("Asset", assetId));
        if (identity.username().equals(asset.username())) {
            throw new IllegalArgumentException("Cannot request access to an asset you own");
        }
        AccessRequest created = accessRequests.create(assetId, identity.username(), request.description());
        log.info("Access request {} for asset {} created by {}", created.id(), assetId, identity.username());
        return ResponseEntity.created(URI.create("/api/v1/access-requests/" + created.id())).body(created);
    }

    @GetMapping
    public ResponseEntity<List<AccessRequest>> list(
            @CurrentIdentity Identity identity,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "20") int limit) {
        Paging.validate(offset, limit);
        identity.enforceOrDeny(EntityType.ACCESS_REQUEST, Action.READ);
        RowFilter visible = RowVisibility.accessRequests(identity);
        return ResponseEntity.ok()
                .header(Paging.TOTAL_COUNT_HEADER, Long.toString(accessRequests.count(visible)))
                .body(accessRequests.findAll(visible, offset, limit));
    }

    @GetMapping("/{id}")
    public AccessRequest get(@CurrentIdentity Identity identity, @PathVariable long id) {
        identity.enforceOrDeny(EntityType.ACCESS_REQUEST, Action.READ);
        return find(identity, id);
    }

    @PostMapping("/{id}/permission")
    public AccessRequest decide(
            @CurrentIdentity Identity identity,
            @PathVariable long id,
            @Valid @RequestBody PermissionDecisionRequest decision) {
        identity.enforceOrDeny(EntityType.ACCESS_REQUEST, Action.UPDATE);
        AccessRequest request = find(identity, id);
        String owner = assets.findById(request.assetId(), RowFilter.all()).map(Asset::username).orElse(null);
        if (!OwnershipRules.canApproveAccessRequest(identity, owner)) {
            throw new AuthorizationException(
                    identity.username(), EntityType.ACCESS_REQUEST.value(), APPROVE);
        }
        AccessRequest decided = request.decide(decision.allowed(), identity.username(), clock.instant());
        log.info("Access request {} {} by {}", id, decision.allowed() ? "allowed" : "refused", identity.username());
        return accessRequests.update(decided);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@CurrentIdentity Identity identity, @PathVariable long id) {
        identity.enforceOrDeny(EntityType.ACCESS_REQUEST, Action.DELETE);
        find(identity, id);
        accessRequests.deleteById(id);
        return ResponseEntity.noContent().build();
    }

    private AccessRequest find(Identity identity, long id) {
        return accessRequests.findById(id, RowVisibility.accessRequests(identity))
                .orElseThrow(() -> new ResourceNotFoundException(ENTITY, id));
    }
}
