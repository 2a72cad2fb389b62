package com.meridian.platformapi.api;

import com.meridian.platformapi.domain.AccessRequestRepository;
import com.meridian.platformapi.domain.Asset;
import com.meridian.platformapi.domain.AssetRepository;
import com.meridian.platformapi.domain.ResourceNotFoundException;
import com.meridian.platformapi.infrastructure.web.CurrentIdentity;
import com.meridian.security.Action;
import com.meridian.security.EntityType;
import com.meridian.security.identity.Identity;
import com.meridian.security.visibility.AssetAccessLevel;
import com.meridian.security.visibility.OwnershipRules;
import com.meridian.security.visibility.RowFilter;
import com.meridian.security.visibility.RowVisibility;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Asset endpoints. Every read goes through a row-visibility filter; authenticated callers are
 * additionally checked against the access policy.
 */
@RestController
@RequestMapping("/api/v1/assets")
public class AssetController {

    private static final Logger log = LoggerFactory.getLogger(AssetController.class);

    private static final String ENTITY = "Asset";

    private final AssetRepository assets;
    private final AccessRequestRepository accessRequests;

    public AssetController(AssetRepository assets, AccessRequestRepository accessRequests) {
        this.assets = assets;
        this.accessRequests = accessRequests;
    }

    @GetMapping
    public ResponseEntity<List<Asset>> list(
            @CurrentIdentity(required = false) Identity identity,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "20") int limit) {
        Paging.validate(offset, limit);
        if (identity != null) {
            identity.enforceOrDeny(EntityType.ASSET, Action.READ);
        }
        RowFilter visible = RowVisibility.assetsVisible(identity);
        return ResponseEntity.ok()
                .header(Paging.TOTAL_COUNT_HEADER, Long.toString(assets.count(visible)))
                .body(assets.findAll(visible, offset, limit));
    }

    /** Full asset record: public assets and the caller's own. Listed-only assets read as not found. */
    @GetMapping("/{id}")
    public Asset get(@CurrentIdentity Identity identity, @PathVariable long id) {
        identity.enforceOrDeny(EntityType.ASSET, Action.READ);
        return assets.findById(id, RowVisibility.assetsReadable(identity))
                .orElseThrow(() -> new ResourceNotFoundException(ENTITY, id));
    }

    @GetMapping("/{id}/permissions")
    public AssetPermissions permissions(
            @CurrentIdentity(required = false) Identity identity, @PathVariable long id) {
        if (identity != null) {
            identity.enforceOrDeny(EntityType.ASSET, Action.READ);
        }
        Asset asset =
                assets.findById(id, RowVisibility.assetsVisible(identity))
                        .orElseThrow(() -> new ResourceNotFoundException(ENTITY, id));
        boolean approved =
                identity != null && accessRequests.approvedRequestExists(identity.username(), id);
        return new AssetPermissions(
                id,
                assets.findById(id, RowVisibility.assetsReadable(identity)).isPresent(),
                assets.findById(id, RowVisibility.assetsMutable(identity)).isPresent(),
                OwnershipRules.canDownloadAssetObject(identity, asset.username(), asset.accessLevel(), approved),
                OwnershipRules.canRunWorkflowOnAsset(identity, asset.username(), asset.accessLevel(), approved),
                OwnershipRules.canApproveAccessRequest(identity, asset.username()));
    }

    @PostMapping
    public ResponseEntity<Asset> create(
            @CurrentIdentity Identity identity, @Valid @RequestBody AssetCreateRequest request) {
        identity.enforceOrDeny(EntityType.ASSET, Action.CREATE);
        AssetAccessLevel level =
                request.accessLevel() != null ? request.accessLevel() : AssetAccessLevel.PRIVATE;
        Asset created = assets.create(request.name(), request.description(), identity.username(), level);
        log.info("Asset {} created by {}", created.id(), identity.username());
        return ResponseEntity.created(URI.create("/api/v1/assets/" + created.id())).body(created);
    }

    @PatchMapping("/{id}")
    public Asset update(
            @CurrentIdentity Identity identity,
            @PathVariable long id,
            @Valid @RequestBody AssetUpdateRequest request) {
        identity.enforceOrDeny(EntityType.ASSET, Action.UPDATE);
        Asset current =
                assets.findById(id, RowVisibility.assetsMutable(identity))
                        .orElseThrow(() -> new ResourceNotFoundException(ENTITY, id));
        return assets.update(current.withChanges(request.name(), request.description(), request.accessLevel()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@CurrentIdentity Identity identity, @PathVariable long id) {
        identity.enforceOrDeny(EntityType.ASSET, Action.DELETE);
        assets.findById(id, RowVisibility.assetsMutable(identity))
                .orElseThrow(() -> new ResourceNotFoundException(ENTITY, id));
        assets.deleteById(id);
        int dropped = accessRequests.deleteByAssetId(id);
        log.info("Asset {} deleted by {} along with {} access requests", id, identity.username(), dropped);
        return ResponseEntity.noContent().build();
    }
}
