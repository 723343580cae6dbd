package com.stockdesk.catalogsync.infrastructure.web;

import com.stockdesk.catalogsync.application.ReadCachedCatalog;
import com.stockdesk.catalogsync.application.SyncCatalog;
import com.stockdesk.catalogsync.domain.exception.SyncAlreadyRunningException;
import com.stockdesk.catalogsync.domain.exception.UnknownScopeException;
import com.stockdesk.catalogsync.infrastructure.web.dto.CatalogItemsResponse;
import com.stockdesk.catalogsync.infrastructure.web.dto.SyncCancelResponse;
import com.stockdesk.catalogsync.infrastructure.web.dto.SyncCommandResponse;
import com.stockdesk.catalogsync.infrastructure.web.dto.SyncProgressResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/catalog/{scope}")
public class CatalogSyncController {

    private static final Logger logger = LoggerFactory.getLogger(CatalogSyncController.class);

    private final SyncCatalog syncCatalog;
    private final ReadCachedCatalog readCachedCatalog;

    public CatalogSyncController(SyncCatalog syncCatalog, ReadCachedCatalog readCachedCatalog) {
        this.syncCatalog = syncCatalog;
        this.readCachedCatalog = readCachedCatalog;
    }

    @PostMapping("/sync")
    public ResponseEntity<SyncCommandResponse> startSync(
            @PathVariable("scope") String scope,
            @RequestParam(value = "forceRefresh", defaultValue = "true") boolean forceRefresh) {
        logger.info("Sync requested for scope {} (forceRefresh={})", scope, forceRefresh);

        try {
            syncCatalog.startSync(scope, forceRefresh);
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(new SyncCommandResponse("processing", "Sync started"));

        } catch (SyncAlreadyRunningException e) {
            logger.warn("Sync already running for scope {}", scope);
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(new SyncCommandResponse("processing", e.getMessage()));

        } catch (UnknownScopeException e) {
            logger.warn("Sync requested for unknown scope {}", scope);
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new SyncCommandResponse("error", e.getMessage()));

        } catch (Exception e) {
            logger.error("Error starting sync for scope {}", scope, e);
            return ResponseEntity.internalServerError()
                    .body(new SyncCommandResponse("error", "Failed to start sync"));
        }
    }

    @GetMapping("/sync/progress")
    public ResponseEntity<SyncProgressResponse> getProgress(@PathVariable("scope") String scope) {
        return ResponseEntity.ok(SyncProgressResponse.fromJob(syncCatalog.getSyncProgress(scope)));
    }

    @DeleteMapping("/sync")
    public ResponseEntity<SyncCancelResponse> cancelSync(@PathVariable("scope") String scope) {
        boolean cancelled = syncCatalog.cancelSync(scope);
        logger.info("Cancel requested for scope {}: {}", scope, cancelled ? "signalled" : "nothing running");
        return ResponseEntity.ok(new SyncCancelResponse(cancelled));
    }

    @GetMapping("/items")
    public ResponseEntity<CatalogItemsResponse> getItems(
            @PathVariable("scope") String scope,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        try {
            var snapshot = readCachedCatalog.readCached(scope, limit != null ? limit : 0);
            logger.debug("Returning {} items for scope {}", snapshot.count(), scope);
            return ResponseEntity.ok(CatalogItemsResponse.fromSnapshot(snapshot));

        } catch (UnknownScopeException e) {
            logger.warn("Items requested for unknown scope {}", scope);
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(CatalogItemsResponse.empty());

        } catch (Exception e) {
            logger.error("Error reading items for scope {}", scope, e);
            return ResponseEntity.internalServerError()
                    .body(CatalogItemsResponse.empty());
        }
    }
}
