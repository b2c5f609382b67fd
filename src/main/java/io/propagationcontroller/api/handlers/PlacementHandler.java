package io.propagationcontroller.api.handlers;

import io.propagationcontroller.api.models.requests.BatchPlacementRequest;
import io.propagationcontroller.api.models.requests.PlacementRequest;
import io.propagationcontroller.api.models.responses.ErrorResponse;
import io.propagationcontroller.evaluation.PropagationEvaluator;
import io.propagationcontroller.models.PropagationDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static io.propagationcontroller.config.Constants.PATH_BATCH;
import static io.propagationcontroller.config.Constants.PATH_PLACEMENT;
import static io.propagationcontroller.config.Constants.PATH_RESOLVE;

/**
 * REST API handler for placement resolution.
 *
 * The request body carries the policy together with point-in-time cluster and resource
 * inventories; nothing is stored between calls.
 *
 * Supported operations:
 * - POST /_placement/resolve - Resolve one policy
 * - POST /_placement/resolve/_batch - Resolve a list of policies against the same inventories
 */
@Slf4j
@RestController
@RequestMapping(PATH_PLACEMENT)
public class PlacementHandler {

    private final PropagationEvaluator evaluator;

    public PlacementHandler(PropagationEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Resolve one policy.
     * POST /_placement/resolve
     */
    @PostMapping(PATH_RESOLVE)
    public ResponseEntity<Object> resolve(@RequestBody PlacementRequest request) {
        try {
            if (request == null || request.getPolicy() == null) {
                return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(ErrorResponse.badRequest("Request must contain a policy"));
            }
            log.info("Resolving placement for policy {}", request.getPolicy().qualifiedName());
            PropagationDecision decision = evaluator.evaluate(
                request.getPolicy(), request.getClusters(), request.getResources());
            return ResponseEntity.ok(decision);
        } catch (IllegalArgumentException e) {
            log.error("Invalid placement request: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.invalidPolicy(e.getMessage()));
        } catch (Exception e) {
            log.error("Error resolving placement: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    /**
     * Resolve a list of policies. Decisions are returned in request order.
     * POST /_placement/resolve/_batch
     */
    @PostMapping(PATH_RESOLVE + PATH_BATCH)
    public ResponseEntity<Object> resolveBatch(@RequestBody BatchPlacementRequest request) {
        try {
            if (request == null || request.getPolicies() == null || request.getPolicies().getItems() == null) {
                return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(ErrorResponse.badRequest("Request must contain a policy list"));
            }
            log.info("Resolving placement for {} policies", request.getPolicies().getItems().size());
            List<PropagationDecision> decisions = evaluator.evaluateAll(
                request.getPolicies(), request.getClusters(), request.getResources());
            return ResponseEntity.ok(decisions);
        } catch (IllegalArgumentException e) {
            log.error("Invalid batch placement request: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.invalidPolicy(e.getMessage()));
        } catch (Exception e) {
            log.error("Error resolving batch placement: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}
