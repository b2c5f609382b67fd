package io.propagationcontroller.api.handlers;

import io.propagationcontroller.api.models.requests.BatchPlacementRequest;
import io.propagationcontroller.api.models.requests.PlacementRequest;
import io.propagationcontroller.api.models.responses.ErrorResponse;
import io.propagationcontroller.evaluation.PropagationEvaluator;
import io.propagationcontroller.models.PlacementResult;
import io.propagationcontroller.models.PolicyMetadata;
import io.propagationcontroller.models.PropagationDecision;
import io.propagationcontroller.models.PropagationPolicy;
import io.propagationcontroller.models.PropagationPolicyList;
import io.propagationcontroller.models.PropagationSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PlacementHandlerTest {

    @Mock
    private PropagationEvaluator evaluator;

    @InjectMocks
    private PlacementHandler placementHandler;

    private final PropagationPolicy policy = PropagationPolicy.builder()
        .metadata(PolicyMetadata.builder().name("nginx-propagation").namespace("default").build())
        .spec(new PropagationSpec())
        .build();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testResolve_Success() {
        // Given
        PropagationDecision decision = PropagationDecision.builder()
            .policyName("nginx-propagation")
            .scheduled(true)
            .matchedResources(List.of())
            .placement(PlacementResult.empty())
            .build();
        PlacementRequest request = PlacementRequest.builder().policy(policy).clusters(List.of()).build();
        when(evaluator.evaluate(policy, List.of(), null)).thenReturn(decision);

        // When
        ResponseEntity<Object> response = placementHandler.resolve(request);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isSameAs(decision);
    }

    @Test
    void testResolve_MissingPolicy_ReturnsBadRequest() {
        // When
        ResponseEntity<Object> response = placementHandler.resolve(new PlacementRequest());

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        ErrorResponse error = (ErrorResponse) response.getBody();
        assertThat(error.getError()).isEqualTo("bad_request");
        verifyNoInteractions(evaluator);
    }

    @Test
    void testResolve_InvalidPolicy_ReturnsBadRequest() {
        // Given
        when(evaluator.evaluate(any(), any(), any())).thenThrow(new IllegalArgumentException("spec is required"));

        // When
        ResponseEntity<Object> response = placementHandler.resolve(PlacementRequest.builder().policy(policy).build());

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        ErrorResponse error = (ErrorResponse) response.getBody();
        assertThat(error.getError()).isEqualTo("invalid_policy_exception");
        assertThat(error.getReason()).isEqualTo("spec is required");
    }

    @Test
    void testResolve_UnexpectedFailure_ReturnsInternalError() {
        // Given
        when(evaluator.evaluate(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        // When
        ResponseEntity<Object> response = placementHandler.resolve(PlacementRequest.builder().policy(policy).build());

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(((ErrorResponse) response.getBody()).getStatus()).isEqualTo(500);
    }

    @Test
    void testResolveBatch_Success() {
        // Given
        PropagationPolicyList policies = PropagationPolicyList.builder().items(List.of(policy)).build();
        List<PropagationDecision> decisions = List.of(PropagationDecision.builder().policyName("nginx-propagation").build());
        when(evaluator.evaluateAll(policies, null, null)).thenReturn(decisions);

        // When
        ResponseEntity<Object> response = placementHandler.resolveBatch(
            BatchPlacementRequest.builder().policies(policies).build());

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(decisions);
    }

    @Test
    void testResolveBatch_MissingPolicies_ReturnsBadRequest() {
        ResponseEntity<Object> response = placementHandler.resolveBatch(new BatchPlacementRequest());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verifyNoInteractions(evaluator);
    }
}
