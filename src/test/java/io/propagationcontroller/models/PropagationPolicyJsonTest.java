package io.propagationcontroller.models;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.propagationcontroller.enums.SelectorOperator;
import io.propagationcontroller.enums.TaintEffect;
import io.propagationcontroller.enums.TolerationOperator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PropagationPolicyJsonTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
    }

    @Test
    void testDeserializeFullPolicy() throws Exception {
        // Given
        String json = "{"
            + "\"apiVersion\":\"policy.karmada.io/v1alpha1\","
            + "\"kind\":\"PropagationPolicy\","
            + "\"metadata\":{\"name\":\"nginx-propagation\",\"namespace\":\"default\"},"
            + "\"spec\":{"
            + "  \"resourceSelector\":[{\"apiVersion\":\"apps/v1\",\"kind\":\"Deployment\",\"names\":[\"nginx\"],"
            + "    \"labelSelector\":{\"matchExpressions\":[{\"key\":\"app\",\"operator\":\"In\",\"values\":[\"nginx\"]}]}}],"
            + "  \"placement\":{"
            + "    \"clusterAffinity\":{\"clusterNames\":[\"member1\",\"member2\"],\"exclude\":[\"member3\"]},"
            + "    \"clusterTolerations\":[{\"key\":\"dedicated\",\"operator\":\"Exists\",\"effect\":\"NoSchedule\"}],"
            + "    \"spreadConstraints\":[{\"spreadByField\":\"region\",\"maximum\":2,\"minimum\":1}]"
            + "  },"
            + "  \"schedulerName\":\"default-scheduler\","
            + "  \"unknownField\":true"
            + "}}";

        // When
        PropagationPolicy policy = objectMapper.readValue(json, PropagationPolicy.class);

        // Then
        assertThat(policy.qualifiedName()).isEqualTo("default/nginx-propagation");
        PropagationSpec spec = policy.getSpec();
        assertThat(spec.getResourceSelectors()).hasSize(1);
        assertThat(spec.getResourceSelectors().get(0).findLabelSelector().get().getMatchExpressions().get(0).getOperator())
            .isEqualTo(SelectorOperator.IN);
        assertThat(spec.getPlacement().getClusterAffinity().getExcludeClusters()).containsExactly("member3");
        Toleration toleration = spec.getPlacement().getClusterTolerations().get(0);
        assertThat(toleration.getOperator()).isEqualTo(TolerationOperator.EXISTS);
        assertThat(toleration.getEffect()).isEqualTo(TaintEffect.NO_SCHEDULE);
        SpreadConstraint constraint = spec.getPlacement().getSpreadConstraints().get(0);
        assertThat(constraint.getSpreadByField()).isEqualTo("region");
        assertThat(constraint.getMaximum()).isEqualTo(2);
        assertThat(constraint.getMinimum()).isEqualTo(1);
    }

    @Test
    void testAbsentAndEmptySelectorListsStayDistinct() throws Exception {
        PropagationSpec absent = objectMapper.readValue("{}", PropagationSpec.class);
        PropagationSpec empty = objectMapper.readValue("{\"resourceSelector\":[]}", PropagationSpec.class);

        assertThat(absent.getResourceSelectors()).isNull();
        assertThat(empty.getResourceSelectors()).isNotNull().isEmpty();
    }

    @Test
    void testAbsentAffinityIsDistinctFromEmptyAffinity() throws Exception {
        Placement absent = objectMapper.readValue("{}", Placement.class);
        Placement empty = objectMapper.readValue("{\"clusterAffinity\":{}}", Placement.class);

        assertThat(absent.findClusterAffinity()).isEmpty();
        assertThat(empty.findClusterAffinity()).isPresent();
        assertThat(empty.getClusterAffinity().findLabelSelector()).isEmpty();
    }

    @Test
    void testClusterDescriptorTaints() throws Exception {
        String json = "{\"name\":\"member1\",\"region\":\"east\",\"labels\":{\"env\":\"prod\"},"
            + "\"taints\":[{\"key\":\"gpu\",\"value\":\"true\",\"effect\":\"NoExecute\"}]}";

        ClusterDescriptor cluster = objectMapper.readValue(json, ClusterDescriptor.class);

        assertThat(cluster.getTaints()).singleElement()
            .extracting(Taint::getEffect)
            .isEqualTo(TaintEffect.NO_EXECUTE);
        assertThat(cluster.getLabels()).containsEntry("env", "prod");
    }

    @Test
    void testPlacementResultSerialization() throws Exception {
        String json = objectMapper.writeValueAsString(PlacementResult.empty());

        assertThat(json).contains("\"selectedClusters\":[]");
        assertThat(json).doesNotContain("allConstraintsSatisfied");
    }
}
