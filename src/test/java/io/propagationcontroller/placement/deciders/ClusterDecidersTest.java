package io.propagationcontroller.placement.deciders;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.propagationcontroller.enums.Decision;
import io.propagationcontroller.enums.SelectorOperator;
import io.propagationcontroller.enums.TaintEffect;
import io.propagationcontroller.enums.TolerationOperator;
import io.propagationcontroller.models.ClusterAffinity;
import io.propagationcontroller.models.ClusterDescriptor;
import io.propagationcontroller.models.FieldSelector;
import io.propagationcontroller.models.FieldSelectorRequirement;
import io.propagationcontroller.models.LabelSelector;
import io.propagationcontroller.models.Taint;
import io.propagationcontroller.models.Toleration;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ClusterDecidersTest {

    private final ClusterDescriptor member1 = ClusterDescriptor.builder()
        .name("member1")
        .provider("aws")
        .region("us-east-1")
        .zone("us-east-1a")
        .labels(Map.of("env", "prod"))
        .build();

    @Test
    void testExcludeClustersDecider_ListedCluster_ReturnsNo() {
        ExcludeClustersDecider decider = new ExcludeClustersDecider();
        ClusterAffinity affinity = ClusterAffinity.builder().excludeClusters(List.of("member1")).build();

        assertThat(decider.canPlace(member1, affinity, List.of())).isEqualTo(Decision.NO);
        assertThat(decider.canPlace(member1, null, List.of())).isEqualTo(Decision.YES);
    }

    @Test
    void testClusterNamesDecider_EmptyAllowList_ReturnsYes() {
        ClusterNamesDecider decider = new ClusterNamesDecider();

        assertThat(decider.canPlace(member1, ClusterAffinity.builder().clusterNames(List.of()).build(), List.of()))
            .isEqualTo(Decision.YES);
        assertThat(decider.canPlace(member1, ClusterAffinity.builder().clusterNames(List.of("member2")).build(), List.of()))
            .isEqualTo(Decision.NO);
        assertThat(decider.canPlace(member1, ClusterAffinity.builder().clusterNames(List.of("member1")).build(), List.of()))
            .isEqualTo(Decision.YES);
    }

    @Test
    void testLabelSelectorDecider_MatchesClusterLabels() {
        LabelSelectorDecider decider = new LabelSelectorDecider();
        ClusterAffinity prod = ClusterAffinity.builder()
            .labelSelector(LabelSelector.builder().matchLabels(Map.of("env", "prod")).build())
            .build();
        ClusterAffinity dev = ClusterAffinity.builder()
            .labelSelector(LabelSelector.builder().matchLabels(Map.of("env", "dev")).build())
            .build();

        assertThat(decider.canPlace(member1, prod, List.of())).isEqualTo(Decision.YES);
        assertThat(decider.canPlace(member1, dev, List.of())).isEqualTo(Decision.NO);
        assertThat(decider.canPlace(member1, new ClusterAffinity(), List.of())).isEqualTo(Decision.YES);
    }

    @Test
    void testFieldSelectorDecider_RegionIn_ReturnsYes() {
        FieldSelectorDecider decider = new FieldSelectorDecider();

        assertThat(decider.canPlace(member1, fieldAffinity("region", SelectorOperator.IN, "us-east-1"), List.of()))
            .isEqualTo(Decision.YES);
        assertThat(decider.canPlace(member1, fieldAffinity("provider", SelectorOperator.NOT_IN, "aws"), List.of()))
            .isEqualTo(Decision.NO);
        assertThat(decider.canPlace(member1, fieldAffinity("cluster", SelectorOperator.IN, "member1"), List.of()))
            .isEqualTo(Decision.YES);
    }

    @Test
    void testFieldSelectorDecider_UnknownField_ReturnsNo() {
        FieldSelectorDecider decider = new FieldSelectorDecider();

        assertThat(decider.canPlace(member1, fieldAffinity("datacenter", SelectorOperator.IN, "dc1"), List.of()))
            .isEqualTo(Decision.NO);
    }

    @Test
    void testFieldSelectorDecider_MissingZone_NotInMatches() {
        FieldSelectorDecider decider = new FieldSelectorDecider();
        ClusterDescriptor noZone = ClusterDescriptor.builder().name("member2").region("eu-west-1").build();

        assertThat(decider.canPlace(noZone, fieldAffinity("zone", SelectorOperator.NOT_IN, "eu-west-1a"), List.of()))
            .isEqualTo(Decision.YES);
        assertThat(decider.canPlace(noZone, fieldAffinity("zone", SelectorOperator.IN, "eu-west-1a"), List.of()))
            .isEqualTo(Decision.NO);
    }

    @Test
    void testTaintTolerationDecider_UntoleratedNoSchedule_ReturnsNo() {
        TaintTolerationDecider decider = new TaintTolerationDecider();
        ClusterDescriptor tainted = taintedCluster(TaintEffect.NO_SCHEDULE);

        assertThat(decider.canPlace(tainted, null, List.of())).isEqualTo(Decision.NO);
    }

    @Test
    void testTaintTolerationDecider_ToleratedTaint_ReturnsYes() {
        TaintTolerationDecider decider = new TaintTolerationDecider();
        ClusterDescriptor tainted = taintedCluster(TaintEffect.NO_EXECUTE);
        Toleration toleration = Toleration.builder()
            .key("dedicated")
            .operator(TolerationOperator.EXISTS)
            .build();

        assertThat(decider.canPlace(tainted, null, List.of(toleration))).isEqualTo(Decision.YES);
    }

    @Test
    void testTaintTolerationDecider_PreferNoSchedule_IsIgnored() {
        TaintTolerationDecider decider = new TaintTolerationDecider();

        assertThat(decider.canPlace(taintedCluster(TaintEffect.PREFER_NO_SCHEDULE), null, List.of()))
            .isEqualTo(Decision.YES);
    }

    @Test
    void testTaintTolerationDecider_UnrecognizedEffect_ReturnsNo() throws Exception {
        // Given
        ClusterDescriptor cluster = new ObjectMapper().readValue(
            "{\"name\":\"c1\",\"taints\":[{\"key\":\"dedicated\",\"value\":\"gpu\",\"effect\":\"NoScheduleX\"}]}",
            ClusterDescriptor.class);
        TaintTolerationDecider decider = new TaintTolerationDecider();

        // When
        Decision decision = decider.canPlace(cluster, null, List.of());

        // Then
        assertThat(cluster.getTaints().get(0).getEffect()).isNull();
        assertThat(decision).isEqualTo(Decision.NO);
    }

    @Test
    void testTaintTolerationDecider_MissingEffect_ToleratedByKeyMatch() {
        TaintTolerationDecider decider = new TaintTolerationDecider();
        ClusterDescriptor cluster = ClusterDescriptor.builder()
            .name("c1")
            .taints(List.of(Taint.builder().key("dedicated").value("gpu").build()))
            .build();
        Toleration toleration = Toleration.builder().key("dedicated").operator(TolerationOperator.EXISTS).build();

        assertThat(decider.canPlace(cluster, null, List.of())).isEqualTo(Decision.NO);
        assertThat(decider.canPlace(cluster, null, List.of(toleration))).isEqualTo(Decision.YES);
    }

    private ClusterAffinity fieldAffinity(String key, SelectorOperator operator, String... values) {
        FieldSelectorRequirement requirement = FieldSelectorRequirement.builder()
            .key(key)
            .operator(operator)
            .values(List.of(values))
            .build();
        return ClusterAffinity.builder()
            .fieldSelector(FieldSelector.builder().matchExpressions(List.of(requirement)).build())
            .build();
    }

    private ClusterDescriptor taintedCluster(TaintEffect effect) {
        return ClusterDescriptor.builder()
            .name("tainted")
            .taints(List.of(Taint.builder().key("dedicated").value("gpu").effect(effect).build()))
            .build();
    }
}
