package io.propagationcontroller.models;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.propagationcontroller.enums.TaintEffect;
import io.propagationcontroller.enums.TolerationOperator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TolerationTest {

    private final Taint dedicated = Taint.builder()
        .key("dedicated").value("gpu").effect(TaintEffect.NO_SCHEDULE).build();

    @Test
    void testEqualOperatorRequiresSameKeyAndValue() {
        Toleration matching = Toleration.builder()
            .key("dedicated").operator(TolerationOperator.EQUAL).value("gpu").build();
        Toleration otherValue = Toleration.builder()
            .key("dedicated").operator(TolerationOperator.EQUAL).value("cpu").build();

        assertThat(matching.tolerates(dedicated)).isTrue();
        assertThat(otherValue.tolerates(dedicated)).isFalse();
    }

    @Test
    void testUnsetOperatorBehavesAsEqual() {
        Toleration toleration = Toleration.builder().key("dedicated").value("gpu").build();

        assertThat(toleration.tolerates(dedicated)).isTrue();
    }

    @Test
    void testExistsOperatorIgnoresValue() {
        Toleration toleration = Toleration.builder()
            .key("dedicated").operator(TolerationOperator.EXISTS).build();

        assertThat(toleration.tolerates(dedicated)).isTrue();
    }

    @Test
    void testExistsWithEmptyKeyToleratesEverything() {
        Toleration toleration = Toleration.builder().operator(TolerationOperator.EXISTS).build();
        Taint other = Taint.builder().key("maintenance").effect(TaintEffect.NO_EXECUTE).build();

        assertThat(toleration.tolerates(dedicated)).isTrue();
        assertThat(toleration.tolerates(other)).isTrue();
    }

    @Test
    void testEffectMustMatchWhenSet() {
        Toleration noExecuteOnly = Toleration.builder()
            .key("dedicated").operator(TolerationOperator.EXISTS).effect(TaintEffect.NO_EXECUTE).build();

        assertThat(noExecuteOnly.tolerates(dedicated)).isFalse();
    }

    @Test
    void testDifferentKeyIsNotTolerated() {
        Toleration toleration = Toleration.builder()
            .key("maintenance").operator(TolerationOperator.EXISTS).build();

        assertThat(toleration.tolerates(dedicated)).isFalse();
    }

    @Test
    void testUnrecognizedOperatorToleratesNothing() throws Exception {
        // Given
        Toleration toleration = new ObjectMapper().readValue(
            "{\"key\":\"dedicated\",\"operator\":\"Bogus\",\"value\":\"gpu\"}", Toleration.class);

        // When
        boolean tolerated = toleration.tolerates(dedicated);

        // Then
        assertThat(toleration.getOperator()).isEqualTo(TolerationOperator.UNSUPPORTED);
        assertThat(tolerated).isFalse();
    }

    @Test
    void testBlankOperatorBehavesAsEqual() throws Exception {
        Toleration toleration = new ObjectMapper().readValue(
            "{\"key\":\"dedicated\",\"operator\":\"\",\"value\":\"gpu\"}", Toleration.class);

        assertThat(toleration.getOperator()).isEqualTo(TolerationOperator.EQUAL);
        assertThat(toleration.tolerates(dedicated)).isTrue();
    }
}
