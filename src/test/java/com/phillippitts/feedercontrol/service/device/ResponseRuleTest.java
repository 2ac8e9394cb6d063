package com.phillippitts.feedercontrol.service.device;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseRuleTest {

    @Test
    void familyIsLowerCasedTextBeforeFirstColon() {
        assertThat(ResponseRule.familyOf("Relay:fan:on")).isEqualTo("relay");
        assertThat(ResponseRule.familyOf("ping")).isEqualTo("ping");
    }

    @Test
    void sensorStatusCompletesOnPrintInterval() {
        ResponseRule rule = ResponseRule.forCommand("sensors:status");

        assertThat(rule.accepts("Sensor service status: ACTIVE")).isTrue();
        assertThat(rule.accepts("Relay fan turned ON")).isFalse();
        assertThat(rule.isComplete(List.of("Sensor service status: ACTIVE"))).isFalse();
        assertThat(rule.isComplete(List.of("Sensor service status: ACTIVE", "Print interval: 500ms"))).isTrue();
    }

    @Test
    void otherCommandsCompleteOnFirstFamilyLine() {
        ResponseRule rule = ResponseRule.forCommand("feeder:start:50,3,5");

        assertThat(rule.accepts("Feeder started, target 50g")).isTrue();
        assertThat(rule.accepts("Relay fan turned ON")).isFalse();
        assertThat(rule.isComplete(List.of("Feeder started, target 50g"))).isTrue();
    }

    @Test
    void emptyFamilyAcceptsNothing() {
        ResponseRule rule = ResponseRule.forCommand(":status");

        assertThat(ResponseRule.familyOf(":status")).isEmpty();
        assertThat(rule.accepts("Relay fan turned ON")).isFalse();
        assertThat(rule.accepts("")).isFalse();
    }
}
