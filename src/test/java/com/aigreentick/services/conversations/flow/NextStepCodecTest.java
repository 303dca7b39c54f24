package com.aigreentick.services.conversations.flow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("NextStepCodec")
class NextStepCodecTest {

    @Test
    @DisplayName("Plain pointer decodes to CONTINUE")
    void plainPointerIsContinue() {
        NextStep step = NextStepCodec.decode("ask_name");

        assertThat(step.isContinue()).isTrue();
        assertThat(step.getNodeId()).isEqualTo("ask_name");
    }

    @Test
    @DisplayName("Jump marker decodes to JUMP with the flow id")
    void jumpMarkerIsJump() {
        NextStep step = NextStepCodec.decode("__JUMP__42");

        assertThat(step.isJump()).isTrue();
        assertThat(step.getTargetFlowId()).isEqualTo(42L);
    }

    @Test
    @DisplayName("End marker decodes to TERMINATE")
    void endMarkerIsTerminate() {
        assertThat(NextStepCodec.decode("__END__")).isEqualTo(NextStep.terminate());
    }

    @Test
    @DisplayName("Missing pointer decodes to null")
    void blankPointerIsNull() {
        assertThat(NextStepCodec.decode(null)).isNull();
        assertThat(NextStepCodec.decode("   ")).isNull();
    }

    @Test
    @DisplayName("Jump marker without a numeric id is rejected")
    void jumpWithoutIdIsRejected() {
        assertThatThrownBy(() -> NextStepCodec.decode("__JUMP__sales"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("__JUMP__sales");
    }

    @Test
    @DisplayName("Encoding writes the legacy markers back")
    void encodeWritesMarkers() {
        assertThat(NextStepCodec.encode(NextStep.jumpTo(7L))).isEqualTo("__JUMP__7");
        assertThat(NextStepCodec.encode(NextStep.terminate())).isEqualTo("__END__");
        assertThat(NextStepCodec.encode(NextStep.continueTo("n2"))).isEqualTo("n2");
        assertThat(NextStepCodec.encode(NextStep.awaitingInput())).isNull();
    }
}
