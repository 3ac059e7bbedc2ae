package io.plandigest.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RunStateTest {

    @Test
    void shouldParseCaseInsensitiveWireValues() {
        assertThat(RunState.parse("COMPLETE")).isEqualTo(RunState.COMPLETE);
        assertThat(RunState.parse("failed")).isEqualTo(RunState.FAILED);
        assertThat(RunState.parse("in-progress")).isEqualTo(RunState.IN_PROGRESS);
        assertThat(RunState.parse("need clarification")).isEqualTo(RunState.NEED_CLARIFICATION);
    }

    @Test
    void shouldMapUnknownOrMissingStateToUnknown() {
        assertThat(RunState.parse(null)).isEqualTo(RunState.UNKNOWN);
        assertThat(RunState.parse("")).isEqualTo(RunState.UNKNOWN);
        assertThat(RunState.parse("ARCHIVED")).isEqualTo(RunState.UNKNOWN);
    }

    @Test
    void shouldClassifyTerminalStates() {
        assertThat(RunState.COMPLETE.isSuccess()).isTrue();
        assertThat(RunState.FAILED.isFailure()).isTrue();
        assertThat(RunState.IN_PROGRESS.isSuccess()).isFalse();
        assertThat(RunState.IN_PROGRESS.isFailure()).isFalse();
    }
}
