package com.procurement.risk.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisRunTest {

    @Test
    void advance_throughAllStates_endsDone() {
        AnalysisRun run = new AnalysisRun("TND-1");

        run.advance(AnalysisState.DETECTING);
        run.advance(AnalysisState.SCORING);
        run.advance(AnalysisState.EXPLAINING);
        run.advance(AnalysisState.VALIDATING);
        run.advance(AnalysisState.DONE);

        assertThat(run.getState()).isEqualTo(AnalysisState.DONE);
        assertThat(run.getState().isTerminal()).isTrue();
    }

    @Test
    void advance_skippingState_rejected() {
        AnalysisRun run = new AnalysisRun("TND-1");
        run.advance(AnalysisState.DETECTING);

        assertThatThrownBy(() -> run.advance(AnalysisState.EXPLAINING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("DETECTING -> EXPLAINING");
    }

    @Test
    void fail_recordsStateFailedIn() {
        AnalysisRun run = new AnalysisRun("TND-1");
        run.advance(AnalysisState.DETECTING);
        run.advance(AnalysisState.SCORING);

        AnalysisState failedIn = run.fail();

        assertThat(failedIn).isEqualTo(AnalysisState.SCORING);
        assertThat(run.getState()).isEqualTo(AnalysisState.FAILED);
    }

    @Test
    void terminalStates_allowNoFurtherTransition() {
        assertThat(AnalysisState.DONE.canTransitionTo(AnalysisState.FAILED)).isFalse();
        assertThat(AnalysisState.FAILED.canTransitionTo(AnalysisState.DETECTING)).isFalse();
        assertThat(AnalysisState.RECEIVED.canTransitionTo(AnalysisState.FAILED)).isTrue();
    }
}
