package com.retrywrap.model.ctx;

import com.retrywrap.exception.OperationFailure;
import com.retrywrap.model.RetryConfig;
import com.retrywrap.model.enums.InvocationState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttemptStateTest {

    @Test
    void shouldAdvanceUntilLastAttempt() {
        AttemptState ctx = new AttemptState(RetryConfig.builder().maxAttempts(3).build());

        assertThat(ctx.getAttemptIndex()).isZero();
        assertThat(ctx.getState()).isEqualTo(InvocationState.ATTEMPTING);
        assertThat(ctx.isLastAttempt()).isFalse();

        ctx.advance();
        ctx.advance();

        assertThat(ctx.getAttemptIndex()).isEqualTo(2);
        assertThat(ctx.attemptsMade()).isEqualTo(3);
        assertThat(ctx.isLastAttempt()).isTrue();
        assertThatThrownBy(ctx::advance).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldNotAdvanceAfterTerminalState() {
        AttemptState ctx = new AttemptState(RetryConfig.builder().maxAttempts(5).build());
        ctx.recordFailure(new OperationFailure("Error", "boom"));
        ctx.fail();

        assertThat(ctx.getState().isTerminal()).isTrue();
        assertThat(ctx.getLastFailure().getMessage()).isEqualTo("boom");
        assertThatThrownBy(ctx::advance).isInstanceOf(IllegalStateException.class);
    }
}
