package com.retrywrap.core.failure;

import com.retrywrap.exception.OperationFailure;
import com.retrywrap.model.RetryConfig;
import com.retrywrap.model.ctx.AttemptState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorKindFailureDeciderTest {

    private final ErrorKindFailureDecider decider = new ErrorKindFailureDecider();

    @Test
    void shouldRetryEveryKindWhenNoneConfigured() {
        AttemptState ctx = new AttemptState(RetryConfig.defaults());

        assertThat(decider.isRetryable(new OperationFailure("Anything", "x"), ctx)).isTrue();
        assertThat(decider.isRetryable(new OperationFailure("Error", "y"), ctx)).isTrue();
    }

    @Test
    void shouldRetryOnlyConfiguredKinds() {
        AttemptState ctx = new AttemptState(RetryConfig.builder()
                .retryableErrorKinds(List.of("CustomError", "NetworkError"))
                .build());

        assertThat(decider.isRetryable(new OperationFailure("CustomError", "x"), ctx)).isTrue();
        assertThat(decider.isRetryable(new OperationFailure("NetworkError", "x"), ctx)).isTrue();
        assertThat(decider.isRetryable(new OperationFailure("IOException", "x"), ctx)).isFalse();
    }

    @Test
    void shouldNotMatchByPrefixOrCase() {
        AttemptState ctx = new AttemptState(RetryConfig.builder()
                .retryableErrorKinds(List.of("Network"))
                .build());

        assertThat(decider.isRetryable(new OperationFailure("NetworkError", "x"), ctx)).isFalse();
        assertThat(decider.isRetryable(new OperationFailure("network", "x"), ctx)).isFalse();
    }
}
