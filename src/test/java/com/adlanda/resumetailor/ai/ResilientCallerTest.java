package com.adlanda.resumetailor.ai;

import com.adlanda.resumetailor.exception.AiServiceUnavailableException;
import com.adlanda.resumetailor.exception.MalformedAiResponseException;
import com.adlanda.resumetailor.exception.TailoringCancelledException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilientCallerTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final ResilientCaller caller = new ResilientCaller(RetryPolicy.DEFAULT, sleeps::add);

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void call_rateLimitedTwiceThenSucceeds_returnsResultWithExponentialBackoff() {
        AtomicInteger attempts = new AtomicInteger();

        String result = caller.call("score match", () -> {
            if (attempts.incrementAndGet() <= 2) {
                throw new TransientAiException("429 - rate limit reached");
            }
            return "{\"score\":85}";
        });

        assertThat(result).isEqualTo("{\"score\":85}");
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(sleeps).containsExactly(1000L, 2000L);
    }

    @Test
    void call_alwaysTransient_givesUpAfterMaxRetriesPlusOneAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        TransientAiException failure = new TransientAiException("503 - overloaded");

        assertThatThrownBy(() -> caller.call("analyze job", () -> {
            attempts.incrementAndGet();
            throw failure;
        }))
                .isInstanceOf(AiServiceUnavailableException.class)
                .hasMessageContaining("max retries exceeded")
                .hasCause(failure)
                .extracting(e -> ((AiServiceUnavailableException) e).getAttempts())
                .isEqualTo(4);

        assertThat(attempts.get()).isEqualTo(4);
        assertThat(sleeps).containsExactly(1000L, 2000L, 4000L);
    }

    @Test
    void call_nonTransientFailure_isNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> caller.call("select bullets", () -> {
            attempts.incrementAndGet();
            throw new NonTransientAiException("401 - invalid api key");
        })).isInstanceOf(AiServiceUnavailableException.class);

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void call_domainExceptionPassesThroughUntouched() {
        MalformedAiResponseException malformed = new MalformedAiResponseException("bad json");

        assertThatThrownBy(() -> caller.call("tailor bullet", () -> {
            throw malformed;
        })).isSameAs(malformed);
    }

    @Test
    void call_interruptedDuringBackoff_abortsWithCancellation() {
        ResilientCaller interrupting = new ResilientCaller(RetryPolicy.DEFAULT, backOffPeriod -> {
            throw new InterruptedException();
        });
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> interrupting.call("generate summary", () -> {
            attempts.incrementAndGet();
            throw new TransientAiException("429");
        })).isInstanceOf(TailoringCancelledException.class);

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void call_realSleeperInterruptedFromAnotherThread_stopsRetrying() throws Exception {
        ResilientCaller slow = new ResilientCaller(new RetryPolicy(3, Duration.ofSeconds(30)));
        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<Throwable> outcome = new AtomicReference<>();

        Thread worker = new Thread(() -> {
            try {
                slow.call("tailor bullet", () -> {
                    attempts.incrementAndGet();
                    throw new TransientAiException("503 - overloaded");
                });
            } catch (RuntimeException e) {
                outcome.set(e);
            }
        });
        worker.start();
        Thread.sleep(200);
        worker.interrupt();
        worker.join(5_000);

        assertThat(worker.isAlive()).isFalse();
        assertThat(outcome.get()).isInstanceOf(TailoringCancelledException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void isTransient_classifiesHttpAndNetworkFailures() {
        assertThat(ResilientCaller.isTransient(
                HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS, "", HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8))).isTrue();
        assertThat(ResilientCaller.isTransient(
                HttpServerErrorException.create(HttpStatus.BAD_GATEWAY, "", HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8))).isTrue();
        assertThat(ResilientCaller.isTransient(
                HttpClientErrorException.create(HttpStatus.BAD_REQUEST, "", HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8))).isFalse();
        assertThat(ResilientCaller.isTransient(new ResourceAccessException("connection reset"))).isTrue();
        assertThat(ResilientCaller.isTransient(new NonTransientAiException("429 - slow down"))).isTrue();
        assertThat(ResilientCaller.isTransient(new IllegalStateException("boom"))).isFalse();
        assertThat(ResilientCaller.isTransient(
                new MalformedAiResponseException("bad json", new IOException("eof")))).isFalse();
    }

    @Test
    void retryPolicy_delayDoublesPerAttempt() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100));

        assertThat(policy.maxAttempts()).isEqualTo(6);
        assertThat(policy.delayBefore(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delayBefore(3)).isEqualTo(Duration.ofMillis(400));
        assertThatThrownBy(() -> new RetryPolicy(-1, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }
}
