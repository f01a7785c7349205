package com.adlanda.resumetailor.ai;

import com.adlanda.resumetailor.exception.AiServiceUnavailableException;
import com.adlanda.resumetailor.exception.ResumeTailorException;
import com.adlanda.resumetailor.exception.TailoringCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Runs one AI backend call under a {@link RetryPolicy}, on a spring-retry {@link RetryTemplate}.
 *
 * Transient failures (network errors, rate limits, 5xx) are retried with
 * exponential backoff. Anything else, and retry exhaustion, surfaces as
 * {@link AiServiceUnavailableException}. Interrupting the calling thread aborts
 * a pending backoff sleep immediately.
 */
public class ResilientCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientCaller.class);

    private final RetryPolicy policy;
    private final RetryTemplate retryTemplate;

    public ResilientCaller(RetryPolicy policy) {
        this(policy, new ThreadWaitSleeper());
    }

    public ResilientCaller(RetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.retryTemplate = retryTemplate(policy, sleeper);
    }

    public <T> T call(String operation, Callable<T> action) {
        try {
            return retryTemplate.execute(
                    (RetryCallback<T, Exception>) context -> {
                        context.setAttribute(RetryContext.NAME, operation);
                        return action.call();
                    },
                    context -> giveUp(operation, context));
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TailoringCancelledException(operation, e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new AiServiceUnavailableException(operation + " failed", 1, e);
        }
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    private static <T> T giveUp(String operation, RetryContext context) {
        Throwable last = context.getLastThrowable();
        if (last instanceof ResumeTailorException domain) {
            throw domain;
        }
        if (isTransient(last)) {
            throw new AiServiceUnavailableException(
                    operation + ": max retries exceeded", context.getRetryCount(), last);
        }
        throw new AiServiceUnavailableException(operation + " failed", context.getRetryCount(), last);
    }

    static RetryTemplate retryTemplate(RetryPolicy policy, Sleeper sleeper) {
        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(policy.backoffUnit().toMillis());
        backOff.setMultiplier(2.0);
        backOff.setMaxInterval(Math.max(1L, policy.delayBefore(policy.maxRetries()).toMillis()));
        backOff.setSleeper(sleeper);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new TransientFailurePolicy(policy.maxAttempts()));
        template.setBackOffPolicy(backOff);
        template.registerListener(new AttemptLogger(policy.maxAttempts()));
        return template;
    }

    /**
     * Whether a failure is worth retrying: rate limits, server errors and I/O problems.
     */
    static boolean isTransient(Throwable error) {
        if (error instanceof ResumeTailorException) {
            return false;
        }
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TransientAiException || t instanceof ResourceAccessException
                    || t instanceof IOException) {
                return true;
            }
            if (t instanceof HttpStatusCodeException http) {
                int status = http.getStatusCode().value();
                return status == 429 || status >= 500;
            }
            if (t instanceof NonTransientAiException) {
                String message = t.getMessage();
                return message != null && message.startsWith("429");
            }
        }
        return false;
    }

    /**
     * Retries only transient failures, up to the attempt budget.
     */
    static final class TransientFailurePolicy extends SimpleRetryPolicy {

        TransientFailurePolicy(int maxAttempts) {
            super(maxAttempts);
        }

        @Override
        public boolean canRetry(RetryContext context) {
            Throwable last = context.getLastThrowable();
            return (last == null || isTransient(last)) && context.getRetryCount() < getMaxAttempts();
        }
    }

    private static final class AttemptLogger implements RetryListener {

        private final int maxAttempts;

        AttemptLogger(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        @Override
        public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                     Throwable throwable) {
            if (throwable instanceof ResumeTailorException) {
                return;
            }
            log.warn("{} failed on attempt {}/{}: {}",
                    context.getAttribute(RetryContext.NAME), context.getRetryCount(), maxAttempts,
                    throwable.getMessage());
        }
    }
}
