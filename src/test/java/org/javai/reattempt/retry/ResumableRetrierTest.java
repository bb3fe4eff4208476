package org.javai.reattempt.retry;

import org.javai.reattempt.RequestError;
import org.javai.reattempt.Result;
import org.javai.reattempt.classify.FailureClassifier;
import org.javai.reattempt.ops.RetryReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class ResumableRetrierTest {

    private static final RequestError UNAUTHENTICATED = RequestError.badStatus(401);

    private TestClock clock;
    private RecordingSleeper sleeper;
    private List<Integer> reportedSuspensions;
    private ResumableRetrier retrier;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        sleeper = new RecordingSleeper(clock);
        reportedSuspensions = new ArrayList<>();

        RetryReporter reporter = new RetryReporter() {
            @Override
            public void reportSuspended(String operation, RequestError error, int attemptNumber) {
                reportedSuspensions.add(attemptNumber);
            }
        };

        retrier = ResumableRetrier.builder()
                .reporter(reporter)
                .clock(clock)
                .sleeper(sleeper)
                .build();
    }

    @Test
    void start_success_finishesWithoutSuspending() {
        ScriptedOperation<String> operation = ScriptedOperation.of(Result.succeeded("profile"));

        RetryContext<String> context = retrier.start(
                List.of(Policy.maxRetries(1)),
                List.of(FailureClassifier.onAllFailures()),
                operation
        ).join();

        assertThat(context).isEqualTo(new RetryContext.Finished<>(Result.succeeded("profile")));
        assertThat(operation.attempts()).isEqualTo(1);
        assertThat(reportedSuspensions).isEmpty();
    }

    @Test
    void start_retriableFailure_suspendsWithoutSleepingOrAdvancing() {
        ScriptedOperation<String> operation = ScriptedOperation.of(Result.failed(UNAUTHENTICATED));
        List<Policy> policies = List.of(Policy.maxRetries(1), Policy.constantInterval(250));

        RetryContext<String> context = retrier.start(
                policies,
                List.of(FailureClassifier.onUnauthenticatedStatus()),
                operation
        ).join();

        assertThat(context).isInstanceOf(RetryContext.Suspended.class);
        RetryContext.Suspended<String> suspended = (RetryContext.Suspended<String>) context;
        assertThat(suspended.lastError()).isEqualTo(UNAUTHENTICATED);
        assertThat(suspended.policies()).isEqualTo(policies);
        assertThat(suspended.attempts()).isEqualTo(1);
        assertThat(suspended.startedAt()).isEqualTo(clock.instant());
        assertThat(sleeper.sleeps()).isEmpty();
        assertThat(operation.attempts()).isEqualTo(1);
        assertThat(reportedSuspensions).containsExactly(1);
    }

    @Test
    void start_nonRetriableFailure_finishesWithFailure() {
        ScriptedOperation<String> operation = ScriptedOperation.of(Result.failed(RequestError.badStatus(500)));

        RetryContext<String> context = retrier.start(
                List.of(Policy.maxRetries(3)),
                List.of(FailureClassifier.onUnauthenticatedStatus()),
                operation
        ).join();

        assertThat(context).isEqualTo(new RetryContext.Finished<>(Result.failed(RequestError.badStatus(500))));
    }

    @Test
    void resume_runsSideEffectBeforeNextAttempt() {
        List<String> events = new ArrayList<>();
        AtomicReference<String> token = new AtomicReference<>("expired");
        ScriptedOperation<String> scripted = ScriptedOperation.of(Result.failed(UNAUTHENTICATED), Result.succeeded("profile"));

        RetryContext<String> context = retrier.start(
                List.of(Policy.maxRetries(1)),
                List.of(FailureClassifier.onUnauthenticatedStatus()),
                () -> {
                    events.add("attempt with " + token.get());
                    return scripted.get();
                }
        ).join();

        RetryContext<String> next = retrier.resume(error -> {
            events.add("refresh after " + error);
            token.set("fresh");
            return CompletableFuture.completedFuture(null);
        }, context).join();

        assertThat(next).isEqualTo(new RetryContext.Finished<>(Result.succeeded("profile")));
        assertThat(events).containsExactly(
                "attempt with expired",
                "refresh after " + UNAUTHENTICATED,
                "attempt with fresh");
    }

    @Test
    void resume_policyStops_finishesWithLastErrorAndSkipsSideEffect() {
        ScriptedOperation<String> operation = ScriptedOperation.of(Result.failed(UNAUTHENTICATED));
        List<RequestError> sideEffects = new ArrayList<>();

        RetryContext<String> context = retrier.start(
                List.of(Policy.maxRetries(0)),
                List.of(FailureClassifier.onAllFailures()),
                operation
        ).join();
        RetryContext<String> next = retrier.resume(error -> {
            sideEffects.add(error);
            return CompletableFuture.completedFuture(null);
        }, context).join();

        assertThat(next).isEqualTo(new RetryContext.Finished<>(Result.failed(UNAUTHENTICATED)));
        assertThat(sideEffects).isEmpty();
        assertThat(operation.attempts()).isEqualTo(1);
    }

    @Test
    void resume_keepsStartTimeAndAdvancedPolicies() {
        ScriptedOperation<String> operation = ScriptedOperation.of(Result.failed(UNAUTHENTICATED));

        RetryContext<String> first = retrier.start(
                List.of(Policy.maxRetries(3), Policy.constantInterval(200)),
                List.of(FailureClassifier.onAllFailures()),
                operation
        ).join();
        RetryContext.Suspended<String> second = (RetryContext.Suspended<String>) retrier.resume(
                error -> CompletableFuture.completedFuture(null), first).join();

        assertThat(second.startedAt()).isEqualTo(((RetryContext.Suspended<String>) first).startedAt());
        assertThat(second.policies()).containsExactly(Policy.maxRetries(2), Policy.constantInterval(200));
        assertThat(second.attempts()).isEqualTo(2);
        assertThat(sleeper.sleeps()).containsExactly(200L);
    }

    @Test
    void throwingReporter_doesNotBreakChain() {
        ResumableRetrier withBrokenReporter = ResumableRetrier.builder()
                .reporter(new RetryReporter() {
                    @Override
                    public void reportSuspended(String operation, RequestError error, int attemptNumber) {
                        throw new IllegalStateException("reporter down");
                    }
                })
                .clock(clock)
                .sleeper(sleeper)
                .build();
        ScriptedOperation<String> operation = ScriptedOperation.of(Result.failed(UNAUTHENTICATED), Result.succeeded("profile"));

        RetryContext<String> context = withBrokenReporter.start(
                List.of(Policy.maxRetries(1)),
                List.of(FailureClassifier.onUnauthenticatedStatus()),
                operation
        ).join();
        RetryContext<String> next = withBrokenReporter.resume(error -> CompletableFuture.completedFuture(null), context).join();

        assertThat(context.isFinished()).isFalse();
        assertThat(next).isEqualTo(new RetryContext.Finished<>(Result.succeeded("profile")));
    }

    @Test
    void resume_finishedContext_isRejected() {
        RetryContext<String> finished = new RetryContext.Finished<>(Result.succeeded("done"));

        assertThatThrownBy(() -> retrier.resume(error -> CompletableFuture.completedFuture(null), finished))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("finished");
    }

    @Test
    void resumableWith_deliversSuspensionsAndFinalResultToHandlers() {
        List<RetryContext.Suspended<String>> suspensions = new ArrayList<>();
        List<Result<String>> finished = new ArrayList<>();
        ScriptedOperation<String> operation = ScriptedOperation.of(
                Result.failed(RequestError.timedOut()),
                Result.failed(RequestError.timedOut()),
                Result.succeeded("ok"));

        retrier.resumableWith(
                "Feed.load",
                List.of(Policy.maxRetries(5)),
                List.of(FailureClassifier.onTimeout()),
                suspensions::add,
                operation
        ).join();

        // The host loop: each delivered suspension is resumed once
        int resumed = 0;
        while (resumed < suspensions.size()) {
            retrier.resume(error -> CompletableFuture.completedFuture(null), finished::add, suspensions.get(resumed)).join();
            resumed++;
        }

        assertThat(suspensions).hasSize(2);
        assertThat(suspensions).extracting(RetryContext.Suspended::name).containsOnly("Feed.load");
        assertThat(finished).containsExactly(Result.succeeded("ok"));
    }

    @Test
    void resumableWith_immediateSuccess_returnsFinishedWithoutCallingHandler() {
        List<RetryContext.Suspended<String>> suspensions = new ArrayList<>();

        RetryContext<String> context = retrier.resumableWith(
                List.of(Policy.maxRetries(5)),
                List.of(FailureClassifier.onAllFailures()),
                suspensions::add,
                ScriptedOperation.of(Result.succeeded("ok"))
        ).join();

        assertThat(context.isFinished()).isTrue();
        assertThat(suspensions).isEmpty();
    }

    @Test
    void resumedChain_matchesSynchronousEngine() {
        List<Policy> policies = List.of(Policy.maxRetries(4), Policy.maxDuration(5_000), Policy.exponentialBackoff(500, 3_000));
        List<FailureClassifier> classifiers = List.of(FailureClassifier.onTimeout(), FailureClassifier.onStatus(503));

        TestClock syncClock = new TestClock();
        RecordingSleeper syncSleeper = new RecordingSleeper(syncClock);
        ScriptedOperation<String> syncOperation = failingScript().taking(syncClock, Duration.ofMillis(100));
        Result<String> syncResult = Retrier.builder()
                .clock(syncClock)
                .sleeper(syncSleeper)
                .executor(Runnable::run)
                .build()
                .with(policies, classifiers, syncOperation)
                .join();

        ScriptedOperation<String> resumableOperation = failingScript().taking(clock, Duration.ofMillis(100));
        RetryContext<String> context = retrier.start(policies, classifiers, resumableOperation).join();
        while (context instanceof RetryContext.Suspended<String> suspended) {
            context = retrier.resume(error -> CompletableFuture.completedFuture(null), suspended).join();
        }

        assertThat(((RetryContext.Finished<String>) context).result()).isEqualTo(syncResult);
        assertThat(resumableOperation.attempts()).isEqualTo(syncOperation.attempts());
        assertThat(sleeper.sleeps()).isEqualTo(syncSleeper.sleeps());
    }

    private static ScriptedOperation<String> failingScript() {
        return ScriptedOperation.of(
                Result.failed(RequestError.timedOut()),
                Result.failed(RequestError.badStatus(503)),
                Result.failed(RequestError.timedOut()),
                Result.failed(RequestError.badStatus(503)));
    }
}
