package org.javai.reattempt.retry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.reattempt.RequestError;
import org.javai.reattempt.Result;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * The decision step shared by {@link Retrier} and {@link ResumableRetrier}.
 *
 * <p>Every policy is advanced at once, so their delays overlap. The combined stage is lifted
 * into {@link Result} shape: {@code Succeeded(successors)} when all continue,
 * {@code Failed(error)} when any policy stops. A sleeper that completes exceptionally has no
 * {@link RequestError} of its own, so that case yields {@code Failed(placeholder)}; callers
 * treat it as a stop and report the last real error instead.
 */
final class PolicyChain {

    private static final Logger LOG = LogManager.getLogger(PolicyChain.class);

    private PolicyChain() {
        // Utility class
    }

    static CompletableFuture<Result<List<Policy>>> advance(
            List<Policy> policies,
            TransitionContext context,
            RequestError error
    ) {
        List<CompletableFuture<RetryDecision>> stages = new ArrayList<>(policies.size());
        for (Policy policy : policies) {
            stages.add(start(policy, context, error));
        }

        return CompletableFuture.allOf(stages.toArray(new CompletableFuture<?>[0]))
                .handle((ignored, failure) -> {
                    if (failure != null) {
                        LOG.warn("Policy transition failed, stopping retry chain", failure);
                        return Result.<List<Policy>>failed(RequestError.placeholder());
                    }
                    return collect(policies, stages, error);
                });
    }

    private static CompletableFuture<RetryDecision> start(Policy policy, TransitionContext context, RequestError error) {
        try {
            CompletionStage<RetryDecision> stage = policy.advance(context, error);
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Result<List<Policy>> collect(
            List<Policy> policies,
            List<CompletableFuture<RetryDecision>> stages,
            RequestError error
    ) {
        List<Policy> successors = new ArrayList<>(stages.size());
        for (int i = 0; i < stages.size(); i++) {
            RetryDecision decision = stages.get(i).join();
            if (decision instanceof RetryDecision.Stop stop) {
                LOG.debug("Policy [{}] stopped the retry chain: {}", policies.get(i).id(), stop.reason());
                return Result.failed(error);
            }
            successors.add(((RetryDecision.Continue) decision).next());
        }
        return Result.succeeded(List.copyOf(successors));
    }
}
