package com.syncrecovery.core.test;

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decides which calls of a collaborator fake fail.
 * 
 * <pre>{@code
 * FailureInjector injector = FailureInjector.failingOn(3);
 * ReplayEventHandler handler = event -> injector.maybeThrow("write rejected");
 * }</pre>
 */
public final class FailureInjector {

    private final Set<Integer> failingCalls;
    private final boolean failEveryCall;
    private final AtomicInteger calls = new AtomicInteger();

    private FailureInjector(Set<Integer> failingCalls, boolean failEveryCall) {
        this.failingCalls = failingCalls;
        this.failEveryCall = failEveryCall;
    }

    /**
     * Fail on the given 1-indexed call numbers only.
     */
    public static FailureInjector failingOn(Integer... calls) {
        return new FailureInjector(Set.of(calls), false);
    }

    public static FailureInjector alwaysFail() {
        return new FailureInjector(Set.of(), true);
    }

    public static FailureInjector neverFail() {
        return new FailureInjector(Set.of(), false);
    }

    /**
     * Count one call and report whether it fails.
     */
    public boolean shouldFail() {
        int call = calls.incrementAndGet();
        return failEveryCall || failingCalls.contains(call);
    }

    /**
     * Count one call and throw {@link IllegalStateException} if it fails.
     */
    public void maybeThrow(String message) {
        if (shouldFail()) {
            throw new IllegalStateException(message);
        }
    }
}
