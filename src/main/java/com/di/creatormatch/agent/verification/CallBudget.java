package com.di.creatormatch.agent.verification;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-run cap on external metrics calls. Calls are reserved before dispatch, so the number issued
 * can never exceed the cap no matter how workers interleave.
 */
public final class CallBudget {

    private final int cap;
    private final AtomicInteger reserved = new AtomicInteger();
    private final AtomicInteger issued = new AtomicInteger();

    public CallBudget(int cap) {
        this.cap = Math.max(0, cap);
    }

    /** Reserves {@code calls} if they all fit; reserves nothing otherwise. */
    public boolean tryReserve(int calls) {
        while (true) {
            int current = reserved.get();
            if (current + calls > cap) return false;
            if (reserved.compareAndSet(current, current + calls)) return true;
        }
    }

    /** Records one call actually sent to the provider. */
    public void recordIssued() {
        issued.incrementAndGet();
    }

    public int getCap() {
        return cap;
    }

    public int getReserved() {
        return reserved.get();
    }

    public int getIssued() {
        return issued.get();
    }
}
