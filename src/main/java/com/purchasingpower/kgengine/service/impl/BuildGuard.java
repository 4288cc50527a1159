package com.purchasingpower.kgengine.service.impl;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-flight flag for graph builds. Whoever acquires it must release it in a finally block.
 */
public class BuildGuard {

    private final AtomicBoolean running = new AtomicBoolean(false);

    public boolean tryAcquire() {
        return running.compareAndSet(false, true);
    }

    public void release() {
        running.set(false);
    }

    public boolean isHeld() {
        return running.get();
    }
}
