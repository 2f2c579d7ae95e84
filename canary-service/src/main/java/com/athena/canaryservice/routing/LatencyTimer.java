package com.athena.canaryservice.routing;

/**
 * Time source for latency measurement and the injected canary slowdown.
 */
public interface LatencyTimer {

    long nanoTime();

    void sleep(long millis) throws InterruptedException;

    LatencyTimer SYSTEM = new LatencyTimer() {
        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public void sleep(long millis) throws InterruptedException {
            Thread.sleep(millis);
        }
    };
}
