package io.streamwire.websocket;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * A resettable flag that threads can wait on.
 */
final class ConnectionSignal {

    private boolean set;

    ConnectionSignal(boolean initiallySet) {
        this.set = initiallySet;
    }

    synchronized void set() {
        set = true;
        notifyAll();
    }

    synchronized void clear() {
        set = false;
    }

    synchronized boolean isSet() {
        return set;
    }

    /**
     * Waits until the flag is set.
     *
     * @return true if the flag was set within the timeout
     */
    synchronized boolean await(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!set) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        return true;
    }
}
