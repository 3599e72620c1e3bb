package org.mathcore;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Equation numbering that outlives single conversions.
 *
 * <p>Each conversion works on a scratch copy; the copy replaces the stored value only
 * when the conversion returns normally. All access goes through one lock, so conversions
 * sharing a counter run one at a time.
 */
final class GlobalCounter {
    private static final Logger log = LogManager.getLogger("converter");

    private final ReentrantLock lock = new ReentrantLock();
    private int value = 0;

    <T> T withCounter(Function<EquationCounter, T> conversion) {
        this.lock.lock();
        try {
            var scratch = new EquationCounter(this.value);
            var result = conversion.apply(scratch);
            log.debug("global counter {} -> {}", this.value, scratch.value());
            this.value = scratch.value();
            return result;
        } finally {
            this.lock.unlock();
        }
    }

    void reset() {
        this.lock.lock();
        try {
            log.debug("global counter reset from {}", this.value);
            this.value = 0;
        } finally {
            this.lock.unlock();
        }
    }

    int value() {
        this.lock.lock();
        try {
            return this.value;
        } finally {
            this.lock.unlock();
        }
    }
}
