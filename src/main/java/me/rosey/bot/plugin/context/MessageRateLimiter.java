package me.rosey.bot.plugin.context;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Token bucket bounding how many messages a plugin may publish per second.
 *
 * <p>
 * The bucket starts full with {@code messagesPerSecond} tokens and refills
 * continuously, lazily on each {@link #tryAcquire()} call. A limit of zero or
 * less disables limiting.
 */
public class MessageRateLimiter {

    private static final long NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final long capacity;
    private final LongSupplier nanoTime;
    private final AtomicLong tokens;
    private final AtomicLong lastRefillNanos;

    public MessageRateLimiter(int messagesPerSecond) {
        this(messagesPerSecond, System::nanoTime);
    }

    MessageRateLimiter(int messagesPerSecond, LongSupplier nanoTime) {
        this.capacity = Math.max(0, messagesPerSecond);
        this.nanoTime = nanoTime;
        this.tokens = new AtomicLong(capacity);
        this.lastRefillNanos = new AtomicLong(nanoTime.getAsLong());
    }

    public boolean isUnlimited() {
        return capacity == 0;
    }

    /**
     * Take one token.
     *
     * @return {@code false} when the plugin is over its rate
     */
    public synchronized boolean tryAcquire() {
        if (isUnlimited()) {
            return true;
        }
        refill();
        if (tokens.get() > 0) {
            tokens.decrementAndGet();
            return true;
        }
        return false;
    }

    /**
     * Milliseconds until the next token, 0 when one is available.
     */
    public synchronized long waitTimeMs() {
        if (isUnlimited()) {
            return 0;
        }
        refill();
        if (tokens.get() > 0) {
            return 0;
        }
        return TimeUnit.NANOSECONDS.toMillis(NANOS_PER_SECOND / capacity);
    }

    private void refill() {
        long now = nanoTime.getAsLong();
        long elapsedNanos = now - lastRefillNanos.get();
        if (elapsedNanos <= 0) {
            return;
        }
        long tokensToAdd = (elapsedNanos * capacity) / NANOS_PER_SECOND;
        if (tokensToAdd > 0) {
            tokens.set(Math.min(capacity, tokens.get() + tokensToAdd));
            lastRefillNanos.set(now);
        }
    }
}
