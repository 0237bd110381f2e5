package com.vtb.discovery.modules;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Бюджет времени с флагом кооперативной отмены.
 * Дочерний дедлайн истекает не позже родителя и видит его отмену.
 */
public final class DiscoveryDeadline {

    private final LongSupplier nanoClock;
    private final long deadlineNanos;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final DiscoveryDeadline parent;

    private DiscoveryDeadline(LongSupplier nanoClock, long deadlineNanos, DiscoveryDeadline parent) {
        this.nanoClock = nanoClock;
        this.deadlineNanos = deadlineNanos;
        this.parent = parent;
    }

    public static DiscoveryDeadline after(Duration budget) {
        return after(budget, System::nanoTime);
    }

    static DiscoveryDeadline after(Duration budget, LongSupplier nanoClock) {
        long now = nanoClock.getAsLong();
        return new DiscoveryDeadline(nanoClock, now + saturatedNanos(budget), null);
    }

    /**
     * Дедлайн без ограничения по времени, только отмена
     */
    public static DiscoveryDeadline unbounded() {
        return new DiscoveryDeadline(System::nanoTime, Long.MAX_VALUE, null);
    }

    /**
     * Дочерний дедлайн: min(оставшееся у родителя, limit)
     */
    public DiscoveryDeadline child(Duration limit) {
        long now = nanoClock.getAsLong();
        long candidate = deadlineNanos == Long.MAX_VALUE
            ? now + saturatedNanos(limit)
            : Math.min(deadlineNanos, now + saturatedNanos(limit));
        return new DiscoveryDeadline(nanoClock, candidate, this);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }

    public boolean isExpired() {
        return isCancelled() || deadlineNanos != Long.MAX_VALUE && nanoClock.getAsLong() - deadlineNanos >= 0;
    }

    public Duration remaining() {
        if (isCancelled()) {
            return Duration.ZERO;
        }
        if (deadlineNanos == Long.MAX_VALUE) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        long left = deadlineNanos - nanoClock.getAsLong();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    /**
     * Таймаут операции ввода-вывода, не выходящий за дедлайн. Минимум 1 мс.
     */
    public int boundTimeoutMillis(int configuredMillis) {
        long remainingMs = remaining().toMillis();
        long bounded = Math.min(configuredMillis, remainingMs);
        return (int) Math.max(1L, bounded);
    }

    private static long saturatedNanos(Duration duration) {
        if (duration == null || duration.isNegative()) {
            return 0L;
        }
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE / 2;
        }
    }
}
