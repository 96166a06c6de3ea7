package io.malicki.retrycommander.kafka.hook;

import io.malicki.retrycommander.kafka.retry.RetryableMessage;

import java.util.EnumSet;
import java.util.Set;

/**
 * Builds hooks from lambdas. The capability set is exactly the callbacks supplied.
 */
public final class RetryHooks {

    private RetryHooks() {
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @FunctionalInterface
    public interface MessageCallback {
        void accept(RetryableMessage message) throws Exception;
    }

    @FunctionalInterface
    public interface OutcomeCallback {
        void accept(RetryableMessage message, boolean success) throws Exception;
    }

    public static final class Builder {
        private final String name;
        private MessageCallback beforeRetry;
        private OutcomeCallback afterRetry;
        private MessageCallback beforeDlq;
        private MessageCallback afterDlq;

        private Builder(String name) {
            this.name = name;
        }

        public Builder beforeRetry(MessageCallback callback) {
            this.beforeRetry = callback;
            return this;
        }

        public Builder afterRetry(OutcomeCallback callback) {
            this.afterRetry = callback;
            return this;
        }

        public Builder beforeDlq(MessageCallback callback) {
            this.beforeDlq = callback;
            return this;
        }

        public Builder afterDlq(MessageCallback callback) {
            this.afterDlq = callback;
            return this;
        }

        public RetryHook build() {
            EnumSet<HookPoint> points = EnumSet.noneOf(HookPoint.class);
            if (beforeRetry != null) points.add(HookPoint.BEFORE_RETRY);
            if (afterRetry != null) points.add(HookPoint.AFTER_RETRY);
            if (beforeDlq != null) points.add(HookPoint.BEFORE_DLQ);
            if (afterDlq != null) points.add(HookPoint.AFTER_DLQ);
            return new LambdaHook(name, Set.copyOf(points), beforeRetry, afterRetry, beforeDlq, afterDlq);
        }
    }

    private static final class LambdaHook implements RetryHook {
        private final String name;
        private final Set<HookPoint> points;
        private final MessageCallback beforeRetry;
        private final OutcomeCallback afterRetry;
        private final MessageCallback beforeDlq;
        private final MessageCallback afterDlq;

        private LambdaHook(String name, Set<HookPoint> points,
                           MessageCallback beforeRetry, OutcomeCallback afterRetry,
                           MessageCallback beforeDlq, MessageCallback afterDlq) {
            this.name = name;
            this.points = points;
            this.beforeRetry = beforeRetry;
            this.afterRetry = afterRetry;
            this.beforeDlq = beforeDlq;
            this.afterDlq = afterDlq;
        }

        @Override
        public Set<HookPoint> hookPoints() {
            return points;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void beforeRetry(RetryableMessage message) throws Exception {
            beforeRetry.accept(message);
        }

        @Override
        public void afterRetry(RetryableMessage message, boolean success) throws Exception {
            afterRetry.accept(message, success);
        }

        @Override
        public void beforeDlq(RetryableMessage message) throws Exception {
            beforeDlq.accept(message);
        }

        @Override
        public void afterDlq(RetryableMessage message) throws Exception {
            afterDlq.accept(message);
        }
    }
}
