/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.eventlog;

import io.nosqlbench.eventlog.kvp.Attributes;
import org.apache.logging.log4j.Level;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Brackets calls with {@link EventLog#start} and {@link EventLog#end} records, so a unit of
 * work is logged as an activity without start/end calls at every call site.
 *
 * <p>Each invocation writes {@code name.begin}, runs the wrapped code with its original
 * arguments, writes {@code name.end (seconds)} with the same attributes, and returns the
 * result unchanged. The wrapper keeps no state between invocations; concurrent invocations
 * each pair their own start and end.</p>
 *
 * <h2>Usage Examples</h2>
 *
 * <h3>Wrapping a Function</h3>
 * <pre>{@code
 * Function<Path, Dataset> load = events.wrap("load_dataset")
 *     .level(Level.DEBUG)
 *     .attributes(Attributes.of("source", "catalog"))
 *     .build()
 *     .wrapFunction(loader::load);
 *
 * Dataset ds = load.apply(path);
 * }</pre>
 *
 * <h3>One-off Invocation</h3>
 * <pre>{@code
 * ActivityWrapper activity = ActivityWrapper.builder(events, "compute_knn").build();
 * long[] neighbors = activity.invoke(() -> knn.compute(query));
 * }</pre>
 *
 * <h2>Failures</h2>
 * <p>With {@link FailureMode#PROPAGATE}, the default, a failure thrown by the wrapped code
 * is not caught: no end record is written for that invocation and the failure reaches the
 * caller unchanged. {@link FailureMode#RECORD_FAILURE} writes an end record with status
 * code {@value #STATUS_FAILED} and an {@value #ERROR_ATTRIBUTE} attribute before
 * rethrowing the same failure.</p>
 *
 * @see EventLog
 * @since 1.0.0
 */
public final class ActivityWrapper {

    /** Status code given to the end record of a failed invocation in {@link FailureMode#RECORD_FAILURE}. */
    public static final int STATUS_FAILED = 1;

    /** Attribute naming the failure's class in {@link FailureMode#RECORD_FAILURE}. */
    public static final String ERROR_ATTRIBUTE = "error";

    /**
     * What to do when the wrapped code throws.
     */
    public enum FailureMode {
        /** Write nothing more and let the failure propagate. */
        PROPAGATE,
        /** Write a failed end record, then let the failure propagate. */
        RECORD_FAILURE
    }

    private final EventLog eventLog;
    private final String name;
    private final Level level;
    private final Attributes attributes;
    private final FailureMode failureMode;

    private ActivityWrapper(Builder builder) {
        this.eventLog = builder.eventLog;
        this.name = builder.name;
        this.level = builder.level;
        this.attributes = builder.attributes;
        this.failureMode = builder.failureMode;
    }

    /**
     * @param eventLog where the start and end records go
     * @param name the activity name written on both records
     * @return a builder for the wrapper
     */
    public static Builder builder(EventLog eventLog, String name) {
        return new Builder(eventLog, name);
    }

    /**
     * Runs the callable once as a logged activity.
     *
     * @param callable the work to run
     * @param <T> the result type
     * @return whatever the callable returned
     * @throws Exception whatever the callable threw
     */
    public <T> T invoke(Callable<T> callable) throws Exception {
        return wrapCallable(callable).call();
    }

    public <T> Callable<T> wrapCallable(Callable<T> callable) {
        Objects.requireNonNull(callable, "callable");
        return () -> {
            Timestamp started = begin();
            T result;
            try {
                result = callable.call();
            } catch (Exception | Error failure) {
                failed(started, failure);
                throw failure;
            }
            completed(started);
            return result;
        };
    }

    public <T> Supplier<T> wrapSupplier(Supplier<T> supplier) {
        Objects.requireNonNull(supplier, "supplier");
        return () -> {
            Timestamp started = begin();
            T result;
            try {
                result = supplier.get();
            } catch (RuntimeException | Error failure) {
                failed(started, failure);
                throw failure;
            }
            completed(started);
            return result;
        };
    }

    public Runnable wrapRunnable(Runnable runnable) {
        Objects.requireNonNull(runnable, "runnable");
        return () -> {
            Timestamp started = begin();
            try {
                runnable.run();
            } catch (RuntimeException | Error failure) {
                failed(started, failure);
                throw failure;
            }
            completed(started);
        };
    }

    public <A, R> Function<A, R> wrapFunction(Function<A, R> function) {
        Objects.requireNonNull(function, "function");
        return argument -> {
            Timestamp started = begin();
            R result;
            try {
                result = function.apply(argument);
            } catch (RuntimeException | Error failure) {
                failed(started, failure);
                throw failure;
            }
            completed(started);
            return result;
        };
    }

    public String getName() {
        return name;
    }

    public Level getLevel() {
        return level;
    }

    public Attributes getAttributes() {
        return attributes;
    }

    public FailureMode getFailureMode() {
        return failureMode;
    }

    private Timestamp begin() {
        return eventLog.start(name, level, attributes);
    }

    private void completed(Timestamp started) {
        eventLog.end(name, started, level, EventLog.STATUS_OK, attributes);
    }

    /**
     * Writes the failed end record in {@link FailureMode#RECORD_FAILURE}. A failure while
     * writing it is attached to {@code failure} as suppressed, so the caller still sees the
     * original failure.
     */
    private void failed(Timestamp started, Throwable failure) {
        if (failureMode != FailureMode.RECORD_FAILURE) {
            return;
        }
        try {
            eventLog.end(name, started, level, STATUS_FAILED,
                attributes.with(ERROR_ATTRIBUTE, failure.getClass().getSimpleName()));
        } catch (RuntimeException recordFailure) {
            failure.addSuppressed(recordFailure);
        }
    }

    /**
     * Builder for {@link ActivityWrapper}.
     */
    public static final class Builder {
        private final EventLog eventLog;
        private final String name;
        private Level level;
        private Attributes attributes = Attributes.empty();
        private FailureMode failureMode = FailureMode.PROPAGATE;

        private Builder(EventLog eventLog, String name) {
            this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
            this.name = Objects.requireNonNull(name, "name");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Activity name must not be empty");
            }
        }

        /**
         * Sets the level of both records. Defaults to the event log's default level.
         */
        public Builder level(Level level) {
            this.level = level;
            return this;
        }

        /**
         * Sets the attributes written on both the start and the end record.
         */
        public Builder attributes(Attributes attributes) {
            this.attributes = Objects.requireNonNullElse(attributes, Attributes.empty());
            return this;
        }

        public Builder failureMode(FailureMode failureMode) {
            this.failureMode = Objects.requireNonNull(failureMode, "failureMode");
            return this;
        }

        public ActivityWrapper build() {
            return new ActivityWrapper(this);
        }
    }
}
