/*
 * Copyright 2025 Netflix, Inc.
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
 */

package com.netflix.podlifetime.common.framework.scheduler.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import com.netflix.podlifetime.common.framework.scheduler.ExecutionContext;
import com.netflix.podlifetime.common.framework.scheduler.LocalScheduler;
import com.netflix.podlifetime.common.framework.scheduler.LocalSchedulerException;
import com.netflix.podlifetime.common.framework.scheduler.ScheduleReference;
import com.netflix.podlifetime.common.framework.scheduler.model.ScheduleDescriptor;
import com.netflix.podlifetime.common.util.Evaluators;
import com.netflix.podlifetime.common.util.retry.Retryer;
import com.netflix.podlifetime.common.util.time.Clock;
import com.netflix.spectator.api.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * {@link LocalScheduler} implementation which uses a single Reactor worker as a timer, and runs the actions on
 * the executors provided by the callers. Each schedule is a chain of one-shot timers, with the next one armed after
 * the current execution completes.
 */
public class DefaultLocalScheduler implements LocalScheduler {

    private static final Logger logger = LoggerFactory.getLogger(DefaultLocalScheduler.class);

    private final Clock clock;
    private final Scheduler.Worker worker;
    private final SchedulerMetrics metrics;

    private final ConcurrentMap<String, ScheduleHolder> activeHoldersById = new ConcurrentHashMap<>();

    public DefaultLocalScheduler(Scheduler timerScheduler, Clock clock, Registry registry) {
        this.clock = clock;
        this.worker = timerScheduler.createWorker();
        this.metrics = new SchedulerMetrics(registry);
    }

    public void shutdown() {
        new ArrayList<>(activeHoldersById.values()).forEach(ScheduleHolder::cancel);
        worker.dispose();
    }

    @Override
    public List<ScheduleReference> getActiveSchedules() {
        return new ArrayList<>(activeHoldersById.values());
    }

    @Override
    public Optional<ScheduleReference> findSchedule(String scheduleId) {
        return Optional.ofNullable(activeHoldersById.get(scheduleId));
    }

    @Override
    public ScheduleReference schedule(ScheduleDescriptor scheduleDescriptor, Consumer<ExecutionContext> action, ExecutorService executorService) {
        String scheduleId = UUID.randomUUID().toString();

        // Schedulers.fromExecutor does not interrupt running actions on dispose
        ScheduleHolder holder = new ScheduleHolder(scheduleId, scheduleDescriptor, action, Schedulers.fromExecutor(executorService));
        activeHoldersById.put(scheduleId, holder);
        logger.info("New schedule added: name={}, id={}, descriptor={}", scheduleDescriptor.getName(), scheduleId, scheduleDescriptor);

        holder.scheduleNext(scheduleDescriptor.getInitialDelay().toMillis());
        return holder;
    }

    @Override
    public void cancel(String scheduleId) {
        ScheduleHolder holder = activeHoldersById.get(scheduleId);
        if (holder == null) {
            throw LocalSchedulerException.scheduleNotFound(scheduleId);
        }
        holder.cancel();
    }

    private class ScheduleHolder implements ScheduleReference {

        private final String scheduleId;
        private final ScheduleDescriptor descriptor;
        private final Consumer<ExecutionContext> action;
        private final Scheduler actionScheduler;

        private final AtomicLong cycle = new AtomicLong();

        private volatile boolean closed;
        private volatile Retryer retryer;
        private volatile Disposable timerDisposable;

        private ScheduleHolder(String scheduleId,
                               ScheduleDescriptor descriptor,
                               Consumer<ExecutionContext> action,
                               Scheduler actionScheduler) {
            this.scheduleId = scheduleId;
            this.descriptor = descriptor;
            this.action = action;
            this.actionScheduler = actionScheduler;
        }

        @Override
        public String getScheduleId() {
            return scheduleId;
        }

        @Override
        public ScheduleDescriptor getDescriptor() {
            return descriptor;
        }

        @Override
        public boolean isClosed() {
            return closed;
        }

        @Override
        public void cancel() {
            if (closed) {
                return;
            }
            closed = true;
            Evaluators.acceptNotNull(timerDisposable, Disposable::dispose);
            activeHoldersById.remove(scheduleId);
            logger.info("Schedule cancelled: name={}, id={}", descriptor.getName(), scheduleId);
        }

        private void scheduleNext(long delayMs) {
            if (closed) {
                return;
            }
            try {
                this.timerDisposable = worker.schedule(this::runAction, delayMs, TimeUnit.MILLISECONDS);
            } catch (Exception e) {
                // Rejected after the worker is disposed.
                logger.warn("Cannot arm the next execution of schedule: name={}", descriptor.getName(), e);
            }
        }

        private void runAction() {
            if (closed) {
                return;
            }
            ExecutionContext context = ExecutionContext.newBuilder()
                    .withId(scheduleId)
                    .withCycle(cycle.getAndIncrement())
                    .withCancellationCheck(this::isClosed)
                    .build();
            long startTime = clock.wallTime();

            Mono.<Void>fromRunnable(() -> action.accept(context))
                    .subscribeOn(actionScheduler)
                    .timeout(descriptor.getTimeout(), Mono.error(() -> LocalSchedulerException.timeout(descriptor.getName())))
                    .subscribe(
                            next -> {
                            },
                            error -> onFailure(startTime, error),
                            () -> onSuccess(startTime)
                    );
        }

        private void onSuccess(long startTime) {
            metrics.onSuccess(descriptor, clock.wallTime() - startTime);
            this.retryer = null;
            scheduleNext(descriptor.getInterval().toMillis());
        }

        private void onFailure(long startTime, Throwable error) {
            logger.warn("Action execution error: name={}", descriptor.getName(), error);
            metrics.onFailure(descriptor, clock.wallTime() - startTime, error);

            Retryer nextRetryer = retryer == null ? descriptor.getRetryerSupplier().get() : retryer.retry();
            this.retryer = nextRetryer;
            scheduleNext(nextRetryer.getDelayMs().orElse(descriptor.getInterval().toMillis()));
        }
    }
}
