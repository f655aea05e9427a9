package com.factory.edge.r2dbc.service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * =====================================================================
 * SerialWriteLane
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Runs journal mutations strictly one after another, in submission order.
 *
 *   submit(task) ──▶ [ unicast queue ] ──concatMap──▶ task completes ──▶ next
 *
 * A task is subscribed only after the previous one has terminated, so reading
 * the chain tail and inserting the next row behave as one atomic step.
 *
 * Reads do not go through the lane.
 *
 * SHUTDOWN
 * --------
 * {@link #close(Duration)} stops accepting work, lets queued tasks finish and
 * waits (bounded) for the queue to drain.
 */
final class SerialWriteLane {

    private static final Logger log = LoggerFactory.getLogger(SerialWriteLane.class);

    private static final Duration EMIT_SPIN = Duration.ofSeconds(5);

    private final Sinks.Many<WriteTask<?>> queue = Sinks.many().unicast().onBackpressureBuffer();
    private final Sinks.Empty<Void> drained = Sinks.empty();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Scheduler scheduler;
    private final Disposable worker;

    SerialWriteLane(String name) {
        this.scheduler = Schedulers.newSingle(name);
        this.worker = queue.asFlux()
                .publishOn(scheduler)
                .concatMap(WriteTask::run)
                .subscribe(
                        v -> { },
                        e -> {
                            log.error("Write lane {} terminated unexpectedly", name, e);
                            drained.tryEmitEmpty();
                        },
                        drained::tryEmitEmpty);
    }

    /**
     * Queues {@code work}; the returned Mono completes with its outcome. Nothing
     * is queued until the returned Mono is subscribed.
     */
    <T> Mono<T> submit(Mono<T> work) {
        return Mono.defer(() -> {
            if (closed.get()) {
                return Mono.error(new JournalStorageException("Journal is closed"));
            }
            WriteTask<T> task = new WriteTask<>(work);
            try {
                queue.emitNext(task, Sinks.EmitFailureHandler.busyLooping(EMIT_SPIN));
            } catch (Sinks.EmissionException e) {
                return Mono.error(new JournalStorageException("Journal write queue rejected the task", e));
            }
            // hop off the lane thread so callers may block on the result
            return task.result.asMono().publishOn(Schedulers.boundedElastic());
        });
    }

    boolean isClosed() {
        return closed.get();
    }

    void close(Duration timeout) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        queue.tryEmitComplete();
        try {
            drained.asMono().block(timeout);
        } catch (IllegalStateException e) {
            log.warn("Journal write lane did not drain within {}", timeout);
        } finally {
            worker.dispose();
            scheduler.dispose();
        }
    }

    private static final class WriteTask<T> {

        private final Mono<T> work;
        private final Sinks.One<T> result = Sinks.one();

        WriteTask(Mono<T> work) {
            this.work = work;
        }

        Mono<Void> run() {
            return work
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .doOnNext(value -> {
                        if (value.isPresent()) {
                            result.tryEmitValue(value.get());
                        } else {
                            result.tryEmitEmpty();
                        }
                    })
                    .doOnError(result::tryEmitError)
                    .onErrorResume(e -> Mono.empty())
                    .then();
        }
    }
}
