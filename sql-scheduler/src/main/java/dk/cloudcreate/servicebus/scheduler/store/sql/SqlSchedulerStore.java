package dk.cloudcreate.servicebus.scheduler.store.sql;

import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import dk.cloudcreate.servicebus.common.Lifecycle;
import dk.cloudcreate.servicebus.common.transaction.*;
import dk.cloudcreate.servicebus.scheduler.*;
import dk.cloudcreate.servicebus.scheduler.store.SchedulerStore;
import org.jdbi.v3.core.Handle;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * SQL based {@link SchedulerStore}.<br>
 * The command of each {@link ScheduledOperation} is stored as a base64 encoded payload produced by the {@link ScheduledCommandSerializer}.
 * <p>
 * Every change (add, remove or extract) is followed by {@link #fetchNextOperation(HandleAwareUnitOfWork)} in the same {@link UnitOfWork},
 * which claims the earliest unsent operation by flipping its <code>is_sent</code> flag from 0 to 1.
 * Only the writer whose conditional update changed the row announces it as the next operation.<br>
 * The post callbacks are called after the {@link UnitOfWork} has been committed, using the configured {@link Executor}.
 * <p>
 * The store is started when it's created. {@link #stop()} shuts down the callback executor if the store created it
 * (callbacks already handed to it still run), an {@link Executor} provided by the caller is left untouched.
 * A stopped store rejects add, remove and extract until it's started again.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class SqlSchedulerStore implements SchedulerStore, Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(SqlSchedulerStore.class);

    public static final String   DEFAULT_SCHEDULER_TABLE_NAME = "scheduler_registry";
    static final        Duration STOP_TIMEOUT                 = Duration.ofSeconds(5);

    private final HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory;
    private final ScheduledCommandSerializer                                    commandSerializer;
    private final boolean                                                       ownsCallbackExecutor;
    private final String                                                        schedulerTableName;
    private final PostCommitCallbacks                                           postCommitCallbacks = new PostCommitCallbacks();
    private volatile Executor                                                   callbackExecutor;
    private volatile boolean                                                    started;

    /**
     * Create a store that runs the post callbacks on its own daemon thread, which is shut down by {@link #stop()}
     *
     * @param unitOfWorkFactory the unit of work factory
     */
    public SqlSchedulerStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory) {
        this(unitOfWorkFactory,
             new ScheduledCommandSerializer(),
             createCallbackExecutor(),
             true,
             Optional.empty());
    }

    /**
     * @param unitOfWorkFactory  the unit of work factory
     * @param commandSerializer  the serializer for the scheduled commands
     * @param callbackExecutor   the executor that runs the post callbacks after commit
     * @param schedulerTableName the optional name of the scheduler table (default {@value #DEFAULT_SCHEDULER_TABLE_NAME})
     */
    public SqlSchedulerStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory,
                             ScheduledCommandSerializer commandSerializer,
                             Executor callbackExecutor,
                             Optional<String> schedulerTableName) {
        this(unitOfWorkFactory, commandSerializer, callbackExecutor, false, schedulerTableName);
    }

    private SqlSchedulerStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory,
                              ScheduledCommandSerializer commandSerializer,
                              Executor callbackExecutor,
                              boolean ownsCallbackExecutor,
                              Optional<String> schedulerTableName) {
        this.ownsCallbackExecutor = ownsCallbackExecutor;
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.commandSerializer = requireNonNull(commandSerializer, "No commandSerializer provided");
        this.callbackExecutor = requireNonNull(callbackExecutor, "No callbackExecutor provided");
        this.schedulerTableName = requireNonNull(schedulerTableName, "No schedulerTableName option provided").orElse(DEFAULT_SCHEDULER_TABLE_NAME);
        try {
            unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
                unitOfWork.handle().execute(bind("CREATE TABLE IF NOT EXISTS {:schedulerTable} (\n" +
                                                         "  id VARCHAR(255) NOT NULL PRIMARY KEY,\n" +
                                                         "  processing_date TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                                         "  command TEXT NOT NULL,\n" +
                                                         "  is_sent INTEGER NOT NULL DEFAULT 0\n" +
                                                         ")",
                                                 arg("schedulerTable", this.schedulerTableName)));
                unitOfWork.handle().execute(bind("CREATE INDEX IF NOT EXISTS {:schedulerTable}_processing_date_idx ON {:schedulerTable} (processing_date, is_sent)",
                                                 arg("schedulerTable", this.schedulerTableName)));
                log.info("Initialized scheduler table '{}'", this.schedulerTableName);
            });
        } catch (RuntimeException e) {
            if (ownsCallbackExecutor) {
                ((ExecutorService) callbackExecutor).shutdownNow();
            }
            throw e;
        }
        started = true;
    }

    private static ExecutorService createCallbackExecutor() {
        return Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                                                         .nameFormat("Scheduler-PostCommit-%d")
                                                         .daemon(true)
                                                         .build());
    }

    @Override
    public void start() {
        if (!started) {
            log.info("[{}] Starting SqlSchedulerStore", schedulerTableName);
            if (ownsCallbackExecutor) {
                callbackExecutor = createCallbackExecutor();
            }
            started = true;
        }
    }

    @Override
    public void stop() {
        if (started) {
            log.info("[{}] Stopping SqlSchedulerStore", schedulerTableName);
            started = false;
            if (ownsCallbackExecutor) {
                var executorService = (ExecutorService) callbackExecutor;
                executorService.shutdown();
                try {
                    if (!executorService.awaitTermination(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                        log.warn("[{}] Post commit callbacks didn't finish within {}", schedulerTableName, STOP_TIMEOUT);
                        executorService.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    executorService.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
            log.info("[{}] SqlSchedulerStore stopped", schedulerTableName);
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public void add(ScheduledOperation operation, PostAdd postAdd) {
        requireNonNull(operation, "No operation provided");
        requireNonNull(postAdd, "No postAdd callback provided");
        requireStarted();
        var command = Base64.getEncoder().encodeToString(commandSerializer.serialize(operation.command));
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            unitOfWork.handle()
                      .createUpdate(bind("INSERT INTO {:schedulerTable} (id, processing_date, command, is_sent) " +
                                                 "VALUES (:id, :processingDate, :command, :isSent)",
                                         arg("schedulerTable", schedulerTableName)))
                      .bind("id", operation.id.toString())
                      .bind("processingDate", operation.date)
                      .bind("command", command)
                      .bind("isSent", operation.isSent ? 1 : 0)
                      .execute();
            log.debug("[{}:{}] Added operation due at {}", schedulerTableName, operation.id, operation.date);

            var nextOperation = fetchNextOperation(unitOfWork);
            Runnable postCommitCallback = () -> postAdd.added(operation, nextOperation);
            unitOfWork.registerLifecycleCallbackForResource(postCommitCallback, postCommitCallbacks);
        });
    }

    @Override
    public void remove(ScheduledOperationId id, PostRemove postRemove) {
        requireNonNull(id, "No id provided");
        requireNonNull(postRemove, "No postRemove callback provided");
        requireStarted();
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var rowsDeleted = deleteOperation(unitOfWork.handle(), id);
            log.debug("[{}:{}] Removed {} operation(s)", schedulerTableName, id, rowsDeleted);

            var nextOperation = fetchNextOperation(unitOfWork);
            Runnable postCommitCallback = () -> postRemove.removed(nextOperation);
            unitOfWork.registerLifecycleCallbackForResource(postCommitCallback, postCommitCallbacks);
        });
    }

    @Override
    public void extract(ScheduledOperationId id, PostExtract postExtract) {
        requireNonNull(id, "No id provided");
        requireNonNull(postExtract, "No postExtract callback provided");
        requireStarted();
        var operation = load(id).orElseThrow(() -> new ScheduledOperationNotFoundException(msg("Operation with ID \"{}\" not found", id)));

        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            // Another writer may have extracted or removed the operation after it was loaded
            if (deleteOperation(unitOfWork.handle(), id) != 1) {
                throw new ScheduledOperationNotFoundException(msg("Operation with ID \"{}\" not found", id));
            }
            log.debug("[{}:{}] Extracted operation due at {}", schedulerTableName, id, operation.date);

            var nextOperation = fetchNextOperation(unitOfWork);
            Runnable postCommitCallback = () -> postExtract.extracted(operation, nextOperation);
            unitOfWork.registerLifecycleCallbackForResource(postCommitCallback, postCommitCallbacks);
        });
    }

    /**
     * Reads the operation directly from a {@link Handle}, i.e. outside any {@link UnitOfWork}
     */
    @Override
    public Optional<ScheduledOperation> load(ScheduledOperationId id) {
        requireNonNull(id, "No id provided");
        return unitOfWorkFactory.getJdbi()
                                .withHandle(handle -> handle.createQuery(bind("SELECT id, processing_date, command, is_sent FROM {:schedulerTable} WHERE id = :id",
                                                                              arg("schedulerTable", schedulerTableName)))
                                                            .bind("id", id.toString())
                                                            .map(row -> new ScheduledOperation(ScheduledOperationId.of(row.getColumn("id", String.class)),
                                                                                               row.getColumn("processing_date", OffsetDateTime.class),
                                                                                               commandSerializer.deserialize(Base64.getDecoder().decode(row.getColumn("command", String.class))),
                                                                                               row.getColumn("is_sent", Integer.class) == 1))
                                                            .findOne());
    }

    /**
     * Find the unsent operation with the earliest date and claim it by setting <code>is_sent</code> to 1.<br>
     * The operation is only returned if this {@link UnitOfWork} changed the flag. If another writer claimed (or deleted)
     * the row first, no operation is returned.
     *
     * @param unitOfWork the active unit of work, which holds the row lock until it's committed or rolled back
     * @return the claimed operation or {@link Optional#empty()}
     */
    Optional<NextScheduledOperation> fetchNextOperation(HandleAwareUnitOfWork unitOfWork) {
        var handle = unitOfWork.handle();
        var candidate = handle.createQuery(bind("SELECT id, processing_date FROM {:schedulerTable} WHERE is_sent = 0 " +
                                                        "ORDER BY processing_date ASC LIMIT 1 FOR UPDATE",
                                                arg("schedulerTable", schedulerTableName)))
                              .map(row -> new NextScheduledOperation(ScheduledOperationId.of(row.getColumn("id", String.class)),
                                                                     toUTC(row.getColumn("processing_date", OffsetDateTime.class))))
                              .findOne();
        if (candidate.isEmpty()) {
            log.trace("[{}] No unsent operation found", schedulerTableName);
            return Optional.empty();
        }

        var rowsUpdated = handle.createUpdate(bind("UPDATE {:schedulerTable} SET is_sent = 1 WHERE id = :id AND is_sent = 0",
                                                   arg("schedulerTable", schedulerTableName)))
                                .bind("id", candidate.get().id.toString())
                                .execute();
        if (rowsUpdated != 1) {
            log.debug("[{}:{}] Operation was claimed by another writer", schedulerTableName, candidate.get().id);
            return Optional.empty();
        }
        log.debug("[{}:{}] Next operation is due at {}", schedulerTableName, candidate.get().id, candidate.get().date);
        return candidate;
    }

    private int deleteOperation(Handle handle, ScheduledOperationId id) {
        return handle.createUpdate(bind("DELETE FROM {:schedulerTable} WHERE id = :id",
                                        arg("schedulerTable", schedulerTableName)))
                     .bind("id", id.toString())
                     .execute();
    }

    private static OffsetDateTime toUTC(OffsetDateTime timestamp) {
        return timestamp.withOffsetSameInstant(ZoneOffset.UTC);
    }

    private void requireStarted() {
        if (!started) {
            throw new IllegalStateException(msg("[{}] The SqlSchedulerStore is stopped", schedulerTableName));
        }
    }

    public String getSchedulerTableName() {
        return schedulerTableName;
    }

    Executor getCallbackExecutor() {
        return callbackExecutor;
    }

    private class PostCommitCallbacks implements UnitOfWorkLifecycleCallback<Runnable> {
        @Override
        public void afterCommit(UnitOfWork unitOfWork, List<Runnable> associatedResources) {
            for (var callback : associatedResources) {
                try {
                    callbackExecutor.execute(() -> {
                        try {
                            callback.run();
                        } catch (RuntimeException e) {
                            log.error(msg("[{}] Post commit callback failed", schedulerTableName), e);
                        }
                    });
                } catch (RejectedExecutionException e) {
                    log.error(msg("[{}] Post commit callback was rejected as the SqlSchedulerStore is stopped", schedulerTableName), e);
                }
            }
        }
    }
}
