package dk.cloudcreate.servicebus.common.transaction;

import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Generic {@link HandleAwareUnitOfWorkFactory} that manages the {@link UnitOfWork} and the underlying database transaction
 * using {@link Jdbi}.<br>
 * The active {@link UnitOfWork} is associated with the thread that created it, and each {@link UnitOfWork} owns its own
 * {@link Handle} (and thereby its own database connection) from {@link UnitOfWork#start()} until it's committed or rolled back.
 *
 * @param <UOW> the concrete {@link HandleAwareUnitOfWork} type
 */
public abstract class GenericHandleAwareUnitOfWorkFactory<UOW extends HandleAwareUnitOfWork> implements HandleAwareUnitOfWorkFactory<UOW> {
    private static final Logger log = LoggerFactory.getLogger(GenericHandleAwareUnitOfWorkFactory.class);

    private final Jdbi            jdbi;
    private final ThreadLocal<UOW> unitsOfWork = new ThreadLocal<>();

    public GenericHandleAwareUnitOfWorkFactory(Jdbi jdbi) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
    }

    @Override
    public Jdbi getJdbi() {
        return jdbi;
    }

    @Override
    public UOW getRequiredUnitOfWork() {
        var unitOfWork = unitsOfWork.get();
        if (unitOfWork == null) {
            throw new NoActiveUnitOfWorkException();
        }
        return unitOfWork;
    }

    @Override
    public UOW getOrCreateNewUnitOfWork() {
        var unitOfWork = unitsOfWork.get();
        if (unitOfWork == null) {
            log.trace("Creating a new UnitOfWork");
            unitOfWork = createNewUnitOfWorkInstance(this);
            unitOfWork.start();
            unitsOfWork.set(unitOfWork);
        }
        return unitOfWork;
    }

    @Override
    public Optional<UOW> getCurrentUnitOfWork() {
        return Optional.ofNullable(unitsOfWork.get());
    }

    /**
     * Called by the {@link GenericHandleAwareUnitOfWork} when it has been committed or rolled back
     */
    protected void removeUnitOfWork() {
        log.trace("Removing the UnitOfWork associated with the current thread");
        unitsOfWork.remove();
    }

    /**
     * Create a new (not yet started) {@link UnitOfWork} instance
     *
     * @param unitOfWorkFactory this factory
     * @return the new {@link UnitOfWork} instance
     */
    protected abstract UOW createNewUnitOfWorkInstance(GenericHandleAwareUnitOfWorkFactory<UOW> unitOfWorkFactory);

    /**
     * {@link HandleAwareUnitOfWork} that drives a {@link Handle} transaction and calls the {@link UnitOfWorkLifecycleCallback}'s
     * registered with it.<br>
     * Subclasses can hook into the life cycle using {@link #beforeCommitting()}, {@link #afterCommitting()} and {@link #afterRollback(Exception)}
     */
    public static class GenericHandleAwareUnitOfWork implements HandleAwareUnitOfWork {
        private static final Logger log = LoggerFactory.getLogger(GenericHandleAwareUnitOfWork.class);

        private final GenericHandleAwareUnitOfWorkFactory<?>                  unitOfWorkFactory;
        private final Map<UnitOfWorkLifecycleCallback<Object>, List<Object>> unitOfWorkLifecycleCallbackResources;
        private       Handle                                                 handle;
        private       UnitOfWorkStatus                                       status;
        private       Exception                                              causeOfRollback;

        public GenericHandleAwareUnitOfWork(GenericHandleAwareUnitOfWorkFactory<?> unitOfWorkFactory) {
            this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
            this.unitOfWorkLifecycleCallbackResources = new LinkedHashMap<>();
            this.status = UnitOfWorkStatus.Ready;
        }

        @Override
        public void start() {
            if (status == UnitOfWorkStatus.Ready || status.isCompleted) {
                log.trace("Starting UnitOfWork with initial status {}", status);
                handle = unitOfWorkFactory.getJdbi().open();
                handle.begin();
                status = UnitOfWorkStatus.Started;
            } else if (status == UnitOfWorkStatus.Started) {
                log.warn("The UnitOfWork was already started");
            } else {
                close();
                throw new UnitOfWorkException(msg("Cannot start an UnitOfWork with status {}", status));
            }
        }

        @Override
        public void commit() {
            if (status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                log.debug("Rolling back the UnitOfWork instead of committing it as it was marked as rollback only");
                var cause = causeOfRollback;
                rollback(cause);
                throw new UnitOfWorkException(msg("Cannot commit the UnitOfWork as it was marked as rollback only{}",
                                                  cause != null ? " due to: " + cause.getMessage() : ""),
                                              cause);
            }
            if (status != UnitOfWorkStatus.Started) {
                throw new UnitOfWorkException(msg("Cannot commit an UnitOfWork with status {}", status));
            }

            beforeCommitting();
            unitOfWorkLifecycleCallbackResources.forEach((callback, resources) -> {
                log.trace("BeforeCommit for {} with {} associated resource(s)", callback.getClass().getName(), resources.size());
                callback.beforeCommit(this, resources);
            });

            try {
                handle.commit();
            } catch (RuntimeException e) {
                var unitOfWorkException = new UnitOfWorkException("Failed to commit the UnitOfWork", e);
                rollback(unitOfWorkException);
                throw unitOfWorkException;
            }
            status = UnitOfWorkStatus.Committed;
            close();
            log.debug("UnitOfWork committed");

            afterCommitting();
            unitOfWorkLifecycleCallbackResources.forEach((callback, resources) -> {
                try {
                    log.trace("AfterCommit for {} with {} associated resource(s)", callback.getClass().getName(), resources.size());
                    callback.afterCommit(this, resources);
                } catch (RuntimeException e) {
                    log.error(msg("{} failed during afterCommit", callback.getClass().getName()), e);
                }
            });
        }

        @Override
        public void rollback(Exception cause) {
            if (status.isCompleted) {
                log.debug("Ignoring rollback as the UnitOfWork has already been {}", status);
                return;
            }
            causeOfRollback = cause;
            unitOfWorkLifecycleCallbackResources.forEach((callback, resources) -> {
                try {
                    callback.beforeRollback(this, resources, cause);
                } catch (RuntimeException e) {
                    log.error(msg("{} failed during beforeRollback", callback.getClass().getName()), e);
                }
            });

            try {
                if (handle != null) {
                    handle.rollback();
                }
            } finally {
                status = UnitOfWorkStatus.RolledBack;
                close();
            }
            log.debug(msg("UnitOfWork rolled back{}", cause != null ? " due to: " + cause.getMessage() : ""));

            afterRollback(cause);
            unitOfWorkLifecycleCallbackResources.forEach((callback, resources) -> {
                try {
                    callback.afterRollback(this, resources, cause);
                } catch (RuntimeException e) {
                    log.error(msg("{} failed during afterRollback", callback.getClass().getName()), e);
                }
            });
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }

        @Override
        public Exception getCauseOfRollback() {
            return causeOfRollback;
        }

        @Override
        public void markAsRollbackOnly(Exception cause) {
            if (status.isCompleted) {
                throw new UnitOfWorkException(msg("Cannot mark an UnitOfWork with status {} as rollback only", status));
            }
            status = UnitOfWorkStatus.MarkedForRollbackOnly;
            causeOfRollback = cause;
        }

        @Override
        public Handle handle() {
            if (handle == null || status.isCompleted) {
                throw new UnitOfWorkException(msg("No active transaction. UnitOfWork has status {}", status));
            }
            return handle;
        }

        @SuppressWarnings("unchecked")
        @Override
        public <T> T registerLifecycleCallbackForResource(T resource, UnitOfWorkLifecycleCallback<T> associatedUnitOfWorkCallback) {
            requireNonNull(resource, "No resource provided");
            requireNonNull(associatedUnitOfWorkCallback, "No associatedUnitOfWorkCallback provided");
            unitOfWorkLifecycleCallbackResources.computeIfAbsent((UnitOfWorkLifecycleCallback<Object>) associatedUnitOfWorkCallback,
                                                                 callback -> new ArrayList<>())
                                                .add(resource);
            return resource;
        }

        /**
         * Called before the underlying transaction is committed
         */
        protected void beforeCommitting() {
        }

        /**
         * Called after the underlying transaction has been committed
         */
        protected void afterCommitting() {
        }

        /**
         * Called after the underlying transaction has been rolled back
         *
         * @param cause the cause of the rollback (may be null)
         */
        protected void afterRollback(Exception cause) {
        }

        private void close() {
            try {
                if (handle != null) {
                    handle.close();
                }
            } catch (RuntimeException e) {
                log.debug("Failed to close the UnitOfWork Handle", e);
            } finally {
                handle = null;
                unitOfWorkFactory.removeUnitOfWork();
            }
        }
    }
}
