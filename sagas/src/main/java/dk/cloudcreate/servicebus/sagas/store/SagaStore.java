package dk.cloudcreate.servicebus.sagas.store;

import dk.cloudcreate.servicebus.sagas.SagaId;

import java.util.Optional;

/**
 * Persistence of {@link SerializedSaga}'s.<br>
 * All writes happen within a {@link dk.cloudcreate.servicebus.common.transaction.UnitOfWork} and the <code>afterSaveHandler</code>
 * is called only after that {@link dk.cloudcreate.servicebus.common.transaction.UnitOfWork} has been committed.
 */
public interface SagaStore {
    /**
     * Store a new saga
     *
     * @throws DuplicateSagaIdException if a saga with the same identifier has already been stored
     */
    void save(SerializedSaga serializedSaga, Runnable afterSaveHandler);

    /**
     * Update an existing saga
     *
     * @throws SagaStoreException if the saga doesn't exist
     */
    void update(SerializedSaga serializedSaga, Runnable afterSaveHandler);

    Optional<SerializedSaga> load(SagaId id);
}
