package dk.cloudcreate.servicebus.common.transaction;

import org.jdbi.v3.core.Jdbi;

/**
 * Specialization of {@link UnitOfWorkFactory} that creates and maintains {@link HandleAwareUnitOfWork}'s
 */
public interface HandleAwareUnitOfWorkFactory<UOW extends HandleAwareUnitOfWork> extends UnitOfWorkFactory<UOW> {
    /**
     * The {@link Jdbi} instance used to open the {@link org.jdbi.v3.core.Handle} of each {@link HandleAwareUnitOfWork}
     */
    Jdbi getJdbi();
}
