package dk.cloudcreate.servicebus.common.transaction;

import org.jdbi.v3.core.Jdbi;

/**
 * {@link HandleAwareUnitOfWorkFactory} where the components in this library manually manage the {@link UnitOfWork}
 * and the underlying database transaction.<br>
 * Usage:
 * <pre>{@code
 * var unitOfWorkFactory = new JdbiUnitOfWorkFactory(Jdbi.create(dataSource));
 * unitOfWorkFactory.usingUnitOfWork(unitOfWork -> unitOfWork.handle().execute("..."));
 * }</pre>
 */
public class JdbiUnitOfWorkFactory extends GenericHandleAwareUnitOfWorkFactory<GenericHandleAwareUnitOfWorkFactory.GenericHandleAwareUnitOfWork> {
    public JdbiUnitOfWorkFactory(Jdbi jdbi) {
        super(jdbi);
    }

    @Override
    protected GenericHandleAwareUnitOfWork createNewUnitOfWorkInstance(GenericHandleAwareUnitOfWorkFactory<GenericHandleAwareUnitOfWork> unitOfWorkFactory) {
        return new GenericHandleAwareUnitOfWork(unitOfWorkFactory);
    }
}
