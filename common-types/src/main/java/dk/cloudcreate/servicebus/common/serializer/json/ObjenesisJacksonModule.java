package dk.cloudcreate.servicebus.common.serializer.json;

import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.deser.*;
import com.fasterxml.jackson.databind.module.SimpleModule;
import org.objenesis.*;
import org.objenesis.instantiator.ObjectInstantiator;

import java.lang.reflect.Modifier;
import java.util.concurrent.*;

/**
 * Jackson {@link com.fasterxml.jackson.databind.Module} that lets Jackson deserialize types that neither have a default constructor nor
 * a property based creator (e.g. immutable events, aggregates and sagas).<br>
 * Instances of such types are created using {@link Objenesis}, which doesn't call any constructor nor initialize any fields,
 * after which Jackson populates the fields from the JSON.
 */
public class ObjenesisJacksonModule extends SimpleModule {
    public ObjenesisJacksonModule() {
        super(ObjenesisJacksonModule.class.getSimpleName());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        context.addValueInstantiators(new ObjenesisValueInstantiators());
    }

    private static class ObjenesisValueInstantiators extends ValueInstantiators.Base {
        private final Objenesis                                      objenesis       = new ObjenesisStd();
        private final ConcurrentMap<Class<?>, ObjectInstantiator<?>> instantiatorMap = new ConcurrentHashMap<>();

        @Override
        public ValueInstantiator findValueInstantiator(DeserializationConfig config,
                                                       BeanDescription beanDesc,
                                                       ValueInstantiator defaultInstantiator) {
            var beanType = beanDesc.getBeanClass();
            if (defaultInstantiator.canCreateUsingDefault() ||
                    defaultInstantiator.canCreateFromObjectWith() ||
                    defaultInstantiator.canCreateUsingDelegate() ||
                    !isObjenesisCandidate(beanType)) {
                return defaultInstantiator;
            }
            return new ObjenesisValueInstantiator(beanType,
                                                  instantiatorMap.computeIfAbsent(beanType, objenesis::getInstantiatorOf));
        }

        private static boolean isObjenesisCandidate(Class<?> beanType) {
            return !beanType.isInterface() &&
                    !beanType.isArray() &&
                    !beanType.isPrimitive() &&
                    !beanType.isEnum() &&
                    !Modifier.isAbstract(beanType.getModifiers()) &&
                    !beanType.getName().startsWith("java.");
        }
    }

    private static class ObjenesisValueInstantiator extends ValueInstantiator.Base {
        private final ObjectInstantiator<?> objectInstantiator;

        private ObjenesisValueInstantiator(Class<?> type, ObjectInstantiator<?> objectInstantiator) {
            super(type);
            this.objectInstantiator = objectInstantiator;
        }

        @Override
        public boolean canCreateUsingDefault() {
            return true;
        }

        @Override
        public Object createUsingDefault(DeserializationContext ctxt) {
            return objectInstantiator.newInstance();
        }
    }
}
