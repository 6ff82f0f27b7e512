package dev.fumaz.lifestyle;

import dev.fumaz.lifestyle.provider.Provider;
import dev.fumaz.lifestyle.provider.SingletonProvider;
import org.jetbrains.annotations.NotNull;

import java.util.logging.Level;
import java.util.logging.Logger;

final class SingletonLifestyle extends Lifestyle {

    private static final Logger LOGGER = Logger.getLogger(SingletonLifestyle.class.getName());

    SingletonLifestyle() {
        super("Singleton");
    }

    @Override
    protected int getLength() {
        return 1000;
    }

    @Override
    protected <T> @NotNull Provider<T> createInstanceProvider(@NotNull Registration<T> registration,
                                                              @NotNull Provider<T> creator) {
        return new SingletonProvider<>(() -> {
            try {
                return creator.provide();
            } catch (RuntimeException e) {
                LOGGER.log(Level.FINE, e, () -> "Singleton construction of " + registration.getServiceType().getName()
                        + " failed; the next request will retry");
                throw e;
            }
        });
    }
}
