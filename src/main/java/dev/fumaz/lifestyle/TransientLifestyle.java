package dev.fumaz.lifestyle;

import dev.fumaz.lifestyle.provider.Provider;
import org.jetbrains.annotations.NotNull;

final class TransientLifestyle extends Lifestyle {

    TransientLifestyle() {
        super("Transient");
    }

    @Override
    protected int getLength() {
        return 1;
    }

    @Override
    protected <T> @NotNull Provider<T> createInstanceProvider(@NotNull Registration<T> registration,
                                                              @NotNull Provider<T> creator) {
        return creator;
    }
}
