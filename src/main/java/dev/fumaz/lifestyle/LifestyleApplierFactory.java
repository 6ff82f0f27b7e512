package dev.fumaz.lifestyle;

import dev.fumaz.lifestyle.provider.Provider;
import org.jetbrains.annotations.NotNull;

/**
 * Builds the caching policy of a custom {@link Lifestyle}.
 * <p>
 * Called once for every registration that uses the lifestyle, so state captured by the returned provider
 * (counters, timestamps, locks) belongs to that registration alone.
 */
@FunctionalInterface
public interface LifestyleApplierFactory {

    /**
     * @param transientInstanceCreator creates a new instance on every call
     * @return the provider that decides when to call {@code transientInstanceCreator}
     */
    @NotNull Provider<Object> createApplier(@NotNull Provider<Object> transientInstanceCreator);

}
