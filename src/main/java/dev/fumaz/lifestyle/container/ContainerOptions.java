package dev.fumaz.lifestyle.container;

import dev.fumaz.lifestyle.Lifestyle;
import dev.fumaz.lifestyle.reflection.ConstructionBehavior;
import dev.fumaz.lifestyle.reflection.ReflectiveConstructionBehavior;
import dev.fumaz.lifestyle.util.Requires;
import org.jetbrains.annotations.NotNull;

/**
 * Configuration object controlling how a {@link Container} registers and constructs services.
 */
public final class ContainerOptions {

    private final boolean allowOverridingRegistrations;
    private final Lifestyle defaultLifestyle;
    private final ConstructionBehavior constructionBehavior;

    private ContainerOptions(boolean allowOverridingRegistrations,
                             Lifestyle defaultLifestyle,
                             ConstructionBehavior constructionBehavior) {
        this.allowOverridingRegistrations = allowOverridingRegistrations;
        this.defaultLifestyle = defaultLifestyle;
        this.constructionBehavior = constructionBehavior;
    }

    public boolean isAllowOverridingRegistrations() {
        return allowOverridingRegistrations;
    }

    public @NotNull Lifestyle getDefaultLifestyle() {
        return defaultLifestyle;
    }

    public @NotNull ConstructionBehavior getConstructionBehavior() {
        return constructionBehavior;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ContainerOptions defaults() {
        return builder().build();
    }

    public static final class Builder {
        private boolean allowOverridingRegistrations = false;
        private Lifestyle defaultLifestyle = Lifestyle.TRANSIENT;
        private ConstructionBehavior constructionBehavior = new ReflectiveConstructionBehavior();

        public Builder allowOverridingRegistrations(boolean allowOverridingRegistrations) {
            this.allowOverridingRegistrations = allowOverridingRegistrations;
            return this;
        }

        public Builder defaultLifestyle(@NotNull Lifestyle defaultLifestyle) {
            this.defaultLifestyle = Requires.isNotNull(defaultLifestyle, "defaultLifestyle");
            return this;
        }

        public Builder constructionBehavior(@NotNull ConstructionBehavior constructionBehavior) {
            this.constructionBehavior = Requires.isNotNull(constructionBehavior, "constructionBehavior");
            return this;
        }

        public ContainerOptions build() {
            return new ContainerOptions(allowOverridingRegistrations, defaultLifestyle, constructionBehavior);
        }
    }
}
