package io.fullerstack.atom;

import io.fullerstack.atom.config.AtomSettings;
import io.fullerstack.atom.core.AtomImpl;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Entry point for creating {@link Atom}s.
 *
 * <p><strong>Usage:</strong>
 * <pre>
 * Atom&lt;Integer&gt; counter = Atoms.create(0, failure -&gt;
 *     log.warn("Listener failed", failure.cause()));
 *
 * Atom&lt;List&lt;String&gt;&gt; names = Atoms.builder(List.of("a"))
 *     .name("names")
 *     .copier(List::copyOf)
 *     .unhandledFailurePolicy(UnhandledFailurePolicy.LOG)
 *     .build();
 * </pre>
 *
 * <p>Settings not given to the builder come from {@link AtomSettings#defaults()}
 * ({@code atom.properties}, overridable with system properties).
 */
public final class Atoms {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private Atoms() {
    }

    /**
     * Creates an atom with default settings and no error handler.
     *
     * @throws IllegalArgumentException if the configured policy is
     *                                  {@link UnhandledFailurePolicy#REQUIRE_HANDLER}
     */
    public static <T> Atom<T> create(T initial) {
        return builder(initial).build();
    }

    /**
     * Creates an atom whose listener failures go to {@code errorHandler}.
     *
     * @param initial      the starting value
     * @param errorHandler receives listener failures, may be null
     */
    public static <T> Atom<T> create(T initial, ListenerErrorHandler<T> errorHandler) {
        return builder(initial).errorHandler(errorHandler).build();
    }

    public static <T> Builder<T> builder(T initial) {
        return new Builder<>(initial);
    }

    /**
     * Fluent configuration for a single atom.
     *
     * @param <T> the value type
     */
    public static final class Builder<T> {

        private final T initial;
        private String name;
        private ListenerErrorHandler<T> errorHandler;
        private Equivalence<? super T> equivalence = Equivalence.natural();
        private UnaryOperator<T> copier = UnaryOperator.identity();
        private AtomSettings.AtomSettingsBuilder settings;

        private Builder(T initial) {
            this.initial = Objects.requireNonNull(initial, "Initial value cannot be null");
        }

        /**
         * Name used in log output and failure records. Defaults to {@code atom-<n>}.
         */
        public Builder<T> name(String name) {
            Objects.requireNonNull(name, "name cannot be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name cannot be blank");
            }
            this.name = name;
            return this;
        }

        public Builder<T> errorHandler(ListenerErrorHandler<T> errorHandler) {
            this.errorHandler = errorHandler;
            return this;
        }

        /**
         * Change suppression strategy. Defaults to {@link Equivalence#natural()}.
         */
        public Builder<T> equivalence(Equivalence<? super T> equivalence) {
            this.equivalence = Objects.requireNonNull(equivalence, "equivalence cannot be null");
            return this;
        }

        /**
         * Applied to the initial value, to every value stored by a write, and to values handed
         * out by {@link Atom#get()}, to updaters and to listeners, for mutable value types.
         * Defaults to identity.
         */
        public Builder<T> copier(UnaryOperator<T> copier) {
            this.copier = Objects.requireNonNull(copier, "copier cannot be null");
            return this;
        }

        /**
         * Replaces every configured setting.
         */
        public Builder<T> settings(AtomSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings cannot be null").toBuilder();
            return this;
        }

        public Builder<T> fairLock(boolean fairLock) {
            settings().fairLock(fairLock);
            return this;
        }

        public Builder<T> unhandledFailurePolicy(UnhandledFailurePolicy policy) {
            settings().unhandledFailurePolicy(policy);
            return this;
        }

        public Builder<T> failureCapacity(int capacity) {
            settings().failureCapacity(capacity);
            return this;
        }

        private AtomSettings.AtomSettingsBuilder settings() {
            if (settings == null) {
                settings = AtomSettings.defaults().toBuilder();
            }
            return settings;
        }

        /**
         * @throws IllegalArgumentException if no error handler was given and the policy is
         *                                  {@link UnhandledFailurePolicy#REQUIRE_HANDLER}
         */
        public Atom<T> build() {
            AtomSettings resolved = settings().build();
            if (errorHandler == null
                && resolved.getUnhandledFailurePolicy() == UnhandledFailurePolicy.REQUIRE_HANDLER) {
                throw new IllegalArgumentException(
                    "An error handler is required (" + AtomSettings.UNHANDLED_POLICY_KEY + "=REQUIRE_HANDLER)"
                );
            }
            String resolvedName = name != null ? name : "atom-" + SEQUENCE.incrementAndGet();
            return new AtomImpl<>(resolvedName, initial, errorHandler, equivalence, copier, resolved);
        }
    }
}
