package io.fullerstack.atom.config;

import io.fullerstack.atom.UnhandledFailurePolicy;

import lombok.Builder;
import lombok.Getter;

import java.util.Objects;

/**
 * Resolved per-atom settings.
 *
 * <p>{@link #defaults()} reads them from {@link AtomConfig#global()}; individual values
 * can then be overridden through {@link #toBuilder()}.
 */
@Getter
public final class AtomSettings {

    public static final String FAIR_LOCK_KEY = "atom.lock.fair";
    public static final String UNHANDLED_POLICY_KEY = "atom.listener-failure.unhandled-policy";
    public static final String FAILURE_CAPACITY_KEY = "atom.listener-failure.capacity";

    private final boolean fairLock;
    private final UnhandledFailurePolicy unhandledFailurePolicy;
    private final int failureCapacity;

    @Builder(toBuilder = true)
    private AtomSettings(boolean fairLock, UnhandledFailurePolicy unhandledFailurePolicy, int failureCapacity) {
        if (failureCapacity < 1) {
            throw new IllegalArgumentException("failureCapacity must be positive: " + failureCapacity);
        }
        this.fairLock = fairLock;
        this.unhandledFailurePolicy = Objects.requireNonNull(unhandledFailurePolicy, "unhandledFailurePolicy cannot be null");
        this.failureCapacity = failureCapacity;
    }

    public static AtomSettings defaults() {
        return from(AtomConfig.global());
    }

    /**
     * Reads settings from the given configuration, falling back to built-in defaults
     * for absent keys.
     *
     * @throws ConfigurationException if a present key holds an invalid value
     */
    public static AtomSettings from(AtomConfig config) {
        int capacity = config.getInt(FAILURE_CAPACITY_KEY, 256);
        if (capacity < 1) {
            throw new ConfigurationException(
                "Invalid value for key '" + FAILURE_CAPACITY_KEY + "': " + capacity + " (must be positive)"
            );
        }
        return AtomSettings.builder()
            .fairLock(config.getBoolean(FAIR_LOCK_KEY, false))
            .unhandledFailurePolicy(config.getEnum(UNHANDLED_POLICY_KEY, UnhandledFailurePolicy.class, UnhandledFailurePolicy.DISCARD))
            .failureCapacity(capacity)
            .build();
    }

    @Override
    public String toString() {
        return "AtomSettings[fairLock=" + fairLock
            + ", unhandledFailurePolicy=" + unhandledFailurePolicy
            + ", failureCapacity=" + failureCapacity + "]";
    }
}
