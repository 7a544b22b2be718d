package io.fullerstack.atom;

/**
 * What an atom does with a listener failure when it has no {@link ListenerErrorHandler}.
 *
 * <p>Configured with {@code atom.listener-failure.unhandled-policy}.
 */
public enum UnhandledFailurePolicy {

    /** Drop the failure silently. */
    DISCARD,

    /** Log the failure at WARN. */
    LOG,

    /** Keep the failure in a bounded queue, read with {@link Atom#drainFailures()}. */
    COLLECT,

    /** Refuse to create an atom without an error handler. */
    REQUIRE_HANDLER
}
