package io.fullerstack.atom.dispatch;

import io.fullerstack.atom.ListenerErrorHandler;
import io.fullerstack.atom.ListenerFailure;
import io.fullerstack.atom.UnhandledFailurePolicy;
import io.fullerstack.atom.cell.Registration;
import io.fullerstack.atom.cell.Snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Delivers a {@link Snapshot} to its listeners, one at a time, on the calling thread.
 *
 * <p>Must be called after the atom's lock has been released. Each listener call is isolated:
 * an {@link Exception} thrown by one listener is caught, routed as a {@link ListenerFailure},
 * and the remaining listeners are still notified. {@link Error}s are not caught.
 *
 * <p><b>Failure routing:</b>
 * <ul>
 *   <li>With an error handler: the handler gets the failure. If the handler itself throws,
 *       that is logged at ERROR.</li>
 *   <li>Without one: the {@link UnhandledFailurePolicy} decides.</li>
 * </ul>
 *
 * @param <T> the value type
 */
public final class NotificationDispatcher<T> {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final String atomName;
    private final ListenerErrorHandler<T> errorHandler;
    private final UnhandledFailurePolicy unhandledPolicy;
    private final FailureQueue<T> failures;

    /**
     * @param atomName        name reported in failures and log output
     * @param errorHandler    receives listener failures, may be null
     * @param unhandledPolicy applies when errorHandler is null
     * @param failureCapacity size of the queue used by {@link UnhandledFailurePolicy#COLLECT}
     */
    public NotificationDispatcher(String atomName,
                                  ListenerErrorHandler<T> errorHandler,
                                  UnhandledFailurePolicy unhandledPolicy,
                                  int failureCapacity) {
        this.atomName = Objects.requireNonNull(atomName, "Atom name cannot be null");
        this.errorHandler = errorHandler;
        this.unhandledPolicy = Objects.requireNonNull(unhandledPolicy, "Unhandled policy cannot be null");
        this.failures = new FailureQueue<>(failureCapacity);
    }

    public void dispatch(Snapshot<T> snapshot) {
        T value = snapshot.value();
        for (Registration<T> registration : snapshot.registrations()) {
            try {
                registration.listener().accept(value);
            } catch (Exception e) {
                handle(new ListenerFailure<>(atomName, registration.id(), value, e));
            }
        }
    }

    private void handle(ListenerFailure<T> failure) {
        if (errorHandler != null) {
            try {
                errorHandler.onListenerError(failure);
            } catch (Exception handlerError) {
                logger.error("Error handler of atom '{}' failed while handling listener {}",
                    atomName, failure.listenerId(), handlerError);
            }
            return;
        }

        switch (unhandledPolicy) {
            case DISCARD -> {
            }
            case COLLECT -> {
                if (failures.offer(failure)) {
                    logger.debug("Failure queue of atom '{}' full, dropped oldest failure ({} dropped so far)",
                        atomName, failures.droppedCount());
                }
            }
            // REQUIRE_HANDLER atoms always have a handler; log if one slips through
            case LOG, REQUIRE_HANDLER -> logger.warn("Listener {} of atom '{}' failed on value {}",
                failure.listenerId(), atomName, failure.value(), failure.cause());
        }
    }

    /**
     * Removes and returns collected failures. Empty unless the policy is
     * {@link UnhandledFailurePolicy#COLLECT} and no error handler is set.
     */
    public List<ListenerFailure<T>> drainFailures() {
        return failures.drain();
    }
}
