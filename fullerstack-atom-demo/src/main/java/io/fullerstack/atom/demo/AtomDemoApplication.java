package io.fullerstack.atom.demo;

import io.fullerstack.atom.Atom;
import io.fullerstack.atom.Atoms;
import io.fullerstack.atom.Subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Atom Demo Application
 *
 * Walks a counter atom through its lifecycle:
 * - subscribe a listener and read the current value
 * - set, then update
 * - add a second listener for one write only (try-with-resources)
 * - unsubscribe the first listener; the last write reaches nobody
 */
public class AtomDemoApplication {

    private static final Logger logger = LoggerFactory.getLogger(AtomDemoApplication.class);

    /**
     * What the demo observed.
     *
     * @param finalValue   value of the counter at the end
     * @param mainObserved values seen by the long-lived listener
     * @param scopedObserved values seen by the scoped listener
     */
    public record DemoResult(int finalValue, List<Integer> mainObserved, List<Integer> scopedObserved) {
    }

    public static void main(String[] args) {
        DemoConfig config = DemoConfig.fromEnv();
        logger.info("Starting atom demo: initial={}, increment={}", config.initialValue(), config.increment());

        DemoResult result = run(config);

        logger.info("Demo finished: final value {}", result.finalValue());
    }

    public static DemoResult run(DemoConfig config) {
        List<Integer> mainObserved = new ArrayList<>();
        List<Integer> scopedObserved = new ArrayList<>();

        Atom<Integer> count = Atoms.builder(config.initialValue())
            .name("count")
            .errorHandler(failure -> logger.error("Listener error on '{}'", failure.atomName(), failure.cause()))
            .build();

        Subscription sub = count.subscribe(value -> {
            logger.info("count changed: {}", value);
            mainObserved.add(value);
        });

        logger.info("current value: {}", count.get());

        count.set(5);

        count.update(previous -> previous + config.increment());

        try (Subscription scoped = count.subscribe(value -> {
            logger.info("count changed (scoped listener): {}", value);
            scopedObserved.add(value);
        })) {
            count.set(3);
        }

        count.set(10);

        sub.unsubscribe();

        count.set(1);

        return new DemoResult(count.get(), List.copyOf(mainObserved), List.copyOf(scopedObserved));
    }
}
