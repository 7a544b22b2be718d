package io.fullerstack.atom;

import io.fullerstack.atom.config.AtomSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AtomsTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(AtomSettings.UNHANDLED_POLICY_KEY);
    }

    @Test
    void createUsesGeneratedName() {
        Atom<Integer> first = Atoms.create(1);
        Atom<Integer> second = Atoms.create(2);

        assertThat(first.name()).startsWith("atom-");
        assertThat(second.name()).startsWith("atom-").isNotEqualTo(first.name());
    }

    @Test
    void builderAppliesName() {
        Atom<String> atom = Atoms.builder("hello").name("greeting").build();

        assertThat(atom.name()).isEqualTo("greeting");
        assertThat(atom).hasToString("Atom[greeting]");
    }

    @Test
    void nullInitialValueIsRejected() {
        assertThatThrownBy(() -> Atoms.create(null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void blankNameIsRejected() {
        assertThatThrownBy(() -> Atoms.builder(1).name(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void requireHandlerPolicyRejectsAtomWithoutHandler() {
        assertThatThrownBy(() -> Atoms.builder(0)
            .unhandledFailurePolicy(UnhandledFailurePolicy.REQUIRE_HANDLER)
            .build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("error handler is required");
    }

    @Test
    void requireHandlerPolicyFromSystemProperty() {
        System.setProperty(AtomSettings.UNHANDLED_POLICY_KEY, "REQUIRE_HANDLER");

        assertThatThrownBy(() -> Atoms.create(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(Atoms.create(0, failure -> { }).get()).isZero();
    }

    @Test
    void collectPolicyKeepsFailuresForInspection() {
        Atom<Integer> atom = Atoms.builder(0)
            .unhandledFailurePolicy(UnhandledFailurePolicy.COLLECT)
            .failureCapacity(2)
            .build();
        atom.subscribe(v -> { throw new IllegalStateException("failed on " + v); });

        atom.set(1);
        atom.set(2);
        atom.set(3);

        List<ListenerFailure<Integer>> failures = atom.drainFailures();
        assertThat(failures).extracting(ListenerFailure::value).containsExactly(2, 3);
        assertThat(failures.get(0).cause()).hasMessage("failed on 2");
        assertThat(atom.drainFailures()).isEmpty();
    }

    @Test
    void discardIsTheDefaultPolicy() {
        Atom<Integer> atom = Atoms.create(0);
        atom.subscribe(v -> { throw new IllegalStateException("dropped"); });

        atom.set(1);

        assertThat(atom.get()).isEqualTo(1);
        assertThat(atom.drainFailures()).isEmpty();
    }

    @Test
    void identityEquivalenceSuppressesOnlySameReference() {
        AtomicInteger notifications = new AtomicInteger();
        String initial = new String("same");
        Atom<String> atom = Atoms.builder(initial).equivalence(Equivalence.identity()).build();
        atom.subscribe(v -> notifications.incrementAndGet());

        atom.set(initial);
        atom.set(new String("same"));

        assertThat(notifications.get()).isEqualTo(1);
    }

    @Test
    void neverEquivalenceNotifiesEveryWrite() {
        AtomicInteger notifications = new AtomicInteger();
        Atom<Integer> atom = Atoms.builder(5).equivalence(Equivalence.never()).build();
        atom.subscribe(v -> notifications.incrementAndGet());

        atom.set(5);
        atom.set(5);

        assertThat(notifications.get()).isEqualTo(2);
    }

    @Test
    void copierProtectsStoredValue() {
        Atom<List<Integer>> atom = Atoms.<List<Integer>>builder(new ArrayList<>(List.of(1, 2, 3)))
            .copier(ArrayList::new)
            .build();

        atom.get().add(4);

        assertThat(atom.get()).containsExactly(1, 2, 3);
    }

    @Test
    void copierDetachesValuesPassedToSet() {
        List<Integer> initial = new ArrayList<>(List.of(1));
        Atom<List<Integer>> atom = Atoms.<List<Integer>>builder(initial)
            .copier(ArrayList::new)
            .build();
        AtomicInteger notifications = new AtomicInteger();
        atom.subscribe(v -> notifications.incrementAndGet());
        initial.add(98);

        List<Integer> mine = new ArrayList<>(List.of(2));
        atom.set(mine);
        mine.add(99);

        assertThat(atom.get()).containsExactly(2);
        assertThat(notifications.get()).isEqualTo(1);
    }

    @Test
    void failedCopyOnSetIsNotRemembered() {
        AtomicInteger calls = new AtomicInteger();
        Atom<List<Integer>> atom = Atoms.<List<Integer>>builder(List.of(0))
            .copier(v -> {
                if (v.contains(7) && calls.getAndIncrement() == 0) {
                    throw new IllegalStateException("copy failed");
                }
                return List.copyOf(v);
            })
            .build();
        List<List<Integer>> seen = new ArrayList<>();
        atom.subscribe(seen::add);

        assertThatThrownBy(() -> atom.set(List.of(7)))
            .isInstanceOf(IllegalStateException.class);
        assertThat(atom.get()).containsExactly(0);
        assertThat(seen).isEmpty();

        atom.set(List.of(7));

        assertThat(seen).containsExactly(List.of(7));
    }

    @Test
    void settingsCanBeReplacedWholesale() {
        AtomSettings settings = AtomSettings.builder()
            .fairLock(true)
            .unhandledFailurePolicy(UnhandledFailurePolicy.COLLECT)
            .failureCapacity(1)
            .build();
        Atom<Integer> atom = Atoms.builder(0).settings(settings).build();
        atom.subscribe(v -> { throw new IllegalStateException("kept"); });

        atom.set(1);

        assertThat(atom.drainFailures()).hasSize(1);
    }
}
