// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjil.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.vsjil.support.InstanceError;
import uk.co.farowl.vsjil.support.ReentrantInitialisationError;

/**
 * Test the accessors of {@link Local} from a single thread, in one or
 * two instances. Each test gets fresh instances, so the static slots
 * declared here start uninitialised in every test.
 */
@DisplayName("A Local")
class LocalTest {

    /** A counter, as in the simplest use. */
    static final Local<Integer> COUNTER = new Local<>(Integer.class);

    /** A slot with a fallible initialiser. */
    static final Local<Integer> FALLIBLE = new Local<>(Integer.class);

    /** A slot with no type information. */
    static final Local<List<String>> NAMES = new Local<>();

    Instance a, b;
    InstanceContext cxA, cxB;

    @BeforeEach
    void setUp() {
        a = new Instance("A");
        b = new Instance("B");
        cxA = a.context();
        cxB = b.context();
    }

    @AfterEach
    void tearDown() {
        a.close();
        b.close();
    }

    @Nested
    @DisplayName("before initialisation")
    class BeforeInit {

        @Test
        @DisplayName("get returns null")
        void getAbsent() {
            assertNull(COUNTER.get(cxA));
            assertNull(NAMES.get(cxA));
        }

        @Test
        @DisplayName("get does not initialise")
        void getDoesNotInit() {
            COUNTER.get(cxA);
            assertNull(COUNTER.get(cxA));
            assertEquals(0, a.size());
        }

        @Test
        @DisplayName("construction allocates no identity")
        void noIdentityYet() {
            Local<String> fresh = new Local<>(String.class);
            assertEquals("Local<String>[unresolved]", fresh.toString());
            long id = fresh.id();
            assertEquals("Local<String>[" + id + "]", fresh.toString());
        }
    }

    @Nested
    @DisplayName("when initialised with a producer")
    class InitWith {

        /** The scenario: store 42 in A, read it back, B sees nothing. */
        @Test
        @DisplayName("holds the value in that instance only")
        void counterScenario() {
            assertEquals(42, COUNTER.getOrInitWith(cxA, () -> 42));
            assertEquals(42, COUNTER.get(cxA));
            assertNull(COUNTER.get(cxB));
        }

        @Test
        @DisplayName("does not call the producer again")
        void producerCalledOnce() {
            AtomicInteger calls = new AtomicInteger();
            Integer first = COUNTER.getOrInitWith(cxA,
                    () -> 100 + calls.incrementAndGet());
            Integer second = COUNTER.getOrInitWith(cxA,
                    () -> 100 + calls.incrementAndGet());
            assertEquals(101, first);
            assertSame(first, second);
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("returns the same object every time")
        void sameObject() {
            List<String> names = NAMES.getOrInitWith(cxA, ArrayList::new);
            names.add("x");
            assertSame(names, NAMES.get(cxA));
            assertSame(names, NAMES.getOrInit(cxA, new ArrayList<>()));
            assertSame(names, NAMES.getOrInitWith(cxA, ArrayList::new));
            assertEquals(List.of("x"), NAMES.get(cxA));
        }

        @Test
        @DisplayName("is reached through any context of the instance")
        void anyContext() {
            Integer v = COUNTER.getOrInit(cxA, 7);
            assertSame(v, COUNTER.get(a.context()));
            assertSame(cxA.getInstance(), a);
        }

        @Test
        @DisplayName("each instance initialises separately")
        void separateInstances() {
            List<String> na = NAMES.getOrInitWith(cxA, ArrayList::new);
            List<String> nb = NAMES.getOrInitWith(cxB, ArrayList::new);
            assertNotNull(na);
            assertNotNull(nb);
            na.add("only in A");
            assertTrue(nb.isEmpty());
            assertEquals(1, a.size());
            assertEquals(1, b.size());
        }

        @Test
        @DisplayName("rejects a null value")
        void nullValue() {
            assertThrows(NullPointerException.class,
                    () -> COUNTER.getOrInitWith(cxA, () -> null));
            assertNull(COUNTER.get(cxA));
            assertThrows(NullPointerException.class,
                    () -> COUNTER.getOrInit(cxA, null));
            assertEquals(3, COUNTER.getOrInit(cxA, 3));
        }
    }

    @Nested
    @DisplayName("when initialised with a value")
    class InitValue {

        @Test
        @DisplayName("keeps the first value")
        void firstValueWins() {
            assertEquals(1, COUNTER.getOrInit(cxA, 1));
            assertEquals(1, COUNTER.getOrInit(cxA, 2));
            assertEquals(2, COUNTER.getOrInit(cxB, 2));
        }
    }

    @Nested
    @DisplayName("when initialised by a fallible initialiser")
    class TryInit {

        /**
         * The scenario: fail, then succeed with 7, then return 7
         * without calling the initialiser again.
         */
        @Test
        @DisplayName("is not poisoned by failure")
        void failThenSucceed() throws IOException {
            AtomicInteger calls = new AtomicInteger();
            Initialiser<Context, Integer, IOException> f = cx -> {
                if (calls.incrementAndGet() == 1) {
                    throw new IOException("first time");
                }
                return 7;
            };

            IOException e = assertThrows(IOException.class,
                    () -> FALLIBLE.getOrTryInit(cxA, f));
            assertEquals("first time", e.getMessage());
            assertNull(FALLIBLE.get(cxA));

            assertEquals(7, FALLIBLE.getOrTryInit(cxA, f));
            assertEquals(7, FALLIBLE.getOrTryInit(cxA, f));
            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("calls a failing initialiser every time")
        void alwaysFails() {
            AtomicInteger calls = new AtomicInteger();
            for (int i = 1; i <= 3; i++) {
                assertThrows(IOException.class,
                        () -> FALLIBLE.getOrTryInit(cxA, cx -> {
                            calls.incrementAndGet();
                            throw new IOException();
                        }));
                assertEquals(i, calls.get());
            }
            assertNull(FALLIBLE.get(cxA));
        }

        @Test
        @DisplayName("passes the context to the initialiser")
        void contextPassed() {
            InstanceContext[] seen = new InstanceContext[1];
            int v = FALLIBLE.getOrTryInit(cxB, cx -> {
                seen[0] = cx;
                return cx.getInstance().getName().length();
            });
            assertEquals(1, v);
            assertSame(cxB, seen[0]);
        }

        @Test
        @DisplayName("lets the initialiser use other slots")
        void usesOtherSlots() {
            int v = FALLIBLE.getOrTryInit(cxA,
                    cx -> COUNTER.getOrInit(cx, 20) + 1);
            assertEquals(21, v);
            assertEquals(20, COUNTER.get(cxA));
            assertNull(COUNTER.get(cxB));
        }

        @Test
        @DisplayName("propagates unchecked exceptions")
        void unchecked() {
            assertThrows(IllegalStateException.class,
                    () -> FALLIBLE.getOrTryInit(cxA, cx -> {
                        throw new IllegalStateException();
                    }));
            assertEquals(9, FALLIBLE.getOrInit(cxA, 9));
        }
    }

    @Nested
    @DisplayName("when re-entered during initialisation")
    class Reentrant {

        @Test
        @DisplayName("fails fast from getOrInitWith")
        void reenterWith() {
            ReentrantInitialisationError e = assertThrows(
                    ReentrantInitialisationError.class,
                    () -> COUNTER.getOrInitWith(cxA,
                            () -> COUNTER.getOrInitWith(cxA, () -> 1)));
            assertEquals(COUNTER.id(), e.getSlot());
            // The slot is not poisoned
            assertNull(COUNTER.get(cxA));
            assertEquals(2, COUNTER.getOrInit(cxA, 2));
        }

        @Test
        @DisplayName("fails fast from getOrTryInit")
        void reenterTry() {
            assertThrows(ReentrantInitialisationError.class,
                    () -> FALLIBLE.getOrTryInit(cxA,
                            cx -> FALLIBLE.getOrInit(cx, 1)));
            assertNull(FALLIBLE.get(cxA));
        }

        @Test
        @DisplayName("fails fast through another context")
        void reenterOtherContext() {
            assertThrows(ReentrantInitialisationError.class,
                    () -> COUNTER.getOrInitWith(cxA,
                            () -> COUNTER.getOrInitDefault(a.context())));
        }

        @Test
        @DisplayName("allows get, which sees no value")
        void getDuringInit() {
            Integer[] seen = {-1};
            COUNTER.getOrInitWith(cxA, () -> {
                seen[0] = COUNTER.get(cxA);
                return 5;
            });
            assertNull(seen[0]);
            assertEquals(5, COUNTER.get(cxA));
        }

        @Test
        @DisplayName("allows the same slot in another instance")
        void otherInstance() {
            int v = COUNTER.getOrInitWith(cxA,
                    () -> COUNTER.getOrInit(cxB, 3) * 2);
            assertEquals(6, v);
            assertEquals(3, COUNTER.get(cxB));
        }
    }

    @Nested
    @DisplayName("when initialised by default")
    class InitDefault {

        @Test
        @DisplayName("uses zero for a wrapped primitive")
        void zero() {
            assertEquals(0, COUNTER.getOrInitDefault(cxA));
            Local<Boolean> flag = new Local<>(Boolean.class);
            assertFalse(flag.getOrInitDefault(cxA));
            Local<String> text = new Local<>(String.class);
            assertEquals("", text.getOrInitDefault(cxA));
        }

        @Test
        @DisplayName("keeps a value already present")
        void existing() {
            COUNTER.getOrInit(cxA, 8);
            assertEquals(8, COUNTER.getOrInitDefault(cxA));
        }

        @Test
        @DisplayName("uses the supplier given")
        void supplier() {
            Local<Integer> x = new Local<>(() -> 11);
            assertEquals(11, x.getOrInitDefault(cxA));
            Local<Integer> y = new Local<>(Integer.class, () -> 12);
            assertEquals(12, y.getOrInitDefault(cxA));
        }

        @Test
        @DisplayName("uses the constructor of a class")
        void constructor() {
            Local<Tally> tally = new Local<>(Tally.class);
            Tally t = tally.getOrInitDefault(cxA);
            t.count += 1;
            assertSame(t, tally.getOrInitDefault(cxA));
            assertEquals(1, tally.get(cxA).count);
            assertNotEquals(t, tally.getOrInitDefault(cxB));
        }

        @Test
        @DisplayName("fails when there is no rule")
        void noRule() {
            assertThrows(InstanceError.class,
                    () -> NAMES.getOrInitDefault(cxA));
            Local<Thread.State> state = new Local<>(Thread.State.class);
            assertThrows(InstanceError.class,
                    () -> state.getOrInitDefault(cxA));
            assertNull(state.get(cxA));
        }

        @Test
        @DisplayName("keeps a value present when there is no rule")
        void existingNoRule() {
            List<String> names = new ArrayList<>();
            NAMES.getOrInit(cxA, names);
            assertSame(names, NAMES.getOrInitDefault(cxA));
            Local<Thread.State> state = new Local<>(Thread.State.class);
            state.getOrInit(cxA, Thread.State.NEW);
            assertEquals(Thread.State.NEW, state.getOrInitDefault(cxA));
        }

        @Test
        @DisplayName("treats a primitive class as its wrapper")
        void primitive() {
            Local<Integer> i = new Local<>(int.class);
            assertEquals(5, i.getOrInit(cxA, 5));
            assertEquals(5, i.get(cxA));
            assertEquals(0, i.getOrInitDefault(cxB));
            Local<Long> n = new Local<>(long.class);
            assertEquals(0L, n.getOrInitDefault(cxA));
        }
    }

    @Nested
    @DisplayName("when misused")
    class Misuse {

        @Test
        @DisplayName("detects a value of the wrong type")
        @SuppressWarnings({"unchecked", "rawtypes"})
        void wrongType() {
            Local<Integer> typed = new Local<>(Integer.class);
            Local raw = typed;
            assertThrows(InstanceError.class,
                    () -> raw.getOrInit(cxA, "not a number"));
            // The value was stored before the check caught it.
            assertThrows(InstanceError.class, () -> typed.get(cxA));
        }

        @Test
        @DisplayName("cannot be used in a closed instance")
        void closed() {
            COUNTER.getOrInit(cxA, 1);
            a.close();
            assertTrue(a.isClosed());
            assertThrows(InstanceError.class, () -> COUNTER.get(cxA));
            assertThrows(InstanceError.class,
                    () -> COUNTER.getOrInit(cxA, 2));
            // Closing again is harmless and B is unaffected
            a.close();
            assertEquals(4, COUNTER.getOrInit(cxB, 4));
        }
    }

    /** A class with a public constructor taking no arguments. */
    public static class Tally {
        int count;

        public Tally() {}
    }
}
