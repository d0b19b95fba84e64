package com.sandy.fleet.view.service.impl;

import com.sandy.fleet.view.service.SubscriptionState;
import com.sandy.fleet.view.transport.RpcError;
import com.sandy.fleet.view.transport.StatusCode;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.subscription.MultiEmitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ManagedSubscriptionTest {

    ManagedSubscription subscription;
    List<String> data;
    List<Throwable> errors;

    @BeforeEach
    void init() {
        subscription = new ManagedSubscription("test");
        data = new ArrayList<>();
        errors = new ArrayList<>();
    }

    @Test
    void callFailingWhileStartingKeepsNoHandle() {
        RpcError error = new RpcError(StatusCode.UNAVAILABLE, "no transport");
        subscription.start(Multi.createFrom().<String>failure(error), data::add, errors::add);

        assertEquals(SubscriptionState.ERRORED, subscription.state());
        assertEquals(List.of(error), errors);
        assertFalse(subscription.holdsCall());
        subscription.stop();
        assertEquals(SubscriptionState.ERRORED, subscription.state());
    }

    @Test
    void streamCompletingWhileStartingKeepsNoHandle() {
        subscription.start(Multi.createFrom().items("a", "b"), data::add, errors::add);

        assertEquals(List.of("a", "b"), data);
        assertEquals(SubscriptionState.COMPLETED, subscription.state());
        assertFalse(subscription.holdsCall());
    }

    @Test
    void activeStreamIsCancelledOnStop() {
        AtomicInteger terminated = new AtomicInteger();
        subscription.start(Multi.createFrom().<String>emitter(em -> em.onTermination(terminated::incrementAndGet)),
                data::add, errors::add);
        assertEquals(SubscriptionState.ACTIVE, subscription.state());
        assertTrue(subscription.holdsCall());

        subscription.stop();
        subscription.stop();
        assertEquals(SubscriptionState.CANCELLED, subscription.state());
        assertEquals(1, terminated.get());
        assertFalse(subscription.holdsCall());
    }

    @Test
    void signalsOfReplacedStreamAreIgnored() {
        List<MultiEmitter<? super String>> emitters = new ArrayList<>();
        Multi<String> stream = Multi.createFrom().emitter(emitters::add);
        subscription.start(stream, data::add, errors::add);
        subscription.start(stream, data::add, errors::add);
        assertEquals(2, emitters.size());

        emitters.get(0).emit("stale");
        emitters.get(0).fail(new RpcError(StatusCode.INTERNAL, "stale"));
        emitters.get(1).emit("fresh");

        assertEquals(List.of("fresh"), data);
        assertTrue(errors.isEmpty());
        assertEquals(SubscriptionState.ACTIVE, subscription.state());
        subscription.stop();
    }
}
