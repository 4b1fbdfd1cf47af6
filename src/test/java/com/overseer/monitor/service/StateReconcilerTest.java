package com.overseer.monitor.service;

import com.overseer.monitor.domain.MachineState;
import com.overseer.monitor.domain.MachineStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class StateReconcilerTest {

    private StateReconciler reconciler;
    private final List<MachineStatus> delivered = new ArrayList<>();

    @BeforeEach
    void setUp() {
        reconciler = new StateReconciler();
        reconciler.registerSubscriber(delivered::add);
    }

    @Test
    void last_accepted_status_wins() {
        reconciler.activate(1, 1);
        MachineStatus last = null;
        for (int i = 0; i <= 10; i++) {
            last = status(1, MachineState.OPERATIONAL, i / 10.0);
            assertThat(reconciler.accept(1, 1, last)).isTrue();
        }

        assertThat(reconciler.current(1)).containsSame(last);
    }

    @Test
    void nothing_is_accepted_before_activation() {
        assertThat(reconciler.accept(5, 1, status(5, MachineState.IDLE, 0))).isFalse();
        assertThat(reconciler.current(5)).isEmpty();
        assertThat(delivered).isEmpty();
    }

    @Test
    void delayed_status_from_previous_generation_is_dropped() {
        MachineStatus a = status(1, MachineState.OPERATIONAL, 0.4);
        MachineStatus c = status(1, MachineState.IDLE, 0.0);
        MachineStatus b = status(1, MachineState.OPERATIONAL, 0.5);

        reconciler.activate(1, 1);
        reconciler.accept(1, 1, a);
        reconciler.retire(1, 1);
        reconciler.activate(1, 2);
        reconciler.accept(1, 2, c);

        assertThat(reconciler.accept(1, 1, b)).isFalse();
        assertThat(reconciler.current(1)).containsSame(c);
        assertThat(delivered).containsExactly(a, c);
    }

    @Test
    void retired_slot_keeps_last_state_but_takes_nothing_new() {
        MachineStatus a = status(2, MachineState.PAUSED, 0.3);
        reconciler.activate(2, 7);
        reconciler.accept(2, 7, a);

        reconciler.retire(2, 7);

        assertThat(reconciler.accept(2, 7, status(2, MachineState.OPERATIONAL, 0.31))).isFalse();
        assertThat(reconciler.current(2)).containsSame(a);
    }

    @Test
    void retire_of_an_older_generation_leaves_newer_open() {
        reconciler.activate(3, 1);
        reconciler.activate(3, 2);

        reconciler.retire(3, 1);

        assertThat(reconciler.accept(3, 2, status(3, MachineState.IDLE, 0))).isTrue();
    }

    @Test
    void evict_forgets_machine() {
        reconciler.activate(4, 1);
        reconciler.accept(4, 1, status(4, MachineState.IDLE, 0));

        reconciler.evict(4);

        assertThat(reconciler.current(4)).isEmpty();
        assertThat(reconciler.snapshot()).doesNotContainKey(4);
        assertThat(reconciler.accept(4, 1, status(4, MachineState.IDLE, 0))).isFalse();
    }

    @Test
    void redelivered_id_overwrites_but_notifies_once() {
        reconciler.activate(1, 1);
        MachineStatus s = status(1, MachineState.OPERATIONAL, 0.1);

        assertThat(reconciler.accept(1, 1, s)).isTrue();
        assertThat(reconciler.accept(1, 1, s)).isTrue();

        assertThat(reconciler.current(1)).containsSame(s);
        assertThat(delivered).containsExactly(s);
    }

    @Test
    void failing_subscriber_does_not_block_others_or_the_table() {
        List<MachineStatus> second = new ArrayList<>();
        StateReconciler r = new StateReconciler();
        r.registerSubscriber(s -> { throw new IllegalStateException("boom"); });
        r.registerSubscriber(second::add);
        r.activate(1, 1);
        MachineStatus s = status(1, MachineState.IDLE, 0);

        assertThat(r.accept(1, 1, s)).isTrue();

        assertThat(second).containsExactly(s);
        assertThat(r.current(1)).containsSame(s);
    }

    @Test
    void snapshot_is_an_ordered_copy() {
        reconciler.activate(9, 1);
        reconciler.activate(2, 1);
        reconciler.accept(9, 1, status(9, MachineState.IDLE, 0));
        reconciler.accept(2, 1, status(2, MachineState.IDLE, 0));

        var snap = reconciler.snapshot();
        reconciler.accept(2, 1, status(2, MachineState.OPERATIONAL, 0.5));

        assertThat(snap.keySet()).containsExactly(2, 9);
        assertThat(snap.get(2).getState()).isEqualTo(MachineState.IDLE);
    }

    @Test
    void slow_subscriber_for_one_machine_does_not_block_another() throws Exception {
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        StateReconciler r = new StateReconciler();
        r.registerSubscriber(s -> {
            if (s.getMachineId() == 1) {
                inside.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });
        r.activate(1, 1);
        r.activate(2, 1);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            pool.submit(() -> r.accept(1, 1, status(1, MachineState.IDLE, 0)));
            assertThat(inside.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(r.accept(2, 1, status(2, MachineState.OPERATIONAL, 0.2))).isTrue();
            assertThat(r.current(2)).isPresent();
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    private static MachineStatus status(int machineId, MachineState state, double progress) {
        return MachineStatus.builder().machineId(machineId).state(state).progress(progress).build();
    }
}
