package com.overseer.monitor.support;

import com.overseer.monitor.domain.MachineRegistration;
import com.overseer.monitor.domain.MachineState;
import com.overseer.monitor.domain.MachineStatus;
import com.overseer.monitor.provider.MachineProvider;
import com.overseer.monitor.provider.StatusListener;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/** Push provider driven by the test: {@link #emit} plays the device, commands are recorded. */
public class FakeProvider implements MachineProvider {

    public final List<String> calls = new ArrayList<>();
    public final AtomicInteger stops = new AtomicInteger();
    public volatile StatusListener listener;
    public volatile MachineRegistration machine;
    public volatile RuntimeException failOnStart;
    public volatile RuntimeException failOnCommand;

    @Override
    public void start(MachineRegistration machine, int intervalMs, StatusListener listener) {
        if (failOnStart != null) throw failOnStart;
        this.machine = machine;
        this.listener = listener;
        record("start:" + intervalMs);
    }

    @Override
    public void stop() {
        stops.incrementAndGet();
        record("stop");
    }

    @Override
    public void pauseJob() { command("pause"); }

    @Override
    public void resumeJob() { command("resume"); }

    @Override
    public void cancelJob() { command("cancel"); }

    public MachineStatus emit(MachineState state, double progress) {
        MachineStatus s = MachineStatus.builder()
                .machineId(machine.getId())
                .state(state)
                .progress(progress)
                .build();
        listener.onStatus(s);
        return s;
    }

    public synchronized List<String> calls() {
        return List.copyOf(calls);
    }

    private void command(String name) {
        record(name);
        if (failOnCommand != null) throw failOnCommand;
    }

    private synchronized void record(String call) {
        calls.add(call);
    }
}
