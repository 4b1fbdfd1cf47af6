package com.overseer.monitor.service;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/** What a {@link MachineOrchestrator#sync} pass did, by machine id. */
@Value
@Builder
public class SyncResult {
    @Singular("addStarted")   List<Integer> started;
    @Singular("addRestarted") List<Integer> restarted;
    @Singular("addStopped")   List<Integer> stopped;
    @Singular("addRemoved")   List<Integer> removed;
    @Singular("addUnchanged") List<Integer> unchanged;
    @Singular("addFailed")    Map<Integer, String> failed;   // id -> start failure message

    public boolean isClean() {
        return failed.isEmpty();
    }
}
