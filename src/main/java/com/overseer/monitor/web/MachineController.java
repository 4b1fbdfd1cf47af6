package com.overseer.monitor.web;

import com.overseer.monitor.domain.MachineCommand;
import com.overseer.monitor.domain.MachineRegistration;
import com.overseer.monitor.domain.MachineStatus;
import com.overseer.monitor.provider.MachineProviderRegistry;
import com.overseer.monitor.service.CommandDispatcher;
import com.overseer.monitor.service.MachineOrchestrator;
import com.overseer.monitor.service.StateReconciler;
import com.overseer.monitor.service.SyncResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/** HTTP facade over the orchestrator, the current-state table and the command dispatcher. */
@Slf4j
@RestController
@RequestMapping("/machines")
@RequiredArgsConstructor
public class MachineController {

    private final MachineOrchestrator orchestrator;
    private final StateReconciler reconciler;
    private final CommandDispatcher dispatcher;
    private final MachineProviderRegistry providers;

    // ---- registrations ----

    @GetMapping
    public List<MachineRegistration> registrations() {
        return orchestrator.registrations();
    }

    @GetMapping("/types")
    public List<String> machineTypes() {
        return providers.machineTypes();
    }

    @PutMapping
    public SyncResult sync(@RequestBody List<MachineRegistration> machines) {
        log.info("[REST] PUT /machines count={}", machines.size());
        return orchestrator.sync(machines);
    }

    @PostMapping
    public SyncResult register(@RequestBody MachineRegistration machine) {
        log.info("[REST] POST /machines id={} type={}", machine.getId(), machine.getMachineType());
        return orchestrator.register(machine);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> remove(@PathVariable("id") int id) {
        log.info("[REST] DELETE /machines/{}", id);
        orchestrator.remove(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/enable")
    public SyncResult enable(@PathVariable("id") int id) {
        return orchestrator.enable(id);
    }

    @PostMapping("/{id}/disable")
    public SyncResult disable(@PathVariable("id") int id) {
        return orchestrator.disable(id);
    }

    // ---- state ----

    @GetMapping("/status")
    public Map<Integer, MachineStatus> allStatus() {
        return reconciler.snapshot();
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<MachineStatus> status(@PathVariable("id") int id) {
        return ResponseEntity.of(reconciler.current(id));
    }

    // ---- commands ----

    @PostMapping("/{id}/commands/{command}")
    public ResponseEntity<Void> command(@PathVariable("id") int id, @PathVariable("command") String command) {
        MachineCommand cmd = MachineCommand.parse(command);
        log.info("[REST] POST /machines/{}/commands/{}", id, cmd);
        dispatcher.dispatch(id, cmd);
        return ResponseEntity.noContent().build();
    }
}
