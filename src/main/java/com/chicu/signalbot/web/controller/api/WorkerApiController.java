package com.chicu.signalbot.web.controller.api;

import com.chicu.signalbot.command.PurgeCommand;
import com.chicu.signalbot.engine.ActionResult;
import com.chicu.signalbot.engine.ScheduledWorker;
import com.chicu.signalbot.engine.WorkerRegistry;
import com.chicu.signalbot.engine.WorkerStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@RestController
@RequestMapping("/api/workers")
@RequiredArgsConstructor
public class WorkerApiController {

    /** Разрушительные действия: вручную только через подтверждение в чате. */
    private static final Set<String> CONFIRMED_ONLY = Set.of(PurgeCommand.WORKER);

    private final WorkerRegistry registry;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Map<String, Object>> all() {
        return registry.all().stream().map(WorkerApiController::toBody).toList();
    }

    /** Неизвестное имя → WorkerNotConfiguredException → 404 в {@link ApiErrorHandler}. */
    @GetMapping(value = "/{name}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> status(@PathVariable String name) {
        return toBody(registry.get(name).status());
    }

    @PostMapping(value = "/{name}/start", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> start(@PathVariable String name) {
        ScheduledWorker worker = registry.get(name);
        boolean changed = worker.start();
        log.info("▶ API start '{}': changed={}", worker.getName(), changed);

        Map<String, Object> body = toBody(worker.status());
        body.put("changed", changed);
        if (!changed && worker.getInterval().isDisabled()) {
            body.put("message", "worker is manual-only");
        }
        return ResponseEntity.ok(body);
    }

    @PostMapping(value = "/{name}/stop", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> stop(@PathVariable String name) {
        ScheduledWorker worker = registry.get(name);
        boolean changed = worker.stop();
        log.info("⏹ API stop '{}': changed={}", worker.getName(), changed);

        Map<String, Object> body = toBody(worker.status());
        body.put("changed", changed);
        return ResponseEntity.ok(body);
    }

    @PostMapping(value = "/{name}/trigger", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> trigger(@PathVariable String name) {
        ScheduledWorker worker = registry.get(name);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", worker.getName());

        if (CONFIRMED_ONLY.contains(worker.getName())) {
            log.warn("⛔ API trigger '{}' rejected: needs chat confirmation", worker.getName());
            body.put("result", "REJECTED");
            body.put("message", "'" + worker.getName() + "' needs confirmation, use the `"
                    + worker.getName() + " now` chat command");
            return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
        }

        ActionResult result = worker.triggerNow();
        body.put("result", result.status().name());
        body.put("message", result.message());
        return result.isFailed()
                ? ResponseEntity.internalServerError().body(body)
                : ResponseEntity.ok(body);
    }

    // ---------- helpers ----------

    static Map<String, Object> toBody(WorkerStatus s) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", s.name());
        body.put("target", s.target());
        body.put("state", s.state().name());
        body.put("interval", s.interval().label());
        body.put("manualOnly", s.isManualOnly());
        body.put("nextTrigger", s.nextTrigger() != null ? s.nextTrigger().toString() : null);
        body.put("secondsRemaining", s.timeRemaining() != null ? s.timeRemaining().toSeconds() : null);
        body.put("lastRunAt", s.lastRunAt() != null ? s.lastRunAt().toString() : null);
        if (s.lastResult() != null) {
            body.put("lastResult", s.lastResult().status().name());
            body.put("lastMessage", s.lastResult().message());
        }
        return body;
    }
}
