package com.phillippitts.feedercontrol.presentation.controller;

import com.phillippitts.feedercontrol.service.scheduler.JobScheduler;
import com.phillippitts.feedercontrol.service.scheduler.SchedulerStatus;
import com.phillippitts.feedercontrol.service.scheduler.SettingsUpdateResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thin REST adapter over {@link JobScheduler}.
 */
@RestController
@RequestMapping("/api/scheduler")
class SchedulerController {

    private static final Logger LOG = LogManager.getLogger(SchedulerController.class);

    private final JobScheduler scheduler;

    SchedulerController(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping("/status")
    ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(toBody(scheduler.status()));
    }

    @PostMapping("/start")
    ResponseEntity<Map<String, Object>> start() {
        LOG.info("Scheduler start requested");
        scheduler.start();
        return ResponseEntity.ok(toBody(scheduler.status()));
    }

    @PostMapping("/stop")
    ResponseEntity<Map<String, Object>> stop() {
        LOG.info("Scheduler stop requested");
        scheduler.stop();
        return ResponseEntity.ok(toBody(scheduler.status()));
    }

    /**
     * Partial update, e.g. {@code {"syncSensors": 5}}. Unknown keys and negative or non-integer
     * values are rejected with 400 before anything changes.
     */
    @PutMapping("/settings")
    ResponseEntity<Map<String, Object>> updateSettings(@RequestBody Map<String, Object> partial) {
        SettingsUpdateResult result = scheduler.updateSettingsManually(partial);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("settings", result.settings().toMap());
        body.put("remoteSynced", result.remoteSynced());
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> toBody(SchedulerStatus status) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("running", status.running());
        body.put("settings", status.currentSettings().toMap());
        body.put("jobs", status.activeJobNames());
        body.put("liveThreads", status.liveThreadCount());
        return body;
    }
}
