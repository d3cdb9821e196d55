package com.example.signage.service.admin.controller;

import com.example.signage.service.scheduling.FailedJob;
import com.example.signage.service.scheduling.JobScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/admin/jobs")
@RequiredArgsConstructor
public class JobAdminController {

    private final JobScheduler jobScheduler;

    @GetMapping
    public ResponseEntity<Set<String>> getLiveJobs() {
        return ResponseEntity.ok(jobScheduler.liveJobKeys());
    }

    @GetMapping("/failed")
    public ResponseEntity<List<FailedJob>> getFailedJobs() {
        return ResponseEntity.ok(jobScheduler.failedJobs());
    }
}
