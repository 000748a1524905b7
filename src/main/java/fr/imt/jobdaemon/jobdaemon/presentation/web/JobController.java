package fr.imt.jobdaemon.jobdaemon.presentation.web;

import fr.imt.jobdaemon.jobdaemon.business.model.DaemonStatus;
import fr.imt.jobdaemon.jobdaemon.business.model.JobExecution;
import fr.imt.jobdaemon.jobdaemon.business.model.JobFilter;
import fr.imt.jobdaemon.jobdaemon.business.model.JobStatus;
import fr.imt.jobdaemon.jobdaemon.business.service.JobDaemonService;
import fr.imt.jobdaemon.jobdaemon.infrastructure.service.DaemonLifecycle;
import fr.imt.jobdaemon.jobdaemon.presentation.web.dto.ApiResponse;
import fr.imt.jobdaemon.jobdaemon.presentation.web.dto.JobRequest;
import fr.imt.jobdaemon.jobdaemon.presentation.web.dto.JobResponse;
import fr.imt.jobdaemon.jobdaemon.presentation.web.dto.mappers.JobWebMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
public class JobController {

    private final JobDaemonService jobDaemonService;
    private final DaemonLifecycle daemonLifecycle;
    private final JobWebMapper jobWebMapper;

    @GetMapping("/jobs")
    public ResponseEntity<ApiResponse<List<JobResponse>>> listJobs(
            @RequestParam(required = false) List<JobStatus> status,
            @RequestParam(required = false) List<String> tag,
            @RequestParam(required = false) String name,
            @RequestParam(required = false) Boolean enabled,
            @RequestParam(required = false) Integer limit) {
        JobFilter filter = JobFilter.builder()
                .status(status)
                .tags(tag)
                .namePattern(name)
                .enabled(enabled)
                .limit(limit)
                .build();
        return ResponseEntity.ok(ApiResponse.ok(jobWebMapper.toResponses(jobDaemonService.listJobs(filter))));
    }

    @GetMapping("/jobs/{id}")
    public ResponseEntity<ApiResponse<JobResponse>> getJob(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.ok(jobWebMapper.toResponse(jobDaemonService.getJob(id))));
    }

    @PostMapping("/jobs")
    public ResponseEntity<ApiResponse<JobResponse>> addJob(@Valid @RequestBody JobRequest request) {
        JobResponse created = jobWebMapper.toResponse(jobDaemonService.addJob(jobWebMapper.toSpec(request)));
        return new ResponseEntity<>(ApiResponse.ok(created), HttpStatus.CREATED);
    }

    @PostMapping("/jobs/{id}/trigger")
    public ResponseEntity<ApiResponse<JobResponse>> triggerJob(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.ok(jobWebMapper.toResponse(jobDaemonService.triggerJob(id))));
    }

    @PostMapping("/jobs/{id}/stop")
    public ResponseEntity<ApiResponse<JobResponse>> stopJob(@PathVariable String id,
                                                            @RequestParam(required = false) String signal) {
        return ResponseEntity.ok(ApiResponse.ok(jobWebMapper.toResponse(jobDaemonService.stopJob(id, signal))));
    }

    @DeleteMapping("/jobs/{id}")
    public ResponseEntity<ApiResponse<Boolean>> removeJob(@PathVariable String id,
                                                          @RequestParam(defaultValue = "false") boolean force) {
        return ResponseEntity.ok(ApiResponse.ok(jobDaemonService.removeJob(id, force)));
    }

    @GetMapping("/jobs/{id}/executions")
    public ResponseEntity<ApiResponse<List<JobExecution>>> getExecutions(@PathVariable String id,
                                                                         @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(ApiResponse.ok(jobDaemonService.getJobHistory(id, limit)));
    }

    @GetMapping("/status")
    public ResponseEntity<ApiResponse<DaemonStatus>> status() {
        return ResponseEntity.ok(ApiResponse.ok(daemonLifecycle.status()));
    }
}
