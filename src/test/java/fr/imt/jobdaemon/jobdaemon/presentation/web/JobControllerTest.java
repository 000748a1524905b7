package fr.imt.jobdaemon.jobdaemon.presentation.web;

import fr.imt.jobdaemon.jobdaemon.business.model.JobFilter;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSchedule;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.model.JobStatus;
import fr.imt.jobdaemon.jobdaemon.business.service.JobDaemonService;
import fr.imt.jobdaemon.jobdaemon.configuration.DaemonProperties;
import fr.imt.jobdaemon.jobdaemon.exception.ErrorCodes;
import fr.imt.jobdaemon.jobdaemon.exception.JobNotFoundException;
import fr.imt.jobdaemon.jobdaemon.exception.JobStateException;
import fr.imt.jobdaemon.jobdaemon.infrastructure.service.DaemonLifecycle;
import fr.imt.jobdaemon.jobdaemon.presentation.web.dto.mappers.JobWebMapperImpl;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {JobController.class, WebhookController.class},
        properties = {"spring.main.web-application-type=servlet", "jobdaemon.api.key=test-key"})
@Import(JobWebMapperImpl.class)
@EnableConfigurationProperties(DaemonProperties.class)
class JobControllerTest {

    private static final String KEY = "test-key";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JobDaemonService jobDaemonService;

    @MockBean
    private DaemonLifecycle daemonLifecycle;

    @Test
    void requestWithoutKeyIsRejected() throws Exception {
        mockMvc.perform(get("/api/v1/jobs"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value(ErrorCodes.UNAUTHORIZED));

        mockMvc.perform(get("/api/v1/jobs").header(ApiKeyFilter.API_KEY_HEADER, "wrong-key"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(jobDaemonService);
    }

    @Test
    void listJobsPassesFilter() throws Exception {
        when(jobDaemonService.listJobs(any(JobFilter.class))).thenReturn(List.of(
                JobSpec.builder().id("job_1").name("backup").command("tar czf b.tgz .")
                        .status(JobStatus.IDLE).schedule(JobSchedule.cron("0 3 * * *")).build()));

        mockMvc.perform(get("/api/v1/jobs").param("status", "IDLE").param("limit", "5")
                        .header(ApiKeyFilter.API_KEY_HEADER, KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data[0].id").value("job_1"))
                .andExpect(jsonPath("$.data[0].schedule.cron").value("0 3 * * *"));

        ArgumentCaptor<JobFilter> filter = ArgumentCaptor.forClass(JobFilter.class);
        verify(jobDaemonService).listJobs(filter.capture());
        assertEquals(List.of(JobStatus.IDLE), filter.getValue().getStatus());
        assertEquals(5, filter.getValue().getLimit());
    }

    @Test
    void addJobReturnsCreated() throws Exception {
        when(jobDaemonService.addJob(any(JobSpec.class))).thenAnswer(invocation -> {
            JobSpec request = invocation.getArgument(0);
            request.setId("job_new");
            request.setStatus(JobStatus.IDLE);
            return request;
        });

        mockMvc.perform(post("/api/v1/jobs").header(ApiKeyFilter.API_KEY_HEADER, KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\":\"echo hi\",\"schedule\":{\"interval\":60000}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.id").value("job_new"))
                .andExpect(jsonPath("$.data.schedule.interval").value(60000));

        ArgumentCaptor<JobSpec> spec = ArgumentCaptor.forClass(JobSpec.class);
        verify(jobDaemonService).addJob(spec.capture());
        assertEquals(60000L, spec.getValue().getSchedule().getInterval());
    }

    @Test
    void addJobWithoutCommandIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/jobs").header(ApiKeyFilter.API_KEY_HEADER, KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"nothing to run\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));

        verify(jobDaemonService, never()).addJob(any());
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        when(jobDaemonService.getJob("job_missing")).thenThrow(new JobNotFoundException("job_missing"));

        mockMvc.perform(get("/api/v1/jobs/job_missing").header(ApiKeyFilter.API_KEY_HEADER, KEY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("JOB_NOT_FOUND"));
    }

    @Test
    void stateConflictIsConflict() throws Exception {
        when(jobDaemonService.triggerJob("job_1"))
                .thenThrow(new JobStateException(ErrorCodes.JOB_ALREADY_RUNNING, "Job job_1 is already running"));

        mockMvc.perform(post("/api/v1/jobs/job_1/trigger").header(ApiKeyFilter.API_KEY_HEADER, KEY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("JOB_ALREADY_RUNNING"));
    }

    @Test
    void webhooksReportDisabledWhenNotConfigured() throws Exception {
        mockMvc.perform(get("/api/v1/webhooks").header(ApiKeyFilter.API_KEY_HEADER, KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.enabled").value(false));

        mockMvc.perform(post("/api/v1/webhooks").header(ApiKeyFilter.API_KEY_HEADER, KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"endpoint\":\"http://localhost:9000/hook\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value(ErrorCodes.WEBHOOKS_DISABLED));
    }
}
