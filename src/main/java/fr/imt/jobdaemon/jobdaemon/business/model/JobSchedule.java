package fr.imt.jobdaemon.jobdaemon.business.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * When a job runs. Either a five-field cron expression or a fixed interval in milliseconds.
 * An interval of 0 (or no schedule at all) means the job only runs on demand.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSchedule {

    private String cron;

    private Long interval;

    public static JobSchedule cron(String expression) {
        return new JobSchedule(expression, null);
    }

    public static JobSchedule every(Duration interval) {
        return new JobSchedule(null, interval.toMillis());
    }

    // isCron/isInterval would pass for the accessors of the cron and interval properties
    public boolean hasCron() {
        return cron != null && !cron.isBlank();
    }

    public boolean hasInterval() {
        return !hasCron() && interval != null && interval > 0;
    }

    public boolean repeats() {
        return hasCron() || hasInterval();
    }
}
