package fr.imt.jobdaemon.jobdaemon.business.command;

import fr.imt.jobdaemon.jobdaemon.business.model.JobFilter;
import fr.imt.jobdaemon.jobdaemon.business.model.JobUpdate;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.service.JobDaemonService;
import fr.imt.jobdaemon.jobdaemon.exception.UnknownCommandException;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import static fr.imt.jobdaemon.jobdaemon.business.command.CommandArguments.FILTER;
import static fr.imt.jobdaemon.jobdaemon.business.command.CommandArguments.FORCE;
import static fr.imt.jobdaemon.jobdaemon.business.command.CommandArguments.JOB_ID;
import static fr.imt.jobdaemon.jobdaemon.business.command.CommandArguments.JOB_SPEC;
import static fr.imt.jobdaemon.jobdaemon.business.command.CommandArguments.LIMIT;
import static fr.imt.jobdaemon.jobdaemon.business.command.CommandArguments.SIGNAL;
import static fr.imt.jobdaemon.jobdaemon.business.command.CommandArguments.UPDATE;

/**
 * Registry of the control protocol commands. Job commands are registered here; daemon lifecycle
 * commands ({@code status}, {@code restart}, {@code stop-daemon}) are registered by the daemon itself.
 */
@Service
public class ControlCommandFactory {

    public static final String STATUS = "status";
    public static final String ADD_JOB = "add-job";
    public static final String START_JOB = "start-job";
    public static final String TRIGGER_JOB = "trigger-job";
    public static final String STOP_JOB = "stop-job";
    public static final String LIST_JOBS = "list-jobs";
    public static final String GET_JOB = "get-job";
    public static final String REMOVE_JOB = "remove-job";
    public static final String RESTART = "restart";
    public static final String STOP_DAEMON = "stop-daemon";
    public static final String UPDATE_JOB = "update-job";
    public static final String ENABLE_JOB = "enable-job";
    public static final String DISABLE_JOB = "disable-job";
    public static final String JOB_HISTORY = "job-history";
    public static final String JOB_STATS = "job-stats";

    private final Map<String, Function<CommandArguments, ControlCommand>> registry = new ConcurrentHashMap<>();

    public ControlCommandFactory(JobDaemonService jobDaemonService) {

        registry.put(ADD_JOB, args ->
                new AddJobCommand(jobDaemonService, args.require(JOB_SPEC, JobSpec.class)));

        registry.put(STOP_JOB, args ->
                new StopJobCommand(jobDaemonService, args.requireString(JOB_ID), args.optionalString(SIGNAL).orElse(null)));

        registry.put(REMOVE_JOB, args ->
                new RemoveJobCommand(jobDaemonService, args.requireString(JOB_ID), args.flag(FORCE)));

        registry.put(LIST_JOBS, args ->
                new ListJobsCommand(jobDaemonService, args.optional(FILTER, JobFilter.class).orElse(JobFilter.all())));

        registry.put(START_JOB, byJobId(jobDaemonService::startJob));
        registry.put(TRIGGER_JOB, byJobId(jobDaemonService::triggerJob));
        registry.put(GET_JOB, byJobId(jobDaemonService::getJob));
        registry.put(ENABLE_JOB, byJobId(jobDaemonService::enableJob));
        registry.put(DISABLE_JOB, byJobId(jobDaemonService::disableJob));
        registry.put(JOB_STATS, byJobId(jobDaemonService::getJobStatistics));

        registry.put(UPDATE_JOB, args -> {
            String jobId = args.requireString(JOB_ID);
            JobUpdate update = args.require(UPDATE, JobUpdate.class);
            return () -> jobDaemonService.updateJob(jobId, update);
        });

        registry.put(JOB_HISTORY, args -> {
            String jobId = args.requireString(JOB_ID);
            Integer limit = args.optionalInt(LIMIT).orElse(null);
            return () -> jobDaemonService.getJobHistory(jobId, limit);
        });
    }

    public void register(String commandName, Function<CommandArguments, ControlCommand> factory) {
        registry.put(commandName, factory);
    }

    public ControlCommand create(String commandName, CommandArguments arguments) {
        if (commandName == null || commandName.isBlank()) {
            throw new IllegalArgumentException("Missing command");
        }
        return registry.getOrDefault(commandName, args -> {
            throw new UnknownCommandException("Unknown command: " + commandName);
        }).apply(arguments);
    }

    public Set<String> commandNames() {
        return new TreeSet<>(registry.keySet());
    }

    private static Function<CommandArguments, ControlCommand> byJobId(Function<String, Object> action) {
        return args -> {
            String jobId = args.requireString(JOB_ID);
            return () -> action.apply(jobId);
        };
    }
}
