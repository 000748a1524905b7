package fr.imt.jobdaemon.jobdaemon.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "jobdaemon")
public class DaemonProperties {

    private Path runtimeDir = Path.of(System.getProperty("java.io.tmpdir"));

    private Path socketPath = runtimeDir.resolve("jobdaemon-" + System.getProperty("user.name") + ".sock");

    private Path pidFile = runtimeDir.resolve("jobdaemon-" + System.getProperty("user.name") + ".pid");

    private Path logFile = runtimeDir.resolve("jobdaemon-" + System.getProperty("user.name") + ".log");

    private Path jobsFile = runtimeDir.resolve("jobdaemon-jobs-" + System.getProperty("user.name") + ".json");

    private DataSize maxLogSize = DataSize.ofMegabytes(10);

    private Scheduler scheduler = new Scheduler();

    private Execution execution = new Execution();

    private Retry retry = new Retry();

    private Cleanup cleanup = new Cleanup();

    private Store store = new Store();

    private Events events = new Events();

    private Client client = new Client();

    private Api api = new Api();

    @Data
    public static class Scheduler {
        /**
         * Use the fixed-interval scan instead of the heap-driven timer.
         */
        private boolean legacy = false;
        private Duration checkInterval = Duration.ofSeconds(2);
        private Duration maxSleep = Duration.ofSeconds(60);
    }

    @Data
    public static class Execution {
        private String shell = "/bin/sh";
        private Duration gracePeriod = Duration.ofSeconds(5);
        private DataSize maxOutput = DataSize.ofKilobytes(64);
        private int maxHistory = 100;
    }

    @Data
    public static class Retry {
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(60);
    }

    @Data
    public static class Cleanup {
        /**
         * How long finished one-shot jobs are kept before housekeeping removes them.
         */
        private Duration retention = Duration.ofHours(24);
    }

    @Data
    public static class Store {
        private String type = "memory";
    }

    @Data
    public static class Events {
        private Redis redis = new Redis();

        private Webhooks webhooks = new Webhooks();

        @Data
        public static class Redis {
            private boolean enabled = false;
            private String topic = "jobdaemon-events";
        }

        @Data
        public static class Webhooks {
            private boolean enabled = false;
            /**
             * URLs that receive every job event as a JSON POST. More can be registered at runtime.
             */
            private List<String> endpoints = new ArrayList<>();
            private Duration timeout = Duration.ofSeconds(5);
        }
    }

    @Data
    public static class Client {
        private Duration requestTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Api {
        /**
         * Expected value of the {@code X-API-Key} header. A random key is generated and logged when unset.
         */
        private String key;
    }
}
