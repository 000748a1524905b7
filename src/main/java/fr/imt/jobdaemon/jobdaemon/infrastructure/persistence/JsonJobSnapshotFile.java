package fr.imt.jobdaemon.jobdaemon.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.port.JobSnapshotPort;
import fr.imt.jobdaemon.jobdaemon.configuration.DaemonProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Job table persisted as a JSON array. Writes go to a temporary file in the same directory
 * which then replaces the snapshot, so a crash never leaves a half-written file behind.
 */
@Slf4j
@Component
public class JsonJobSnapshotFile implements JobSnapshotPort {

    private static final TypeReference<List<JobSpec>> JOB_LIST = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;

    @Autowired
    public JsonJobSnapshotFile(DaemonProperties properties, ObjectMapper objectMapper) {
        this(properties.getJobsFile(), objectMapper);
    }

    public JsonJobSnapshotFile(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<List<JobSpec>> load() {
        if (!Files.exists(file)) {
            log.info("No job snapshot at {}, starting empty", file);
            return Optional.empty();
        }
        try {
            List<JobSpec> jobs = objectMapper.readValue(file.toFile(), JOB_LIST);
            if (jobs == null) {
                log.warn("Job snapshot {} holds no job list, ignoring it", file);
                return Optional.empty();
            }
            if (jobs.contains(null)) {
                log.warn("Job snapshot {} holds empty entries, skipping them", file);
                jobs = jobs.stream().filter(Objects::nonNull).toList();
            }
            log.info("Loaded {} job(s) from {}", jobs.size(), file);
            return Optional.of(jobs);
        } catch (IOException e) {
            log.warn("Job snapshot {} is unreadable, ignoring it: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(Collection<JobSpec> jobs) {
        try {
            Path directory = file.toAbsolutePath().getParent();
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), jobs);
                move(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write job snapshot " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    private void move(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to a plain replace", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
