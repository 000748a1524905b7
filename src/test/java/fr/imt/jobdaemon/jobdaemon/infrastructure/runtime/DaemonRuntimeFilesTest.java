package fr.imt.jobdaemon.jobdaemon.infrastructure.runtime;

import fr.imt.jobdaemon.jobdaemon.exception.DaemonAlreadyRunningException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DaemonRuntimeFilesTest {

    @TempDir
    Path dir;

    private DaemonRuntimeFiles files() {
        return new DaemonRuntimeFiles(dir.resolve("d.pid"), dir.resolve("d.sock"));
    }

    @Test
    void writesAndCleansUpThePidFile() {
        DaemonRuntimeFiles files = files();
        files.ensureNotRunning();
        files.writePidFile();

        assertEquals(ProcessHandle.current().pid(), files.readPid().orElseThrow());

        files.releasePidFile();
        assertFalse(Files.exists(files.getPidFile()));
    }

    @Test
    void pidFileClaimedByALiveProcessIsRefused() throws Exception {
        long parent = ProcessHandle.current().parent().orElseThrow().pid();
        Files.writeString(dir.resolve("d.pid"), String.valueOf(parent));

        assertThrows(DaemonAlreadyRunningException.class, () -> files().writePidFile());
        assertEquals(parent, files().readPid().orElseThrow());
    }

    @Test
    void foreignPidFileIsNotReleased() throws Exception {
        long parent = ProcessHandle.current().parent().orElseThrow().pid();
        Files.writeString(dir.resolve("d.pid"), String.valueOf(parent));

        files().releasePidFile();

        assertEquals(parent, files().readPid().orElseThrow());
    }

    @Test
    void livePidMeansAlreadyRunning() throws Exception {
        long parent = ProcessHandle.current().parent().orElseThrow().pid();
        Files.writeString(dir.resolve("d.pid"), String.valueOf(parent));

        assertThrows(DaemonAlreadyRunningException.class, () -> files().ensureNotRunning());
    }

    @Test
    void listeningSocketMeansAlreadyRunning() throws Exception {
        try (ServerSocketChannel server = ServerSocketChannel.open(StandardProtocolFamily.UNIX)) {
            server.bind(UnixDomainSocketAddress.of(dir.resolve("d.sock")));

            assertThrows(DaemonAlreadyRunningException.class, () -> files().ensureNotRunning());
        }
    }

    @Test
    void staleFilesAreRemoved() throws Exception {
        Process finished = new ProcessBuilder("true").start();
        finished.waitFor();
        Files.writeString(dir.resolve("d.pid"), String.valueOf(finished.pid()));
        Files.createFile(dir.resolve("d.sock"));

        files().ensureNotRunning();

        assertFalse(Files.exists(dir.resolve("d.pid")));
        assertFalse(Files.exists(dir.resolve("d.sock")));
    }

    @Test
    void garbagePidFileIsTreatedAsStale() throws Exception {
        Files.writeString(dir.resolve("d.pid"), "not a pid");

        assertTrue(files().readPid().isEmpty());
        assertDoesNotThrow(() -> files().ensureNotRunning());
    }
}
