package fr.imt.jobdaemon.jobdaemon.business.service;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Keeps the first {@code limit} bytes of a stream and counts the rest. Readable while still being written.
 */
class BoundedOutput {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final int limit;
    private long dropped;

    BoundedOutput(int limit) {
        this.limit = limit;
    }

    synchronized void write(byte[] bytes, int offset, int length) {
        int room = Math.max(0, limit - buffer.size());
        int kept = Math.min(room, length);
        buffer.write(bytes, offset, kept);
        dropped += length - kept;
    }

    @Override
    public synchronized String toString() {
        String text = buffer.toString(StandardCharsets.UTF_8);
        if (dropped > 0) {
            return text + "\n... [truncated " + dropped + " bytes]";
        }
        return text;
    }
}
