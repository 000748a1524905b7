package fr.imt.jobdaemon.jobdaemon.presentation.ipc;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;

/**
 * Newline-delimited frames over a socket channel. Reads happen on one thread; writes may come from
 * several threads and are serialized.
 * <p>
 * The channel is used directly instead of through {@code Channels.newInputStream}, whose blocking read
 * would hold up concurrent writes on the same channel.
 */
public class FrameChannel implements Closeable {

    private final SocketChannel channel;
    private final int maxFrameBytes;
    private final ByteBuffer readBuffer = ByteBuffer.allocate(8192);
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private final Object writeLock = new Object();

    public FrameChannel(SocketChannel channel, int maxFrameBytes) {
        this.channel = channel;
        this.maxFrameBytes = maxFrameBytes;
        readBuffer.flip();
    }

    /**
     * @return the next frame without its terminating newline, or null at end of stream
     * @throws FrameTooLargeException if a frame grows past the limit
     */
    public byte[] readFrame() throws IOException {
        while (true) {
            while (readBuffer.hasRemaining()) {
                byte next = readBuffer.get();
                if (next == '\n') {
                    byte[] frame = pending.toByteArray();
                    pending.reset();
                    return frame;
                }
                pending.write(next);
                if (pending.size() > maxFrameBytes) {
                    throw new FrameTooLargeException("Frame exceeds " + maxFrameBytes + " bytes");
                }
            }
            readBuffer.clear();
            int read = channel.read(readBuffer);
            readBuffer.flip();
            if (read < 0) {
                return null;
            }
        }
    }

    public void writeFrame(byte[] frame) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(frame.length + 1);
        buffer.put(frame).put((byte) '\n').flip();
        synchronized (writeLock) {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        }
    }

    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    public static class FrameTooLargeException extends IOException {

        public FrameTooLargeException(String message) {
            super(message);
        }
    }
}
