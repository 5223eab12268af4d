package io.clgrader.core.process;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Logger;

/// Drains a process stream into memory, keeping at most `limit` bytes.
///
/// The stream is always read to its end so the child never blocks on a full pipe;
/// bytes past the limit are discarded and the capture is flagged truncated.
final class BoundedCapture implements Runnable {

    private static final Logger logger = Logger.getLogger(BoundedCapture.class.getName());

    private final InputStream source;
    private final int limit;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private boolean truncated;

    BoundedCapture(InputStream source, int limit) {
        this.source = source;
        this.limit = limit;
    }

    @Override
    public void run() {
        byte[] chunk = new byte[8192];
        try (InputStream in = source) {
            int read;
            while ((read = in.read(chunk)) != -1) {
                append(chunk, read);
            }
        } catch (IOException e) {
            // Stream closed while the process was being killed; keep what was captured.
            logger.fine("Capture stopped: " + e.getMessage());
        }
    }

    private synchronized void append(byte[] chunk, int length) {
        int room = limit - buffer.size();
        if (room >= length) {
            buffer.write(chunk, 0, length);
            return;
        }
        if (room > 0) {
            buffer.write(chunk, 0, room);
        }
        truncated = true;
    }

    synchronized byte[] bytes() {
        return buffer.toByteArray();
    }

    synchronized boolean isTruncated() {
        return truncated;
    }
}
