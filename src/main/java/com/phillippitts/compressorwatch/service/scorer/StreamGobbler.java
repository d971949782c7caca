package com.phillippitts.compressorwatch.service.scorer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Drains a process stream into a capped buffer on a daemon thread.
 *
 * <p>Once the cap is reached the stream keeps being read (so the child never blocks on a full
 * pipe) but further output is discarded.
 */
final class StreamGobbler implements Runnable {

    private static final Logger LOG = LogManager.getLogger(StreamGobbler.class);

    private final InputStream inputStream;
    private final StringBuffer sink;
    private final String name;
    private final int maxBytes;

    private StreamGobbler(InputStream inputStream, StringBuffer sink, String name, int maxBytes) {
        this.inputStream = inputStream;
        this.sink = sink;
        this.name = name;
        this.maxBytes = maxBytes;
    }

    static Thread start(InputStream inputStream, StringBuffer sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            boolean capReached = false;
            while ((line = br.readLine()) != null) {
                if (sink.length() >= maxBytes) {
                    if (!capReached) {
                        LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                        capReached = true;
                    }
                    continue;
                }
                if (sink.length() > 0) {
                    sink.append('\n');
                }
                int available = maxBytes - sink.length();
                if (line.length() > available) {
                    sink.append(line, 0, available);
                    LOG.warn("Stream '{}' reached {}B cap (truncated line)", name, maxBytes);
                    capReached = true;
                } else {
                    sink.append(line);
                }
            }
        } catch (IOException e) {
            LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
        }
    }

    static String snippet(StringBuffer sb, int maxChars) {
        if (sb == null) {
            return "";
        }
        int len = Math.min(maxChars, sb.length());
        return sb.substring(0, len);
    }
}
