package com.lsemantica.core.trace;

import com.lsemantica.core.json.CanonicalJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Append-only newline-delimited JSON sink.
 * <p>
 * Writes are best-effort: a failed append is logged and reported through the return value,
 * never thrown. The parent directory must already exist. Concurrent writers to the same path
 * are not coordinated.
 */
@Component
public class NdjsonSink {

    private static final Logger log = LoggerFactory.getLogger(NdjsonSink.class);

    /**
     * Appends {@code record} as one canonical JSON line.
     *
     * @return {@code true} when the line was written
     */
    public boolean appendRecord(Path path, Object record, String sinkName) {
        if (path == null) {
            return false;
        }
        String line;
        try {
            line = CanonicalJson.write(record);
        } catch (IllegalStateException e) {
            log.warn("Failed to serialize {} record for {}: {}", sinkName, path, e.getMessage());
            return false;
        }
        return appendText(path, line, sinkName);
    }

    /**
     * Appends raw text followed by a newline.
     *
     * @return {@code true} when the text was written
     */
    public boolean appendText(Path path, String text, String sinkName) {
        if (path == null) {
            return false;
        }
        try {
            Files.writeString(path, text + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            log.debug("Appended {} record to {}", sinkName, path);
            return true;
        } catch (IOException | SecurityException e) {
            log.warn("Failed to append {} record to {}: {}", sinkName, path, e.getMessage());
            return false;
        }
    }
}
