package com.museum.curation.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.museum.curation.store.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Writes the JSON artifacts of one run into {@code <artifactRoot>/<runId>/}.
 * Each artifact is written once: files are opened with {@code CREATE_NEW}, and a
 * second write of the same name fails instead of overwriting.
 */
public class RunArtifactWriter {
    private static final Logger log = LoggerFactory.getLogger(RunArtifactWriter.class);

    public static final String CHANGES = "changes.json";
    public static final String REVIEW_QUEUE = "review_queue.json";
    public static final String METRICS = "metrics.json";
    public static final String DRIFT_REPORT = "drift_report.json";
    public static final String SUMMARY = "summary.json";

    private final Path runDirectory;
    private final ObjectMapper objectMapper;
    private final Set<String> written = new LinkedHashSet<>();

    public RunArtifactWriter(Path artifactRoot, String runId) {
        this(artifactRoot, runId, JsonMappers.create());
    }

    public RunArtifactWriter(Path artifactRoot, String runId, ObjectMapper objectMapper) {
        this.runDirectory = artifactRoot.resolve(runId);
        this.objectMapper = objectMapper;
    }

    public Path getRunDirectory() {
        return runDirectory;
    }

    /**
     * Serializes {@code content} to {@code <runDirectory>/<name>}.
     *
     * @throws ArtifactWriteException if the artifact already exists or cannot be written
     */
    public synchronized Path write(String name, Object content) {
        if (written.contains(name)) {
            throw new ArtifactWriteException("Artifact already written for this run: " + name);
        }
        Path target = runDirectory.resolve(name);
        try {
            Files.createDirectories(runDirectory);
            try (OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW,
                    StandardOpenOption.WRITE)) {
                objectMapper.writeValue(out, content);
            }
        } catch (FileAlreadyExistsException e) {
            throw new ArtifactWriteException("Artifact already exists: " + target, e);
        } catch (IOException e) {
            throw new ArtifactWriteException("Failed to write artifact " + target, e);
        }
        written.add(name);
        log.debug("artifact.written name={} path={}", name, target);
        return target;
    }

    public synchronized Set<String> getWrittenArtifacts() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(written));
    }
}
