package io.plandigest.core.source;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.plandigest.core.model.Plan;
import io.plandigest.core.model.PlanRun;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Serves plans and runs from a JSON snapshot exported from the platform.
 * The file is re-read on every query so a refreshed export is picked up without restarting.
 */
public final class FileRecordSource implements RecordSource {
    private final Path path;
    private final ObjectMapper mapper;

    public FileRecordSource(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public String name() {
        return "file:" + path;
    }

    @Override
    public synchronized List<PlanRun> listRuns(RunQuery query) throws IOException {
        return load().planRuns().stream()
            .filter(run -> query.matchesWindow(run.createdAt()))
            .filter(run -> query.state() == null || run.runState() == query.state())
            .filter(run -> query.planId() == null || query.planId().equals(run.planId()))
            .sorted(Comparator.comparing(PlanRun::createdAt, Comparator.nullsLast(Comparator.reverseOrder())))
            .limit(query.limit())
            .toList();
    }

    @Override
    public synchronized List<Plan> listPlans(int limit) throws IOException {
        return load().plans().stream()
            .sorted(Comparator.comparing(Plan::createdAt).reversed())
            .limit(Math.max(1, limit))
            .toList();
    }

    @Override
    public synchronized Plan getPlan(String planId) throws IOException {
        return load().plans().stream()
            .filter(plan -> plan.id().equals(planId))
            .findFirst()
            .orElseThrow(() -> new RecordSourceException("plan not found: " + planId, 404));
    }

    @Override
    public synchronized PlanRun getRun(String runId) throws IOException {
        return load().planRuns().stream()
            .filter(run -> run.id().equals(runId))
            .findFirst()
            .orElseThrow(() -> new RecordSourceException("plan run not found: " + runId, 404));
    }

    public synchronized void save(RecordSnapshot snapshot) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private RecordSnapshot load() throws IOException {
        if (!Files.exists(path)) {
            throw new RecordSourceException("snapshot file not found: " + path);
        }
        try {
            return mapper.readValue(Files.readString(path), RecordSnapshot.class);
        } catch (IOException e) {
            throw new RecordSourceException("unable to read snapshot " + path + ": " + e.getMessage(), e);
        }
    }
}
