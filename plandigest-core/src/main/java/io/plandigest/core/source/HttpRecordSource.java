package io.plandigest.core.source;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.plandigest.core.model.Plan;
import io.plandigest.core.model.PlanRun;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HttpRecordSource implements RecordSource {
    private static final Logger LOG = LoggerFactory.getLogger(HttpRecordSource.class);
    private static final long MAX_BACKOFF_MS = 2000;

    private final HttpUrl apiBase;
    private final String apiKey;
    private final String orgId;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final int maxAttempts;
    private final long initialBackoffMs;

    public HttpRecordSource(String apiBase, String apiKey, String orgId, Duration timeout, int maxAttempts) {
        this(
            apiBase,
            apiKey,
            orgId,
            new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(timeout)
                .callTimeout(timeout)
                .build(),
            maxAttempts,
            250
        );
    }

    public HttpRecordSource(
        String apiBase,
        String apiKey,
        String orgId,
        OkHttpClient client,
        int maxAttempts,
        long initialBackoffMs
    ) {
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.orgId = orgId == null ? "" : orgId.trim();
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public String name() {
        return "http:" + apiBase;
    }

    @Override
    public List<PlanRun> listRuns(RunQuery query) throws IOException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("page_size", String.valueOf(query.limit()));
        if (query.state() != null) {
            params.put("run_state", query.state().wireValue());
        }
        if (query.planId() != null) {
            params.put("plan_id", query.planId());
        }
        if (query.since() != null) {
            params.put("created_after", query.since().toString());
        }
        if (query.until() != null) {
            params.put("created_before", query.until().toString());
        }
        JsonNode body = get(List.of("api", "v0", "plan-runs", ""), params);
        List<PlanRun> runs = readList(body, PlanRun.class);
        return runs.size() > query.limit() ? runs.subList(0, query.limit()) : runs;
    }

    @Override
    public List<Plan> listPlans(int limit) throws IOException {
        JsonNode body = get(List.of("api", "v0", "plans", ""), Map.of("page_size", String.valueOf(Math.max(1, limit))));
        return readList(body, Plan.class);
    }

    @Override
    public Plan getPlan(String planId) throws IOException {
        requireId(planId, "planId");
        JsonNode body = get(List.of("api", "v0", "plans", planId, ""), Map.of());
        return mapper.treeToValue(body, Plan.class);
    }

    @Override
    public PlanRun getRun(String runId) throws IOException {
        requireId(runId, "runId");
        JsonNode body = get(List.of("api", "v0", "plan-runs", runId, ""), Map.of());
        return mapper.treeToValue(body, PlanRun.class);
    }

    private JsonNode get(List<String> segments, Map<String, String> query) throws IOException {
        if (apiKey.isBlank()) {
            throw new RecordSourceException("missing API key for record source " + apiBase);
        }

        HttpUrl.Builder url = apiBase.newBuilder();
        for (String segment : segments) {
            url.addPathSegment(segment);
        }
        query.forEach(url::addQueryParameter);
        Request request = buildRequest(url.build());

        long delayMs = initialBackoffMs;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = client.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    ResponseBody body = response.body();
                    String raw = body == null ? "" : body.string();
                    return raw.isBlank() ? mapper.createObjectNode() : mapper.readTree(raw);
                }
                String errorBody = response.body() == null ? "" : response.body().string();
                boolean retryable = response.code() == 429 || response.code() >= 500;
                if (retryable && attempt < maxAttempts) {
                    LOG.warn("Record source returned HTTP {} for {} (attempt {}/{})", response.code(), request.url().encodedPath(), attempt, maxAttempts);
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, MAX_BACKOFF_MS);
                    continue;
                }
                throw new RecordSourceException(
                    "HTTP " + response.code() + " from " + request.url().encodedPath() + ": " + truncate(errorBody, 300),
                    response.code()
                );
            } catch (RecordSourceException e) {
                throw e;
            } catch (IOException e) {
                if (attempt < maxAttempts) {
                    LOG.warn("Record source call to {} failed (attempt {}/{}): {}", request.url().encodedPath(), attempt, maxAttempts, e.getMessage());
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, MAX_BACKOFF_MS);
                    continue;
                }
                throw new RecordSourceException("Record source call to " + request.url().encodedPath() + " failed: " + e.getMessage(), e);
            }
        }
        throw new RecordSourceException("Record source call to " + request.url().encodedPath() + " exhausted retries");
    }

    private Request buildRequest(HttpUrl url) {
        Request.Builder builder = new Request.Builder()
            .url(url)
            .get()
            .header("Authorization", "Api-Key " + apiKey)
            .header("Accept", "application/json");
        if (!orgId.isBlank()) {
            builder.header("X-Organization-Id", orgId);
        }
        return builder.build();
    }

    private <T> List<T> readList(JsonNode body, Class<T> type) throws IOException {
        JsonNode items = body.isArray() ? body : body.path("results");
        if (!items.isArray()) {
            return List.of();
        }
        JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, type);
        try {
            List<T> values = mapper.convertValue(items, listType);
            return values == null ? List.of() : new ArrayList<>(values);
        } catch (IllegalArgumentException e) {
            throw new RecordSourceException("Malformed " + type.getSimpleName() + " payload: " + e.getMessage(), e);
        }
    }

    private void requireId(String id, String label) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(label + " must not be blank");
        }
    }

    private String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
