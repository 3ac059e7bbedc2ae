package io.plandigest.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Plan(
    String id,
    String name,
    String description,
    @JsonProperty("created_at") @JsonAlias({"createdAt"}) Instant createdAt,
    @JsonProperty("updated_at") @JsonAlias({"updatedAt"}) Instant updatedAt
) {
    public Plan {
        Objects.requireNonNull(id, "id must not be null");
        name = name == null ? "" : name;
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }
}
