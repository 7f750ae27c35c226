package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Operational alert raised by the storage monitor or the scheduler.
 *
 * Alerts are resolved, never deleted. Only {@code resolvedAt} changes after
 * creation.
 */
public class Alert {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("severity")
    private final AlertSeverity severity;

    @JsonProperty("message")
    private final String message;

    /**
     * Tier the alert refers to; null for alerts about jobs
     */
    @JsonProperty("tier")
    private final StorageTier tier;

    /**
     * Component or job type that raised the alert
     */
    @JsonProperty("source")
    private final String source;

    @JsonProperty("created_at")
    private final Instant createdAt;

    @JsonProperty("resolved_at")
    private volatile Instant resolvedAt;

    public Alert(AlertSeverity severity, String message, StorageTier tier, String source, Instant createdAt) {
        this(UUID.randomUUID().toString(), severity, message, tier, source, createdAt);
    }

    public Alert(String id, AlertSeverity severity, String message, StorageTier tier, String source,
                 Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.message = Objects.requireNonNull(message, "message");
        this.tier = tier;
        this.source = Objects.requireNonNull(source, "source");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public String getId() {
        return id;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public StorageTier getTier() {
        return tier;
    }

    public String getSource() {
        return source;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public boolean isResolved() {
        return resolvedAt != null;
    }

    /**
     * Resolve the alert. Resolving twice keeps the first resolution time.
     */
    public synchronized void resolve(Instant at) {
        if (resolvedAt == null) {
            resolvedAt = at;
        }
    }

    @Override
    public String toString() {
        return "Alert{" + severity.getValue() + ", source=" + source
            + (tier != null ? ", tier=" + tier.getValue() : "")
            + ", message='" + message + "'" + (resolvedAt != null ? ", resolved" : "") + "}";
    }
}
