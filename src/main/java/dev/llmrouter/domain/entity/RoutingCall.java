package dev.llmrouter.domain.entity;

import dev.llmrouter.domain.valueobject.CallRecord;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One completed routed call, written when the telemetry endpoint is unreachable.
 */
@Entity
@Table(name = "routing_calls", indexes = {
        @Index(name = "idx_routing_calls_created_at", columnList = "created_at"),
        @Index(name = "idx_routing_calls_provider", columnList = "provider")
})
public class RoutingCall {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "provider", nullable = false, length = 100)
    private String provider;
    @Column(name = "model_name", nullable = false, length = 200)
    private String modelName;
    @Column(name = "actual_model", length = 200)
    private String actualModel;
    @Column(name = "agent_name", nullable = false, length = 100)
    private String agentName;
    @Column(name = "tokens_in", nullable = false)
    private int tokensIn;
    @Column(name = "tokens_out", nullable = false)
    private int tokensOut;
    @Column(name = "cost_usd", nullable = false, precision = 18, scale = 8)
    private BigDecimal costUsd;
    @Column(name = "latency_ms", nullable = false)
    private long latencyMs;
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected RoutingCall() {
    }

    public static RoutingCall from(CallRecord record) {
        RoutingCall c = new RoutingCall();
        c.id = UUID.randomUUID();
        c.provider = record.provider();
        c.modelName = record.modelName();
        c.actualModel = record.actualModel();
        c.agentName = record.agentName();
        c.tokensIn = record.tokensIn();
        c.tokensOut = record.tokensOut();
        c.costUsd = record.costUsd();
        c.latencyMs = record.latencyMs();
        c.createdAt = Instant.now();
        return c;
    }

    public UUID getId() {
        return id;
    }

    public String getProvider() {
        return provider;
    }

    public String getModelName() {
        return modelName;
    }

    public String getActualModel() {
        return actualModel;
    }

    public String getAgentName() {
        return agentName;
    }

    public int getTokensIn() {
        return tokensIn;
    }

    public int getTokensOut() {
        return tokensOut;
    }

    public BigDecimal getCostUsd() {
        return costUsd;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
