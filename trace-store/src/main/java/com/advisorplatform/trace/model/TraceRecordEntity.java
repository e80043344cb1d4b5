package com.advisorplatform.trace.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted agent hop. One row per (correlation_id, hop_index); rows are inserted once
 * and never updated.
 *
 * Column mapping (R2DBC snake_case convention):
 *   correlationId → correlation_id
 *   hopIndex      → hop_index
 *   inputDigest   → input_digest
 *   outputDigest  → output_digest
 *   latencyMs     → latency_ms
 *   modelLabel    → model_label
 *   recordedAt    → recorded_at   (UTC)
 */
@Data
@NoArgsConstructor
@Table("trace_record")
public class TraceRecordEntity {

    @Id
    private Long id;

    private String correlationId;

    private int hopIndex;

    /** e.g. {@code intent}, {@code specialist:quant}, {@code router:thesis:2}, {@code critic} */
    private String component;

    private String inputDigest;

    private String outputDigest;

    private long latencyMs;

    /** Enum name of {@link com.advisorplatform.common.model.HopOutcome} */
    private String outcome;

    /** Model that produced the hop's output; {@code null} for non-model hops. */
    private String modelLabel;

    private LocalDateTime recordedAt;
}
