package tech.noetzold.screening_api.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

@Entity
@Table(name = "entity_verdicts")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EntityVerdictRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", length = 120, nullable = false, unique = true)
    private String entityId;

    @Column(name = "entity_name", length = 400)
    private String entityName;

    @Enumerated(EnumType.STRING)
    @Column(name = "sanctions_level", length = 20, nullable = false)
    private RiskLevel sanctionsLevel;

    @Column(name = "flagged_signals", length = 120)
    private String flaggedSignals; // comma separated, e.g. "SAN,SCO"

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "verdict_json", columnDefinition = "jsonb")
    private JsonNode verdictJson;

    @Column(name = "resolved_at", nullable = false)
    private Instant resolvedAt;

    @PrePersist
    public void prePersist() {
        if (resolvedAt == null) resolvedAt = Instant.now();
    }
}
