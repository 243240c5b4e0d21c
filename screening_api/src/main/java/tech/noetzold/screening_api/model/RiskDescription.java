package tech.noetzold.screening_api.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "risk_descriptions",
        uniqueConstraints = @UniqueConstraint(columnNames = {"risk_type", "risk_level"}))
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RiskDescription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "risk_type", length = 120, nullable = false)
    private String riskType;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", length = 20, nullable = false)
    private RiskLevel riskLevel;

    @Column(name = "risk_desc", length = 255)
    private String riskDesc;

    @Column(name = "info", columnDefinition = "text")
    private String info;

    @Column(name = "risk_desc_info", columnDefinition = "text")
    private String riskDescInfo;
}
