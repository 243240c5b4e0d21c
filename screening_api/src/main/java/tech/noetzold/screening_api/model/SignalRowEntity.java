package tech.noetzold.screening_api.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Ingested signal row as stored by the upstream loaders.
 */
@Entity
@Table(name = "risk_signal_rows", indexes = @Index(name = "idx_signal_entity", columnList = "entity_id"))
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SignalRowEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", length = 120, nullable = false)
    private String entityId;

    @Column(name = "entity_dt", length = 40)
    private String entityDate;

    @Column(name = "active_status", length = 40)
    private String activeStatus;

    @Column(name = "entity_name", length = 400)
    private String entityName;

    @Column(name = "secondary_name", length = 400)
    private String secondaryName;

    @Column(name = "country_nm1", length = 160)
    private String countryName;

    @Column(name = "country_nm2", length = 160)
    private String secondaryCountry;

    @Column(name = "date_value", length = 40)
    private String dateValue;

    @Column(name = "sanctions_nm", length = 400)
    private String sanctionsName;

    @Column(name = "start_time", length = 40)
    private String startTime;

    @Column(name = "end_time", length = 40)
    private String endTime;

    @Column(name = "listing_description", columnDefinition = "text")
    private String listingDescription;

    @Column(name = "sector_description", columnDefinition = "text")
    private String sectorDescription;

    @Enumerated(EnumType.STRING)
    @Column(name = "is_san", length = 20)
    private RiskLevel sanFlag;

    @Enumerated(EnumType.STRING)
    @Column(name = "is_ool", length = 20)
    private RiskLevel oolFlag;

    @Enumerated(EnumType.STRING)
    @Column(name = "is_sco", length = 20)
    private RiskLevel scoFlag;

    public SignalRow toSignalRow() {
        return SignalRow.builder()
                .entityId(entityId)
                .entityDate(entityDate)
                .activeStatus(activeStatus)
                .entityName(entityName)
                .secondaryName(secondaryName)
                .countryName(countryName)
                .secondaryCountry(secondaryCountry)
                .dateValue(dateValue)
                .sanctionsName(sanctionsName)
                .startTime(startTime)
                .endTime(endTime)
                .listingDescription(listingDescription)
                .sectorDescription(sectorDescription)
                .sanFlag(sanFlag)
                .oolFlag(oolFlag)
                .scoFlag(scoFlag)
                .build();
    }
}
