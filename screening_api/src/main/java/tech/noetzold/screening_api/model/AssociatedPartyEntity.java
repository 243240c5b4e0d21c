package tech.noetzold.screening_api.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "associated_parties", indexes = @Index(name = "idx_party_entity", columnList = "entity_id"))
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AssociatedPartyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", length = 120, nullable = false)
    private String entityId;

    @Column(name = "sorp_id", length = 120)
    private String sorpId;

    @Column(name = "nmtoken_level", length = 40)
    private String level;

    @Column(name = "related_name", length = 400)
    private String relatedName;

    @Column(name = "source_type", length = 80)
    private String sourceType;

    @Column(name = "relation_name", length = 160)
    private String relationName;

    public AssociatedParty toAssociatedParty() {
        return new AssociatedParty(sorpId, level, relatedName, sourceType, relationName);
    }
}
