package tech.noetzold.screening_api.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "uani_vessels")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UaniVessel {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "imo", length = 20, nullable = false, unique = true)
    private String imo;

    @Column(name = "vessel_name", length = 200)
    private String vesselName;

    @Column(name = "flag", length = 120)
    private String flag;

    @Column(name = "date_added")
    private LocalDate dateAdded;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;
}
