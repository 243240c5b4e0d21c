package tech.noetzold.screening_api.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "sanctioned_countries")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SanctionedCountry {

    public static final String CARGO = "CARGO";
    public static final String PORT = "PORT";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "country_name", length = 160, nullable = false)
    private String countryName;

    @Column(name = "list_type", length = 20, nullable = false)
    private String listType; // CARGO or PORT
}
