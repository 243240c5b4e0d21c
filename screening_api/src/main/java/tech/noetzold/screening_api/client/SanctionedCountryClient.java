package tech.noetzold.screening_api.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.dao.DataAccessException;
import tech.noetzold.screening_api.exception.ProviderException;
import tech.noetzold.screening_api.model.ProviderPayload;
import tech.noetzold.screening_api.model.ScreeningWindow;
import tech.noetzold.screening_api.repository.SanctionedCountryRepository;

/**
 * One sanctioned-country reference list (cargo origin or port). The subject is a country name,
 * matched ignoring case and surrounding blanks.
 */
public class SanctionedCountryClient implements ProviderClient {

    public static final String CARGO_PROVIDER_ID = "country_reference_cargo";
    public static final String PORT_PROVIDER_ID = "country_reference_port";

    private final String providerId;
    private final String listType;
    private final SanctionedCountryRepository repository;
    private final ObjectMapper objectMapper;

    public SanctionedCountryClient(String providerId, String listType, SanctionedCountryRepository repository,
                                   ObjectMapper objectMapper) {
        this.providerId = providerId;
        this.listType = listType;
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public ProviderPayload fetch(String subjectId, ScreeningWindow window) {
        String country = subjectId.trim();
        boolean listed;
        try {
            listed = repository.existsByListTypeAndCountryNameIgnoreCase(listType, country);
        } catch (DataAccessException e) {
            throw new ProviderException(providerId, subjectId, "Country list lookup failed", e);
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("country_name", country);
        body.put("list_type", listType);
        body.put("listed", listed);
        return ProviderPayload.success(providerId, body);
    }
}
