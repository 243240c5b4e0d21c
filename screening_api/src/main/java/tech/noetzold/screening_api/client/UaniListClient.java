package tech.noetzold.screening_api.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import tech.noetzold.screening_api.exception.ProviderException;
import tech.noetzold.screening_api.model.ProviderPayload;
import tech.noetzold.screening_api.model.ScreeningWindow;
import tech.noetzold.screening_api.model.UaniVessel;
import tech.noetzold.screening_api.repository.UaniVesselRepository;

import java.util.Optional;

/**
 * UANI tanker tracker list kept in the local database. Payload: {@code {found, entry}}.
 */
@Component
public class UaniListClient implements ProviderClient {

    public static final String PROVIDER_ID = "uani_list";

    private final UaniVesselRepository repository;
    private final ObjectMapper objectMapper;

    public UaniListClient(UaniVesselRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public ProviderPayload fetch(String subjectId, ScreeningWindow window) {
        Optional<UaniVessel> vessel;
        try {
            vessel = repository.findFirstByImo(subjectId.trim());
        } catch (DataAccessException e) {
            throw new ProviderException(PROVIDER_ID, subjectId, "UANI lookup failed", e);
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("found", vessel.isPresent());
        vessel.ifPresent(v -> {
            ObjectNode entry = body.putObject("entry");
            entry.put("imo", v.getImo());
            entry.put("vessel_name", v.getVesselName());
            entry.put("flag", v.getFlag());
            entry.put("date_added", v.getDateAdded() == null ? null : v.getDateAdded().toString());
            entry.put("notes", v.getNotes());
        });
        return ProviderPayload.success(PROVIDER_ID, body);
    }
}
