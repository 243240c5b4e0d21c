package tech.noetzold.screening_api.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import tech.noetzold.screening_api.exception.InvalidRequestException;
import tech.noetzold.screening_api.model.CheckDescriptor;
import tech.noetzold.screening_api.model.DescriptionText;
import tech.noetzold.screening_api.model.RiskRecord;
import tech.noetzold.screening_api.model.ScreeningLog;
import tech.noetzold.screening_api.model.ScreeningRequest;
import tech.noetzold.screening_api.model.ScreeningResponse;
import tech.noetzold.screening_api.model.ScreeningSummary;
import tech.noetzold.screening_api.model.ScreeningWindow;
import tech.noetzold.screening_api.orchestrator.ScreeningOrchestrator;
import tech.noetzold.screening_api.probe.CompositeProbe;
import tech.noetzold.screening_api.probe.ProbeParameters;
import tech.noetzold.screening_api.repository.ScreeningLogRepository;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Screens every party of a request and rolls the results up into a transaction-level record.
 */
@Slf4j
@Service
public class ScreeningService {

    public static final String TRANSACTION_CHECK = "Transaction_overall";

    private final ScreeningOrchestrator orchestrator;
    private final DescriptionLookupService descriptions;
    private final ScreeningLogRepository screeningLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${screening.default-window-days:365}")
    private int defaultWindowDays = 365;

    public ScreeningService(ScreeningOrchestrator orchestrator,
                            DescriptionLookupService descriptions,
                            ScreeningLogRepository screeningLogRepository,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.orchestrator = orchestrator;
        this.descriptions = descriptions;
        this.screeningLogRepository = screeningLogRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public ScreeningResponse screen(ScreeningRequest request) {
        String requestId = (request.requestId() != null && !request.requestId().isBlank())
                ? request.requestId()
                : "scr_" + UUID.randomUUID();
        String previousTraceId = MDC.get("trace_id");
        MDC.put("trace_id", requestId);
        try {
            ScreeningWindow window = resolveWindow(request);
            log.info("Screening {} parties for request {} over {}", request.parties().size(), requestId, window.asDateRange());

            List<ScreeningResponse.PartyResult> parties = new ArrayList<>();
            List<String> componentIds = new ArrayList<>();
            List<RiskRecord> components = new ArrayList<>();

            for (ScreeningRequest.Party party : request.parties()) {
                Map<String, Object> params = new LinkedHashMap<>();
                if (party.params() != null) {
                    params.putAll(party.params());
                }
                params.putIfAbsent(ProbeParameters.START_DATE, window.start().toString());
                params.putIfAbsent(ProbeParameters.END_DATE, window.end().toString());

                Map<String, String> subjectRef = Map.of(party.role(), party.subjectId());
                List<RiskRecord> results = orchestrator.execute(party.checks(), party.subjectId(), params).stream()
                        .map(record -> record.withSubjectRef(subjectRef))
                        .toList();
                parties.add(new ScreeningResponse.PartyResult(party.role(), party.subjectId(), results));

                for (RiskRecord record : results) {
                    componentIds.add(party.role() + "/" + record.riskType());
                    components.add(record);
                }
            }

            RiskRecord transaction = transactionRecord(componentIds, components);
            ScreeningResponse response = new ScreeningResponse(requestId, window, parties, transaction,
                    ScreeningSummary.of(components));
            persistLog(request, response);
            return response;
        } finally {
            if (previousTraceId != null) {
                MDC.put("trace_id", previousTraceId);
            } else {
                MDC.remove("trace_id");
            }
        }
    }

    public List<CheckDescriptor> listChecks() {
        return orchestrator.registry().all().stream().map(CheckDescriptor::of).toList();
    }

    public Optional<ScreeningLog> findLog(String requestId) {
        return screeningLogRepository.findFirstByRequestIdOrderByCreatedAtDesc(requestId);
    }

    private ScreeningWindow resolveWindow(ScreeningRequest request) {
        LocalDate end = request.endDate() != null ? request.endDate() : LocalDate.now(clock);
        LocalDate start = request.startDate() != null ? request.startDate() : end.minusDays(defaultWindowDays);
        if (start.isAfter(end)) {
            throw new InvalidRequestException("Window start " + start + " is after end " + end);
        }
        return new ScreeningWindow(start, end);
    }

    private RiskRecord transactionRecord(List<String> componentIds, List<RiskRecord> components) {
        if (components.isEmpty()) {
            return null;
        }
        CompositeProbe transaction = new CompositeProbe(TRANSACTION_CHECK, "Transaction overall risk", "transaction",
                componentIds, List.of());
        RiskRecord combined = transaction.combine(components);
        DescriptionText text = descriptions.lookup(combined.riskType(), combined.riskLevel());
        return combined.withDescriptions(text.info(), text.riskDescriptionInfo());
    }

    private void persistLog(ScreeningRequest request, ScreeningResponse response) {
        try {
            ScreeningLog entry = ScreeningLog.builder()
                    .requestId(response.requestId())
                    .overallLevel(response.summary().overallLevel())
                    .requestJson(objectMapper.valueToTree(request))
                    .responseJson(objectMapper.valueToTree(response))
                    .build();
            screeningLogRepository.save(entry);
        } catch (Exception e) {
            log.warn("Error to persist ScreeningLog", e);
        }
    }
}
