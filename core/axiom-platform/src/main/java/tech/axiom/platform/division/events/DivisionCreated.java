package tech.axiom.platform.division.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Builder;
import tech.axiom.platform.common.ExecutionContext;
import tech.axiom.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event emitted when a division is created.
 *
 * <p>Event type: {@code axiom:org:division:created}
 */
@Builder
public record DivisionCreated(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String causationId,
    String principalId,
    Long divisionId,
    String code,
    String name,
    Long parentId,
    int sortOrder
) implements DivisionEvent {

    private static final String EVENT_TYPE = "axiom:org:division:created";

    @JsonIgnore
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    @JsonIgnore
    public String eventType() {
        return EVENT_TYPE;
    }

    @Override
    @JsonIgnore
    public String subject() {
        return "org.division." + divisionId;
    }

    @Override
    @JsonIgnore
    public String toDataJson() {
        try {
            return MAPPER.writeValueAsString(new Data(divisionId, code, name, parentId, sortOrder));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize event data", e);
        }
    }

    public record Data(
        Long divisionId,
        String code,
        String name,
        Long parentId,
        int sortOrder
    ) {}

    /**
     * Create a pre-configured builder with event metadata from the execution context.
     */
    public static DivisionCreatedBuilder fromContext(ExecutionContext ctx) {
        return DivisionCreated.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .causationId(ctx.causationId())
            .principalId(ctx.principalId());
    }
}
