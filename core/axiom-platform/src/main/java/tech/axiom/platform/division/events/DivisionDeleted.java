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
 * Event emitted when a division is deleted, either soft (flagged) or hard (row removed).
 *
 * <p>Event type: {@code axiom:org:division:deleted}
 */
@Builder
public record DivisionDeleted(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String causationId,
    String principalId,
    Long divisionId,
    String code,
    boolean softDelete
) implements DivisionEvent {

    private static final String EVENT_TYPE = "axiom:org:division:deleted";

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
            return MAPPER.writeValueAsString(new Data(divisionId, code, softDelete));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize event data", e);
        }
    }

    public record Data(
        Long divisionId,
        String code,
        boolean softDelete
    ) {}

    /**
     * Create a pre-configured builder with event metadata from the execution context.
     */
    public static DivisionDeletedBuilder fromContext(ExecutionContext ctx) {
        return DivisionDeleted.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .causationId(ctx.causationId())
            .principalId(ctx.principalId());
    }
}
