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
import java.util.List;

/**
 * Event emitted when a division is given a new parent or sort order.
 *
 * <p>{@code renumberedSiblings} lists the former siblings whose sort order was
 * rewritten to close the gap left by the move, with their new sort orders.
 *
 * <p>Event type: {@code axiom:org:division:moved}
 */
@Builder
public record DivisionMoved(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String causationId,
    String principalId,
    Long divisionId,
    Long oldParentId,
    Long newParentId,
    int sortOrder,
    List<SiblingOrder> renumberedSiblings
) implements DivisionEvent {

    private static final String EVENT_TYPE = "axiom:org:division:moved";

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
            return MAPPER.writeValueAsString(new Data(divisionId, oldParentId, newParentId, sortOrder, renumberedSiblings));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize event data", e);
        }
    }

    public record Data(
        Long divisionId,
        Long oldParentId,
        Long newParentId,
        int sortOrder,
        List<SiblingOrder> renumberedSiblings
    ) {}

    public record SiblingOrder(Long divisionId, int sortOrder) {}

    /**
     * Create a pre-configured builder with event metadata from the execution context.
     */
    public static DivisionMovedBuilder fromContext(ExecutionContext ctx) {
        return DivisionMoved.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .causationId(ctx.causationId())
            .principalId(ctx.principalId());
    }
}
