package tech.axiom.platform.division;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.axiom.platform.audit.AuditContext;
import tech.axiom.platform.common.ExecutionContext;
import tech.axiom.platform.common.OffsetPage;
import tech.axiom.platform.common.Result;
import tech.axiom.platform.common.TracingContext;
import tech.axiom.platform.common.api.ErrorResponse;
import tech.axiom.platform.common.api.UseCaseErrors;
import tech.axiom.platform.common.errors.UseCaseError;
import tech.axiom.platform.division.events.DivisionCreated;
import tech.axiom.platform.division.events.DivisionDeleted;
import tech.axiom.platform.division.events.DivisionEvent;
import tech.axiom.platform.division.events.DivisionMoved;
import tech.axiom.platform.division.events.DivisionRestored;
import tech.axiom.platform.division.events.DivisionUpdated;
import tech.axiom.platform.division.operations.createdivision.CreateDivisionCommand;
import tech.axiom.platform.division.operations.deletedivision.DeleteDivisionCommand;
import tech.axiom.platform.division.operations.movedivision.MoveDivisionCommand;
import tech.axiom.platform.division.operations.restoredivision.RestoreDivisionCommand;
import tech.axiom.platform.division.operations.updatedivision.UpdateDivisionCommand;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * REST API for the division hierarchy.
 *
 * <p>Write endpoints translate request bodies into commands and return the stored
 * division after a successful commit. Business errors are mapped to 400 or 404.
 */
@Path("/api/v1/divisions")
@Tag(name = "Divisions", description = "Manage the organizational division hierarchy")
@Produces(MediaType.APPLICATION_JSON)
public class DivisionResource {

    @Inject
    DivisionOperations operations;

    @Inject
    AuditContext auditContext;

    @Inject
    TracingContext tracingContext;

    // ==================== List ====================

    @GET
    @Operation(operationId = "searchDivisions", summary = "List divisions, one page at a time",
        description = "Ordered by sort order then name. The search term matches code, name or short name.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Page of divisions",
            content = @Content(schema = @Schema(implementation = DivisionPageResponse.class))),
        @APIResponse(responseCode = "400", description = "Invalid paging parameters")
    })
    public DivisionPageResponse searchDivisions(
            @QueryParam("skip") @DefaultValue("0") @Min(0) int skip,
            @QueryParam("limit") @DefaultValue("20") @Min(1) @Max(100) int limit,
            @QueryParam("includeDeleted") @DefaultValue("false") boolean includeDeleted,
            @QueryParam("search") String search,
            @QueryParam("activeOnly") @DefaultValue("true") boolean activeOnly) {
        OffsetPage<Division> page = operations.search(
            new DivisionFilter(includeDeleted, activeOnly, search), skip, limit);
        return new DivisionPageResponse(
            toDtos(page.items()), page.total(), page.offset(), page.limit());
    }

    @GET
    @Path("/list")
    @Operation(operationId = "listDivisions", summary = "List all matching divisions without paging")
    public List<DivisionResponse> listDivisions(
            @QueryParam("includeDeleted") @DefaultValue("false") boolean includeDeleted,
            @QueryParam("search") String search,
            @QueryParam("activeOnly") @DefaultValue("true") boolean activeOnly) {
        return toDtos(operations.list(new DivisionFilter(includeDeleted, activeOnly, search)));
    }

    // ==================== Get ====================

    @GET
    @Path("/{id}")
    @Operation(operationId = "getDivision", summary = "Get a division by ID")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Division details",
            content = @Content(schema = @Schema(implementation = DivisionResponse.class))),
        @APIResponse(responseCode = "404", description = "Division not found")
    })
    public Response getDivision(
            @PathParam("id") long id,
            @QueryParam("includeDeleted") @DefaultValue("false") boolean includeDeleted) {
        return operations.findById(id, includeDeleted)
            .map(division -> Response.ok(toDto(division)).build())
            .orElseGet(() -> mapErrorToResponse(DivisionErrors.notFound(id)));
    }

    @GET
    @Path("/by-code/{code}")
    @Operation(operationId = "getDivisionByCode", summary = "Get a division by code (case-insensitive)")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Division details",
            content = @Content(schema = @Schema(implementation = DivisionResponse.class))),
        @APIResponse(responseCode = "404", description = "Division not found")
    })
    public Response getDivisionByCode(
            @PathParam("code") String code,
            @QueryParam("includeDeleted") @DefaultValue("false") boolean includeDeleted) {
        return operations.findByCode(code, includeDeleted)
            .map(division -> Response.ok(toDto(division)).build())
            .orElseGet(() -> Response.status(Response.Status.NOT_FOUND)
                .entity(new ErrorResponse(DivisionErrors.DIVISION_NOT_FOUND,
                    "Division with code '" + code + "' not found"))
                .build());
    }

    // ==================== Create ====================

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(operationId = "createDivision", summary = "Create a division",
        description = "Without a sort order the division is placed after its last sibling.")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Division created",
            content = @Content(schema = @Schema(implementation = DivisionResponse.class))),
        @APIResponse(responseCode = "400", description = "Invalid request, duplicate code or unknown parent")
    })
    public Response createDivision(@Valid @NotNull CreateDivisionRequest request) {
        var command = new CreateDivisionCommand(
            request.code(),
            request.name(),
            request.shortName(),
            request.parentId(),
            request.sortOrder(),
            request.internal(),
            request.active()
        );

        Result<DivisionCreated> result = operations.createDivision(command, executionContext());

        if (result instanceof Result.Failure<DivisionCreated> f) {
            return mapErrorToResponse(f.error());
        }
        return Response.status(Response.Status.CREATED)
            .entity(storedDivision(result))
            .build();
    }

    // ==================== Update ====================

    @PUT
    @Path("/{id}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(operationId = "updateDivision", summary = "Update a division",
        description = "Only the fields present in the body are changed. A parentId of 0 or null makes the division a root; "
            + "a null shortName removes it.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Division updated",
            content = @Content(schema = @Schema(implementation = DivisionResponse.class))),
        @APIResponse(responseCode = "400", description = "Invalid request or hierarchy rule violated"),
        @APIResponse(responseCode = "404", description = "Division not found")
    })
    public Response updateDivision(@PathParam("id") long id, @Valid @NotNull UpdateDivisionRequest request) {
        return update(id, request);
    }

    @PATCH
    @Path("/{id}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(operationId = "patchDivision", summary = "Partially update a division")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Division updated",
            content = @Content(schema = @Schema(implementation = DivisionResponse.class))),
        @APIResponse(responseCode = "400", description = "Invalid request or hierarchy rule violated"),
        @APIResponse(responseCode = "404", description = "Division not found")
    })
    public Response patchDivision(@PathParam("id") long id, @Valid @NotNull UpdateDivisionRequest request) {
        return update(id, request);
    }

    private Response update(long id, UpdateDivisionRequest request) {
        // An explicit null parent means root
        Long parentId = request.clearsParent() ? Long.valueOf(0L) : request.getParentId();
        var command = new UpdateDivisionCommand(
            id,
            request.getCode(),
            request.getName(),
            request.getShortName(),
            parentId,
            request.getSortOrder(),
            request.getInternal(),
            request.getActive(),
            request.clearsShortName()
        );

        Result<DivisionUpdated> result = operations.updateDivision(command, executionContext());

        if (result instanceof Result.Failure<DivisionUpdated> f) {
            return mapErrorToResponse(f.error());
        }
        return Response.ok(storedDivision(result)).build();
    }

    // ==================== Delete / Restore ====================

    @DELETE
    @Path("/{id}")
    @Operation(operationId = "deleteDivision", summary = "Delete a division",
        description = "Soft delete by default. Divisions with non-deleted children cannot be deleted.")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Division deleted"),
        @APIResponse(responseCode = "400", description = "Division has children"),
        @APIResponse(responseCode = "404", description = "Division not found")
    })
    public Response deleteDivision(
            @PathParam("id") long id,
            @QueryParam("softDelete") @DefaultValue("true") boolean softDelete) {
        Result<DivisionDeleted> result = operations.deleteDivision(
            new DeleteDivisionCommand(id, softDelete), executionContext());

        if (result instanceof Result.Failure<DivisionDeleted> f) {
            return mapErrorToResponse(f.error());
        }
        return Response.noContent().build();
    }

    @POST
    @Path("/{id}/restore")
    @Operation(operationId = "restoreDivision", summary = "Restore a soft-deleted division")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Division restored",
            content = @Content(schema = @Schema(implementation = DivisionResponse.class))),
        @APIResponse(responseCode = "400", description = "Division is not deleted, or its code is taken"),
        @APIResponse(responseCode = "404", description = "Division not found")
    })
    public Response restoreDivision(@PathParam("id") long id) {
        Result<DivisionRestored> result = operations.restoreDivision(
            new RestoreDivisionCommand(id), executionContext());

        if (result instanceof Result.Failure<DivisionRestored> f) {
            return mapErrorToResponse(f.error());
        }
        return Response.ok(storedDivision(result)).build();
    }

    // ==================== Hierarchy ====================

    @GET
    @Path("/{id}/children")
    @Operation(operationId = "getDivisionChildren", summary = "Direct children of a division")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Children in sibling order"),
        @APIResponse(responseCode = "404", description = "Division not found")
    })
    public Response getChildren(
            @PathParam("id") long id,
            @QueryParam("includeDeleted") @DefaultValue("false") boolean includeDeleted) {
        Optional<List<Division>> children = operations.findChildren(id, includeDeleted);
        if (children.isEmpty()) {
            return mapErrorToResponse(DivisionErrors.notFound(id));
        }
        return Response.ok(toDtos(children.get())).build();
    }

    @GET
    @Path("/hierarchy/tree")
    @Operation(operationId = "getDivisionTree", summary = "Flattened division tree",
        description = "With rootId, the root followed by its descendants, each parent before its children. "
            + "Without rootId, the top-level divisions only.")
    public List<DivisionResponse> getHierarchyTree(@QueryParam("rootId") Long rootId) {
        return toDtos(operations.getHierarchyTree(rootId));
    }

    @PUT
    @Path("/{id}/move")
    @Operation(operationId = "moveDivision", summary = "Move a division under a new parent",
        description = "Omitting newParentId (or passing 0) moves the division to the top level. "
            + "The former siblings are renumbered when the parent changes.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Division moved",
            content = @Content(schema = @Schema(implementation = DivisionResponse.class))),
        @APIResponse(responseCode = "400", description = "Self parent, unknown parent or cycle"),
        @APIResponse(responseCode = "404", description = "Division not found")
    })
    public Response moveDivision(
            @PathParam("id") long id,
            @QueryParam("newParentId") Long newParentId,
            @QueryParam("newSortOrder") Integer newSortOrder) {
        Result<DivisionMoved> result = operations.moveDivision(
            new MoveDivisionCommand(id, newParentId, newSortOrder), executionContext());

        if (result instanceof Result.Failure<DivisionMoved> f) {
            return mapErrorToResponse(f.error());
        }
        return Response.ok(storedDivision(result)).build();
    }

    // ==================== Lookups ====================

    @GET
    @Path("/codes/available")
    @Operation(operationId = "getAvailableDivisionCodes", summary = "Codes of active divisions, sorted")
    public List<String> getAvailableCodes(@QueryParam("prefix") String prefix) {
        return operations.getAvailableCodes(prefix);
    }

    @GET
    @Path("/search/suggest")
    @Operation(operationId = "suggestDivisions", summary = "Type-ahead suggestions over active divisions")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Matching divisions"),
        @APIResponse(responseCode = "400", description = "Query shorter than 2 characters")
    })
    public List<DivisionResponse> suggest(
            @QueryParam("q") @NotNull @Size(min = 2) String query,
            @QueryParam("limit") @DefaultValue("10") @Min(1) @Max(50) int limit) {
        return toDtos(operations.suggest(query, limit));
    }

    // ==================== Helper Methods ====================

    private ExecutionContext executionContext() {
        return ExecutionContext.from(tracingContext, auditContext.principalId());
    }

    private DivisionResponse storedDivision(Result<? extends DivisionEvent> result) {
        var success = (Result.Success<? extends DivisionEvent>) result;
        long divisionId = success.value().divisionId();
        return operations.findById(divisionId, true)
            .map(this::toDto)
            .orElseThrow(() -> new IllegalStateException("Division " + divisionId + " missing after commit"));
    }

    private Response mapErrorToResponse(UseCaseError error) {
        return UseCaseErrors.toResponse(error);
    }

    private List<DivisionResponse> toDtos(List<Division> divisions) {
        return divisions.stream().map(this::toDto).toList();
    }

    private DivisionResponse toDto(Division division) {
        return new DivisionResponse(
            division.id,
            division.code,
            division.name,
            division.shortName,
            division.parentId,
            division.sortOrder,
            division.internal,
            division.active,
            division.deleted,
            division.createdAt,
            division.updatedAt
        );
    }

    // ==================== DTOs ====================

    public record CreateDivisionRequest(
        @NotBlank @Size(max = Division.CODE_MAX_LENGTH) String code,
        @NotBlank @Size(max = Division.NAME_MAX_LENGTH) String name,
        @Size(max = Division.SHORT_NAME_MAX_LENGTH) String shortName,
        Long parentId,
        Integer sortOrder,
        Boolean internal,
        Boolean active
    ) {}

    /**
     * Update body. Setters record which properties were present so that an explicit
     * {@code null} can be told apart from an omitted property.
     */
    public static class UpdateDivisionRequest {

        @Size(min = 1, max = Division.CODE_MAX_LENGTH)
        private String code;

        @Size(min = 1, max = Division.NAME_MAX_LENGTH)
        private String name;

        @Size(max = Division.SHORT_NAME_MAX_LENGTH)
        private String shortName;

        private Long parentId;
        private Integer sortOrder;
        private Boolean internal;
        private Boolean active;

        @JsonIgnore
        private boolean shortNameSent;

        @JsonIgnore
        private boolean parentIdSent;

        public String getCode() { return code; }
        public void setCode(String code) { this.code = code; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getShortName() { return shortName; }
        public void setShortName(String shortName) {
            this.shortName = shortName;
            this.shortNameSent = true;
        }

        public Long getParentId() { return parentId; }
        public void setParentId(Long parentId) {
            this.parentId = parentId;
            this.parentIdSent = true;
        }

        public Integer getSortOrder() { return sortOrder; }
        public void setSortOrder(Integer sortOrder) { this.sortOrder = sortOrder; }

        public Boolean getInternal() { return internal; }
        public void setInternal(Boolean internal) { this.internal = internal; }

        public Boolean getActive() { return active; }
        public void setActive(Boolean active) { this.active = active; }

        @JsonIgnore
        public boolean clearsShortName() {
            return shortNameSent && shortName == null;
        }

        @JsonIgnore
        public boolean clearsParent() {
            return parentIdSent && parentId == null;
        }
    }

    public record DivisionResponse(
        Long id,
        String code,
        String name,
        String shortName,
        Long parentId,
        int sortOrder,
        boolean internal,
        boolean active,
        boolean deleted,
        Instant createdAt,
        Instant updatedAt
    ) {}

    public record DivisionPageResponse(
        List<DivisionResponse> items,
        long total,
        int skip,
        int limit
    ) {}
}
