package com.flagship.contractor_ledger.project;

import com.flagship.contractor_ledger.company.Company;
import com.flagship.contractor_ledger.company.CompanyStore;
import com.flagship.contractor_ledger.exception.ConstraintViolationException;
import com.flagship.contractor_ledger.exception.NotFoundException;
import com.flagship.contractor_ledger.exception.ValidationException;
import com.flagship.contractor_ledger.persistence.LedgerTransactionBoundary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Year;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC store for projects.
 *
 * Enforces the ownership rule on every write: a client project names an existing, active
 * client company and an own project names none.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ProjectStore {

    private static final String COLUMNS =
        "id, code, name, ownership, client_company_id, status, location, estimated_budget, planned_start, "
            + "planned_end, actual_start, actual_end, description, active, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final CompanyStore companyStore;
    private final LedgerTransactionBoundary boundary;

    public Project create(ProjectRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException("Project name is required");
        }
        if (request.getOwnership() == null) {
            throw new ValidationException("Project ownership is required");
        }
        validateBudget(request.getEstimatedBudget());
        validateClient(request.getOwnership(), request.getClientCompanyId());

        String code = request.getCode() == null || request.getCode().isBlank()
            ? generateCode(Year.now().getValue())
            : request.getCode().trim();
        ensureCodeAvailable(code, null);

        Instant now = Instant.now();
        Project project = Project.builder()
            .id(UUID.randomUUID())
            .code(code)
            .name(request.getName().trim())
            .ownership(request.getOwnership())
            .clientCompanyId(request.getClientCompanyId())
            .status(request.getStatus() != null ? request.getStatus() : ProjectStatus.PLANNED)
            .location(request.getLocation())
            .estimatedBudget(request.getEstimatedBudget())
            .plannedStart(request.getPlannedStart())
            .plannedEnd(request.getPlannedEnd())
            .actualStart(request.getActualStart())
            .actualEnd(request.getActualEnd())
            .description(request.getDescription())
            .active(true)
            .createdAt(now)
            .updatedAt(now)
            .build();

        insert(project);
        log.info("Created project {} ({})", project.getCode(), project.getOwnership().code());
        return project;
    }

    public Project update(UUID id, ProjectUpdate update) {
        Project current = getById(id);
        if (update.getName() != null && update.getName().isBlank()) {
            throw new ValidationException("Project name cannot be blank");
        }

        OwnershipType ownership = update.getOwnership() != null ? update.getOwnership() : current.getOwnership();
        UUID clientCompanyId = ownership == OwnershipType.OWN
            ? null
            : (update.getClientCompanyId() != null ? update.getClientCompanyId() : current.getClientCompanyId());

        if (update.getEstimatedBudget() != null) {
            validateBudget(update.getEstimatedBudget());
        }
        if (ownership != current.getOwnership() || !Objects.equals(clientCompanyId, current.getClientCompanyId())) {
            validateClient(ownership, clientCompanyId);
        }

        String code = current.getCode();
        if (update.getCode() != null && !update.getCode().isBlank() && !update.getCode().trim().equals(code)) {
            code = update.getCode().trim();
            ensureCodeAvailable(code, id);
        }

        Project updated = current.toBuilder()
            .code(code)
            .name(update.getName() != null ? update.getName().trim() : current.getName())
            .ownership(ownership)
            .clientCompanyId(clientCompanyId)
            .status(update.getStatus() != null ? update.getStatus() : current.getStatus())
            .location(update.getLocation() != null ? update.getLocation() : current.getLocation())
            .estimatedBudget(update.getEstimatedBudget() != null ? update.getEstimatedBudget() : current.getEstimatedBudget())
            .plannedStart(update.getPlannedStart() != null ? update.getPlannedStart() : current.getPlannedStart())
            .plannedEnd(update.getPlannedEnd() != null ? update.getPlannedEnd() : current.getPlannedEnd())
            .actualStart(update.getActualStart() != null ? update.getActualStart() : current.getActualStart())
            .actualEnd(update.getActualEnd() != null ? update.getActualEnd() : current.getActualEnd())
            .description(update.getDescription() != null ? update.getDescription() : current.getDescription())
            .active(update.getActive() != null ? update.getActive() : current.isActive())
            .updatedAt(Instant.now())
            .build();

        boundary.recordMutation();
        jdbcTemplate.update(
            "UPDATE projects SET code = ?, name = ?, ownership = ?, client_company_id = ?, status = ?, location = ?, "
                + "estimated_budget = ?, planned_start = ?, planned_end = ?, actual_start = ?, actual_end = ?, "
                + "description = ?, active = ?, updated_at = ? WHERE id = ?",
            updated.getCode(),
            updated.getName(),
            updated.getOwnership().code(),
            updated.getClientCompanyId(),
            updated.getStatus().code(),
            updated.getLocation(),
            updated.getEstimatedBudget(),
            toSqlDate(updated.getPlannedStart()),
            toSqlDate(updated.getPlannedEnd()),
            toSqlDate(updated.getActualStart()),
            toSqlDate(updated.getActualEnd()),
            updated.getDescription(),
            updated.isActive(),
            Timestamp.from(updated.getUpdatedAt()),
            id
        );
        return updated;
    }

    /**
     * Writes a project row as-is. Used by create, trash restore and snapshot load.
     */
    public void insert(Project project) {
        boundary.recordMutation();
        jdbcTemplate.update(
            "INSERT INTO projects (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            project.getId(),
            project.getCode(),
            project.getName(),
            project.getOwnership().code(),
            project.getClientCompanyId(),
            project.getStatus().code(),
            project.getLocation(),
            project.getEstimatedBudget(),
            toSqlDate(project.getPlannedStart()),
            toSqlDate(project.getPlannedEnd()),
            toSqlDate(project.getActualStart()),
            toSqlDate(project.getActualEnd()),
            project.getDescription(),
            project.isActive(),
            Timestamp.from(project.getCreatedAt()),
            Timestamp.from(project.getUpdatedAt())
        );
    }

    /**
     * Next free code of the form PRJ-2024-001 for the given year.
     */
    public String generateCode(int year) {
        String prefix = "PRJ-" + year + "-";
        List<String> codes = jdbcTemplate.queryForList(
            "SELECT code FROM projects WHERE code LIKE ?", String.class, prefix + "%");

        int next = 1;
        for (String existing : codes) {
            try {
                next = Math.max(next, Integer.parseInt(existing.substring(prefix.length())) + 1);
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric project code {}", existing);
            }
        }
        return prefix + String.format("%03d", next);
    }

    public Optional<Project> findById(UUID id) {
        List<Project> projects = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM projects WHERE id = ?", projectRowMapper(), id);
        return projects.stream().findFirst();
    }

    public Project getById(UUID id) {
        return findById(id).orElseThrow(() -> NotFoundException.of("Project", id));
    }

    public Optional<Project> findByCode(String code) {
        List<Project> projects = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM projects WHERE code = ?", projectRowMapper(), code);
        return projects.stream().findFirst();
    }

    public List<Project> findAll(ProjectStatus status, boolean includeInactive) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM projects WHERE 1 = 1");
        if (status != null) {
            sql.append(" AND status = '").append(status.code()).append("'");
        }
        if (!includeInactive) {
            sql.append(" AND active = TRUE");
        }
        sql.append(" ORDER BY code");
        return jdbcTemplate.query(sql.toString(), projectRowMapper());
    }

    public List<Project> findByClientCompany(UUID companyId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM projects WHERE client_company_id = ? ORDER BY id",
            projectRowMapper(), companyId);
    }

    public List<Project> findAllOrderedById() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM projects ORDER BY id", projectRowMapper());
    }

    private void validateBudget(BigDecimal budget) {
        if (budget != null && budget.signum() < 0) {
            throw new ValidationException("Estimated budget cannot be negative");
        }
    }

    private void validateClient(OwnershipType ownership, UUID clientCompanyId) {
        if (ownership == OwnershipType.OWN) {
            if (clientCompanyId != null) {
                throw new ValidationException("Own projects cannot have a client company");
            }
            return;
        }
        if (clientCompanyId == null) {
            throw new ValidationException("Client projects require a client company");
        }
        Company client = companyStore.getById(clientCompanyId);
        if (!client.isActive()) {
            throw new ConstraintViolationException("Client company of a project must be active");
        }
    }

    private void ensureCodeAvailable(String code, UUID ownId) {
        findByCode(code)
            .filter(existing -> !existing.getId().equals(ownId))
            .ifPresent(existing -> {
                throw new ConstraintViolationException("Project code is already in use: " + code);
            });
    }

    private static Date toSqlDate(LocalDate date) {
        return date != null ? Date.valueOf(date) : null;
    }

    private static LocalDate toLocalDate(Date date) {
        return date != null ? date.toLocalDate() : null;
    }

    private RowMapper<Project> projectRowMapper() {
        return (rs, rowNum) -> Project.builder()
            .id(rs.getObject("id", UUID.class))
            .code(rs.getString("code"))
            .name(rs.getString("name"))
            .ownership(OwnershipType.fromCode(rs.getString("ownership")))
            .clientCompanyId(rs.getObject("client_company_id", UUID.class))
            .status(ProjectStatus.fromCode(rs.getString("status")))
            .location(rs.getString("location"))
            .estimatedBudget(rs.getBigDecimal("estimated_budget"))
            .plannedStart(toLocalDate(rs.getDate("planned_start")))
            .plannedEnd(toLocalDate(rs.getDate("planned_end")))
            .actualStart(toLocalDate(rs.getDate("actual_start")))
            .actualEnd(toLocalDate(rs.getDate("actual_end")))
            .description(rs.getString("description"))
            .active(rs.getBoolean("active"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .updatedAt(rs.getTimestamp("updated_at").toInstant())
            .build();
    }
}
