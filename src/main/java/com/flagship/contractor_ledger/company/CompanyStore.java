package com.flagship.contractor_ledger.company;

import com.flagship.contractor_ledger.exception.NotFoundException;
import com.flagship.contractor_ledger.exception.ValidationException;
import com.flagship.contractor_ledger.persistence.LedgerTransactionBoundary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC store for companies.
 *
 * Deletion is not offered here: removing a company cascades into projects, transactions and
 * allocations, which {@link com.flagship.contractor_ledger.trash.TrashStore} captures as one bundle.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class CompanyStore {

    private static final String COLUMNS =
        "id, kind, role, name, national_id, tax_office, tax_number, contact_person, phone, email, "
            + "address, bank_name, iban, notes, active, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerTransactionBoundary boundary;

    public Company create(CompanyRequest request) {
        if (request.getKind() == null || request.getRole() == null) {
            throw new ValidationException("Company kind and role are required");
        }
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException("Company name is required");
        }

        Instant now = Instant.now();
        Company company = Company.builder()
            .id(UUID.randomUUID())
            .kind(request.getKind())
            .role(request.getRole())
            .name(request.getName().trim())
            .nationalId(request.getNationalId())
            .taxOffice(request.getTaxOffice())
            .taxNumber(request.getTaxNumber())
            .contactPerson(request.getContactPerson())
            .phone(request.getPhone())
            .email(request.getEmail())
            .address(request.getAddress())
            .bankName(request.getBankName())
            .iban(request.getIban())
            .notes(request.getNotes())
            .active(true)
            .createdAt(now)
            .updatedAt(now)
            .build();

        insert(company);
        log.info("Created company {} ({})", company.getId(), company.getRole().code());
        return company;
    }

    public Company update(UUID id, CompanyUpdate update) {
        Company current = getById(id);
        if (update.getName() != null && update.getName().isBlank()) {
            throw new ValidationException("Company name cannot be blank");
        }

        Company updated = current.toBuilder()
            .kind(update.getKind() != null ? update.getKind() : current.getKind())
            .role(update.getRole() != null ? update.getRole() : current.getRole())
            .name(update.getName() != null ? update.getName().trim() : current.getName())
            .nationalId(pick(update.getNationalId(), current.getNationalId()))
            .taxOffice(pick(update.getTaxOffice(), current.getTaxOffice()))
            .taxNumber(pick(update.getTaxNumber(), current.getTaxNumber()))
            .contactPerson(pick(update.getContactPerson(), current.getContactPerson()))
            .phone(pick(update.getPhone(), current.getPhone()))
            .email(pick(update.getEmail(), current.getEmail()))
            .address(pick(update.getAddress(), current.getAddress()))
            .bankName(pick(update.getBankName(), current.getBankName()))
            .iban(pick(update.getIban(), current.getIban()))
            .notes(pick(update.getNotes(), current.getNotes()))
            .active(update.getActive() != null ? update.getActive() : current.isActive())
            .updatedAt(Instant.now())
            .build();

        boundary.recordMutation();
        jdbcTemplate.update(
            "UPDATE companies SET kind = ?, role = ?, name = ?, national_id = ?, tax_office = ?, tax_number = ?, "
                + "contact_person = ?, phone = ?, email = ?, address = ?, bank_name = ?, iban = ?, notes = ?, "
                + "active = ?, updated_at = ? WHERE id = ?",
            updated.getKind().code(),
            updated.getRole().code(),
            updated.getName(),
            updated.getNationalId(),
            updated.getTaxOffice(),
            updated.getTaxNumber(),
            updated.getContactPerson(),
            updated.getPhone(),
            updated.getEmail(),
            updated.getAddress(),
            updated.getBankName(),
            updated.getIban(),
            updated.getNotes(),
            updated.isActive(),
            Timestamp.from(updated.getUpdatedAt()),
            id
        );
        return updated;
    }

    /**
     * Writes a company row as-is, keeping its id and timestamps. Used by trash restore and
     * snapshot load.
     */
    public void insert(Company company) {
        boundary.recordMutation();
        jdbcTemplate.update(
            "INSERT INTO companies (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            company.getId(),
            company.getKind().code(),
            company.getRole().code(),
            company.getName(),
            company.getNationalId(),
            company.getTaxOffice(),
            company.getTaxNumber(),
            company.getContactPerson(),
            company.getPhone(),
            company.getEmail(),
            company.getAddress(),
            company.getBankName(),
            company.getIban(),
            company.getNotes(),
            company.isActive(),
            Timestamp.from(company.getCreatedAt()),
            Timestamp.from(company.getUpdatedAt())
        );
    }

    public Optional<Company> findById(UUID id) {
        List<Company> companies = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM companies WHERE id = ?", companyRowMapper(), id);
        return companies.stream().findFirst();
    }

    public Company getById(UUID id) {
        return findById(id).orElseThrow(() -> NotFoundException.of("Company", id));
    }

    public boolean exists(UUID id) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM companies WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    /**
     * Lists companies ordered by name.
     *
     * @param role optional role filter
     * @param includeInactive whether deactivated companies are included
     */
    public List<Company> findAll(CompanyRole role, boolean includeInactive) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM companies WHERE 1 = 1");
        if (role != null) {
            sql.append(" AND role = '").append(role.code()).append("'");
        }
        if (!includeInactive) {
            sql.append(" AND active = TRUE");
        }
        sql.append(" ORDER BY name, id");
        return jdbcTemplate.query(sql.toString(), companyRowMapper());
    }

    public List<Company> findAllOrderedById() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM companies ORDER BY id", companyRowMapper());
    }

    private static String pick(String update, String current) {
        return update != null ? update : current;
    }

    private RowMapper<Company> companyRowMapper() {
        return (rs, rowNum) -> Company.builder()
            .id(rs.getObject("id", UUID.class))
            .kind(CompanyKind.fromCode(rs.getString("kind")))
            .role(CompanyRole.fromCode(rs.getString("role")))
            .name(rs.getString("name"))
            .nationalId(rs.getString("national_id"))
            .taxOffice(rs.getString("tax_office"))
            .taxNumber(rs.getString("tax_number"))
            .contactPerson(rs.getString("contact_person"))
            .phone(rs.getString("phone"))
            .email(rs.getString("email"))
            .address(rs.getString("address"))
            .bankName(rs.getString("bank_name"))
            .iban(rs.getString("iban"))
            .notes(rs.getString("notes"))
            .active(rs.getBoolean("active"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .updatedAt(rs.getTimestamp("updated_at").toInstant())
            .build();
    }
}
