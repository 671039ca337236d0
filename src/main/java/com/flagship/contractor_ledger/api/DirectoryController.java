package com.flagship.contractor_ledger.api;

import com.flagship.contractor_ledger.api.dto.CategoryPayload;
import com.flagship.contractor_ledger.api.dto.CompanyPayload;
import com.flagship.contractor_ledger.api.dto.ProjectPayload;
import com.flagship.contractor_ledger.category.Category;
import com.flagship.contractor_ledger.category.CategoryType;
import com.flagship.contractor_ledger.company.Company;
import com.flagship.contractor_ledger.company.CompanyRole;
import com.flagship.contractor_ledger.ledger.LedgerService;
import com.flagship.contractor_ledger.project.Project;
import com.flagship.contractor_ledger.project.ProjectStatus;
import com.flagship.contractor_ledger.trash.TrashEntry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Companies, projects and categories.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DirectoryController {

    private final LedgerService ledgerService;

    // ==================== Companies ====================

    @PostMapping("/companies")
    public ResponseEntity<Company> createCompany(@Valid @RequestBody CompanyPayload payload) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ledgerService.createCompany(payload.toRequest()));
    }

    @GetMapping("/companies")
    public List<Company> listCompanies(@RequestParam(name = "role", required = false) String role,
                                       @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
        return ledgerService.listCompanies(role != null ? CompanyRole.fromCode(role) : null, includeInactive);
    }

    @GetMapping("/companies/{id}")
    public Company getCompany(@PathVariable UUID id) {
        return ledgerService.getCompany(id);
    }

    @PatchMapping("/companies/{id}")
    public Company updateCompany(@PathVariable UUID id, @Valid @RequestBody CompanyPayload payload) {
        return ledgerService.updateCompany(id, payload.toUpdate());
    }

    @DeleteMapping("/companies/{id}")
    public TrashEntry deleteCompany(@PathVariable UUID id) {
        return ledgerService.deleteCompany(id);
    }

    // ==================== Projects ====================

    @PostMapping("/projects")
    public ResponseEntity<Project> createProject(@Valid @RequestBody ProjectPayload payload) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ledgerService.createProject(payload.toRequest()));
    }

    @GetMapping("/projects")
    public List<Project> listProjects(@RequestParam(name = "status", required = false) String status,
                                      @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
        return ledgerService.listProjects(status != null ? ProjectStatus.fromCode(status) : null, includeInactive);
    }

    @GetMapping("/projects/{id}")
    public Project getProject(@PathVariable UUID id) {
        return ledgerService.getProject(id);
    }

    @PatchMapping("/projects/{id}")
    public Project updateProject(@PathVariable UUID id, @Valid @RequestBody ProjectPayload payload) {
        return ledgerService.updateProject(id, payload.toUpdate());
    }

    @DeleteMapping("/projects/{id}")
    public TrashEntry deleteProject(@PathVariable UUID id) {
        return ledgerService.deleteProject(id);
    }

    // ==================== Categories ====================

    @PostMapping("/categories")
    public ResponseEntity<Category> createCategory(@RequestBody CategoryPayload payload) {
        Category created = ledgerService.createCategory(payload.getName(), payload.getType(), payload.getColor());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/categories")
    public List<Category> listCategories(@RequestParam(name = "type", required = false) String type) {
        return ledgerService.listCategories(type != null ? CategoryType.fromCode(type) : null);
    }

    @PatchMapping("/categories/{id}")
    public Category updateCategory(@PathVariable UUID id, @RequestBody CategoryPayload payload) {
        return ledgerService.updateCategory(id, payload.getName(), payload.getColor());
    }

    @DeleteMapping("/categories/{id}")
    public ResponseEntity<Void> deleteCategory(@PathVariable UUID id) {
        ledgerService.deleteCategory(id);
        return ResponseEntity.noContent().build();
    }
}
