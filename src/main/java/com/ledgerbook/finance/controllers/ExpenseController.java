package com.ledgerbook.finance.controllers;

import java.time.LocalDate;
import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import com.ledgerbook.finance.dto.ApiResponse;
import com.ledgerbook.finance.dto.expenses.ExpenseRequestDTO;
import com.ledgerbook.finance.dto.expenses.ExpenseResponseDTO;
import com.ledgerbook.finance.notifications.ExpenseStreamHub;
import com.ledgerbook.finance.services.ExpenseService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/finance/expenses")
@RequiredArgsConstructor
public class ExpenseController {

    private final ExpenseService expenseService;
    private final ExpenseStreamHub expenseStreamHub;

    @PostMapping
    public ResponseEntity<ApiResponse<ExpenseResponseDTO>> create(@Valid @RequestBody ExpenseRequestDTO dto) {
        ExpenseResponseDTO created = expenseService.create(dto);
        return ResponseEntity
                .status(201)
                .body(ApiResponse.success(created, "Expense created successfully"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<Page<ExpenseResponseDTO>>> findAll(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(ApiResponse.success(expenseService.findAll(page, size), "Expenses loaded successfully"));
    }

    @GetMapping("/period")
    public ResponseEntity<ApiResponse<List<ExpenseResponseDTO>>> findByPeriod(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
    ) {
        List<ExpenseResponseDTO> list = expenseService.findByAccountingPeriod(start, end);
        return ResponseEntity.ok(ApiResponse.success(list, "Expenses found"));
    }

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        return expenseStreamHub.subscribe();
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ExpenseResponseDTO>> findById(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(expenseService.findById(id), "Expense found"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ExpenseResponseDTO>> update(
            @PathVariable String id,
            @Valid @RequestBody ExpenseRequestDTO dto
    ) {
        ExpenseResponseDTO updated = expenseService.update(id, dto);
        return ResponseEntity.ok(ApiResponse.success(updated, "Expense updated successfully"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        expenseService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Expense deleted successfully"));
    }
}
