package com.ledgerbook.finance.controllers;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ledgerbook.finance.dto.ApiResponse;
import com.ledgerbook.finance.dto.accounts.MoneyAccountRequestDTO;
import com.ledgerbook.finance.dto.accounts.MoneyAccountResponseDTO;
import com.ledgerbook.finance.services.MoneyAccountService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/finance/accounts")
@RequiredArgsConstructor
public class MoneyAccountController {

    private final MoneyAccountService moneyAccountService;

    @PostMapping
    public ResponseEntity<ApiResponse<MoneyAccountResponseDTO>> create(@Valid @RequestBody MoneyAccountRequestDTO dto) {
        MoneyAccountResponseDTO created = moneyAccountService.create(dto);
        return ResponseEntity
                .status(201)
                .body(ApiResponse.success(created, "Money account created successfully"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<MoneyAccountResponseDTO>>> findAll() {
        return ResponseEntity.ok(ApiResponse.success(moneyAccountService.findAll(), "Money accounts loaded successfully"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<MoneyAccountResponseDTO>> findById(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(moneyAccountService.findById(id), "Money account found"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<MoneyAccountResponseDTO>> update(
            @PathVariable String id,
            @Valid @RequestBody MoneyAccountRequestDTO dto
    ) {
        MoneyAccountResponseDTO updated = moneyAccountService.update(id, dto);
        return ResponseEntity.ok(ApiResponse.success(updated, "Money account updated successfully"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        moneyAccountService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Money account deleted successfully"));
    }
}
