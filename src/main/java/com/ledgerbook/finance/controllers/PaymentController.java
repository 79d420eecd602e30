package com.ledgerbook.finance.controllers;

import java.time.LocalDate;
import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
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

import com.ledgerbook.finance.dto.ApiResponse;
import com.ledgerbook.finance.dto.payments.PaymentRequestDTO;
import com.ledgerbook.finance.dto.payments.PaymentResponseDTO;
import com.ledgerbook.finance.services.PaymentService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/finance/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;

    @PostMapping
    public ResponseEntity<ApiResponse<PaymentResponseDTO>> create(@Valid @RequestBody PaymentRequestDTO dto) {
        PaymentResponseDTO created = paymentService.create(dto);
        return ResponseEntity
                .status(201)
                .body(ApiResponse.success(created, "Payment created successfully"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<Page<PaymentResponseDTO>>> findAll(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(ApiResponse.success(paymentService.findAll(page, size), "Payments loaded successfully"));
    }

    @GetMapping("/period")
    public ResponseEntity<ApiResponse<List<PaymentResponseDTO>>> findByPeriod(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
    ) {
        return ResponseEntity.ok(ApiResponse.success(paymentService.findByAccountingPeriod(start, end), "Payments found"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<PaymentResponseDTO>> findById(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(paymentService.findById(id), "Payment found"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<PaymentResponseDTO>> update(
            @PathVariable String id,
            @Valid @RequestBody PaymentRequestDTO dto
    ) {
        PaymentResponseDTO updated = paymentService.update(id, dto);
        return ResponseEntity.ok(ApiResponse.success(updated, "Payment updated successfully"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        paymentService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Payment deleted successfully"));
    }
}
