package com.ledgerbook.finance.repositories;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import com.ledgerbook.finance.entities.Payment;

public interface PaymentRepository extends JpaRepository<Payment, UUID> {

    Page<Payment> findAllByOrderByTransactionDateDesc(Pageable pageable);

    List<Payment> findByAccountingPeriodBetweenOrderByTransactionDateDesc(LocalDate start, LocalDate end);

    boolean existsByAccountId(UUID accountId);
}
