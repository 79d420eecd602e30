package com.ledgerbook.finance.repositories;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import com.ledgerbook.finance.entities.Expense;

public interface ExpenseRepository extends JpaRepository<Expense, UUID> {

    Page<Expense> findAllByOrderByTransactionDateDesc(Pageable pageable);

    List<Expense> findByAccountingPeriodBetweenOrderByTransactionDateDesc(LocalDate start, LocalDate end);

    boolean existsByAccountId(UUID accountId);
}
