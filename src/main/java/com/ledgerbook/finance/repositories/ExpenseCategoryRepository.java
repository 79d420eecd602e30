package com.ledgerbook.finance.repositories;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.ledgerbook.finance.entities.ExpenseCategory;

public interface ExpenseCategoryRepository extends JpaRepository<ExpenseCategory, UUID> {
}
