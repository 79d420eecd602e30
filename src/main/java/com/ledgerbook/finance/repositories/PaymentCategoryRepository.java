package com.ledgerbook.finance.repositories;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.ledgerbook.finance.entities.PaymentCategory;

public interface PaymentCategoryRepository extends JpaRepository<PaymentCategory, UUID> {
}
