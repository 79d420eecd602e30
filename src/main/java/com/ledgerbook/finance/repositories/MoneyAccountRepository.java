package com.ledgerbook.finance.repositories;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.ledgerbook.finance.entities.MoneyAccount;

public interface MoneyAccountRepository extends JpaRepository<MoneyAccount, UUID> {

    List<MoneyAccount> findAllByOrderByNameAsc();
}
