package com.ledgerbook.finance.services;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ledgerbook.finance.dto.accounts.MoneyAccountRequestDTO;
import com.ledgerbook.finance.dto.accounts.MoneyAccountResponseDTO;
import com.ledgerbook.finance.entities.MoneyAccount;
import com.ledgerbook.finance.exceptions.ConflictException;
import com.ledgerbook.finance.exceptions.ResourceNotFoundException;
import com.ledgerbook.finance.money.MoneyFormatter;
import com.ledgerbook.finance.repositories.ExpenseRepository;
import com.ledgerbook.finance.repositories.MoneyAccountRepository;
import com.ledgerbook.finance.repositories.PaymentRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Money accounts. An account that has expenses or payments recorded against
 * it can neither be deleted nor moved to another currency.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MoneyAccountService {

    private final MoneyAccountRepository moneyAccountRepository;
    private final ExpenseRepository expenseRepository;
    private final PaymentRepository paymentRepository;
    private final MoneyFormatter moneyFormatter;

    @Transactional(readOnly = true)
    public List<MoneyAccount> getAll() {
        return moneyAccountRepository.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public MoneyAccount getById(UUID id) {
        return moneyAccountRepository.findById(Objects.requireNonNull(id, "id"))
                .orElseThrow(() -> new ResourceNotFoundException("Money account not found"));
    }

    @Transactional(readOnly = true)
    public List<MoneyAccountResponseDTO> findAll() {
        return getAll().stream().map(this::toDTO).toList();
    }

    @Transactional(readOnly = true)
    public MoneyAccountResponseDTO findById(String id) {
        return toDTO(getById(UUID.fromString(id)));
    }

    @Transactional
    public MoneyAccountResponseDTO create(MoneyAccountRequestDTO dto) {
        MoneyAccount entity = MoneyAccount.builder()
                .name(dto.getName())
                .accountNumber(dto.getAccountNumber())
                .description(dto.getDescription())
                .balance(dto.getBalance())
                .currency(currencyCode(dto))
                .build();

        entity = moneyAccountRepository.save(entity);
        log.info("[MoneyAccountService] created accountId={} currency={} balance={}",
                entity.getId(), entity.getCurrency(), entity.getBalance());
        return toDTO(entity);
    }

    @Transactional
    public MoneyAccountResponseDTO update(String id, MoneyAccountRequestDTO dto) {
        MoneyAccount entity = getById(UUID.fromString(id));
        String currency = currencyCode(dto);

        if (!currency.equals(entity.getCurrency()) && hasTransactions(entity.getId())) {
            throw new ConflictException("Cannot change the currency of an account with transactions");
        }

        entity.setName(dto.getName());
        entity.setAccountNumber(dto.getAccountNumber());
        entity.setDescription(dto.getDescription());
        entity.setBalance(dto.getBalance());
        entity.setCurrency(currency);

        entity = moneyAccountRepository.save(entity);
        log.info("[MoneyAccountService] updated accountId={} currency={} balance={}",
                entity.getId(), entity.getCurrency(), entity.getBalance());
        return toDTO(entity);
    }

    @Transactional
    public void delete(String id) {
        MoneyAccount entity = getById(UUID.fromString(id));
        if (hasTransactions(entity.getId())) {
            throw new ConflictException("Cannot delete an account with transactions");
        }
        moneyAccountRepository.delete(entity);
        log.info("[MoneyAccountService] deleted accountId={}", entity.getId());
    }

    public MoneyAccountResponseDTO toDTO(MoneyAccount account) {
        return MoneyAccountResponseDTO.builder()
                .id(account.getId())
                .name(account.getName())
                .accountNumber(account.getAccountNumber())
                .description(account.getDescription())
                .balance(account.getBalance())
                .balanceFormatted(moneyFormatter.format(account.balanceAsMoney()))
                .currency(account.getCurrency())
                .createdAt(account.getCreatedAt())
                .updatedAt(account.getUpdatedAt())
                .build();
    }

    private boolean hasTransactions(UUID accountId) {
        return expenseRepository.existsByAccountId(accountId) || paymentRepository.existsByAccountId(accountId);
    }

    private static String currencyCode(MoneyAccountRequestDTO dto) {
        return dto.getCurrency().toUpperCase(Locale.ROOT);
    }
}
