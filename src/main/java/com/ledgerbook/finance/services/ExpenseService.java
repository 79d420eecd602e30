package com.ledgerbook.finance.services;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ledgerbook.finance.dto.expenses.ExpenseRequestDTO;
import com.ledgerbook.finance.dto.expenses.ExpenseResponseDTO;
import com.ledgerbook.finance.entities.Expense;
import com.ledgerbook.finance.entities.ExpenseCategory;
import com.ledgerbook.finance.entities.MoneyAccount;
import com.ledgerbook.finance.events.ExpenseChangedEvent;
import com.ledgerbook.finance.events.ExpenseEventType;
import com.ledgerbook.finance.exceptions.BadRequestException;
import com.ledgerbook.finance.exceptions.ResourceNotFoundException;
import com.ledgerbook.finance.money.Money;
import com.ledgerbook.finance.money.MoneyFormatter;
import com.ledgerbook.finance.repositories.ExpenseCategoryRepository;
import com.ledgerbook.finance.repositories.ExpenseRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Expense writes keep the owning account balance in step: creating an expense
 * withdraws its amount, deleting it deposits the amount back, and an update
 * reverses the old withdrawal before applying the new one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseService {

    private final ExpenseRepository expenseRepository;
    private final ExpenseCategoryRepository expenseCategoryRepository;
    private final MoneyAccountService moneyAccountService;
    private final MoneyFormatter moneyFormatter;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public ExpenseResponseDTO create(ExpenseRequestDTO dto) {
        MoneyAccount account = moneyAccountService.getById(UUID.fromString(dto.getAccountId()));
        ExpenseCategory category = findCategory(dto.getCategoryId());

        Expense entity = Expense.builder()
                .account(account)
                .category(category)
                .amount(dto.getAmount())
                .comment(dto.getComment())
                .transactionDate(dto.getTransactionDate())
                .accountingPeriod(accountingPeriod(dto))
                .build();

        account.withdraw(entity.getAmount());
        entity = expenseRepository.save(entity);

        ExpenseResponseDTO created = toDTO(entity);
        log.info("[ExpenseService] created expenseId={} accountId={} amount={}",
                created.getId(), created.getAccountId(), created.getAmount());
        eventPublisher.publishEvent(ExpenseChangedEvent.of(ExpenseEventType.CREATED, created));
        return created;
    }

    @Transactional(readOnly = true)
    public ExpenseResponseDTO findById(String id) {
        return toDTO(getExpense(id));
    }

    @Transactional(readOnly = true)
    public Page<ExpenseResponseDTO> findAll(int page, int size) {
        if (page < 0 || size <= 0) {
            throw new BadRequestException("page must be >= 0 and size > 0");
        }
        return expenseRepository.findAllByOrderByTransactionDateDesc(PageRequest.of(page, size))
                .map(this::toDTO);
    }

    @Transactional(readOnly = true)
    public List<ExpenseResponseDTO> findByAccountingPeriod(LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            throw new BadRequestException("start must not be after end");
        }
        return expenseRepository.findByAccountingPeriodBetweenOrderByTransactionDateDesc(start, end)
                .stream()
                .map(this::toDTO)
                .toList();
    }

    @Transactional
    public ExpenseResponseDTO update(String id, ExpenseRequestDTO dto) {
        Expense entity = getExpense(id);
        MoneyAccount account = moneyAccountService.getById(UUID.fromString(dto.getAccountId()));
        ExpenseCategory category = findCategory(dto.getCategoryId());

        entity.getAccount().deposit(entity.getAmount());
        account.withdraw(dto.getAmount());

        entity.setAccount(account);
        entity.setCategory(category);
        entity.setAmount(dto.getAmount());
        entity.setComment(dto.getComment());
        entity.setTransactionDate(dto.getTransactionDate());
        entity.setAccountingPeriod(accountingPeriod(dto));

        entity = expenseRepository.save(entity);

        ExpenseResponseDTO updated = toDTO(entity);
        log.info("[ExpenseService] updated expenseId={} accountId={} amount={}",
                updated.getId(), updated.getAccountId(), updated.getAmount());
        eventPublisher.publishEvent(ExpenseChangedEvent.of(ExpenseEventType.UPDATED, updated));
        return updated;
    }

    @Transactional
    public void delete(String id) {
        Expense entity = getExpense(id);
        ExpenseResponseDTO removed = toDTO(entity);

        entity.getAccount().deposit(entity.getAmount());
        expenseRepository.delete(entity);

        log.info("[ExpenseService] deleted expenseId={} accountId={}", removed.getId(), removed.getAccountId());
        eventPublisher.publishEvent(ExpenseChangedEvent.of(ExpenseEventType.DELETED, removed));
    }

    private Expense getExpense(String id) {
        return expenseRepository.findById(UUID.fromString(id))
                .orElseThrow(() -> new ResourceNotFoundException("Expense not found"));
    }

    private ExpenseCategory findCategory(String categoryId) {
        return expenseCategoryRepository.findById(UUID.fromString(categoryId))
                .orElseThrow(() -> new ResourceNotFoundException("Expense category not found"));
    }

    private static LocalDate accountingPeriod(ExpenseRequestDTO dto) {
        return dto.getAccountingPeriod() != null ? dto.getAccountingPeriod() : dto.getTransactionDate();
    }

    private ExpenseResponseDTO toDTO(Expense entity) {
        MoneyAccount account = entity.getAccount();
        ExpenseResponseDTO dto = new ExpenseResponseDTO();

        dto.setId(entity.getId() != null ? entity.getId().toString() : null);
        dto.setAccountId(account.getId() != null ? account.getId().toString() : null);
        dto.setAccountName(account.getName());

        dto.setCategoryId(entity.getCategory().getId() != null ? entity.getCategory().getId().toString() : null);
        dto.setCategoryName(entity.getCategory().getName());

        dto.setAmount(entity.getAmount());
        dto.setAmountFormatted(moneyFormatter.format(Money.of(entity.getAmount(), account.getCurrency())));
        dto.setCurrency(account.getCurrency());
        dto.setComment(entity.getComment());
        dto.setTransactionDate(entity.getTransactionDate());
        dto.setAccountingPeriod(entity.getAccountingPeriod());

        dto.setCreatedAt(entity.getCreatedAt());
        dto.setUpdatedAt(entity.getUpdatedAt());

        return dto;
    }
}
