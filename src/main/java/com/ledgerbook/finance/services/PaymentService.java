package com.ledgerbook.finance.services;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ledgerbook.finance.dto.payments.PaymentRequestDTO;
import com.ledgerbook.finance.dto.payments.PaymentResponseDTO;
import com.ledgerbook.finance.entities.MoneyAccount;
import com.ledgerbook.finance.entities.Payment;
import com.ledgerbook.finance.entities.PaymentCategory;
import com.ledgerbook.finance.exceptions.BadRequestException;
import com.ledgerbook.finance.exceptions.ResourceNotFoundException;
import com.ledgerbook.finance.money.Money;
import com.ledgerbook.finance.money.MoneyFormatter;
import com.ledgerbook.finance.repositories.PaymentCategoryRepository;
import com.ledgerbook.finance.repositories.PaymentRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Payments are the income side of the ledger. Creating one deposits its amount
 * into the account, deleting it withdraws the amount again, and an update
 * reverses the old deposit before applying the new one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final PaymentCategoryRepository paymentCategoryRepository;
    private final MoneyAccountService moneyAccountService;
    private final MoneyFormatter moneyFormatter;

    @Transactional
    public PaymentResponseDTO create(PaymentRequestDTO dto) {
        MoneyAccount account = moneyAccountService.getById(UUID.fromString(dto.getAccountId()));

        Payment entity = Payment.builder()
                .account(account)
                .category(findCategory(dto.getCategoryId()))
                .amount(dto.getAmount())
                .comment(dto.getComment())
                .transactionDate(dto.getTransactionDate())
                .accountingPeriod(accountingPeriod(dto))
                .build();

        account.deposit(entity.getAmount());
        entity = paymentRepository.save(entity);

        PaymentResponseDTO created = toDTO(entity);
        log.info("[PaymentService] created paymentId={} accountId={} amount={}",
                created.getId(), created.getAccountId(), created.getAmount());
        return created;
    }

    @Transactional(readOnly = true)
    public PaymentResponseDTO findById(String id) {
        return toDTO(getPayment(id));
    }

    @Transactional(readOnly = true)
    public Page<PaymentResponseDTO> findAll(int page, int size) {
        if (page < 0 || size <= 0) {
            throw new BadRequestException("page must be >= 0 and size > 0");
        }
        return paymentRepository.findAllByOrderByTransactionDateDesc(PageRequest.of(page, size))
                .map(this::toDTO);
    }

    @Transactional(readOnly = true)
    public List<PaymentResponseDTO> findByAccountingPeriod(LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            throw new BadRequestException("start must not be after end");
        }
        return paymentRepository.findByAccountingPeriodBetweenOrderByTransactionDateDesc(start, end)
                .stream()
                .map(this::toDTO)
                .toList();
    }

    @Transactional
    public PaymentResponseDTO update(String id, PaymentRequestDTO dto) {
        Payment entity = getPayment(id);
        MoneyAccount account = moneyAccountService.getById(UUID.fromString(dto.getAccountId()));
        PaymentCategory category = findCategory(dto.getCategoryId());

        entity.getAccount().withdraw(entity.getAmount());
        account.deposit(dto.getAmount());

        entity.setAccount(account);
        entity.setCategory(category);
        entity.setAmount(dto.getAmount());
        entity.setComment(dto.getComment());
        entity.setTransactionDate(dto.getTransactionDate());
        entity.setAccountingPeriod(accountingPeriod(dto));

        entity = paymentRepository.save(entity);

        PaymentResponseDTO updated = toDTO(entity);
        log.info("[PaymentService] updated paymentId={} accountId={} amount={}",
                updated.getId(), updated.getAccountId(), updated.getAmount());
        return updated;
    }

    @Transactional
    public void delete(String id) {
        Payment entity = getPayment(id);

        entity.getAccount().withdraw(entity.getAmount());
        paymentRepository.delete(entity);

        log.info("[PaymentService] deleted paymentId={} accountId={}", entity.getId(), entity.getAccount().getId());
    }

    private Payment getPayment(String id) {
        return paymentRepository.findById(UUID.fromString(id))
                .orElseThrow(() -> new ResourceNotFoundException("Payment not found"));
    }

    private PaymentCategory findCategory(String categoryId) {
        if (categoryId == null || categoryId.isBlank()) {
            return null;
        }
        return paymentCategoryRepository.findById(UUID.fromString(categoryId))
                .orElseThrow(() -> new ResourceNotFoundException("Payment category not found"));
    }

    private static LocalDate accountingPeriod(PaymentRequestDTO dto) {
        return dto.getAccountingPeriod() != null ? dto.getAccountingPeriod() : dto.getTransactionDate();
    }

    private PaymentResponseDTO toDTO(Payment entity) {
        MoneyAccount account = entity.getAccount();
        PaymentCategory category = entity.getCategory();
        PaymentResponseDTO dto = new PaymentResponseDTO();

        dto.setId(entity.getId() != null ? entity.getId().toString() : null);
        dto.setAccountId(account.getId() != null ? account.getId().toString() : null);
        dto.setAccountName(account.getName());

        if (category != null) {
            dto.setCategoryId(category.getId() != null ? category.getId().toString() : null);
            dto.setCategoryName(category.getName());
        }

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
