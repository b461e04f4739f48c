package com.meterpay.credit;

import com.meterpay.domain.CreditAccount;
import com.meterpay.domain.CreditAccountRepository;
import com.meterpay.domain.ServiceType;
import com.meterpay.domain.TransactionKind;
import com.meterpay.domain.TransactionRecord;
import com.meterpay.domain.TransactionRecordRepository;
import com.meterpay.settlement.submit.PaymentFailedException;
import com.meterpay.settlement.submit.TransactionSubmitter;
import com.meterpay.settlement.submit.TransferSigner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

/**
 * Standing USD credit per (payer, service). Top-ups and spends are single atomic updates in the store;
 * a spend never drives the balance negative. The ledger never pays on a payer's behalf: auto top-up
 * only signals {@link CreditException.Code#AUTO_TOPUP_REQUIRED}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditLedgerService {

    private final CreditAccountRepository creditAccountRepository;
    private final TransactionRecordRepository transactionRecordRepository;
    private final TransactionSubmitter transactionSubmitter;
    private final Clock clock;

    /**
     * Current balance; zero when no account exists. Never creates an account.
     */
    public BigDecimal balance(String payerAddress, String serviceId, ServiceType serviceType) {
        return creditAccountRepository.findByPayerAddressAndServiceIdAndServiceType(payerAddress, serviceId, serviceType)
                .map(CreditAccount::getBalance)
                .orElse(BigDecimal.ZERO);
    }

    /**
     * Pays {@code referenceAmount} USD, then credits it, creating the account on first top-up.
     *
     * @throws PaymentFailedException when the payment was not submitted; the ledger is untouched
     */
    public CreditAccount topUp(String payerAddress, String serviceId, ServiceType serviceType,
                               BigDecimal referenceAmount, TransferSigner signer) {
        requirePositive(referenceAmount);
        TransactionRecord payment = transactionSubmitter.pay(payerAddress, referenceAmount, TransactionKind.CREDIT_TOPUP, signer);
        CreditAccount account = creditAccountRepository.credit(payerAddress, serviceId, serviceType,
                referenceAmount, payment.getSignature(), clock.instant());
        log.info("Credited {} USD to {} for {}/{}; balance {}", referenceAmount, payerAddress, serviceType, serviceId,
                account.getBalance());
        return account;
    }

    /**
     * Debits {@code amount}; all or nothing.
     *
     * @throws CreditException INSUFFICIENT_CREDITS or AUTO_TOPUP_REQUIRED; the balance is unchanged
     */
    public CreditAccount spend(String payerAddress, String serviceId, ServiceType serviceType, BigDecimal amount) {
        requirePositive(amount);
        return creditAccountRepository.debit(payerAddress, serviceId, serviceType, amount, clock.instant())
                .orElseThrow(() -> rejectedSpend(payerAddress, serviceId, serviceType, amount));
    }

    public List<CreditAccount> accountsFor(String payerAddress) {
        return creditAccountRepository.findByPayerAddressOrderByUpdatedAtDesc(payerAddress);
    }

    public CreditAccount enableAutoTopup(String payerAddress, String serviceId, ServiceType serviceType,
                                         BigDecimal threshold, BigDecimal topupAmount) {
        if (threshold == null || threshold.signum() < 0) {
            throw new CreditException(CreditException.Code.INVALID_AMOUNT, "Threshold must be non-negative");
        }
        requirePositive(topupAmount);
        return creditAccountRepository.updateAutoTopup(payerAddress, serviceId, serviceType, true, threshold,
                        topupAmount, clock.instant())
                .orElseThrow(() -> accountNotFound(payerAddress, serviceId, serviceType));
    }

    public CreditAccount disableAutoTopup(String payerAddress, String serviceId, ServiceType serviceType) {
        return creditAccountRepository.updateAutoTopup(payerAddress, serviceId, serviceType, false, null, null,
                        clock.instant())
                .orElseThrow(() -> accountNotFound(payerAddress, serviceId, serviceType));
    }

    public CreditStats stats(String payerAddress) {
        List<CreditAccount> accounts = creditAccountRepository.findByPayerAddressOrderByUpdatedAtDesc(payerAddress);
        BigDecimal purchased = BigDecimal.ZERO;
        BigDecimal spent = BigDecimal.ZERO;
        BigDecimal balance = BigDecimal.ZERO;
        for (CreditAccount a : accounts) {
            purchased = purchased.add(a.getTotalPurchased());
            spent = spent.add(a.getTotalSpent());
            balance = balance.add(a.getBalance());
        }
        long topups = transactionRecordRepository.countByPayerAddressAndKind(payerAddress, TransactionKind.CREDIT_TOPUP);
        return new CreditStats(purchased, spent, balance, accounts.size(), topups);
    }

    private CreditException rejectedSpend(String payerAddress, String serviceId, ServiceType serviceType,
                                          BigDecimal amount) {
        return creditAccountRepository.findByPayerAddressAndServiceIdAndServiceType(payerAddress, serviceId, serviceType)
                .map(account -> {
                    if (account.isAutoTopupEnabled() && account.getAutoTopupThreshold() != null
                            && account.getBalance().compareTo(account.getAutoTopupThreshold()) < 0) {
                        log.info("Auto top-up of {} USD required for {} on {}/{}",
                                account.getAutoTopupAmount(), payerAddress, serviceType, serviceId);
                        return new CreditException(CreditException.Code.AUTO_TOPUP_REQUIRED,
                                "Balance " + account.getBalance() + " is below auto top-up threshold; top up "
                                        + account.getAutoTopupAmount() + " to continue", account);
                    }
                    return new CreditException(CreditException.Code.INSUFFICIENT_CREDITS,
                            "Balance " + account.getBalance() + " cannot cover " + amount, account);
                })
                .orElseGet(() -> new CreditException(CreditException.Code.INSUFFICIENT_CREDITS,
                        "No credits for this service"));
    }

    private static CreditException accountNotFound(String payerAddress, String serviceId, ServiceType serviceType) {
        return new CreditException(CreditException.Code.ACCOUNT_NOT_FOUND,
                "No credit account for " + payerAddress + " on " + serviceType + "/" + serviceId);
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new CreditException(CreditException.Code.INVALID_AMOUNT, "Amount must be positive");
        }
    }
}
