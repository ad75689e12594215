package com.give.payout.infrastructure.custody;

import com.give.payout.domain.custody.AssetTransferService;
import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import com.give.payout.domain.model.UInt256;
import com.give.payout.infrastructure.persistence.entity.CustodyBalanceEntity;
import com.give.payout.infrastructure.persistence.entity.CustodyBalanceId;
import com.give.payout.infrastructure.persistence.repository.CustodyBalanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;

/**
 * Asset ledger backed by the custody_balance table.
 *
 * Both rows of a transfer are locked with PESSIMISTIC_WRITE in a fixed order
 * (asset, holder) so concurrent transfers between the same holders cannot deadlock.
 */
@Component
public class LedgerAssetTransferService implements AssetTransferService {

    private static final Logger log = LoggerFactory.getLogger(LedgerAssetTransferService.class);

    private static final Comparator<CustodyBalanceId> LOCK_ORDER =
            Comparator.comparing(CustodyBalanceId::getAsset).thenComparing(CustodyBalanceId::getHolder);

    private final CustodyBalanceRepository repository;
    private final Clock clock;

    public LedgerAssetTransferService(CustodyBalanceRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger balanceOf(String asset, String holder) {
        return repository.findById(new CustodyBalanceId(asset, holder))
                .map(CustodyBalanceEntity::getBalance)
                .orElse(BigInteger.ZERO);
    }

    @Override
    @Transactional
    public void transfer(String asset, String from, String to, BigInteger amount) {
        if (to == null || to.isBlank()) {
            throw new PayoutException(PayoutErrorCode.TRANSFER_FAILED, "Transfer of " + asset + " has no recipient");
        }
        if (to.equals(from)) {
            throw new PayoutException(PayoutErrorCode.TRANSFER_FAILED, "Transfer of " + asset + " to its own sender " + from);
        }
        if (amount == null || amount.signum() <= 0) {
            throw new PayoutException(PayoutErrorCode.TRANSFER_FAILED, "Transfer amount must be positive, got " + amount);
        }

        CustodyBalanceId fromId = new CustodyBalanceId(asset, from);
        CustodyBalanceId toId = new CustodyBalanceId(asset, to);
        CustodyBalanceEntity sender;
        CustodyBalanceEntity receiver;
        if (LOCK_ORDER.compare(fromId, toId) < 0) {
            sender = lockOrCreate(fromId);
            receiver = lockOrCreate(toId);
        } else {
            receiver = lockOrCreate(toId);
            sender = lockOrCreate(fromId);
        }

        if (sender.getBalance().compareTo(amount) < 0) {
            throw new PayoutException(PayoutErrorCode.INSUFFICIENT_BALANCE,
                    from + " holds " + sender.getBalance() + " " + asset + ", cannot send " + amount);
        }

        BigInteger newReceiverBalance = UInt256.checked(receiver.getBalance().add(amount), "balance");
        OffsetDateTime now = OffsetDateTime.now(clock);
        sender.setBalance(sender.getBalance().subtract(amount));
        sender.setUpdatedAt(now);
        receiver.setBalance(newReceiverBalance);
        receiver.setUpdatedAt(now);
        repository.save(sender);
        repository.save(receiver);
        log.debug("Transferred {} {} from {} to {}", amount, asset, from, to);
    }

    @Override
    @Transactional
    public void deposit(String asset, String holder, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new PayoutException(PayoutErrorCode.ZERO_AMOUNT, "Deposit amount must be positive");
        }
        CustodyBalanceEntity account = lockOrCreate(new CustodyBalanceId(asset, holder));
        account.setBalance(UInt256.checked(account.getBalance().add(amount), "balance"));
        account.setUpdatedAt(OffsetDateTime.now(clock));
        repository.save(account);
        log.debug("Deposited {} {} to {}", amount, asset, holder);
    }

    private CustodyBalanceEntity lockOrCreate(CustodyBalanceId id) {
        return repository.findForUpdate(id)
                .orElseGet(() -> CustodyBalanceEntity.builder()
                        .id(id)
                        .balance(BigInteger.ZERO)
                        .updatedAt(OffsetDateTime.now(clock))
                        .build());
    }
}
