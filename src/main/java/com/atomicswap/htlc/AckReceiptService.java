package com.atomicswap.htlc;

import com.atomicswap.config.RedisConfig;
import com.atomicswap.domain.enums.AckOutcome;
import com.atomicswap.event.AckEvent;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Remembers acknowledgement sequences already applied so relayer redeliveries short-circuit
 * before touching the database.
 *
 * <p>This is a fast path only: a sequence whose pending transfer is gone is a no-op even when
 * its receipt has expired. Receipts are written after the acknowledging transaction commits,
 * so a rolled-back acknowledgement leaves no receipt behind. Redis being unreachable degrades
 * to the database path and never fails an acknowledgement.
 *
 * <p>Key schema: {@code swap:ack:seen:{sequence}} → outcome name
 */
@Service
public class AckReceiptService {

    private static final Logger log = LoggerFactory.getLogger(AckReceiptService.class);

    public static final String KEY_PREFIX = RedisConfig.KEY_PREFIX_ACK_SEEN;

    private final RedisTemplate<String, Object> redisTemplate;
    private final Duration receiptTtl;

    public AckReceiptService(
            RedisTemplate<String, Object> redisTemplate,
            @Value("${atomicswap.ack.receipt-ttl-hours:24}") long receiptTtlHours) {
        this.redisTemplate = redisTemplate;
        this.receiptTtl = Duration.ofHours(receiptTtlHours);
    }

    public boolean isProcessed(long sequence) {
        try {
            Boolean exists = redisTemplate.hasKey(KEY_PREFIX + sequence);
            return exists != null && exists;
        } catch (DataAccessException e) {
            log.warn("Ack receipt lookup failed, falling back to the database: sequence={}, error={}",
                    sequence, e.getMessage());
            return false;
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onAckEvent(AckEvent event) {
        if (event.isApplied()) {
            markProcessed(event.getSequence(), event.getOutcome());
        }
    }

    public void markProcessed(long sequence, AckOutcome outcome) {
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + sequence, outcome.name(), receiptTtl);
            log.debug("Ack receipt stored: sequence={}, outcome={}", sequence, outcome);
        } catch (DataAccessException e) {
            log.warn("Ack receipt not stored: sequence={}, outcome={}, error={}", sequence, outcome, e.getMessage());
        }
    }

    Duration getReceiptTtl() {
        return receiptTtl;
    }
}
