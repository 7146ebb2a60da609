package com.example.automation.service;

import com.example.automation.model.WebhookDelivery;
import com.example.automation.repository.WebhookDeliveryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 投递重试的延迟调度，到期时间持久化在 {@link WebhookDelivery#getNextRetryAt()} 上。
 * <p>
 * 退避表固定：第 1 次立即，第 2 次 1 分钟，第 3 次 5 分钟，第 4 次 30 分钟，第 5 次 2 小时，
 * 均相对本轮序列的第一次尝试计算。第 5 次失败后不再自动重试。
 */
@Component
@Slf4j
public class RetryScheduler {

    public static final List<Duration> BACKOFF = List.of(
            Duration.ZERO,
            Duration.ofMinutes(1),
            Duration.ofMinutes(5),
            Duration.ofMinutes(30),
            Duration.ofHours(2));

    public static final int MAX_ATTEMPTS = BACKOFF.size();

    private final WebhookDeliveryRepository deliveryRepository;
    private final Duration claimLease;
    private final int batchSize;

    public RetryScheduler(WebhookDeliveryRepository deliveryRepository,
            @Value("${app.webhooks.claim-lease:PT5M}") Duration claimLease,
            @Value("${app.webhooks.retry-batch-size:100}") int batchSize) {
        this.deliveryRepository = deliveryRepository;
        this.claimLease = claimLease;
        this.batchSize = batchSize;
    }

    /**
     * 第 n 次尝试（本轮序列内，从 1 开始）相对序列起点的偏移。
     */
    public static Duration offsetFor(int attemptInSequence) {
        if (attemptInSequence < 1 || attemptInSequence > MAX_ATTEMPTS) {
            throw new IllegalArgumentException("Attempt " + attemptInSequence + " is outside 1.." + MAX_ATTEMPTS);
        }
        return BACKOFF.get(attemptInSequence - 1);
    }

    /**
     * 本轮序列是否还有剩余尝试次数。
     */
    public boolean hasAttemptsLeft(WebhookDelivery delivery) {
        return delivery.attemptsInSequence() < MAX_ATTEMPTS;
    }

    /**
     * 为投递安排下一次尝试，写入到期时间（由调用方保存）。
     *
     * @param delivery      投递
     * @param attemptNumber 下一次尝试的全局编号
     * @return 到期时间
     */
    public Instant scheduleRetry(WebhookDelivery delivery, int attemptNumber) {
        int attemptInSequence = attemptNumber - delivery.getSequenceStartAttempt() + 1;
        Instant dueAt = delivery.getSequenceStartedAt().plus(offsetFor(attemptInSequence));
        delivery.setNextRetryAt(dueAt);
        log.debug("Delivery {} attempt {} scheduled at {}", delivery.getId(), attemptNumber, dueAt);
        return dueAt;
    }

    /**
     * 第一次尝试由分发方直接执行，到期时间记为认领租约。
     */
    public Instant initialLease(Instant now) {
        return now.plus(claimLease);
    }

    /**
     * 认领已到期的重试。只有认领成功的投递才会返回，多实例并发轮询时同一投递只会被一个实例拿到。
     *
     * @param now 当前时间
     * @return 认领凭证
     */
    public List<DeliveryClaim> dueRetries(Instant now) {
        List<WebhookDelivery> due = deliveryRepository.findDue(now, PageRequest.of(0, batchSize));
        List<DeliveryClaim> claimed = new ArrayList<>();
        for (WebhookDelivery delivery : due) {
            if (deliveryRepository.claim(delivery.getId(), delivery.getVersion(), now.plus(claimLease)) == 1) {
                claimed.add(new DeliveryClaim(delivery.getId(), delivery.getVersion() + 1));
            } else {
                log.debug("Delivery {} already claimed elsewhere", delivery.getId());
            }
        }
        return claimed;
    }

    /**
     * 发送前用手中的凭证再认领一次，并把租约续到本次尝试结束之后。
     *
     * @return 新凭证；凭证已过期（投递被重新认领或已终结）时为空
     */
    public Optional<DeliveryClaim> renew(DeliveryClaim held, Instant now) {
        if (deliveryRepository.claim(held.deliveryId(), held.version(), now.plus(claimLease)) != 1) {
            return Optional.empty();
        }
        return Optional.of(new DeliveryClaim(held.deliveryId(), held.version() + 1));
    }

    /**
     * 手动重试终态失败的投递：开启新一轮序列，编号延续，并直接认领。
     *
     * @return 认领凭证；投递不处于 FAILED 状态或已被并发修改时为空
     */
    public Optional<DeliveryClaim> requeue(WebhookDelivery delivery, Instant now) {
        if (deliveryRepository.requeueFailed(delivery.getId(), delivery.getVersion(), now, now.plus(claimLease)) != 1) {
            return Optional.empty();
        }
        log.info("Delivery {} re-queued for manual retry", delivery.getId());
        return Optional.of(new DeliveryClaim(delivery.getId(), delivery.getVersion() + 1));
    }
}
