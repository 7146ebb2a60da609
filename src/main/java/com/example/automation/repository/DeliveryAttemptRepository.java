package com.example.automation.repository;

import com.example.automation.model.DeliveryAttempt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 投递尝试记录仓储接口。
 */
@Repository
public interface DeliveryAttemptRepository extends JpaRepository<DeliveryAttempt, Long> {

    List<DeliveryAttempt> findByDeliveryIdOrderByAttemptNumberAsc(String deliveryId);

    long countByDeliveryId(String deliveryId);

    void deleteByWebhookId(Long webhookId);
}
