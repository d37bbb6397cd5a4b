package com.tradeagent.repository.jpa;

import com.tradeagent.domain.enums.IntentStatus;
import com.tradeagent.entity.OrderIntentEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OrderIntentJpaRepository extends JpaRepository<OrderIntentEntity, String> {

    List<OrderIntentEntity> findByStatusInOrderByCreatedAtDesc(List<IntentStatus> statuses);

    List<OrderIntentEntity> findTop50ByOrderByCreatedAtDesc();
}
