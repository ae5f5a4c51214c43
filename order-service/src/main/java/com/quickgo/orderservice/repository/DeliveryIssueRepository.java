package com.quickgo.orderservice.repository;

import com.quickgo.orderservice.model.DeliveryIssue;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DeliveryIssueRepository extends JpaRepository<DeliveryIssue, UUID> {

    List<DeliveryIssue> findByResolvedFalseOrderByCreatedAtAsc();

    List<DeliveryIssue> findByOrderIdOrderByCreatedAtAsc(Long orderId);
}
