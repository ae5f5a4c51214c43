package com.quickgo.orderservice.repository;

import com.quickgo.orderservice.model.DeliveryLocation;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DeliveryLocationRepository extends JpaRepository<DeliveryLocation, Long> {

    List<DeliveryLocation> findByOrderIdOrderByRecordedAtDescIdDesc(Long orderId, Pageable pageable);

    long countByOrderId(Long orderId);
}
