package com.quickgo.orderservice.repository;

import com.quickgo.orderservice.model.OrderRating;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OrderRatingRepository extends JpaRepository<OrderRating, Long> {

    boolean existsByOrderId(Long orderId);
}
