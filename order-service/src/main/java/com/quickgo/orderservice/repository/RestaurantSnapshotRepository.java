package com.quickgo.orderservice.repository;

import com.quickgo.orderservice.model.RestaurantSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RestaurantSnapshotRepository extends JpaRepository<RestaurantSnapshot, Long> {
}
