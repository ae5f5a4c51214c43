package com.quickgo.orderservice.repository;

import com.quickgo.orderservice.model.ProductSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProductSnapshotRepository extends JpaRepository<ProductSnapshot, Long> {
}
