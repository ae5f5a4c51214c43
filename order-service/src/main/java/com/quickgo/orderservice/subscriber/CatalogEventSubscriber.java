package com.quickgo.orderservice.subscriber;

import com.quickgo.common.contracts.ProductEventContract;
import com.quickgo.common.contracts.RestaurantEventContract;
import com.quickgo.orderservice.config.AmqpConfig;
import com.quickgo.orderservice.model.ProductSnapshot;
import com.quickgo.orderservice.model.RestaurantSnapshot;
import com.quickgo.orderservice.repository.ProductSnapshotRepository;
import com.quickgo.orderservice.repository.RestaurantSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps the local restaurant and product snapshots in sync with the catalog.
 * Order creation prices and validates carts against these rows only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CatalogEventSubscriber {

    private final RestaurantSnapshotRepository restaurantSnapshotRepository;
    private final ProductSnapshotRepository productSnapshotRepository;

    // upsert
    @RabbitListener(queues = AmqpConfig.Q_RESTAURANT_UPDATES)
    @Transactional
    public void handleRestaurantUpdate(RestaurantEventContract event) {
        log.info("Received 'restaurant.updated' event. restaurantId={}", event.getRestaurantId());

        RestaurantSnapshot snapshot = restaurantSnapshotRepository.findById(event.getRestaurantId())
                .orElseGet(RestaurantSnapshot::new);

        snapshot.setRestaurantId(event.getRestaurantId());
        snapshot.setName(event.getName());
        snapshot.setLatitude(event.getLatitude());
        snapshot.setLongitude(event.getLongitude());
        snapshot.setAcceptingOrders(event.isAcceptingOrders());
        snapshot.setDeliveryFee(event.getDeliveryFee());
        snapshot.setPreparationMinutes(event.getPreparationMinutes());

        restaurantSnapshotRepository.save(snapshot);
        log.info("Restaurant snapshot updated: restaurantId={}, acceptingOrders={}",
                event.getRestaurantId(), event.isAcceptingOrders());
    }

    @RabbitListener(queues = AmqpConfig.Q_PRODUCT_UPDATES)
    @Transactional
    public void handleProductUpdate(ProductEventContract event) {
        log.info("Received 'product.updated' event. productId={}", event.getProductId());

        ProductSnapshot snapshot = productSnapshotRepository.findById(event.getProductId())
                .orElseGet(ProductSnapshot::new);

        snapshot.setProductId(event.getProductId());
        snapshot.setRestaurantId(event.getRestaurantId());
        snapshot.setName(event.getName());
        snapshot.setPrice(event.getPrice());
        snapshot.setAvailable(event.isAvailable());

        productSnapshotRepository.save(snapshot);
        log.info("Product snapshot updated: productId={}, available={}", event.getProductId(), event.isAvailable());
    }

    @RabbitListener(queues = AmqpConfig.Q_PRODUCT_DELETIONS)
    @Transactional
    public void handleProductDelete(Long productId) {
        if (!productSnapshotRepository.existsById(productId)) {
            log.info("Product snapshot already gone, ignoring delete. productId={}", productId);
            return;
        }
        productSnapshotRepository.deleteById(productId);
        log.info("Product snapshot deleted: productId={}", productId);
    }
}
