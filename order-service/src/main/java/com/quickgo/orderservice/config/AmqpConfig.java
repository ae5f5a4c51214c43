package com.quickgo.orderservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Broker topology of the order service.
 *
 * Outbound, notifications go to {@link #ORDER_EXCHANGE} keyed {@code notification.<event>}.
 * Inbound, the catalog publishes restaurant and product snapshots to {@link #CATALOG_EXCHANGE};
 * each routing key has its own queue, dead-lettered to {@link #DLQ_NAME} on listener failure.
 */
@Configuration
public class AmqpConfig {

    public static final String ORDER_EXCHANGE = "order_events_exchange";
    public static final String CATALOG_EXCHANGE = "catalog_events_exchange";

    public static final String DLX_NAME = "dlx";
    public static final String DLQ_NAME = "q.dlq";

    public static final String Q_RESTAURANT_UPDATES = "q.order.restaurant.updates";
    public static final String Q_PRODUCT_UPDATES = "q.order.product.updates";
    public static final String Q_PRODUCT_DELETIONS = "q.order.product.deletions";

    public static final String ROUTING_KEY_RESTAURANT_UPDATED = "restaurant.updated";
    public static final String ROUTING_KEY_PRODUCT_UPDATED = "product.updated";
    public static final String ROUTING_KEY_PRODUCT_DELETED = "product.deleted";

    @Bean
    public TopicExchange orderEventsExchange() {
        return ExchangeBuilder.topicExchange(ORDER_EXCHANGE).durable(true).build();
    }

    @Bean
    public Declarables deadLetterTopology() {
        TopicExchange dlx = ExchangeBuilder.topicExchange(DLX_NAME).durable(true).build();
        Queue dlq = QueueBuilder.durable(DLQ_NAME).build();
        return new Declarables(dlx, dlq, BindingBuilder.bind(dlq).to(dlx).with("#"));
    }

    @Bean
    public Declarables catalogTopology() {
        TopicExchange catalog = ExchangeBuilder.topicExchange(CATALOG_EXCHANGE).durable(true).build();
        Queue restaurants = catalogQueue(Q_RESTAURANT_UPDATES);
        Queue products = catalogQueue(Q_PRODUCT_UPDATES);
        Queue deletions = catalogQueue(Q_PRODUCT_DELETIONS);
        return new Declarables(catalog, restaurants, products, deletions,
                bind(restaurants, catalog, ROUTING_KEY_RESTAURANT_UPDATED),
                bind(products, catalog, ROUTING_KEY_PRODUCT_UPDATED),
                bind(deletions, catalog, ROUTING_KEY_PRODUCT_DELETED));
    }

    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    private static Queue catalogQueue(String name) {
        return QueueBuilder.durable(name)
                .deadLetterExchange(DLX_NAME)
                .deadLetterRoutingKey(name)
                .build();
    }

    private static Binding bind(Queue queue, TopicExchange exchange, String routingKey) {
        return BindingBuilder.bind(queue).to(exchange).with(routingKey);
    }
}
