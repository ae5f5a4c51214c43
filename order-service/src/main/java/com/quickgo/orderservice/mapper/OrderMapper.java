package com.quickgo.orderservice.mapper;

import com.quickgo.orderservice.dto.OrderItemResponse;
import com.quickgo.orderservice.dto.OrderResponse;
import com.quickgo.orderservice.dto.RatingResponse;
import com.quickgo.orderservice.dto.StatusHistoryResponse;
import com.quickgo.orderservice.model.Order;
import com.quickgo.orderservice.model.OrderItem;
import com.quickgo.orderservice.model.OrderRating;
import com.quickgo.orderservice.model.OrderStatusHistory;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    // canBeCancelled, delayed and statusHistory need the clock / other tables, the service fills them
    @Mapping(target = "canBeCancelled", ignore = true)
    @Mapping(target = "delayed", ignore = true)
    @Mapping(target = "statusHistory", ignore = true)
    OrderResponse toOrderResponse(Order order);

    OrderItemResponse toOrderItemResponse(OrderItem orderItem);

    StatusHistoryResponse toStatusHistoryResponse(OrderStatusHistory history);

    List<StatusHistoryResponse> toStatusHistoryResponses(List<OrderStatusHistory> history);

    RatingResponse toRatingResponse(OrderRating rating);
}
