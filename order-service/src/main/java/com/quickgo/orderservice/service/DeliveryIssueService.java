package com.quickgo.orderservice.service;

import com.quickgo.common.exception.AccessDeniedException;
import com.quickgo.common.exception.ResourceNotFoundException;
import com.quickgo.orderservice.dto.DeliveryIssueResponse;
import com.quickgo.orderservice.dto.ReportIssueRequest;
import com.quickgo.orderservice.exception.InvalidStateException;
import com.quickgo.orderservice.mapper.DispatchMapper;
import com.quickgo.orderservice.model.DeliveryIssue;
import com.quickgo.orderservice.model.Order;
import com.quickgo.orderservice.repository.DeliveryIssueRepository;
import com.quickgo.orderservice.repository.OrderRepository;
import com.quickgo.orderservice.security.Actor;
import com.quickgo.orderservice.security.ActorRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Problems a driver runs into while delivering (closed restaurant, wrong address, ...).
 * Reporting never changes the order status; operators decide what happens next.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryIssueService {

    private final DeliveryIssueRepository issueRepository;
    private final OrderRepository orderRepository;
    private final NotificationDispatcher notificationDispatcher;
    private final TimerService timerService;
    private final DispatchMapper dispatchMapper;

    @Transactional
    public DeliveryIssueResponse reportIssue(Long orderId, ReportIssueRequest request, Actor actor) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found: " + orderId));

        if (!actor.is(ActorRole.DRIVER) || !actor.getUserId().equals(order.getDriverId())) {
            throw new AccessDeniedException("Only the assigned driver can report an issue for this order");
        }
        if (order.getStatus().isTerminal()) {
            throw new InvalidStateException("Cannot report an issue on a " + order.getStatus() + " order");
        }

        DeliveryIssue issue = issueRepository.save(DeliveryIssue.builder()
                .orderId(orderId)
                .driverId(actor.getUserId())
                .issueType(request.getIssueType())
                .description(request.getDescription())
                .resolved(false)
                .createdAt(timerService.now())
                .build());

        log.warn("Delivery issue reported: issueId={}, orderId={}, driverId={}, type={}",
                issue.getId(), orderId, actor.getUserId(), request.getIssueType());

        Map<String, Object> payload = Map.of(
                "issueId", issue.getId(),
                "issueType", issue.getIssueType(),
                "description", issue.getDescription());
        notificationDispatcher.notify(Recipients.OPERATORS, NotificationEventType.DELIVERY_ISSUE_REPORTED, order, payload);

        return dispatchMapper.toIssueResponse(issue);
    }

    @Transactional(readOnly = true)
    public List<DeliveryIssueResponse> getOpenIssues(Actor actor) {
        requireOperator(actor);
        return issueRepository.findByResolvedFalseOrderByCreatedAtAsc().stream()
                .map(dispatchMapper::toIssueResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<DeliveryIssueResponse> getIssuesForOrder(Long orderId, Actor actor) {
        requireOperator(actor);
        return issueRepository.findByOrderIdOrderByCreatedAtAsc(orderId).stream()
                .map(dispatchMapper::toIssueResponse)
                .toList();
    }

    @Transactional
    public DeliveryIssueResponse resolveIssue(UUID issueId, String resolutionNotes, Actor actor) {
        requireOperator(actor);
        DeliveryIssue issue = issueRepository.findById(issueId)
                .orElseThrow(() -> new ResourceNotFoundException("Delivery issue not found: " + issueId));

        if (issue.isResolved()) {
            throw new InvalidStateException("Delivery issue " + issueId + " is already resolved");
        }

        issue.setResolved(true);
        issue.setResolutionNotes(resolutionNotes);
        issue.setResolvedBy(actor.getUserId());
        issue.setResolvedAt(timerService.now());
        DeliveryIssue saved = issueRepository.save(issue);

        log.info("Delivery issue resolved: issueId={}, orderId={}, by={}", issueId, saved.getOrderId(), actor.getUserId());
        return dispatchMapper.toIssueResponse(saved);
    }

    private void requireOperator(Actor actor) {
        if (!actor.isPrivileged()) {
            throw AccessDeniedException.operatorsOnly("manage delivery issues");
        }
    }
}
