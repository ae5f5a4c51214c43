package com.quickgo.orderservice.mapper;

import com.quickgo.orderservice.dto.DeliveryIssueResponse;
import com.quickgo.orderservice.dto.DeliveryLocationResponse;
import com.quickgo.orderservice.dto.DispatchOfferResponse;
import com.quickgo.orderservice.dto.DriverAvailabilityResponse;
import com.quickgo.orderservice.model.DeliveryIssue;
import com.quickgo.orderservice.model.DeliveryLocation;
import com.quickgo.orderservice.model.DispatchOffer;
import com.quickgo.orderservice.model.DriverAvailability;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface DispatchMapper {

    DispatchOfferResponse toOfferResponse(DispatchOffer offer);

    DriverAvailabilityResponse toAvailabilityResponse(DriverAvailability availability);

    DeliveryIssueResponse toIssueResponse(DeliveryIssue issue);

    DeliveryLocationResponse toLocationResponse(DeliveryLocation location);
}
