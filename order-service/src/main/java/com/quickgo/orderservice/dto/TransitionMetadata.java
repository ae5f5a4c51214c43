package com.quickgo.orderservice.dto;

import com.quickgo.orderservice.model.CancellationReason;
import lombok.Builder;
import lombok.Getter;

/**
 * Optional context for a status change. Cancellation fields are only read when the target is CANCELLED.
 */
@Getter
@Builder
public class TransitionMetadata {

    private static final TransitionMetadata EMPTY = TransitionMetadata.builder().build();

    private final String notes;
    private final CancellationReason cancellationReason;
    private final String cancellationNotes;

    public static TransitionMetadata empty() {
        return EMPTY;
    }

    public static TransitionMetadata withNotes(String notes) {
        return TransitionMetadata.builder().notes(notes).build();
    }
}
