package com.ardesk.collections.event;

import lombok.Value;

import java.util.Set;

@Value
public class ReadModelsInvalidatedEvent {
    String tenantId;
    LedgerMutation mutation;
    Set<ReadModel> readModels;

    public static ReadModelsInvalidatedEvent of(String tenantId, LedgerMutation mutation) {
        return new ReadModelsInvalidatedEvent(tenantId, mutation, mutation.getInvalidates());
    }
}
