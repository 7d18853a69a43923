package com.fintracker.infrastructure.persistence.queue;

import lombok.Value;

@Value
public class WriteQueueStats {

    int currentDepth;
    int maxDepth;
}
