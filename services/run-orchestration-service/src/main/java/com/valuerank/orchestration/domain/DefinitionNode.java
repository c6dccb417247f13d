package com.valuerank.orchestration.domain;

import java.time.Instant;

public interface DefinitionNode {

    String getId();

    String getParentId();

    int getVersion();

    Instant getCreatedAt();

    Instant getUpdatedAt();
}
