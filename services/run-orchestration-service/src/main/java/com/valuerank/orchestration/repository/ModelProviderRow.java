package com.valuerank.orchestration.repository;

public interface ModelProviderRow {

    String getModelId();

    String getProviderName();
}
