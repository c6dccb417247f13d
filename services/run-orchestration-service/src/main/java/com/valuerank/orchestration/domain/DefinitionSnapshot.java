package com.valuerank.orchestration.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DefinitionSnapshot(
    JsonNode content,
    Integer definitionVersion,
    String preambleVersionId
) {
    public static DefinitionSnapshot of(DefinitionEntity definition) {
        JsonNode content = definition.getContent() == null ? null : definition.getContent().deepCopy();
        return new DefinitionSnapshot(content, definition.getVersion(), definition.getPreambleVersionId());
    }
}
