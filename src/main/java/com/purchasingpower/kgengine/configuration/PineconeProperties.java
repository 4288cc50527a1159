package com.purchasingpower.kgengine.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PineconeProperties {

    @NotBlank
    private String apiKey;

    @NotBlank
    private String indexName;

    /**
     * Empty string is Pinecone's default namespace.
     */
    @NotNull
    private String namespace = "";
}
