package com.frostguard.acoustic.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.io.Serializable;
import java.time.Instant;

/**
 * Training metadata stored next to a serialized outlier model.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelRegistryEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    private Instant createdAt;
    private Integer trees;
    private Double subsample;
    private Integer components;
    private Double contamination;
    private String featureSchema;
    private String schemaHash;
    private Long trainedRows;
    private Double scoreThreshold;
    private String notes;
}
