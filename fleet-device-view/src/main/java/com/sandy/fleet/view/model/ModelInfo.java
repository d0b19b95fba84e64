package com.sandy.fleet.view.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Device model plugin registered with the configuration service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelInfo {
    private String name;
    private String version;
    private String module;
    private String getStateMode;
    @Builder.Default
    private List<String> modelData = new ArrayList<>();
}
