package com.shlawgathon.featuretracker.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeaturePage {

    @Builder.Default
    private List<FeatureView> features = new ArrayList<>();

    private long total;
    private int page;
    private int pageSize;
}
