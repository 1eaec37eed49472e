package com.marketdata.jobs.infrastructure;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What a scheduler reload changed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReloadResult {

    @Builder.Default
    private List<String> armed = new ArrayList<>();
    @Builder.Default
    private List<String> rearmed = new ArrayList<>();
    @Builder.Default
    private List<String> disarmed = new ArrayList<>();
    @Builder.Default
    private List<String> unchanged = new ArrayList<>();
    @Builder.Default
    private List<String> invalid = new ArrayList<>();
}
