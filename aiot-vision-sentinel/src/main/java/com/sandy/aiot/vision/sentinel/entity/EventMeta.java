package com.sandy.aiot.vision.sentinel.entity;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventMeta {
    /** Max value of the run for a spike, min value for a sag. */
    private double peakValue;
    private double zmax;
    /** Rolling median at the first point of the run. */
    private double baselineMu;
    /** Robust sigma (1.4826 * MAD) at the first point of the run. */
    private double baselineSigma;
}
