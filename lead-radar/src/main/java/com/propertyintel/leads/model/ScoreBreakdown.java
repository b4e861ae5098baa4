package com.propertyintel.leads.model;

import lombok.Value;

/** Normalised sub-scores behind a listing score, each in [0, 1]. */
@Value
public class ScoreBreakdown {

    double equity;
    double valueGap;
    double recency;
}
