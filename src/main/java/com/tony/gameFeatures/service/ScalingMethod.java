package com.tony.gameFeatures.service;

public enum ScalingMethod {
    STANDARD, // (x - moyenne) / écart-type
    MINMAX,   // (x - min) / (max - min)
    NONE
}
