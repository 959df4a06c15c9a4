package com.example.pdfstamp.model;

/**
 * 图章DPI的来源
 */
public enum DensitySource {
    EXPLICIT,
    METADATA,
    FALLBACK
}
