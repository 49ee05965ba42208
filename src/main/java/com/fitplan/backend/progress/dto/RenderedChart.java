package com.fitplan.backend.progress.dto;

public record RenderedChart(String fileName, byte[] content) {}
