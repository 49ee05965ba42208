package com.fitplan.backend.catalog.dto;

public record CatalogStats(long exercises, long workouts) {}
