package com.fitplan.backend.catalog.dto;

public record CatalogReloadResponse(int exercises, int workouts) {}
