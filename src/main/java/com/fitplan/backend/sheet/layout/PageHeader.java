package com.fitplan.backend.sheet.layout;

public record PageHeader(int pageIndex, String title, double y) {}
