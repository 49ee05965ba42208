package com.fitplan.backend.sheet.service;

public record RenderedSheet(String fileName, byte[] content, int pageCount) {}
