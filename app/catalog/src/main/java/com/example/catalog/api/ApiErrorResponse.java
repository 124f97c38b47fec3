package com.example.catalog.api;

public record ApiErrorResponse(String code, String message) {}
