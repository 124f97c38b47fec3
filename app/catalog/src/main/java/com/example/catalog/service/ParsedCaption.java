package com.example.catalog.service;

import java.math.BigDecimal;

/** Name, optional price and description derived from a photo caption. */
public record ParsedCaption(String name, BigDecimal price, String description) {}
