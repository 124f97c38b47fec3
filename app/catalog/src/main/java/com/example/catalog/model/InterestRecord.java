package com.example.catalog.model;

import java.time.Instant;
import java.util.UUID;

public record InterestRecord(
    UUID interestId,
    UUID listingId,
    String buyerPhone,
    String buyerName,
    String buyerIp,
    String userAgent,
    boolean messageSent,
    Instant createdAt) {}
