package com.example.catalog.service;

import java.util.UUID;

public record SellerStats(
    UUID sellerId,
    int totalListings,
    int activeListings,
    int draftListings,
    int removedListings,
    int totalInterests,
    int interestsLast7Days,
    int catalogViews) {}
