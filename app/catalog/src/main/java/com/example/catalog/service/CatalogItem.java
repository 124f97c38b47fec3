package com.example.catalog.service;

import com.example.catalog.model.ListingRecord;

/** An ACTIVE listing as shown to buyers, with the pre-filled chat link to its seller. */
public record CatalogItem(ListingRecord listing, String chatLink) {}
