package com.example.catalog.service;

import com.example.catalog.model.SellerRecord;

/** The resolved seller and whether this call created it. */
public record ProvisionResult(SellerRecord seller, boolean created) {}
