/*
 * Where: app/catalog/src/main/java/com/example/catalog/model/SellerRecord.java
 * What: row of the sellers table
 * Why: the phone number is the channel identity, the slug is the public catalog handle
 */
package com.example.catalog.model;

import java.time.Instant;
import java.util.UUID;

public record SellerRecord(
    UUID sellerId,
    String phoneNumber,
    String displayName,
    String catalogSlug,
    boolean active,
    Instant createdAt,
    Instant updatedAt) {}
