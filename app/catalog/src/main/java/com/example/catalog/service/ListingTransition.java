package com.example.catalog.service;

import com.example.catalog.model.AuditAction;
import com.example.catalog.model.ListingRecord;
import com.example.catalog.model.ListingState;
import java.util.Map;

/**
 * A computed lifecycle step: the listing after the step, the state it left and the audit record
 * kind the step must produce.
 */
public record ListingTransition(
    ListingState from, ListingRecord listing, AuditAction auditAction, Map<String, Object> auditPayload) {}
