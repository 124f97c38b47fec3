package com.example.catalog.service;

import com.example.catalog.model.InterestRecord;

public record InterestResult(InterestRecord interest, String chatLink) {}
