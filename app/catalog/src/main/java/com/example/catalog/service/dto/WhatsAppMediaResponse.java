/*
 * Where: catalog downstream DTO
 * What: Graph API media lookup reply
 * Why: the short-lived download url is only reachable through this lookup
 */
package com.example.catalog.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WhatsAppMediaResponse(String id, String url, String mimeType, Long fileSize) {}
