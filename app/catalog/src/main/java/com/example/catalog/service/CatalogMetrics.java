/*
 * Where: catalog service layer
 * What: records lifecycle, audit, delivery and intent counters
 * Why: audit write failures must be visible on the operational channel, not only in logs
 */
package com.example.catalog.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring managed component")
public class CatalogMetrics {

  static final String METRIC_LISTING_TRANSITION_TOTAL = "catalog.listing.transition.total";
  static final String METRIC_AUDIT_WRITE_TOTAL = "catalog.audit.write.total";
  static final String METRIC_DELIVERY_TOTAL = "catalog.message.delivery.total";
  static final String METRIC_INBOUND_INTENT_TOTAL = "catalog.inbound.intent.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public CatalogMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordTransition(String action) {
    increment(METRIC_LISTING_TRANSITION_TOTAL, "Listing lifecycle transitions", "action", action);
  }

  public void recordAuditWrite(String result) {
    increment(METRIC_AUDIT_WRITE_TOTAL, "Audit record write outcomes", "result", result);
  }

  public void recordDelivery(String result) {
    increment(METRIC_DELIVERY_TOTAL, "Outbound message delivery outcomes", "result", result);
  }

  public void recordIntent(String intent) {
    increment(METRIC_INBOUND_INTENT_TOTAL, "Classified inbound events", "intent", intent);
  }

  private void increment(String name, String description, String tagKey, String tagValue) {
    counters
        .computeIfAbsent(
            name + "|" + tagValue,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment();
  }
}
