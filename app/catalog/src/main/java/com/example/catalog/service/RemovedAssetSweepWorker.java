/*
 * Where: catalog cleanup worker
 * What: triggers the removed asset sweep on a schedule
 * Why: reclamation is opt-in per environment
 */
package com.example.catalog.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "catalog.sweep.enabled", havingValue = "true")
public class RemovedAssetSweepWorker {

  private final RemovedAssetSweepService sweepService;

  @Scheduled(fixedDelayString = "${catalog.sweep.interval:PT10M}")
  public void run() {
    sweepService.sweep();
  }
}
