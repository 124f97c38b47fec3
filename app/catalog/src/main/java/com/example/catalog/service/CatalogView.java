package com.example.catalog.service;

import com.example.catalog.model.SellerRecord;
import java.util.List;

public record CatalogView(SellerRecord seller, List<CatalogItem> items) {

  public CatalogView {
    items = List.copyOf(items);
  }
}
