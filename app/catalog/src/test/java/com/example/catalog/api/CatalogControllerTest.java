package com.example.catalog.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.catalog.model.InterestRecord;
import com.example.catalog.model.ListingRecord;
import com.example.catalog.model.ListingState;
import com.example.catalog.model.NetworkMetadata;
import com.example.catalog.model.SellerRecord;
import com.example.catalog.service.CatalogException;
import com.example.catalog.service.CatalogItem;
import com.example.catalog.service.CatalogView;
import com.example.catalog.service.CatalogViewService;
import com.example.catalog.service.InterestResult;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(CatalogController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(CatalogApiExceptionHandler.class)
class CatalogControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final UUID SELLER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
  private static final UUID LISTING_ID = UUID.fromString("00000000-0000-0000-0000-0000000000b1");
  private static final String CHAT_LINK = "https://wa.me/15551234567?text=Hi";

  @Autowired private MockMvc mockMvc;

  @MockitoBean private CatalogViewService catalogViewService;

  @Test
  void viewReturnsActiveListingsWithChatLinks() throws Exception {
    when(catalogViewService.view(eq("ana-shop-x1y2"), any(NetworkMetadata.class)))
        .thenReturn(new CatalogView(seller(), List.of(new CatalogItem(listing(), CHAT_LINK))));

    mockMvc
        .perform(get("/catalog/ana-shop-x1y2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.catalog_slug").value("ana-shop-x1y2"))
        .andExpect(jsonPath("$.seller_name").value("Ana Shop"))
        .andExpect(jsonPath("$.listing_count").value(1))
        .andExpect(jsonPath("$.listings[0].name").value("Red scarf"))
        .andExpect(jsonPath("$.listings[0].chat_link").value(CHAT_LINK));
  }

  @Test
  void viewPassesForwardedClientAddress() throws Exception {
    when(catalogViewService.view(eq("ana-shop-x1y2"), any(NetworkMetadata.class)))
        .thenReturn(new CatalogView(seller(), List.of()));

    mockMvc
        .perform(
            get("/catalog/ana-shop-x1y2")
                .header("X-Forwarded-For", "203.0.113.7, 10.0.0.1")
                .header("User-Agent", "test-agent"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.listing_count").value(0));

    verify(catalogViewService)
        .view("ana-shop-x1y2", new NetworkMetadata("203.0.113.7", "test-agent"));
  }

  @Test
  void viewReturns404ForUnknownSlug() throws Exception {
    when(catalogViewService.view(eq("missing"), any(NetworkMetadata.class)))
        .thenThrow(new CatalogException(CatalogException.Reason.NOT_FOUND, "catalog not found"));

    mockMvc
        .perform(get("/catalog/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("CATALOG_NOT_FOUND"));
  }

  @Test
  void listingReturnsSingleItem() throws Exception {
    when(catalogViewService.listing("ana-shop-x1y2", LISTING_ID))
        .thenReturn(new CatalogItem(listing(), CHAT_LINK));

    mockMvc
        .perform(get("/catalog/ana-shop-x1y2/listings/" + LISTING_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value(LISTING_ID.toString()))
        .andExpect(jsonPath("$.price").value(12.5))
        .andExpect(jsonPath("$.chat_link").value(CHAT_LINK));
  }

  @Test
  void interestReturns201WithChatLink() throws Exception {
    final UUID interestId = UUID.fromString("00000000-0000-0000-0000-0000000000c1");
    when(catalogViewService.signalInterest(
            eq("ana-shop-x1y2"),
            eq(LISTING_ID),
            eq("Bo"),
            isNull(),
            any(NetworkMetadata.class)))
        .thenReturn(
            new InterestResult(
                new InterestRecord(interestId, LISTING_ID, null, "Bo", null, null, true, NOW),
                CHAT_LINK));

    mockMvc
        .perform(
            post("/catalog/ana-shop-x1y2/interest")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"listing_id\": \"" + LISTING_ID + "\", \"buyer_name\": \"Bo\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(interestId.toString()))
        .andExpect(jsonPath("$.listing_id").value(LISTING_ID.toString()))
        .andExpect(jsonPath("$.message_sent").value(true))
        .andExpect(jsonPath("$.chat_link").value(CHAT_LINK));
  }

  @Test
  void interestRequiresListingId() throws Exception {
    mockMvc
        .perform(
            post("/catalog/ana-shop-x1y2/interest")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"buyer_name\": \"Bo\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("CATALOG_VALIDATION_ERROR"));

    verifyNoInteractions(catalogViewService);
  }

  private static SellerRecord seller() {
    return new SellerRecord(
        SELLER_ID, "15551234567", "Ana Shop", "ana-shop-x1y2", true, NOW, NOW);
  }

  private static ListingRecord listing() {
    return new ListingRecord(
        LISTING_ID,
        SELLER_ID,
        "Red scarf",
        "Wool",
        new BigDecimal("12.50"),
        "USD",
        "https://catalog.test/uploads/a.jpg",
        "a.jpg",
        ListingState.ACTIVE,
        null,
        null,
        NOW,
        NOW);
  }
}
