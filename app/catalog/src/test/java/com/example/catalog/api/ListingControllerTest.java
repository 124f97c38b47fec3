package com.example.catalog.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.catalog.model.ListingRecord;
import com.example.catalog.model.ListingState;
import com.example.catalog.model.SellerRecord;
import com.example.catalog.service.CatalogException;
import com.example.catalog.service.DownloadedImage;
import com.example.catalog.service.ListingLifecycleService;
import com.example.catalog.service.ListingService;
import com.example.catalog.service.RemovalResult;
import com.example.catalog.service.SellerService;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ListingController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(CatalogApiExceptionHandler.class)
class ListingControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final UUID SELLER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
  private static final UUID LISTING_ID = UUID.fromString("00000000-0000-0000-0000-0000000000b1");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private ListingService listingService;
  @MockitoBean private ListingLifecycleService lifecycleService;
  @MockitoBean private SellerService sellerService;

  @Test
  void listBySellerReturnsSnakeCaseListings() throws Exception {
    when(listingService.listBySeller(SELLER_ID, true))
        .thenReturn(List.of(listing(ListingState.ACTIVE)));

    mockMvc
        .perform(get("/listings/seller/" + SELLER_ID).param("includeInactive", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value(LISTING_ID.toString()))
        .andExpect(jsonPath("$[0].seller_id").value(SELLER_ID.toString()))
        .andExpect(jsonPath("$[0].image_url").value("https://catalog.test/uploads/a.jpg"))
        .andExpect(jsonPath("$[0].state").value("ACTIVE"));
  }

  @Test
  void getReturns404WhenListingNotFound() throws Exception {
    when(listingService.get(LISTING_ID))
        .thenThrow(new CatalogException(CatalogException.Reason.NOT_FOUND, "listing not found"));

    mockMvc
        .perform(get("/listings/" + LISTING_ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("CATALOG_NOT_FOUND"))
        .andExpect(jsonPath("$.message").value("listing not found"));
  }

  @Test
  void getRejectsMalformedId() throws Exception {
    mockMvc
        .perform(get("/listings/not-a-uuid"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("CATALOG_BAD_REQUEST"));
  }

  @Test
  void patchRejectsNegativePrice() throws Exception {
    mockMvc
        .perform(
            patch("/listings/" + LISTING_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"price\": -1}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("CATALOG_VALIDATION_ERROR"));

    verifyNoInteractions(listingService);
  }

  @Test
  void patchUpdatesDetails() throws Exception {
    when(listingService.update(
            eq(LISTING_ID), eq("Red scarf"), isNull(), any(BigDecimal.class), isNull()))
        .thenReturn(listing(ListingState.ACTIVE));

    mockMvc
        .perform(
            patch("/listings/" + LISTING_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Red scarf\", \"price\": 12.50}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Red scarf"));
  }

  @Test
  void removeReturnsRemovedIdsAndDeadline() throws Exception {
    final Instant deadline = NOW.plusSeconds(30);
    final ListingRecord removed =
        listing(ListingState.ACTIVE).withState(ListingState.REMOVED, NOW, deadline, NOW);
    when(lifecycleService.remove(anyCollection()))
        .thenReturn(new RemovalResult(List.of(removed), deadline));

    mockMvc
        .perform(
            post("/listings/remove")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"listing_ids\": [\"" + LISTING_ID + "\"]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.removed_count").value(1))
        .andExpect(jsonPath("$.removed_ids[0]").value(LISTING_ID.toString()))
        .andExpect(jsonPath("$.undo_deadline").value("2026-03-01T10:00:30Z"));
  }

  @Test
  void removeRequiresListingIds() throws Exception {
    mockMvc
        .perform(post("/listings/remove").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("CATALOG_VALIDATION_ERROR"));
  }

  @Test
  void restoreReturns410AfterUndoWindow() throws Exception {
    when(lifecycleService.restore(LISTING_ID))
        .thenThrow(new CatalogException(CatalogException.Reason.GONE, "undo window expired"));

    mockMvc
        .perform(
            post("/listings/restore")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"listing_id\": \"" + LISTING_ID + "\"}"))
        .andExpect(status().isGone())
        .andExpect(jsonPath("$.code").value("CATALOG_GONE"));
  }

  @Test
  void restoreReturnsActiveListing() throws Exception {
    when(lifecycleService.restore(LISTING_ID)).thenReturn(listing(ListingState.ACTIVE));

    mockMvc
        .perform(
            post("/listings/restore")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"listing_id\": \"" + LISTING_ID + "\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("ACTIVE"));
  }

  @Test
  void uploadStoresDraftForSeller() throws Exception {
    final SellerRecord seller =
        new SellerRecord(SELLER_ID, "15551234567", "Ana", "ana12345", true, NOW, NOW);
    when(sellerService.get(SELLER_ID)).thenReturn(seller);
    when(lifecycleService.intakeImage(
            eq(seller), any(DownloadedImage.class), eq("Red scarf $12.50")))
        .thenReturn(listing(ListingState.DRAFT));

    mockMvc
        .perform(
            multipart("/listings/upload")
                .file(new MockMultipartFile("image", "a.jpg", "image/jpeg", new byte[] {1, 2, 3}))
                .param("seller_id", SELLER_ID.toString())
                .param("caption", "Red scarf $12.50"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(LISTING_ID.toString()))
        .andExpect(jsonPath("$.state").value("DRAFT"));

    final ArgumentCaptor<DownloadedImage> image = ArgumentCaptor.forClass(DownloadedImage.class);
    verify(lifecycleService).intakeImage(eq(seller), image.capture(), eq("Red scarf $12.50"));
    assertThat(image.getValue().content()).containsExactly(1, 2, 3);
    assertThat(image.getValue().contentType()).isEqualTo("image/jpeg");
  }

  @Test
  void uploadRejectsUnsupportedImageType() throws Exception {
    final SellerRecord seller =
        new SellerRecord(SELLER_ID, "15551234567", null, "ana12345", true, NOW, NOW);
    when(sellerService.get(SELLER_ID)).thenReturn(seller);
    when(lifecycleService.intakeImage(eq(seller), any(DownloadedImage.class), isNull()))
        .thenThrow(
            new CatalogException(
                CatalogException.Reason.INVALID_INPUT, "unsupported image type: image/gif"));

    mockMvc
        .perform(
            multipart("/listings/upload")
                .file(new MockMultipartFile("image", "a.gif", "image/gif", new byte[] {1}))
                .param("seller_id", SELLER_ID.toString()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("CATALOG_INVALID_INPUT"));
  }

  @Test
  void uploadForUnknownSellerReturns404() throws Exception {
    when(sellerService.get(SELLER_ID))
        .thenThrow(new CatalogException(CatalogException.Reason.NOT_FOUND, "seller not found"));

    mockMvc
        .perform(
            multipart("/listings/upload")
                .file(new MockMultipartFile("image", "a.jpg", "image/jpeg", new byte[] {1}))
                .param("seller_id", SELLER_ID.toString()))
        .andExpect(status().isNotFound());

    verifyNoInteractions(lifecycleService);
  }

  @Test
  void uploadRequiresImagePart() throws Exception {
    mockMvc
        .perform(multipart("/listings/upload").param("seller_id", SELLER_ID.toString()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("CATALOG_BAD_REQUEST"));

    verifyNoInteractions(sellerService, lifecycleService);
  }

  @Test
  void confirmActivatesDraft() throws Exception {
    when(lifecycleService.confirm(LISTING_ID)).thenReturn(listing(ListingState.ACTIVE));

    mockMvc
        .perform(
            post("/listings/confirm")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"listing_id\": \"" + LISTING_ID + "\", \"confirmed\": true}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("ACTIVE"));
  }

  @Test
  void confirmFalseDiscardsDraft() throws Exception {
    when(lifecycleService.cancel(LISTING_ID)).thenReturn(listing(ListingState.DISCARDED));

    mockMvc
        .perform(
            post("/listings/confirm")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"listing_id\": \"" + LISTING_ID + "\", \"confirmed\": false}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("DISCARDED"));
  }

  @Test
  void confirmOfDecidedDraftReturns409() throws Exception {
    when(lifecycleService.confirm(LISTING_ID))
        .thenThrow(new CatalogException(CatalogException.Reason.CONFLICT, "listing not a draft"));

    mockMvc
        .perform(
            post("/listings/confirm")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"listing_id\": \"" + LISTING_ID + "\", \"confirmed\": true}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("CATALOG_CONFLICT"));
  }

  @Test
  void confirmRequiresDecision() throws Exception {
    mockMvc
        .perform(
            post("/listings/confirm")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"listing_id\": \"" + LISTING_ID + "\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("CATALOG_VALIDATION_ERROR"));

    verifyNoInteractions(lifecycleService);
  }

  @Test
  void patchRejectsPriceBeyondStorableRange() throws Exception {
    mockMvc
        .perform(
            patch("/listings/" + LISTING_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"price\": 1000000000000}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("CATALOG_VALIDATION_ERROR"));

    verifyNoInteractions(listingService);
  }

  private static ListingRecord listing(ListingState state) {
    return new ListingRecord(
        LISTING_ID,
        SELLER_ID,
        "Red scarf",
        null,
        new BigDecimal("12.50"),
        "USD",
        "https://catalog.test/uploads/a.jpg",
        "a.jpg",
        state,
        null,
        null,
        NOW,
        NOW);
  }
}
