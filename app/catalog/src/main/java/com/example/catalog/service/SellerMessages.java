package com.example.catalog.service;

import com.example.catalog.config.ListingProperties;
import com.example.catalog.model.ListingRecord;
import com.example.catalog.model.SellerRecord;
import java.math.BigDecimal;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Texts sent to sellers over the messaging channel. */
@Component
@RequiredArgsConstructor
public class SellerMessages {

  static final String ADD_BUTTON_TITLE = "✅ Add";
  static final String CANCEL_BUTTON_TITLE = "❌ Cancel";

  private final ListingProperties properties;

  public String catalogUrl(SellerRecord seller) {
    return properties.catalogUrl(seller.catalogSlug());
  }

  public String welcome(SellerRecord seller) {
    final String name = seller.displayName() == null ? "there" : seller.displayName();
    return """
        👋 Welcome, %s! Your catalog is ready.

        1. Send a product photo, with name and price in the caption
        2. Tap ✅ to add it to your catalog
        3. Share your catalog link on your Status
        4. Buyers tap "I'm Interested" to message you

        Removed a product by mistake? You have %d seconds to undo it.

        🔗 Your catalog: %s"""
        .formatted(name, properties.undoWindow().toSeconds(), catalogUrl(seller));
  }

  public String welcomeBack(SellerRecord seller) {
    return """
        👋 Welcome back! You're already registered.

        🔗 Your catalog: %s

        Send a photo to add a new product 📸"""
        .formatted(catalogUrl(seller));
  }

  public String help() {
    return """
        📚 *Quick guide*

        *Add a product:* send a photo, optionally captioned like "Red Shoes $45.99", \
        then tap ✅ to confirm.
        *Share:* type "link" to get your catalog URL.
        *Manage:* remove or edit products from the seller app.

        Every action is logged for your protection.""";
  }

  public String catalogLink(SellerRecord seller) {
    return """
        🔗 *Your catalog link*

        %s

        Post it on your Status so buyers can browse. It updates automatically as you add \
        or remove products."""
        .formatted(catalogUrl(seller));
  }

  public String notRegistered() {
    return "You're not registered yet. Type 'start' to register.";
  }

  public String fallback() {
    return """
        👋 Sorry, I didn't get that.

        Send me a *photo* to add a product, or type:
        • *help* for instructions
        • *link* for your catalog link
        • *start* to see the welcome message""";
  }

  public String imageRejected(String reason) {
    return "❌ Sorry, I couldn't process that image (" + reason + "). Please try another one.";
  }

  public String imageDownloadFailed() {
    return "❌ Sorry, I couldn't download that image. Please try again.";
  }

  public String uploadPromptCaption(ListingRecord listing) {
    final StringBuilder caption = new StringBuilder("📦 *").append(listing.name()).append('*');
    if (listing.price() != null) {
      caption.append("\n💰 Price: ").append(formatPrice(listing.price()));
    }
    return caption.append("\n\nAdd this product to your catalog?").toString();
  }

  public String uploadPromptQuestion(ListingRecord listing) {
    return "Tap ✅ to add *" + listing.name() + "* to your catalog, or ❌ to cancel.";
  }

  public String added(ListingRecord listing, SellerRecord seller) {
    return """
        ✅ *%s* added to your catalog!

        🔗 %s

        Send another photo to add more products 📸"""
        .formatted(listing.name(), catalogUrl(seller));
  }

  public String notAdded(ListingRecord listing) {
    return "❌ *" + listing.name() + "* was not added. Send another photo to try again.";
  }

  public String listingNotFound() {
    return "❌ Product not found. It may have been deleted.";
  }

  public String alreadyHandled() {
    return "This product was already handled.";
  }

  public String somethingWentWrong() {
    return "Something went wrong on our side. Please try again in a moment.";
  }

  public String interestNotification(String buyerName, ListingRecord listing) {
    final String buyer = buyerName == null || buyerName.isBlank() ? "Someone" : buyerName;
    return """
        🛒 *New interest!*

        %s is interested in *%s*. Check your messages to talk to the buyer directly."""
        .formatted(buyer, listing.name());
  }

  static String formatPrice(BigDecimal price) {
    return "$" + price.toPlainString();
  }
}
