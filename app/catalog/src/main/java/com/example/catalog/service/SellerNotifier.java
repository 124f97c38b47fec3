/*
 * Where: catalog service layer
 * What: outbound messaging boundary towards sellers and buyers
 * Why: lets routing and tests run without the real messaging platform
 */
package com.example.catalog.service;

import com.example.catalog.service.OutboundMessage.ReplyButton;
import java.util.List;

public interface SellerNotifier {

  DeliveryResult sendText(String to, String body);

  DeliveryResult sendImage(String to, String imageUrl, String caption);

  DeliveryResult sendButtons(String to, String body, List<ReplyButton> buttons);
}
