/*
 * Where: catalog service layer
 * What: maps inbound events to intents by ordered keyword predicates
 * Why: sellers type free-form text, so matching must be forgiving yet deterministic
 */
package com.example.catalog.service;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

@Component
public class IntentClassifier {

  static final Set<String> REGISTRATION_KEYWORDS =
      Set.of("start", "hello", "hi", "register", "signup");
  static final Set<String> HELP_KEYWORDS = Set.of("help", "?", "how", "guide");
  static final List<String> CATALOG_LINK_FRAGMENTS =
      List.of("link", "catalog", "my shop", "my store");

  private final List<Rule> textRules =
      List.of(
          new Rule(Intent.REGISTRATION, REGISTRATION_KEYWORDS::contains),
          new Rule(Intent.HELP, HELP_KEYWORDS::contains),
          new Rule(
              Intent.CATALOG_LINK,
              body -> CATALOG_LINK_FRAGMENTS.stream().anyMatch(body::contains)));

  public Intent classify(InboundEvent event) {
    if (event instanceof InboundEvent.Text text) {
      return classifyText(text.body());
    }
    if (event instanceof InboundEvent.Image) {
      return Intent.IMAGE_INTAKE;
    }
    if (event instanceof InboundEvent.ButtonTap tap) {
      return ButtonAction.parse(tap.buttonId()).map(ButtonAction::intent).orElse(Intent.IGNORED);
    }
    return Intent.IGNORED;
  }

  public Intent classifyText(String body) {
    final String normalized = body == null ? "" : body.strip().toLowerCase(Locale.ROOT);
    for (Rule rule : textRules) {
      if (rule.matches().test(normalized)) {
        return rule.intent();
      }
    }
    return Intent.FALLBACK;
  }

  private record Rule(Intent intent, Predicate<String> matches) {}
}
