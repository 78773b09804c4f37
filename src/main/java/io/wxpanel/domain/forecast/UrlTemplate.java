package io.wxpanel.domain.forecast;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Image URL pattern with {@code {TOKEN}} placeholders.
 *
 * <p>Only tokens in the enabled set are substituted. Unknown placeholders and disabled tokens stay in
 * the expanded text unchanged.</p>
 *
 * @param pattern template text
 * @param tokens tokens this template substitutes
 * @since 0.1.0
 */
public record UrlTemplate(String pattern, Set<TemplateToken> tokens) {
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z]+)\\}");

  public UrlTemplate {
    Objects.requireNonNull(pattern, "pattern");
    if (pattern.isBlank()) {
      throw new IllegalArgumentException("URL template must not be blank");
    }
    tokens = tokens == null || tokens.isEmpty()
        ? Set.of()
        : Set.copyOf(EnumSet.copyOf(tokens));
  }

  /**
   * Creates a template that substitutes every token it recognises.
   *
   * @param pattern template text
   * @return template with all tokens enabled
   */
  public static UrlTemplate of(String pattern) {
    return new UrlTemplate(pattern, EnumSet.allOf(TemplateToken.class));
  }

  /**
   * Expands the template for a run.
   *
   * @param issuance issuance time; must not be {@code null}
   * @param step step token; must not be {@code null}
   * @return URL text
   */
  public String expand(IssuanceTime issuance, String step) {
    Objects.requireNonNull(issuance, "issuance");
    Objects.requireNonNull(step, "step");
    Matcher matcher = PLACEHOLDER.matcher(pattern);
    StringBuilder out = new StringBuilder(pattern.length() + 16);
    while (matcher.find()) {
      String replacement = TemplateToken.fromName(matcher.group(1))
          .filter(tokens::contains)
          .map(token -> token.valueFor(issuance, step))
          .orElse(matcher.group());
      matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(out);
    return out.toString();
  }
}
