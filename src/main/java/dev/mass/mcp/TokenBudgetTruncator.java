package dev.mass.mcp;

import dev.mass.scrape.ResultItem;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Formats scraped items as text blocks and keeps as many as fit in a token budget.
 *
 * <p>Tokens are estimated as characters / 4. If the first item alone exceeds the budget it is cut
 * at the character level, so at least one item is always returned.
 */
@Component
public class TokenBudgetTruncator {

  private static final double CHARS_PER_TOKEN = 4.0;

  private final int tokenBudget;

  public TokenBudgetTruncator(@Value("${mass.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * @param items the items to format, in display order
   * @return formatted text of the leading items that fit the budget, empty for no items
   */
  public String truncate(@Nullable List<ResultItem> items) {
    if (items == null || items.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;

    for (int i = 0; i < items.size(); i++) {
      String formatted = formatItem(i + 1, items.get(i));
      int itemTokens = estimateTokens(formatted);

      if (i == 0 && itemTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        break;
      }
      if (estimatedTokens + itemTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      estimatedTokens += itemTokens;
    }

    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String formatItem(int index, ResultItem item) {
    StringBuilder block =
        new StringBuilder("## [%d] %s\nLink: %s\nSource: %s\n".formatted(
            index, item.title(), item.link(), item.source()));
    item.aiAnalysis()
        .ifPresent(
            analysis ->
                block.append(
                    "Type: %s | Relevance: %d | Tags: %s\n"
                        .formatted(
                            analysis.contentType(),
                            analysis.relevanceScore(),
                            String.join(", ", analysis.tags()))));
    if (item.description() != null && !item.description().isBlank()) {
      block.append('\n').append(item.description()).append('\n');
    }
    return block.append("\n---\n").toString();
  }
}
