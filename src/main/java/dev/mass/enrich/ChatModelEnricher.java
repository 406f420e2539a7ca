package dev.mass.enrich;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.mass.scrape.ResultItem;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enrichment through a remote chat model. Items are sent in fixed-size batches; calls within a
 * batch run concurrently. Any failure for one item leaves that item unchanged.
 */
public class ChatModelEnricher implements ContentEnricher {

  private static final Logger log = LoggerFactory.getLogger(ChatModelEnricher.class);

  static final int MIN_TITLE_LENGTH = 3;

  private static final String SYSTEM_PROMPT =
      "You are an AI assistant that analyzes web content and provides structured data.";

  private final ChatModel chatModel;
  private final AnalysisReplyParser parser;
  private final Executor executor;
  private final int batchSize;

  public ChatModelEnricher(
      ChatModel chatModel, ObjectMapper objectMapper, Executor executor, int batchSize) {
    this.chatModel = chatModel;
    this.parser = new AnalysisReplyParser(objectMapper);
    this.executor = executor;
    this.batchSize = Math.max(1, batchSize);
  }

  @Override
  public List<ResultItem> enhance(List<ResultItem> items, String keywords) {
    List<ResultItem> enhanced = new ArrayList<>(items.size());
    for (int start = 0; start < items.size(); start += batchSize) {
      List<ResultItem> batch = items.subList(start, Math.min(items.size(), start + batchSize));
      List<CompletableFuture<ResultItem>> calls = new ArrayList<>(batch.size());
      for (int i = 0; i < batch.size(); i++) {
        ResultItem item = batch.get(i);
        int index = start + i;
        calls.add(
            CompletableFuture.supplyAsync(() -> enhanceItem(item, keywords), executor)
                .exceptionally(
                    ex -> {
                      log.error("Error processing item {}: {}", index, ex.getMessage());
                      return item;
                    }));
      }
      CompletableFuture.allOf(calls.toArray(new CompletableFuture<?>[0])).join();
      calls.forEach(call -> enhanced.add(call.join()));
    }
    log.info("Enhanced {} results with the remote model", enhanced.size());
    return enhanced;
  }

  ResultItem enhanceItem(ResultItem item, String keywords) {
    if (item.title().length() < MIN_TITLE_LENGTH) {
      return item;
    }
    try {
      ChatResponse response =
          chatModel.chat(
              List.of(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(prompt(item, keywords))));
      String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
      if (text == null || text.isBlank()) {
        log.warn("Empty analysis reply for {}", item.link());
        return item;
      }
      AnalysisReplyParser.Reply reply = parser.parse(text);
      ResultItem result = item.withMetadata(ResultItem.AI_ANALYSIS_KEY, reply.analysis());
      if ((item.description() == null || item.description().isBlank())
          && reply.enhancedDescription() != null) {
        result = result.withDescription(reply.enhancedDescription());
      }
      return result;
    } catch (Exception e) {
      log.error("Error with remote enhancement of {}: {}", item.link(), e.getMessage());
      return item;
    }
  }

  static String prompt(ResultItem item, String keywords) {
    StringBuilder content = new StringBuilder("Title: ").append(item.title()).append('\n');
    if (item.description() != null && !item.description().isBlank()) {
      content.append("Description: ").append(item.description()).append('\n');
    }
    return """
        Analyze this content related to the search query "%s":

        %s
        Provide a JSON response with these fields:
        1. relevance_score (0-100): How relevant this content is to the query
        2. content_type: The likely type (article, video, product, etc.)
        3. enhanced_description: A better description if the original is missing or poor
        4. tags: Up to 5 relevant tags or keywords

        JSON format only."""
        .formatted(keywords, content);
  }
}
