package dev.mass.scrape.browser;

import com.microsoft.playwright.Page;

/** A running browser with one context. */
public interface BrowserSession extends AutoCloseable {

  /** Opens a new tab in the session's context. */
  Page newPage();

  @Override
  void close();
}
