package dev.mass.scrape.browser;

/** Opens isolated browser sessions; one session per adapter call. */
public interface BrowserLauncher {

  /**
   * Starts a browser and returns a session owning it. Closing the session shuts the browser down.
   *
   * @throws com.microsoft.playwright.PlaywrightException if the browser cannot be started
   */
  BrowserSession open();
}
