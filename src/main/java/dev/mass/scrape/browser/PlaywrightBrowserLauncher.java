package dev.mass.scrape.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Launches headless Chromium through Playwright. Each session owns its own {@link Playwright}
 * instance because Playwright objects are not thread-safe and adapters run concurrently.
 */
@Component
public class PlaywrightBrowserLauncher implements BrowserLauncher {

  private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserLauncher.class);

  private final BrowserProperties properties;

  public PlaywrightBrowserLauncher(BrowserProperties properties) {
    this.properties = properties;
  }

  @Override
  public BrowserSession open() {
    Playwright playwright = Playwright.create();
    try {
      Browser browser =
          playwright
              .chromium()
              .launch(new BrowserType.LaunchOptions().setHeadless(properties.headless()));
      BrowserContext context =
          browser.newContext(new Browser.NewContextOptions().setUserAgent(properties.userAgent()));
      context.setDefaultNavigationTimeout(properties.navigationTimeoutMs());
      return new PlaywrightSession(playwright, context);
    } catch (PlaywrightException e) {
      playwright.close();
      throw e;
    }
  }

  private static final class PlaywrightSession implements BrowserSession {

    private final Playwright playwright;
    private final BrowserContext context;

    private PlaywrightSession(Playwright playwright, BrowserContext context) {
      this.playwright = playwright;
      this.context = context;
    }

    @Override
    public Page newPage() {
      return context.newPage();
    }

    @Override
    public void close() {
      try {
        context.browser().close();
      } catch (PlaywrightException e) {
        log.debug("Browser already closed: {}", e.getMessage());
      } finally {
        playwright.close();
      }
    }
  }
}
