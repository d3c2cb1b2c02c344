package com.regdoc.acquirer.crawl.strategy;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.Proxy;
import com.microsoft.playwright.options.WaitUntilState;
import com.regdoc.acquirer.config.AcquirerProperties;
import com.regdoc.acquirer.crawl.identity.NetworkIdentity;
import com.regdoc.acquirer.crawl.util.ReasonCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Headless Chromium through Playwright. Playwright objects are bound to the thread that created
 * them, so every session owns a single thread and all of its browser calls run there.
 */
@Component
public class PlaywrightBrowserSessionFactory implements BrowserSessionFactory {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserSessionFactory.class);
    private static final List<String> LAUNCH_ARGS = List.of(
        "--disable-dev-shm-usage",
        "--no-sandbox",
        "--disable-blink-features=AutomationControlled"
    );
    private static final long CALL_GRACE_SECONDS = 5;

    private final AcquirerProperties properties;

    public PlaywrightBrowserSessionFactory(AcquirerProperties properties) {
        this.properties = properties;
    }

    @Override
    public BrowserSession open(NetworkIdentity identity) throws StrategyException {
        AcquirerProperties.Browser settings = properties.getStrategies().getBrowser();
        List<String> agents = properties.getHttp().getUserAgents();
        String userAgent = agents.get(ThreadLocalRandom.current().nextInt(agents.size()));
        PlaywrightSession session = new PlaywrightSession(identity, settings);
        try {
            session.call(() -> {
                session.start(settings.isHeadless(), userAgent);
                return null;
            }, "launch");
        } catch (StrategyException e) {
            session.close();
            throw e;
        }
        log.info("Browser session started via {}", identity == null ? "direct" : identity.name());
        return session;
    }

    private static final class PlaywrightSession implements BrowserSession {
        private final NetworkIdentity identity;
        private final AcquirerProperties.Browser settings;
        private final ExecutorService thread;
        private Playwright playwright;
        private Browser browser;
        private BrowserContext context;
        private Page page;

        private PlaywrightSession(NetworkIdentity identity, AcquirerProperties.Browser settings) {
            this.identity = identity;
            this.settings = settings;
            this.thread = Executors.newSingleThreadExecutor(runnable -> {
                Thread t = new Thread(runnable, "browser-session");
                t.setDaemon(true);
                return t;
            });
        }

        private void start(boolean headless, String userAgent) {
            playwright = Playwright.create();
            BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
                .setHeadless(headless)
                .setArgs(LAUNCH_ARGS);
            if (identity != null && !identity.isDirect()) {
                Proxy proxy = new Proxy(identity.proxyServer());
                if (identity.hasCredentials()) {
                    proxy.setUsername(identity.username()).setPassword(identity.password());
                }
                options.setProxy(proxy);
            }
            browser = playwright.chromium().launch(options);
            context = browser.newContext(new Browser.NewContextOptions().setUserAgent(userAgent));
            page = context.newPage();
        }

        @Override
        public String fetchHtml(String url) throws StrategyException {
            return call(() -> {
                page.navigate(url, new Page.NavigateOptions()
                    .setTimeout(settings.getNavigationTimeoutSeconds() * 1000.0)
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
                return page.content();
            }, url);
        }

        private <T> T call(Callable<T> work, String what) throws StrategyException {
            Future<T> future = thread.submit(work);
            try {
                return future.get(settings.getNavigationTimeoutSeconds() + CALL_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                throw new StrategyException(ReasonCodes.SESSION_FAILED, "browser call timed out: " + what, e);
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new StrategyException(ReasonCodes.SESSION_FAILED, "interrupted during browser call: " + what, e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof TimeoutError) {
                    throw new StrategyException(ReasonCodes.TIMEOUT, "navigation timed out: " + what, cause);
                }
                if (cause instanceof PlaywrightException) {
                    log.warn("Playwright failure during {}: {}", what, cause.getMessage());
                }
                throw new StrategyException(ReasonCodes.SESSION_FAILED, "browser call failed: " + what, cause);
            }
        }

        @Override
        public NetworkIdentity identity() {
            return identity;
        }

        @Override
        public void close() {
            Future<?> shutdown = thread.submit(this::closeOnOwnerThread);
            try {
                shutdown.get(settings.getNavigationTimeoutSeconds() + CALL_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Interrupted while closing browser session");
            } catch (ExecutionException | TimeoutException e) {
                log.debug("Error closing browser session: {}", e.getMessage());
            } finally {
                thread.shutdownNow();
            }
        }

        private void closeOnOwnerThread() {
            if (context != null) {
                try {
                    context.close();
                } catch (Exception e) {
                    log.debug("Error closing browser context: {}", e.getMessage());
                }
            }
            if (browser != null) {
                try {
                    browser.close();
                } catch (Exception e) {
                    log.debug("Error closing browser: {}", e.getMessage());
                }
            }
            if (playwright != null) {
                try {
                    playwright.close();
                } catch (Exception e) {
                    log.debug("Error closing Playwright: {}", e.getMessage());
                }
            }
        }
    }
}
