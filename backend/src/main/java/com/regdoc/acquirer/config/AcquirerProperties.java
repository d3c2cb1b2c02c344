package com.regdoc.acquirer.config;

import com.regdoc.acquirer.crawl.strategy.StrategyIds;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@ConfigurationProperties(prefix = "acquirer")
public class AcquirerProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private IdentityPool identityPool = new IdentityPool();
    private Detection detection = new Detection();
    private Strategies strategies = new Strategies();
    private Batch batch = new Batch();
    private Timeouts timeouts = new Timeouts();
    private Http http = new Http();
    private Cli cli = new Cli();
    private Persistence persistence = new Persistence();

    public void validate() {
        List<String> priority = strategies.getPriority();
        if (priority.isEmpty()) {
            throw new IllegalStateException("acquirer.strategies.priority must name at least one strategy");
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String id : priority) {
            if (!StrategyIds.ALL.contains(id)) {
                throw new IllegalStateException("Unknown strategy id in acquirer.strategies.priority: " + id);
            }
            if (!seen.add(id)) {
                throw new IllegalStateException("Duplicate strategy id in acquirer.strategies.priority: " + id);
            }
        }
        for (String id : strategies.getDisabled()) {
            if (!StrategyIds.ALL.contains(id)) {
                throw new IllegalStateException("Unknown strategy id in acquirer.strategies.disabled: " + id);
            }
        }
        if (identityPool.getPaidDeathThreshold() <= identityPool.getFreeDeathThreshold()) {
            throw new IllegalStateException(
                "acquirer.identity-pool.paid-death-threshold must be greater than free-death-threshold"
            );
        }
        requireIncreasing("acquirer.detection.consecutive-thresholds", detection.getConsecutiveThresholds());
        requireIncreasing("acquirer.detection.rate-thresholds", detection.getRateThresholds());
        if (detection.getConsecutiveThresholds().size() != 4 || detection.getRateThresholds().size() != 4) {
            throw new IllegalStateException("acquirer.detection level thresholds need exactly four entries each");
        }
        if (detection.getLevelMultipliers().size() != 5) {
            throw new IllegalStateException("acquirer.detection.level-multipliers needs exactly five entries");
        }
        if (detection.getRotateThreshold() > detection.getBanThreshold()) {
            throw new IllegalStateException("acquirer.detection.rotate-threshold must not exceed ban-threshold");
        }
        if (detection.getJitterMin() > detection.getJitterMax()) {
            throw new IllegalStateException("acquirer.detection.jitter-min must not exceed jitter-max");
        }
    }

    private static <T extends Number> void requireIncreasing(String key, List<T> values) {
        for (int i = 1; i < values.size(); i++) {
            if (values.get(i).doubleValue() <= values.get(i - 1).doubleValue()) {
                throw new IllegalStateException(key + " must be strictly increasing");
            }
        }
    }

    public IdentityPool getIdentityPool() {
        return identityPool;
    }

    public void setIdentityPool(IdentityPool identityPool) {
        this.identityPool = identityPool;
    }

    public Detection getDetection() {
        return detection;
    }

    public void setDetection(Detection detection) {
        this.detection = detection;
    }

    public Strategies getStrategies() {
        return strategies;
    }

    public void setStrategies(Strategies strategies) {
        this.strategies = strategies;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Timeouts getTimeouts() {
        return timeouts;
    }

    public void setTimeouts(Timeouts timeouts) {
        this.timeouts = timeouts;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public static class IdentityPool {
        private boolean enabled = true;
        private boolean preferPaid = true;
        private boolean rotationEnabled = true;
        private int freeDeathThreshold = 5;
        private int paidDeathThreshold = 10;
        private int cooldownSeconds = 300;
        private int sweepIntervalMinutes = 30;
        private int aliveFloor = 1;
        private int healthCheckConcurrency = 10;
        private int probeTimeoutSeconds = 8;
        private int forceRotationAfterUses = 10;
        private List<String> probeUrls = new ArrayList<>(List.of(
            "https://httpbin.org/ip",
            "https://ipinfo.io/json",
            "https://api.ipify.org?format=json"
        ));
        private List<PaidIdentity> paid = new ArrayList<>();
        private List<String> freeFeedUrls = new ArrayList<>();
        private int freeFeedLimit = 50;
        private String freeFeedProtocol = "HTTP";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isPreferPaid() {
            return preferPaid;
        }

        public void setPreferPaid(boolean preferPaid) {
            this.preferPaid = preferPaid;
        }

        public boolean isRotationEnabled() {
            return rotationEnabled;
        }

        public void setRotationEnabled(boolean rotationEnabled) {
            this.rotationEnabled = rotationEnabled;
        }

        public int getFreeDeathThreshold() {
            return Math.max(1, freeDeathThreshold);
        }

        public void setFreeDeathThreshold(int freeDeathThreshold) {
            this.freeDeathThreshold = freeDeathThreshold;
        }

        public int getPaidDeathThreshold() {
            return Math.max(1, paidDeathThreshold);
        }

        public void setPaidDeathThreshold(int paidDeathThreshold) {
            this.paidDeathThreshold = paidDeathThreshold;
        }

        public int getCooldownSeconds() {
            return Math.max(0, cooldownSeconds);
        }

        public void setCooldownSeconds(int cooldownSeconds) {
            this.cooldownSeconds = cooldownSeconds;
        }

        public int getSweepIntervalMinutes() {
            return Math.max(1, sweepIntervalMinutes);
        }

        public void setSweepIntervalMinutes(int sweepIntervalMinutes) {
            this.sweepIntervalMinutes = sweepIntervalMinutes;
        }

        public int getAliveFloor() {
            return Math.max(0, aliveFloor);
        }

        public void setAliveFloor(int aliveFloor) {
            this.aliveFloor = aliveFloor;
        }

        public int getHealthCheckConcurrency() {
            return Math.max(1, healthCheckConcurrency);
        }

        public void setHealthCheckConcurrency(int healthCheckConcurrency) {
            this.healthCheckConcurrency = healthCheckConcurrency;
        }

        public int getProbeTimeoutSeconds() {
            return Math.max(1, probeTimeoutSeconds);
        }

        public void setProbeTimeoutSeconds(int probeTimeoutSeconds) {
            this.probeTimeoutSeconds = probeTimeoutSeconds;
        }

        public int getForceRotationAfterUses() {
            return Math.max(1, forceRotationAfterUses);
        }

        public void setForceRotationAfterUses(int forceRotationAfterUses) {
            this.forceRotationAfterUses = forceRotationAfterUses;
        }

        public List<String> getProbeUrls() {
            return probeUrls == null ? List.of() : probeUrls;
        }

        public void setProbeUrls(List<String> probeUrls) {
            this.probeUrls = probeUrls;
        }

        public List<PaidIdentity> getPaid() {
            return paid == null ? List.of() : paid;
        }

        public void setPaid(List<PaidIdentity> paid) {
            this.paid = paid;
        }

        public List<String> getFreeFeedUrls() {
            return freeFeedUrls == null ? List.of() : freeFeedUrls;
        }

        public void setFreeFeedUrls(List<String> freeFeedUrls) {
            this.freeFeedUrls = freeFeedUrls;
        }

        public int getFreeFeedLimit() {
            return Math.max(0, freeFeedLimit);
        }

        public void setFreeFeedLimit(int freeFeedLimit) {
            this.freeFeedLimit = freeFeedLimit;
        }

        public String getFreeFeedProtocol() {
            return freeFeedProtocol == null || freeFeedProtocol.isBlank()
                ? "HTTP"
                : freeFeedProtocol.trim().toUpperCase(Locale.ROOT);
        }

        public void setFreeFeedProtocol(String freeFeedProtocol) {
            this.freeFeedProtocol = freeFeedProtocol;
        }
    }

    public static class PaidIdentity {
        private String name;
        private String protocol = "HTTP";
        private String host;
        private int port;
        private String username;
        private String password;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getProtocol() {
            return protocol;
        }

        public void setProtocol(String protocol) {
            this.protocol = protocol;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }

    public static class Detection {
        private long baseDelayMillis = 1000;
        private long maxDelayMillis = 30000;
        private int rotateThreshold = 3;
        private int banThreshold = 5;
        private List<Integer> consecutiveThresholds = new ArrayList<>(List.of(1, 3, 5, 10));
        private List<Double> rateThresholds = new ArrayList<>(List.of(0.1, 0.3, 0.5, 0.8));
        private List<Double> levelMultipliers = new ArrayList<>(List.of(1.0, 2.0, 3.0, 5.0, 10.0));
        private double searchMultiplier = 1.5;
        private double retryMultiplier = 2.0;
        private double detailMultiplier = 1.2;
        private double jitterMin = 0.8;
        private double jitterMax = 1.5;
        private long fastResponseMillis = 100;
        private int fastResponseMaxBodyChars = 1000;
        private long slowResponseMillis = 30000;
        private int bodyScanMaxChars = 20000;
        private int rateWindowSize = 20;
        private int rateMinSamples = 5;

        public long getBaseDelayMillis() {
            return Math.max(0, baseDelayMillis);
        }

        public void setBaseDelayMillis(long baseDelayMillis) {
            this.baseDelayMillis = baseDelayMillis;
        }

        public long getMaxDelayMillis() {
            return Math.max(0, maxDelayMillis);
        }

        public void setMaxDelayMillis(long maxDelayMillis) {
            this.maxDelayMillis = maxDelayMillis;
        }

        public int getRotateThreshold() {
            return Math.max(1, rotateThreshold);
        }

        public void setRotateThreshold(int rotateThreshold) {
            this.rotateThreshold = rotateThreshold;
        }

        public int getBanThreshold() {
            return Math.max(1, banThreshold);
        }

        public void setBanThreshold(int banThreshold) {
            this.banThreshold = banThreshold;
        }

        public List<Integer> getConsecutiveThresholds() {
            return consecutiveThresholds == null ? List.of() : consecutiveThresholds;
        }

        public void setConsecutiveThresholds(List<Integer> consecutiveThresholds) {
            this.consecutiveThresholds = consecutiveThresholds;
        }

        public List<Double> getRateThresholds() {
            return rateThresholds == null ? List.of() : rateThresholds;
        }

        public void setRateThresholds(List<Double> rateThresholds) {
            this.rateThresholds = rateThresholds;
        }

        public List<Double> getLevelMultipliers() {
            return levelMultipliers == null ? List.of() : levelMultipliers;
        }

        public void setLevelMultipliers(List<Double> levelMultipliers) {
            this.levelMultipliers = levelMultipliers;
        }

        public double getSearchMultiplier() {
            return searchMultiplier;
        }

        public void setSearchMultiplier(double searchMultiplier) {
            this.searchMultiplier = searchMultiplier;
        }

        public double getRetryMultiplier() {
            return retryMultiplier;
        }

        public void setRetryMultiplier(double retryMultiplier) {
            this.retryMultiplier = retryMultiplier;
        }

        public double getDetailMultiplier() {
            return detailMultiplier;
        }

        public void setDetailMultiplier(double detailMultiplier) {
            this.detailMultiplier = detailMultiplier;
        }

        public double getJitterMin() {
            return jitterMin;
        }

        public void setJitterMin(double jitterMin) {
            this.jitterMin = jitterMin;
        }

        public double getJitterMax() {
            return jitterMax;
        }

        public void setJitterMax(double jitterMax) {
            this.jitterMax = jitterMax;
        }

        public long getFastResponseMillis() {
            return Math.max(0, fastResponseMillis);
        }

        public void setFastResponseMillis(long fastResponseMillis) {
            this.fastResponseMillis = fastResponseMillis;
        }

        public int getFastResponseMaxBodyChars() {
            return Math.max(0, fastResponseMaxBodyChars);
        }

        public void setFastResponseMaxBodyChars(int fastResponseMaxBodyChars) {
            this.fastResponseMaxBodyChars = fastResponseMaxBodyChars;
        }

        public long getSlowResponseMillis() {
            return Math.max(1, slowResponseMillis);
        }

        public void setSlowResponseMillis(long slowResponseMillis) {
            this.slowResponseMillis = slowResponseMillis;
        }

        public int getBodyScanMaxChars() {
            return Math.max(0, bodyScanMaxChars);
        }

        public void setBodyScanMaxChars(int bodyScanMaxChars) {
            this.bodyScanMaxChars = bodyScanMaxChars;
        }

        public int getRateWindowSize() {
            return Math.max(1, rateWindowSize);
        }

        public void setRateWindowSize(int rateWindowSize) {
            this.rateWindowSize = rateWindowSize;
        }

        public int getRateMinSamples() {
            return Math.max(1, rateMinSamples);
        }

        public void setRateMinSamples(int rateMinSamples) {
            this.rateMinSamples = rateMinSamples;
        }
    }

    public static class Strategies {
        private List<String> priority = new ArrayList<>(StrategyIds.ALL);
        private List<String> disabled = new ArrayList<>();
        private boolean escalateOnBan = true;
        private StructuredApi structuredApi = new StructuredApi();
        private DirectUrl directUrl = new DirectUrl();
        private SearchEngine searchEngine = new SearchEngine();
        private Browser browser = new Browser();

        public List<String> getPriority() {
            return priority == null ? List.of() : priority;
        }

        public void setPriority(List<String> priority) {
            this.priority = priority;
        }

        public List<String> getDisabled() {
            return disabled == null ? List.of() : disabled;
        }

        public void setDisabled(List<String> disabled) {
            this.disabled = disabled;
        }

        public boolean isEnabled(String strategyId) {
            return !getDisabled().contains(strategyId);
        }

        public boolean isEscalateOnBan() {
            return escalateOnBan;
        }

        public void setEscalateOnBan(boolean escalateOnBan) {
            this.escalateOnBan = escalateOnBan;
        }

        public StructuredApi getStructuredApi() {
            return structuredApi;
        }

        public void setStructuredApi(StructuredApi structuredApi) {
            this.structuredApi = structuredApi;
        }

        public DirectUrl getDirectUrl() {
            return directUrl;
        }

        public void setDirectUrl(DirectUrl directUrl) {
            this.directUrl = directUrl;
        }

        public SearchEngine getSearchEngine() {
            return searchEngine;
        }

        public void setSearchEngine(SearchEngine searchEngine) {
            this.searchEngine = searchEngine;
        }

        public Browser getBrowser() {
            return browser;
        }

        public void setBrowser(Browser browser) {
            this.browser = browser;
        }
    }

    public static class StructuredApi {
        private String baseUrl = "https://flk.npc.gov.cn";
        private String searchPath = "/api/search";
        private String detailPath = "/api/detail";
        private int pageSize = 20;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getSearchPath() {
            return searchPath;
        }

        public void setSearchPath(String searchPath) {
            this.searchPath = searchPath;
        }

        public String getDetailPath() {
            return detailPath;
        }

        public void setDetailPath(String detailPath) {
            this.detailPath = detailPath;
        }

        public int getPageSize() {
            return Math.max(1, pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }
    }

    public static class DirectUrl {
        private Map<String, String> known = new LinkedHashMap<>();

        public Map<String, String> getKnown() {
            return known == null ? Map.of() : known;
        }

        public void setKnown(Map<String, String> known) {
            this.known = known;
        }
    }

    public static class SearchEngine {
        private List<Engine> engines = new ArrayList<>(List.of(
            new Engine("bing", "https://www.bing.com/search?q={query}", "bing"),
            new Engine("duckduckgo", "https://html.duckduckgo.com/html/?q={query}", "duckduckgo")
        ));
        private List<String> siteFilters = new ArrayList<>(List.of("flk.npc.gov.cn", "gov.cn"));
        private int maxResults = 10;

        public List<Engine> getEngines() {
            return engines == null ? List.of() : engines;
        }

        public void setEngines(List<Engine> engines) {
            this.engines = engines;
        }

        public List<String> getSiteFilters() {
            return siteFilters == null ? List.of() : siteFilters;
        }

        public void setSiteFilters(List<String> siteFilters) {
            this.siteFilters = siteFilters;
        }

        public int getMaxResults() {
            return Math.max(1, maxResults);
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = maxResults;
        }
    }

    public static class Engine {
        private String name;
        private String urlTemplate;
        private String layout;

        public Engine() {
        }

        public Engine(String name, String urlTemplate, String layout) {
            this.name = name;
            this.urlTemplate = urlTemplate;
            this.layout = layout;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getUrlTemplate() {
            return urlTemplate;
        }

        public void setUrlTemplate(String urlTemplate) {
            this.urlTemplate = urlTemplate;
        }

        public String getLayout() {
            return layout;
        }

        public void setLayout(String layout) {
            this.layout = layout;
        }
    }

    public static class Browser {
        private boolean headless = true;
        private String searchUrl = "https://www.bing.com/search?q={query}";
        private String resultSelector = "li.b_algo h2 a";
        private String siteFilter = "flk.npc.gov.cn";
        private int restartAfterUses = 10;
        private int navigationTimeoutSeconds = 15;
        private int maxResults = 10;

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public String getSearchUrl() {
            return searchUrl;
        }

        public void setSearchUrl(String searchUrl) {
            this.searchUrl = searchUrl;
        }

        public String getResultSelector() {
            return resultSelector;
        }

        public void setResultSelector(String resultSelector) {
            this.resultSelector = resultSelector;
        }

        public String getSiteFilter() {
            return siteFilter;
        }

        public void setSiteFilter(String siteFilter) {
            this.siteFilter = siteFilter;
        }

        public int getRestartAfterUses() {
            return Math.max(1, restartAfterUses);
        }

        public void setRestartAfterUses(int restartAfterUses) {
            this.restartAfterUses = restartAfterUses;
        }

        public int getNavigationTimeoutSeconds() {
            return Math.max(1, navigationTimeoutSeconds);
        }

        public void setNavigationTimeoutSeconds(int navigationTimeoutSeconds) {
            this.navigationTimeoutSeconds = navigationTimeoutSeconds;
        }

        public int getMaxResults() {
            return Math.max(1, maxResults);
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = maxResults;
        }
    }

    public static class Batch {
        private int concurrencyLimit = 5;
        private int maxConcurrencyLimit = 16;

        public int getConcurrencyLimit() {
            return Math.min(Math.max(1, concurrencyLimit), getMaxConcurrencyLimit());
        }

        public void setConcurrencyLimit(int concurrencyLimit) {
            this.concurrencyLimit = concurrencyLimit;
        }

        public int getMaxConcurrencyLimit() {
            return Math.max(1, maxConcurrencyLimit);
        }

        public void setMaxConcurrencyLimit(int maxConcurrencyLimit) {
            this.maxConcurrencyLimit = maxConcurrencyLimit;
        }

        public int effectiveLimit(Integer requested) {
            if (requested == null || requested < 1) {
                return getConcurrencyLimit();
            }
            return Math.min(requested, getMaxConcurrencyLimit());
        }
    }

    public static class Timeouts {
        private int requestSeconds = 10;
        private int perTargetSeconds = 60;

        public int getRequestSeconds() {
            return Math.max(1, requestSeconds);
        }

        public void setRequestSeconds(int requestSeconds) {
            this.requestSeconds = requestSeconds;
        }

        public int getPerTargetSeconds() {
            return Math.max(1, perTargetSeconds);
        }

        public void setPerTargetSeconds(int perTargetSeconds) {
            this.perTargetSeconds = perTargetSeconds;
        }
    }

    public static class Http {
        private int maxAttempts = 3;
        private boolean paceRequests = true;
        private String acceptLanguage = "zh-CN,zh;q=0.9,en;q=0.8";
        private List<String> userAgents = new ArrayList<>(List.of(DEFAULT_USER_AGENT));

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public boolean isPaceRequests() {
            return paceRequests;
        }

        public void setPaceRequests(boolean paceRequests) {
            this.paceRequests = paceRequests;
        }

        public String getAcceptLanguage() {
            return acceptLanguage;
        }

        public void setAcceptLanguage(String acceptLanguage) {
            this.acceptLanguage = acceptLanguage;
        }

        public List<String> getUserAgents() {
            if (userAgents == null || userAgents.isEmpty()) {
                return List.of(DEFAULT_USER_AGENT);
            }
            return userAgents;
        }

        public void setUserAgents(List<String> userAgents) {
            this.userAgents = userAgents;
        }
    }

    public static class Cli {
        private boolean run = false;
        private String names = "";
        private String targetsCsv = "";
        private Integer concurrencyLimit;
        private boolean exitAfterRun = false;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getNames() {
            return names == null ? "" : names;
        }

        public void setNames(String names) {
            this.names = names;
        }

        public String getTargetsCsv() {
            return targetsCsv == null ? "" : targetsCsv;
        }

        public void setTargetsCsv(String targetsCsv) {
            this.targetsCsv = targetsCsv;
        }

        public Integer getConcurrencyLimit() {
            return concurrencyLimit;
        }

        public void setConcurrencyLimit(Integer concurrencyLimit) {
            this.concurrencyLimit = concurrencyLimit;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    public static class Persistence {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
