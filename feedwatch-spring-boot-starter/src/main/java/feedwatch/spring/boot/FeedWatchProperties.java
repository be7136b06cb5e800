package feedwatch.spring.boot;

import feedwatch.dedup.DuplicateDetector;
import feedwatch.http.JdkHttpFetcher;
import feedwatch.jdbc.TableNames;
import feedwatch.strategy.FeedBridgeStrategy;
import feedwatch.strategy.FeedMirrorStrategy;
import feedwatch.strategy.FetchStrategies;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the feed monitor.
 *
 * @see FeedWatchAutoConfiguration
 */
@ConfigurationProperties(prefix = "feedwatch")
public class FeedWatchProperties {

    /**
     * Period between cycle starts.
     */
    private Duration checkInterval = Duration.ofMinutes(5);

    /**
     * Maximum number of sources checked at the same time.
     */
    private int concurrency = 5;

    /**
     * Lower bound of the random pause after each source.
     */
    private Duration sourceDelayMin = Duration.ofMillis(2000);

    /**
     * Upper bound of the random pause after each source.
     */
    private Duration sourceDelayMax = Duration.ofMillis(3000);

    /**
     * How long notification history is kept.
     */
    private Duration historyRetention = Duration.ofDays(30);

    /**
     * Prefix of the source, destination and history table names.
     */
    private String tablePrefix = TableNames.DEFAULT_PREFIX;

    /**
     * Start the schedule as soon as the monitor bean is created.
     */
    private boolean autoStart = true;

    private final ActiveHours activeHours = new ActiveHours();
    private final CircuitBreakerProps circuitBreaker = new CircuitBreakerProps();
    private final Fetch fetch = new Fetch();
    private final Dedup dedup = new Dedup();
    private final Metrics metrics = new Metrics();

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public Duration getSourceDelayMin() {
        return sourceDelayMin;
    }

    public void setSourceDelayMin(Duration sourceDelayMin) {
        this.sourceDelayMin = sourceDelayMin;
    }

    public Duration getSourceDelayMax() {
        return sourceDelayMax;
    }

    public void setSourceDelayMax(Duration sourceDelayMax) {
        this.sourceDelayMax = sourceDelayMax;
    }

    public Duration getHistoryRetention() {
        return historyRetention;
    }

    public void setHistoryRetention(Duration historyRetention) {
        this.historyRetention = historyRetention;
    }

    public String getTablePrefix() {
        return tablePrefix;
    }

    public void setTablePrefix(String tablePrefix) {
        this.tablePrefix = tablePrefix;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public ActiveHours getActiveHours() {
        return activeHours;
    }

    public CircuitBreakerProps getCircuitBreaker() {
        return circuitBreaker;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public Dedup getDedup() {
        return dedup;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Daily window of hours in which cycles run. Unset means always active.
     */
    public static class ActiveHours {
        private Integer startHour;
        private Integer endHour;
        private String zone;

        public Integer getStartHour() {
            return startHour;
        }

        public void setStartHour(Integer startHour) {
            this.startHour = startHour;
        }

        public Integer getEndHour() {
            return endHour;
        }

        public void setEndHour(Integer endHour) {
            this.endHour = endHour;
        }

        /**
         * Time zone id, defaults to the system zone.
         */
        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }

    public static class CircuitBreakerProps {
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofMinutes(30);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getResetTimeout() {
            return resetTimeout;
        }

        public void setResetTimeout(Duration resetTimeout) {
            this.resetTimeout = resetTimeout;
        }
    }

    public static class Fetch {
        private List<String> strategies = new ArrayList<>(FetchStrategies.DEFAULT_ORDER);
        private Duration strategyDelay = Duration.ofMillis(500);
        private boolean firstSuccess = false;
        private Duration httpTimeout = JdkHttpFetcher.DEFAULT_REQUEST_TIMEOUT;
        private Duration connectTimeout = JdkHttpFetcher.DEFAULT_CONNECT_TIMEOUT;
        private String rssBridgeUrl = FeedBridgeStrategy.DEFAULT_BRIDGE_URL;
        private List<String> feedMirrors = new ArrayList<>(FeedMirrorStrategy.DEFAULT_MIRRORS);

        public List<String> getStrategies() {
            return strategies;
        }

        public void setStrategies(List<String> strategies) {
            this.strategies = strategies;
        }

        public Duration getStrategyDelay() {
            return strategyDelay;
        }

        public void setStrategyDelay(Duration strategyDelay) {
            this.strategyDelay = strategyDelay;
        }

        public boolean isFirstSuccess() {
            return firstSuccess;
        }

        public void setFirstSuccess(boolean firstSuccess) {
            this.firstSuccess = firstSuccess;
        }

        public Duration getHttpTimeout() {
            return httpTimeout;
        }

        public void setHttpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public String getRssBridgeUrl() {
            return rssBridgeUrl;
        }

        public void setRssBridgeUrl(String rssBridgeUrl) {
            this.rssBridgeUrl = rssBridgeUrl;
        }

        public List<String> getFeedMirrors() {
            return feedMirrors;
        }

        public void setFeedMirrors(List<String> feedMirrors) {
            this.feedMirrors = feedMirrors;
        }
    }

    public static class Dedup {
        private int messageScanLimit = DuplicateDetector.DEFAULT_SCAN_LIMIT;

        public int getMessageScanLimit() {
            return messageScanLimit;
        }

        public void setMessageScanLimit(int messageScanLimit) {
            this.messageScanLimit = messageScanLimit;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "feedwatch";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
