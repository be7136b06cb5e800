package feedwatch.spring.boot;

import feedwatch.breaker.CircuitBreaker;
import feedwatch.dedup.DuplicateDetector;
import feedwatch.dedup.ItemIdExtractor;
import feedwatch.fetch.FetchStrategyChain;
import feedwatch.http.HttpFetcher;
import feedwatch.http.JdkHttpFetcher;
import feedwatch.jdbc.ConnectionProvider;
import feedwatch.jdbc.DataSourceConnectionProvider;
import feedwatch.jdbc.JdbcHistoryRepository;
import feedwatch.jdbc.JdbcSourceRegistry;
import feedwatch.jdbc.TableNames;
import feedwatch.jdbc.store.JdbcHistoryStores;
import feedwatch.monitor.ActiveHours;
import feedwatch.monitor.FeedMonitor;
import feedwatch.spi.Deliverer;
import feedwatch.spi.FetchStrategy;
import feedwatch.spi.HistoryStore;
import feedwatch.spi.MetricsExporter;
import feedwatch.spi.RecentMessageScanner;
import feedwatch.spi.SourceRegistry;
import feedwatch.status.CompositeMetricsExporter;
import feedwatch.status.InMemoryMetrics;
import feedwatch.strategy.FetchStrategies;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;

/**
 * Auto-configuration for the feed monitor.
 *
 * <p>Wires a {@link FeedMonitor} from a {@link DataSource}, an application supplied
 * {@link Deliverer} and {@link FeedWatchProperties}. Source, destination and history tables
 * must already exist; see {@code feedwatch.jdbc} for the DDL.
 *
 * <p>Every collaborator backs off when the application defines its own bean. {@link FetchStrategy}
 * beans replace the built-in strategies, in bean order; a {@link FetchStrategyChain} bean replaces
 * the whole chain.
 *
 * @see FeedWatchProperties
 * @see FeedWatchMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(FeedMonitor.class)
@ConditionalOnBean({DataSource.class, Deliverer.class})
@EnableConfigurationProperties(FeedWatchProperties.class)
public class FeedWatchAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public TableNames feedTableNames(FeedWatchProperties props) {
    return TableNames.withPrefix(props.getTablePrefix());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider feedConnectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(SourceRegistry.class)
  public JdbcSourceRegistry sourceRegistry(ConnectionProvider connectionProvider, TableNames tables) {
    return new JdbcSourceRegistry(connectionProvider, tables, Clock.systemUTC());
  }

  @Bean
  @ConditionalOnMissingBean(HistoryStore.class)
  public JdbcHistoryRepository historyStore(DataSource dataSource,
      ConnectionProvider connectionProvider, TableNames tables) {
    return new JdbcHistoryRepository(connectionProvider,
        JdbcHistoryStores.detect(dataSource).withTableName(tables.history()));
  }

  @Bean
  @ConditionalOnMissingBean(HttpFetcher.class)
  public JdkHttpFetcher httpFetcher(FeedWatchProperties props) {
    return JdkHttpFetcher.builder()
        .requestTimeout(props.getFetch().getHttpTimeout())
        .connectTimeout(props.getFetch().getConnectTimeout())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public CircuitBreaker feedCircuitBreaker(FeedWatchProperties props) {
    return CircuitBreaker.builder()
        .failureThreshold(props.getCircuitBreaker().getFailureThreshold())
        .resetTimeout(props.getCircuitBreaker().getResetTimeout())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public DuplicateDetector duplicateDetector(FeedWatchProperties props,
      HistoryStore historyStore,
      SourceRegistry sourceRegistry,
      ObjectProvider<RecentMessageScanner> scannerProvider) {
    return new DuplicateDetector(historyStore, sourceRegistry, scannerProvider.getIfAvailable(),
        ItemIdExtractor.DEFAULT, props.getDedup().getMessageScanLimit());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public FeedMonitor feedMonitor(FeedWatchProperties props,
      SourceRegistry sourceRegistry,
      HistoryStore historyStore,
      Deliverer deliverer,
      HttpFetcher httpFetcher,
      CircuitBreaker circuitBreaker,
      DuplicateDetector duplicateDetector,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<FetchStrategy> strategyProvider,
      ObjectProvider<FetchStrategyChain> chainProvider) {

    ActiveHours activeHours = activeHours(props.getActiveHours());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    InMemoryMetrics inMemoryMetrics = new InMemoryMetrics();

    FetchStrategyChain chain = chainProvider.getIfAvailable();
    if (chain == null) {
      List<FetchStrategy> strategies = strategyProvider.orderedStream().toList();
      if (strategies.isEmpty()) {
        FeedWatchProperties.Fetch fetch = props.getFetch();
        strategies = FetchStrategies.create(fetch.getStrategies(), httpFetcher,
            fetch.getRssBridgeUrl(), fetch.getFeedMirrors());
      }
      chain = FetchStrategyChain.builder()
          .strategies(strategies)
          .strategyDelay(props.getFetch().getStrategyDelay())
          .firstSuccess(props.getFetch().isFirstSuccess())
          .metrics(metrics != null ? CompositeMetricsExporter.of(inMemoryMetrics, metrics) : inMemoryMetrics)
          .build();
    }

    FeedMonitor monitor = FeedMonitor.builder()
        .sourceRegistry(sourceRegistry)
        .historyStore(historyStore)
        .deliverer(deliverer)
        .fetchChain(chain)
        .circuitBreaker(circuitBreaker)
        .duplicateDetector(duplicateDetector)
        .inMemoryMetrics(inMemoryMetrics)
        .metrics(metrics)
        .checkInterval(props.getCheckInterval())
        .concurrency(props.getConcurrency())
        .sourceDelay(props.getSourceDelayMin(), props.getSourceDelayMax())
        .historyRetention(props.getHistoryRetention())
        .activeHours(activeHours)
        .build();
    if (props.isAutoStart()) {
      monitor.start();
    }
    return monitor;
  }

  static ActiveHours activeHours(FeedWatchProperties.ActiveHours props) {
    Integer start = props.getStartHour();
    Integer end = props.getEndHour();
    if (start == null && end == null) {
      return null;
    }
    if (start == null || end == null) {
      throw new IllegalStateException(
          "feedwatch.active-hours.start-hour and end-hour must be set together");
    }
    try {
      ZoneId zone = props.getZone() == null ? ZoneId.systemDefault() : ZoneId.of(props.getZone());
      return new ActiveHours(start, end, zone);
    } catch (IllegalArgumentException | DateTimeException e) {
      throw new IllegalStateException("Invalid feedwatch.active-hours: " + e.getMessage(), e);
    }
  }
}
