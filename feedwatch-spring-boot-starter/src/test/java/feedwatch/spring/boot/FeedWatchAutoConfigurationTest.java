package feedwatch.spring.boot;

import feedwatch.DeliveryResult;
import feedwatch.Destination;
import feedwatch.Item;
import feedwatch.Source;
import feedwatch.breaker.CircuitBreaker;
import feedwatch.dedup.DuplicateDetector;
import feedwatch.fetch.FetchStrategyChain;
import feedwatch.http.HttpFetcher;
import feedwatch.http.JdkHttpFetcher;
import feedwatch.jdbc.ConnectionProvider;
import feedwatch.jdbc.DataSourceConnectionProvider;
import feedwatch.jdbc.JdbcHistoryRepository;
import feedwatch.jdbc.JdbcSourceRegistry;
import feedwatch.jdbc.TableNames;
import feedwatch.jdbc.store.H2HistoryStore;
import feedwatch.monitor.CheckOutcome;
import feedwatch.monitor.FeedMonitor;
import feedwatch.retry.RetrySpec;
import feedwatch.spi.Deliverer;
import feedwatch.spi.FetchStrategy;
import feedwatch.spi.HistoryStore;
import feedwatch.spi.SourceRegistry;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.DateTimeException;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class FeedWatchAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          FeedWatchAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:feedwatch_" + UUID.randomUUID().toString().replace("-", "")
              + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:schema.sql",
          "feedwatch.auto-start=false");

  @Test
  void createsAllBeans() {
    runner.withUserConfiguration(DelivererConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("feedTableNames"));
      assertTrue(ctx.containsBean("feedConnectionProvider"));
      assertTrue(ctx.containsBean("sourceRegistry"));
      assertTrue(ctx.containsBean("historyStore"));
      assertTrue(ctx.containsBean("httpFetcher"));
      assertTrue(ctx.containsBean("feedCircuitBreaker"));
      assertTrue(ctx.containsBean("duplicateDetector"));
      assertTrue(ctx.containsBean("feedMonitor"));

      assertEquals(TableNames.DEFAULT, ctx.getBean(TableNames.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(JdbcSourceRegistry.class, ctx.getBean(SourceRegistry.class));
      assertInstanceOf(JdbcHistoryRepository.class, ctx.getBean(HistoryStore.class));
      assertInstanceOf(H2HistoryStore.class, ctx.getBean(JdbcHistoryRepository.class).store());
      assertInstanceOf(JdkHttpFetcher.class, ctx.getBean(HttpFetcher.class));
      assertNotNull(ctx.getBean(DuplicateDetector.class));
      assertFalse(ctx.getBean(FeedMonitor.class).isRunning());
    });
  }

  @Test
  void monitorUsesConfiguredDatabase() {
    runner.withUserConfiguration(DelivererConfig.class).run(ctx -> {
      var status = ctx.getBean(FeedMonitor.class).getStatus();
      assertEquals(1, status.sourcesMonitored());
      assertEquals("alice", status.sources().get(0).handle());
      assertEquals(5, status.checkIntervalMinutes());
      assertFalse(status.activeHours().configured());
    });
  }

  @Test
  void fetchStrategyBeansReplaceBuiltInStrategies() {
    runner
        .withPropertyValues("feedwatch.fetch.strategy-delay=0ms")
        .withUserConfiguration(DelivererConfig.class, StubStrategyConfig.class).run(ctx -> {
          var monitor = ctx.getBean(FeedMonitor.class);
          var deliverer = ctx.getBean(RecordingDeliverer.class);

          assertEquals(CheckOutcome.DELIVERED, monitor.forceCheck("alice"));
          assertEquals(List.of("C1new"), deliverer.delivered);
          assertTrue(ctx.getBean(HistoryStore.class).hasBeenNotified(1L, "C1new"));
          assertEquals("C1new",
              ctx.getBean(SourceRegistry.class).findByHandle("alice").orElseThrow().lastItemId());
          assertEquals(1, monitor.getStatus().metrics().deliveriesSent());
        });
  }

  @Test
  void userChainReplacesDefaultChain() {
    runner.withUserConfiguration(DelivererConfig.class, ChainConfig.class).run(ctx -> {
      var monitor = ctx.getBean(FeedMonitor.class);
      assertEquals(CheckOutcome.FETCH_FAILED, monitor.forceCheck("alice"));
      assertEquals(1, ctx.getBean(CountingStrategy.class).calls);
    });
  }

  @Test
  void customTablePrefix() {
    runner
        .withPropertyValues("feedwatch.table-prefix=ig_")
        .withUserConfiguration(DelivererConfig.class).run(ctx -> {
          var tables = ctx.getBean(TableNames.class);
          assertEquals("ig_source", tables.source());
          assertEquals("ig_history", tables.history());
          assertEquals("ig_history", ctx.getBean(JdbcHistoryRepository.class).store().tableName());
        });
  }

  @Test
  void circuitBreakerProperties() {
    runner
        .withPropertyValues(
            "feedwatch.circuit-breaker.failure-threshold=1",
            "feedwatch.circuit-breaker.reset-timeout=1h")
        .withUserConfiguration(DelivererConfig.class).run(ctx -> {
          var breaker = ctx.getBean(CircuitBreaker.class);
          breaker.recordFailure("alice");
          assertTrue(breaker.isOpen("alice"));
          assertSame(breaker, ctx.getBean(FeedMonitor.class).circuitBreaker());
        });
  }

  @Test
  void unknownStrategyNameFailsStartup() {
    runner
        .withPropertyValues("feedwatch.fetch.strategies=profile-api,carrier-pigeon")
        .withUserConfiguration(DelivererConfig.class).run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void activeHoursRequireBothBounds() {
    runner
        .withPropertyValues("feedwatch.active-hours.start-hour=8")
        .withUserConfiguration(DelivererConfig.class).run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalStateException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void activeHoursRejectOutOfRangeHour() {
    runner
        .withPropertyValues(
            "feedwatch.active-hours.start-hour=25",
            "feedwatch.active-hours.end-hour=6")
        .withUserConfiguration(DelivererConfig.class).run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertNotNull(findCause(ctx.getStartupFailure(), IllegalStateException.class));
        });
  }

  @Test
  void activeHoursRejectUnknownZone() {
    runner
        .withPropertyValues(
            "feedwatch.active-hours.start-hour=8",
            "feedwatch.active-hours.end-hour=22",
            "feedwatch.active-hours.zone=Mars/Olympus")
        .withUserConfiguration(DelivererConfig.class).run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertNotNull(findCause(ctx.getStartupFailure(), IllegalStateException.class));
        });
  }

  @Test
  void activeHoursValidationFailsAsIllegalState() {
    FeedWatchProperties.ActiveHours props = new FeedWatchProperties.ActiveHours();
    props.setStartHour(8);
    props.setEndHour(24);
    assertThrows(IllegalStateException.class, () -> FeedWatchAutoConfiguration.activeHours(props));

    props.setEndHour(22);
    props.setZone("Not/AZone");
    IllegalStateException e = assertThrows(IllegalStateException.class,
        () -> FeedWatchAutoConfiguration.activeHours(props));
    assertInstanceOf(DateTimeException.class, e.getCause());
  }

  @Test
  void activeHoursConfigured() {
    runner
        .withPropertyValues(
            "feedwatch.active-hours.start-hour=8",
            "feedwatch.active-hours.end-hour=22",
            "feedwatch.active-hours.zone=Europe/Paris")
        .withUserConfiguration(DelivererConfig.class).run(ctx -> {
          var activeHours = ctx.getBean(FeedMonitor.class).getStatus().activeHours();
          assertTrue(activeHours.configured());
          assertEquals(Integer.valueOf(8), activeHours.startHour());
          assertEquals(Integer.valueOf(22), activeHours.endHour());
          assertEquals("Europe/Paris", activeHours.zone());
        });
  }

  @Test
  void autoStartSchedulesCycles() {
    runner
        .withPropertyValues(
            "feedwatch.auto-start=true",
            "feedwatch.source-delay-min=0ms",
            "feedwatch.source-delay-max=0ms",
            "feedwatch.fetch.strategy-delay=0ms")
        .withUserConfiguration(DelivererConfig.class, StubStrategyConfig.class).run(ctx -> {
          assertTrue(ctx.getBean(FeedMonitor.class).isRunning());
        });
  }

  @Test
  void backsOffWhenCustomBeansPresent() {
    runner.withUserConfiguration(DelivererConfig.class, CustomBeansConfig.class).run(ctx -> {
      assertSame(CustomBeansConfig.BREAKER, ctx.getBean(CircuitBreaker.class));
      assertFalse(ctx.containsBean("feedCircuitBreaker"));
      assertFalse(ctx.containsBean("httpFetcher"));
      assertSame(CustomBeansConfig.BREAKER, ctx.getBean(FeedMonitor.class).circuitBreaker());
    });
  }

  @Test
  void notLoadedWithoutDeliverer() {
    runner.run(ctx -> {
      assertFalse(ctx.containsBean("feedMonitor"));
      assertFalse(ctx.containsBean("sourceRegistry"));
    });
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(FeedWatchAutoConfiguration.class))
        .withUserConfiguration(DelivererConfig.class)
        .run(ctx -> assertFalse(ctx.containsBean("feedMonitor")));
  }

  private static <T extends Throwable> T findCause(Throwable t, Class<T> type) {
    while (t != null) {
      if (type.isInstance(t)) {
        return type.cast(t);
      }
      t = t.getCause() == t ? null : t.getCause();
    }
    return null;
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }

  static class RecordingDeliverer implements Deliverer {
    final List<String> delivered = new CopyOnWriteArrayList<>();

    @Override
    public List<DeliveryResult> deliver(Item item, Source source, List<Destination> destinations) {
      delivered.add(item.id());
      return destinations.stream().map(d -> DeliveryResult.delivered(d.id())).toList();
    }
  }

  static class CountingStrategy implements FetchStrategy {
    volatile int calls;

    @Override
    public String name() {
      return "counting";
    }

    @Override
    public List<Item> fetch(String handle) {
      calls++;
      throw new IllegalStateException("unavailable");
    }

    @Override
    public RetrySpec retrySpec() {
      return RetrySpec.NONE;
    }
  }

  @Configuration
  static class DelivererConfig {
    @Bean
    RecordingDeliverer deliverer() {
      return new RecordingDeliverer();
    }
  }

  @Configuration
  static class StubStrategyConfig {
    @Bean
    FetchStrategy stubStrategy() {
      return new FetchStrategy() {
        @Override
        public String name() {
          return "stub";
        }

        @Override
        public List<Item> fetch(String handle) {
          return List.of(Item.builder("C1new").url("https://www.instagram.com/p/C1new/").build());
        }
      };
    }
  }

  @Configuration
  static class ChainConfig {
    @Bean
    CountingStrategy countingStrategy() {
      return new CountingStrategy();
    }

    @Bean
    FetchStrategyChain fetchStrategyChain(CountingStrategy strategy) {
      return FetchStrategyChain.builder().strategy(strategy).strategyDelay(Duration.ZERO).build();
    }
  }

  @Configuration
  static class CustomBeansConfig {
    static final CircuitBreaker BREAKER = CircuitBreaker.builder().failureThreshold(2).build();

    @Bean
    CircuitBreaker customBreaker() {
      return BREAKER;
    }

    @Bean
    HttpFetcher customHttpFetcher() {
      return (uri, headers) -> "";
    }
  }
}
