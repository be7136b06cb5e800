package feedwatch.fetch;

import feedwatch.Item;
import feedwatch.PermanentFetchException;
import feedwatch.ScriptedStrategy;
import feedwatch.TransientFetchException;
import feedwatch.retry.RetrySpec;
import feedwatch.status.InMemoryMetrics;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static feedwatch.Items.item;
import static org.junit.jupiter.api.Assertions.*;

class FetchStrategyChainTest {

    private static final Instant T1 = Instant.parse("2024-01-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-01-02T10:00:00Z");
    private static final Instant T3 = Instant.parse("2024-01-03T10:00:00Z");

    private final List<Duration> sleeps = new ArrayList<>();

    private FetchStrategyChain.Builder chain(ScriptedStrategy... strategies) {
        return FetchStrategyChain.builder()
                .strategies(List.of(strategies))
                .sleeper(sleeps::add);
    }

    @Test
    void poolsItemsSortedNewestFirst() {
        ScriptedStrategy a = ScriptedStrategy.returning("a", item("x1", T1));
        ScriptedStrategy b = ScriptedStrategy.returning("b", item("x3", T3), item("x2", T2));

        List<Item> items = chain(a, b).build().fetchLatestItems("user");

        assertEquals(List.of("x3", "x2", "x1"), items.stream().map(Item::id).toList());
    }

    @Test
    void undatedItemsSortLastInStableOrder() {
        ScriptedStrategy a = ScriptedStrategy.returning("a", item("n1"), item("d1", T1), item("n2"));

        List<Item> items = chain(a).build().fetchLatestItems("user");

        assertEquals(List.of("d1", "n1", "n2"), items.stream().map(Item::id).toList());
    }

    @Test
    void duplicateIdsAcrossStrategiesCollapseToFirstSeen() {
        Item fromA = Item.builder("same").url("https://example.com/p/same/").description("from a").publishedAt(T1).build();
        Item fromB = Item.builder("same").url("https://example.com/p/same/").description("from b").publishedAt(T1).build();

        List<Item> items = chain(
                new ScriptedStrategy("a", List.of(fromA)),
                new ScriptedStrategy("b", List.of(fromB))).build().fetchLatestItems("user");

        assertEquals(1, items.size());
        assertEquals("from a", items.get(0).description());
    }

    @Test
    void failingStrategiesAreSkipped() {
        ScriptedStrategy a = ScriptedStrategy.failing("a", new TransientFetchException("down"));
        ScriptedStrategy b = ScriptedStrategy.returning("b", item("x1", T1));

        FetchStrategyChain chain = chain(a, b).build();
        List<Item> items = chain.fetchLatestItems("user");

        assertEquals(1, items.size());
        assertEquals("b", chain.rememberedStrategy("user").orElseThrow());
    }

    @Test
    void rememberedStrategyIsTriedFirst() {
        List<String> order = new ArrayList<>();
        ScriptedStrategy a = new ScriptedStrategy("a", new PermanentFetchException("blocked"), List.of(item("x1", T1))) {
            @Override
            public synchronized List<Item> fetch(String handle) throws Exception {
                order.add("a");
                return super.fetch(handle);
            }
        };
        ScriptedStrategy b = new ScriptedStrategy("b", List.of(item("x1", T1))) {
            @Override
            public synchronized List<Item> fetch(String handle) throws Exception {
                order.add("b");
                return super.fetch(handle);
            }
        };
        FetchStrategyChain chain = chain(a, b).build();

        chain.fetchLatestItems("user");
        assertEquals(List.of("a", "b"), order);
        assertEquals("b", chain.rememberedStrategy("user").orElseThrow());

        order.clear();
        chain.fetchLatestItems("user");
        assertEquals(List.of("b", "a"), order);
        assertEquals(List.of("b", "a"), chain.attemptOrder("user").stream().map(s -> s.name()).toList());
        assertEquals(List.of("a", "b"), chain.attemptOrder("other").stream().map(s -> s.name()).toList());
    }

    @Test
    void firstSuccessStopsAtFirstNonEmptyStrategy() {
        ScriptedStrategy a = ScriptedStrategy.returning("a");
        ScriptedStrategy b = ScriptedStrategy.returning("b", item("x1", T1));
        ScriptedStrategy c = ScriptedStrategy.returning("c", item("x2", T2));

        List<Item> items = chain(a, b, c).firstSuccess(true).build().fetchLatestItems("user");

        assertEquals(List.of("x1"), items.stream().map(Item::id).toList());
        assertEquals(0, c.calls.get());
    }

    @Test
    void pausesBetweenStrategiesOnly() {
        chain(ScriptedStrategy.returning("a"), ScriptedStrategy.returning("b"), ScriptedStrategy.returning("c"))
                .strategyDelay(Duration.ofMillis(500))
                .build()
                .fetchLatestItems("user");

        assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(500)), sleeps);
    }

    @Test
    void eachStrategyIsRetriedWithItsOwnSpec() {
        RetrySpec threeQuick = RetrySpec.of(3, Duration.ZERO, Duration.ZERO);
        ScriptedStrategy flaky = new ScriptedStrategy("flaky", threeQuick,
                new TransientFetchException("1"), new TransientFetchException("2"), List.of(item("x1", T1)));

        List<Item> items = chain(flaky).strategyDelay(Duration.ZERO).build().fetchLatestItems("user");

        assertEquals(1, items.size());
        assertEquals(3, flaky.calls.get());
    }

    @Test
    void allFailingYieldsEmptyAndRequireThrowsWithSuppressedFailures() {
        TransientFetchException first = new TransientFetchException("first");
        PermanentFetchException second = new PermanentFetchException("second", 404);
        FetchStrategyChain chain = chain(
                ScriptedStrategy.failing("a", first),
                ScriptedStrategy.failing("b", second),
                ScriptedStrategy.returning("c")).build();

        assertTrue(chain.fetchLatestItems("user").isEmpty());
        assertTrue(chain.rememberedStrategy("user").isEmpty());

        AllStrategiesExhaustedException e = assertThrows(AllStrategiesExhaustedException.class,
                () -> chain.requireLatestItems("user"));
        assertEquals("user", e.handle());
        assertArrayEquals(new Throwable[]{first, second}, e.getSuppressed());
    }

    @Test
    void recordsFetchMetrics() {
        InMemoryMetrics metrics = new InMemoryMetrics();
        FetchStrategyChain chain = chain(
                ScriptedStrategy.failing("a", new TransientFetchException("down")),
                ScriptedStrategy.returning("b", item("x1", T1)))
                .metrics(metrics)
                .build();

        chain.fetchLatestItems("user");

        var snapshot = metrics.snapshot();
        assertEquals(1, snapshot.fetchAttempts());
        assertEquals(1, snapshot.fetchSuccesses());
        assertEquals(0, snapshot.fetchFailures());
        assertEquals(1L, snapshot.strategySuccesses().get("b"));
    }

    @Test
    void builderValidation() {
        assertThrows(IllegalArgumentException.class, () -> FetchStrategyChain.builder().build());
        assertThrows(IllegalArgumentException.class, () -> FetchStrategyChain.builder()
                .strategy(ScriptedStrategy.returning("a"))
                .strategy(ScriptedStrategy.returning("a"))
                .build());
        assertThrows(IllegalArgumentException.class, () -> FetchStrategyChain.builder()
                .strategy(ScriptedStrategy.returning("a"))
                .strategyDelay(Duration.ofMillis(-1))
                .build());
    }
}
