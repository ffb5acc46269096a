package com.shardql.engine;

import com.shardql.model.FetchResult;
import com.shardql.model.FetchUnit;
import com.shardql.query.QueryBuilder;
import com.shardql.query.QueryRequest;
import com.shardql.support.StubQueryExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.shardql.support.StubQueryExecutor.row;
import static org.assertj.core.api.Assertions.assertThat;

class FetchDispatcherTest {
    private ExecutorService workers;
    private StubQueryExecutor warehouse;
    private FetchDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        workers = Executors.newFixedThreadPool(8);
        QueryBuilder queryBuilder = new QueryBuilder(null, '"');
        warehouse = new StubQueryExecutor(queryBuilder);
        dispatcher = new FetchDispatcher(warehouse, queryBuilder, new BoundedTaskRunner(workers), 15);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void everyUnitIsDeliveredExactlyOnceAndFailuresStayIsolated() {
        warehouse.rows("ds1", "plays", List.of(row("track", "a")))
                .failRows("ds1", "likes", "quota exceeded")
                .rows("ds2", "plays", List.of(row("track", "b"), row("track", "c")));
        List<FetchUnit> units = List.of(unit("ds1", "plays"), unit("ds1", "likes"), unit("ds2", "plays"), unit("ds2", "missing"));
        List<FetchResult> results = new ArrayList<>();

        dispatcher.dispatch(units, 2, results::add);

        assertThat(results).extracting(FetchResult::getUnit).containsExactlyInAnyOrderElementsOf(units);
        Map<String, FetchResult> byUnit = results.stream()
                .collect(Collectors.toMap(r -> r.getUnit().describe(), Function.identity()));
        assertThat(byUnit.get("ds1.plays").getOutcome().getRows()).hasSize(1);
        assertThat(byUnit.get("ds2.plays").getOutcome().getRows()).extracting(r -> r.get("track")).containsExactly("b", "c");
        assertThat(byUnit.get("ds1.likes").getOutcome().getReason()).isEqualTo("quota exceeded");
        assertThat(byUnit.get("ds2.missing").getOutcome().isSuccess()).isFalse();
        assertThat(byUnit.get("ds2.missing").getOutcome().getReason()).startsWith("relation does not exist");
    }

    @Test
    void passesRowLimitCacheHintAndTimeoutToExecutor() {
        warehouse.rows("ds1", "plays", List.of(row("n", 1), row("n", 2), row("n", 3)));
        FetchUnit unit = FetchUnit.builder().dataset("ds1").table("plays").rowLimit(2).useCache(true).build();
        List<FetchResult> results = new ArrayList<>();

        dispatcher.dispatch(List.of(unit), 1, results::add);

        QueryRequest request = warehouse.getRequests().get(0);
        assertThat(request.getSql()).isEqualTo("SELECT * FROM \"ds1\".\"plays\" LIMIT 2");
        assertThat(request.getMaxRows()).isEqualTo(2);
        assertThat(request.isUseCache()).isTrue();
        assertThat(request.getTimeoutSeconds()).isEqualTo(15);
        assertThat(results.get(0).getOutcome().getRows()).hasSize(2);
    }

    @Test
    void boundsFetchesInFlight() {
        warehouse.delay(20);
        List<FetchUnit> units = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            warehouse.rows("ds", "t" + i, List.of(row("i", i)));
            units.add(unit("ds", "t" + i));
        }
        List<FetchResult> results = new ArrayList<>();

        dispatcher.dispatch(units, 3, results::add);

        assertThat(results).hasSize(10).allSatisfy(r -> assertThat(r.getOutcome().isSuccess()).isTrue());
        assertThat(warehouse.getMaxInFlight()).isLessThanOrEqualTo(3);
    }

    @Test
    void invalidIdentifierBecomesFailureWithoutQuery() {
        FetchUnit unit = unit("ds1", "plays; drop");

        FetchResult result = dispatcher.fetch(unit);

        assertThat(result.getOutcome().isSuccess()).isFalse();
        assertThat(result.getOutcome().getReason()).contains("Invalid table identifier");
        assertThat(warehouse.getRequests()).isEmpty();
    }

    private static FetchUnit unit(String dataset, String table) {
        return FetchUnit.builder().dataset(dataset).table(table).rowLimit(10000).build();
    }
}
