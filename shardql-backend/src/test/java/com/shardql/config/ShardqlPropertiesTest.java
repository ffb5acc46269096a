package com.shardql.config;

import com.shardql.model.EmissionMode;
import com.shardql.model.GroupBy;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ShardqlPropertiesTest {

    @Test
    void defaults() {
        ShardqlProperties properties = new ShardqlProperties();

        assertThat(properties.getEndpoints().getAllTables().getConcurrency()).isEqualTo(10);
        assertThat(properties.getEndpoints().getSingleTable().getConcurrency()).isEqualTo(4);
        assertThat(properties.getEndpoints().getAllTables().getRowLimit()).isEqualTo(10_000);
        assertThat(properties.getDiscovery().getConcurrency()).isEqualTo(2);
        assertThat(properties.getWarehouse().getIdentifierQuote()).isEqualTo("\"");
    }

    @Test
    void bindsKebabCaseKeysAndEnumValues() {
        MapConfigurationPropertySource source = new MapConfigurationPropertySource(Map.of(
                "shardql.datasets[0]", "keywords_ranking_data_sheet1",
                "shardql.datasets[1]", "keywords_ranking_data_sheet2",
                "shardql.dataset-key-prefix", "keywords_ranking_data_sheet",
                "shardql.endpoints.all-tables.group-by", "by-table",
                "shardql.endpoints.all-tables.emission", "streaming",
                "shardql.endpoints.all-tables.row-limit", "500",
                "shardql.endpoints.single-table.use-query-cache", "true",
                "shardql.warehouse.identifier-quote", "`"));

        ShardqlProperties properties = new Binder(source).bind("shardql", Bindable.of(ShardqlProperties.class)).get();

        assertThat(properties.getDatasets()).containsExactly("keywords_ranking_data_sheet1", "keywords_ranking_data_sheet2");
        assertThat(properties.getDatasetKeyPrefix()).isEqualTo("keywords_ranking_data_sheet");
        assertThat(properties.getEndpoints().getAllTables().getGroupBy()).isEqualTo(GroupBy.BY_TABLE);
        assertThat(properties.getEndpoints().getAllTables().getEmission()).isEqualTo(EmissionMode.STREAMING);
        assertThat(properties.getEndpoints().getAllTables().getRowLimit()).isEqualTo(500);
        assertThat(properties.getEndpoints().getAllTables().getConcurrency()).isEqualTo(10);
        assertThat(properties.getEndpoints().getSingleTable().isUseQueryCache()).isTrue();
        assertThat(properties.getWarehouse().getIdentifierQuote()).isEqualTo("`");
    }

    @Test
    void defaultsPassValidation() {
        ShardqlProperties properties = new ShardqlProperties();
        properties.setDatasets(List.of("ds1"));

        assertThat(validate(properties)).isEmpty();
        assertThat(properties.getCors().getAllowedOrigins()).containsExactly("*");
    }

    @Test
    void workerPoolLargerThanConnectionPoolIsRejected() {
        ShardqlProperties properties = new ShardqlProperties();
        properties.setDatasets(List.of("ds1"));
        properties.setWorkerPoolSize(16);
        properties.getWarehouse().setMaximumPoolSize(10);

        Set<ConstraintViolation<ShardqlProperties>> violations = validate(properties);

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactly("worker-pool-size must not exceed warehouse.maximum-pool-size");

        properties.getWarehouse().setMaximumPoolSize(16);
        assertThat(validate(properties)).isEmpty();
    }

    private static Set<ConstraintViolation<ShardqlProperties>> validate(ShardqlProperties properties) {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        try {
            Validator validator = factory.getValidator();
            return validator.validate(properties);
        } finally {
            factory.close();
        }
    }
}
