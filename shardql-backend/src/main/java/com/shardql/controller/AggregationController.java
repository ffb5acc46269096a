package com.shardql.controller;

import com.shardql.api.ApiEnvelope;
import com.shardql.model.AggregationPlan;
import com.shardql.model.EmissionMode;
import com.shardql.service.AggregationService;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

@RestController
public class AggregationController {

    private static final Logger log = LoggerFactory.getLogger(AggregationController.class);
    private static final String MDC_TRACE_ID = "trace_id";

    private final AggregationService aggregationService;

    public AggregationController(AggregationService aggregationService) {
        this.aggregationService = aggregationService;
    }

    /**
     * List the distinct table names found across the configured datasets.
     *
     * GET /tables
     */
    @GetMapping("/tables")
    public ResponseEntity<ApiEnvelope> listTables() {
        log.info("List tables requested: trace_id={}", MDC.get(MDC_TRACE_ID));
        return ResponseEntity.ok(aggregationService.listTables());
    }

    /**
     * Fetch every discovered table of every dataset.
     *
     * GET /tables/data
     */
    @GetMapping({"/tables/data", "/get_all_tables_data"})
    public Object allTablesData(HttpServletResponse response) {
        log.info("All tables data requested: trace_id={}", MDC.get(MDC_TRACE_ID));
        return respond(aggregationService.planAllTables(), response);
    }

    /**
     * Fetch one table from every dataset.
     *
     * GET /table/{table_name}/data
     */
    @GetMapping("/table/{table_name}/data")
    public Object tableData(@PathVariable("table_name") String tableName, HttpServletResponse response) {
        log.info("Table data requested: table={}, trace_id={}", tableName, MDC.get(MDC_TRACE_ID));
        return respond(aggregationService.planTable(tableName), response);
    }

    @GetMapping("/table/data")
    public Object tableDataByParam(@RequestParam(value = "table_name", required = false) String tableName,
                                   HttpServletResponse response) {
        log.info("Table data requested: table={}, trace_id={}", tableName, MDC.get(MDC_TRACE_ID));
        return respond(aggregationService.planTable(tableName), response);
    }

    /**
     * Returns either a buffered envelope or a streaming body. Declared as {@code Object} because
     * Spring picks the streaming return value handler from the runtime type.
     */
    private Object respond(AggregationPlan plan, HttpServletResponse response) {
        if (plan.getEmission() != EmissionMode.STREAMING) {
            return ResponseEntity.ok(aggregationService.execute(plan));
        }

        // The body is written on an async thread, outside TraceIdFilter.
        String traceId = MDC.get(MDC_TRACE_ID);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        StreamingResponseBody body = out -> {
            if (traceId != null) {
                MDC.put(MDC_TRACE_ID, traceId);
            }
            try {
                aggregationService.stream(plan, out);
            } finally {
                MDC.remove(MDC_TRACE_ID);
            }
        };
        return body;
    }
}
