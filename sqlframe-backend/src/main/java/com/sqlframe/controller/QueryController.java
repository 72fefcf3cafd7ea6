package com.sqlframe.controller;

import com.sqlframe.api.InterpolateResponse;
import com.sqlframe.api.QueryRequest;
import com.sqlframe.api.QueryResponse;
import com.sqlframe.frame.Frame;
import com.sqlframe.model.QueryContext;
import com.sqlframe.service.QueryService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.sql.SQLException;
import java.util.List;

@RestController
@RequestMapping("/v1")
public class QueryController {

    private final QueryService queryService;

    public QueryController(QueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * Execute a query and return its result sets as frames.
     *
     * POST /v1/query
     *
     * @param request query with SQL, time range and macro fields
     * @return frames keyed by the request's ref_id
     */
    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) throws SQLException {
        QueryContext ctx = queryService.toContext(request);
        List<Frame> frames = queryService.query(ctx);
        return ResponseEntity.ok(QueryResponse.builder()
                .refId(ctx.getRefId())
                .frames(frames)
                .build());
    }

    /**
     * Interpolate macros without executing.
     *
     * POST /v1/interpolate
     */
    @PostMapping("/interpolate")
    public ResponseEntity<InterpolateResponse> interpolate(@Valid @RequestBody QueryRequest request) {
        QueryContext ctx = queryService.toContext(request);
        QueryContext interpolated = queryService.interpolate(ctx);
        return ResponseEntity.ok(InterpolateResponse.builder()
                .refId(ctx.getRefId())
                .sql(interpolated.getSql())
                .build());
    }
}
