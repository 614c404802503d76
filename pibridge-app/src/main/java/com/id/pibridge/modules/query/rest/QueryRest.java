package com.id.pibridge.modules.query.rest;

import com.id.pibridge.model.PiQueryDataReq;
import com.id.pibridge.model.PiQueryDataRes;
import com.id.pibridge.modules.query.service.QueryDataService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("pibridge")
public class QueryRest {

    private final QueryDataService queryDataService;

    public QueryRest(QueryDataService queryDataService) {
        this.queryDataService = queryDataService;
    }

    @PostMapping("query")
    public ResponseEntity<PiQueryDataRes> query(@RequestBody PiQueryDataReq req) {
        try {
            return ResponseEntity.ok(queryDataService.queryData(req));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }
}
