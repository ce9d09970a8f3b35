package com.querybim.classify.controller;

import com.querybim.classify.model.BatchClassifyRequest;
import com.querybim.classify.model.BatchClassifyResponse;
import com.querybim.classify.model.ResultRecord;
import com.querybim.classify.service.BatchClassifyService;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/batch-classify")
@CrossOrigin(
        origins = "*",
        methods = {RequestMethod.POST, RequestMethod.OPTIONS},
        allowedHeaders = {"Content-Type", "X-Trace-Id"}
)
public class BatchClassifyController {

    private final BatchClassifyService batchClassifyService;

    public BatchClassifyController(BatchClassifyService batchClassifyService) {
        this.batchClassifyService = batchClassifyService;
    }

    @PostMapping
    public BatchClassifyResponse classify(
            @RequestBody(required = false) BatchClassifyRequest request,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId
    ) {
        String effectiveTraceId = (traceId == null || traceId.isBlank()) ? UUID.randomUUID().toString() : traceId;
        List<ResultRecord> results = batchClassifyService.classify(
                request == null ? null : request.getQueries(),
                effectiveTraceId
        );
        return BatchClassifyResponse.ok(results);
    }
}
