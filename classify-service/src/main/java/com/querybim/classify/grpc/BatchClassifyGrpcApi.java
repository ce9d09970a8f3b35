package com.querybim.classify.grpc;

import com.querybim.classify.model.ClassifyQuery;
import com.querybim.classify.model.ResultRecord;
import com.querybim.classify.service.BatchClassifyService;
import com.querybim.classify.service.InvalidBatchRequestException;
import com.querybim.classify.service.MatchBackendException;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class BatchClassifyGrpcApi extends BatchClassifierGrpc.BatchClassifierImplBase {
    private static final Logger log = LoggerFactory.getLogger(BatchClassifyGrpcApi.class);

    private final BatchClassifyService batchClassifyService;

    public BatchClassifyGrpcApi(BatchClassifyService batchClassifyService) {
        this.batchClassifyService = batchClassifyService;
    }

    @Override
    public void classify(ClassifyBatchRequest request, StreamObserver<ClassifyBatchResponse> responseObserver) {
        List<ClassifyQuery> queries = new ArrayList<>(request.getQueriesCount());
        for (ClassifyQueryMessage message : request.getQueriesList()) {
            queries.add(new ClassifyQuery(
                    message.hasRequestId() ? message.getRequestId() : null,
                    message.getQuery(),
                    message.getUniclassType().isEmpty() ? null : message.getUniclassType(),
                    message.hasDepth() ? message.getDepth() : null
            ));
        }

        List<ResultRecord> results;
        try {
            results = batchClassifyService.classify(queries, request.getTraceId());
        } catch (InvalidBatchRequestException ex) {
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription(ex.getMessage()).asRuntimeException());
            return;
        } catch (MatchBackendException ex) {
            responseObserver.onError(Status.UNAVAILABLE
                    .withDescription("Database processing failed: " + ex.getMessage())
                    .asRuntimeException());
            return;
        } catch (RuntimeException ex) {
            log.error("gRPC batch classify failed", ex);
            responseObserver.onError(Status.INTERNAL.withDescription("Internal server error").asRuntimeException());
            return;
        }

        ClassifyBatchResponse.Builder builder = ClassifyBatchResponse.newBuilder()
                .setSuccess(true)
                .setProcessed(results.size());
        for (ResultRecord result : results) {
            builder.addResults(ResultRecordMessage.newBuilder()
                    .setRequestId(result.getRequestId())
                    .setMatch(result.getMatch())
                    .setConfidence(result.getConfidence())
                    .build());
        }
        responseObserver.onNext(builder.build());
        responseObserver.onCompleted();
    }
}
