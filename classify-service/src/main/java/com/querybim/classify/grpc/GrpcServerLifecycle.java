package com.querybim.classify.grpc;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "grpc.server.enabled", havingValue = "true")
public class GrpcServerLifecycle implements InitializingBean, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(GrpcServerLifecycle.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 5;

    private final BatchClassifyGrpcApi batchClassifyGrpcApi;
    private final int configuredPort;
    private Server server;

    public GrpcServerLifecycle(
            BatchClassifyGrpcApi batchClassifyGrpcApi,
            @Value("${grpc.server.port:9095}") int configuredPort
    ) {
        this.batchClassifyGrpcApi = batchClassifyGrpcApi;
        this.configuredPort = configuredPort;
    }

    @Override
    public void afterPropertiesSet() throws IOException {
        server = ServerBuilder.forPort(configuredPort)
                .addService(batchClassifyGrpcApi)
                .build()
                .start();
        log.info("grpc server started service=BatchClassifier port={}", server.getPort());
    }

    /**
     * Port the server is bound to, or -1 when it is not running. Differs from the
     * configured port when that is 0.
     */
    public int getPort() {
        return server == null || server.isShutdown() ? -1 : server.getPort();
    }

    @Override
    public void destroy() throws InterruptedException {
        if (server == null) {
            return;
        }
        server.shutdown();
        if (!server.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
            log.warn("grpc server did not drain within {}s, forcing shutdown", SHUTDOWN_GRACE_SECONDS);
            server.shutdownNow();
        }
        log.info("grpc server stopped service=BatchClassifier");
    }
}
