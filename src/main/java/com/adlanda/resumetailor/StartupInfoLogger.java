package com.adlanda.resumetailor;

import com.adlanda.resumetailor.config.TailoringProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final TailoringProperties properties;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    @Value("${spring.ai.openai.base-url:}")
    private String backendUrl;

    public StartupInfoLogger(TailoringProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            Resume Tailor v{}
            AI backend: {}
              analysis model:   {}
              generation model: {}
              retries: {} (backoff unit {}), parallel tailoring: {}

            API Endpoints:
              GET  http://localhost:{}/api/v1
              POST http://localhost:{}/api/v1/resumes
              POST http://localhost:{}/api/v1/resumes/{id}/tailor

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version,
            backendUrl,
            properties.getAi().getAnalysisModel(),
            properties.getAi().getGenerationModel(),
            properties.getAi().getMaxRetries(),
            properties.getAi().getBackoffUnit(),
            properties.isParallelTailoring(),
            port, port, port, port
        );
    }
}
