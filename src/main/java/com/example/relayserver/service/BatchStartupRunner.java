package com.example.relayserver.service;

import com.example.relayserver.config.ExtractorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * relay.extractor.run-on-startup=true 时，启动后同步执行一次批处理
 */
@Slf4j
@Component
public class BatchStartupRunner implements ApplicationRunner {

    @Autowired
    private ExtractorProperties properties;

    @Autowired
    private BatchProcessingService batchProcessingService;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRunOnStartup()) {
            return;
        }
        log.info("启动时执行批处理: {}", properties.getInputDir());
        batchProcessingService.run(batchProcessingService.createRun(null));
    }
}
