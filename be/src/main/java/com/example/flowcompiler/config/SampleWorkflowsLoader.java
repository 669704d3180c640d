package com.example.flowcompiler.config;

import com.example.flowcompiler.api.v1.dto.SampleWorkflowDto;
import com.example.flowcompiler.samples.SampleWorkflowCatalog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads sample workflow records from classpath resources into the {@link SampleWorkflowCatalog} at startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SampleWorkflowsLoader implements ApplicationRunner {

    private static final String SAMPLES_DIR = "samples/";
    private static final List<String> SAMPLE_FILES = List.of(
            "lead-follow-up.json",
            "webhook-escalation.json"
    );

    private final SampleWorkflowCatalog catalog;
    private final JsonMapper jsonMapper;

    @Override
    public void run(ApplicationArguments args) {
        for (String filename : SAMPLE_FILES) {
            loadSample(SAMPLES_DIR + filename);
        }
    }

    private void loadSample(String path) {
        Resource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            log.warn("Sample workflow resource not found: {}", path);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            SampleWorkflowDto sample = jsonMapper.readValue(in, SampleWorkflowDto.class);
            catalog.register(sample);
            log.info("Loaded sample workflow: {}", sample.name());
        } catch (JacksonException e) {
            log.error("Failed to parse sample workflow {}: {}", path, e.getMessage());
        } catch (IOException e) {
            log.error("Failed to read sample workflow {}: {}", path, e.getMessage());
        }
    }
}
