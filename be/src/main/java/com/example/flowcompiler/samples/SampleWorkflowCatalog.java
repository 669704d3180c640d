package com.example.flowcompiler.samples;

import com.example.flowcompiler.api.SampleNotFoundException;
import com.example.flowcompiler.api.v1.dto.SampleListItem;
import com.example.flowcompiler.api.v1.dto.SampleWorkflowDto;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of sample workflows, keyed by name. Filled at startup by
 * {@link com.example.flowcompiler.config.SampleWorkflowsLoader}; a sample registered again under the
 * same name replaces the earlier one.
 */
@Component
@Slf4j
public class SampleWorkflowCatalog {

    private final Map<String, SampleWorkflowDto> samples = new ConcurrentHashMap<>();

    public void register(SampleWorkflowDto sample) {
        SampleWorkflowDto previous = samples.put(sample.name(), sample);
        log.debug("{} sample workflow name={}", previous != null ? "Replaced" : "Registered", sample.name());
    }

    public SampleWorkflowDto get(String name) {
        SampleWorkflowDto sample = name != null ? samples.get(name) : null;
        if (sample == null) {
            throw new SampleNotFoundException(name);
        }
        return sample;
    }

    public List<SampleListItem> list() {
        return samples.values().stream()
                .map(s -> new SampleListItem(s.name(), s.title(), s.description()))
                .sorted((a, b) -> a.name().compareTo(b.name()))
                .toList();
    }
}
