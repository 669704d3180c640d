package com.example.flowcompiler.api.v1;

import com.example.flowcompiler.api.v1.dto.SampleListResponse;
import com.example.flowcompiler.api.v1.dto.SampleWorkflowDto;
import com.example.flowcompiler.samples.SampleWorkflowCatalog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Sample workflow records bundled with the service.
 */
@RestController
@RequestMapping("/api/v1/samples")
@RequiredArgsConstructor
@Slf4j
public class SamplesController {

    private final SampleWorkflowCatalog catalog;

    @GetMapping
    public ResponseEntity<SampleListResponse> list() {
        log.debug("Listing sample workflows");
        return ResponseEntity.ok(new SampleListResponse(catalog.list()));
    }

    @GetMapping("/{name}")
    public ResponseEntity<SampleWorkflowDto> get(@PathVariable String name) {
        log.info("Getting sample workflow name={}", name);
        return ResponseEntity.ok(catalog.get(name));
    }
}
