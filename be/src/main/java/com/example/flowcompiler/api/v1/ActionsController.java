package com.example.flowcompiler.api.v1;

import com.example.flowcompiler.actions.ActionCatalog;
import com.example.flowcompiler.api.v1.dto.ActionInfoDto;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for listing action types available to action nodes.
 */
@RestController
@RequestMapping("/api/v1/actions")
@RequiredArgsConstructor
@Slf4j
public class ActionsController {

    private final ActionCatalog actionCatalog;

    @GetMapping
    public List<ActionInfoDto> list() {
        List<ActionInfoDto> actions = actionCatalog.all().stream()
                .map(a -> new ActionInfoDto(a.actionType(), a.description(), a.requiredFields(), a.optionalFields()))
                .collect(Collectors.toList());
        log.debug("Listing action types count={}", actions.size());
        return actions;
    }
}
