package com.stepwise.dispatch.api;

import com.stepwise.core.model.ToolDescriptor;
import com.stepwise.core.tools.ToolCatalog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Lists the tools discovered from the tool-execution service at startup.
 */
@RestController
@RequestMapping("/api/v1/tools")
public class ToolController {

    private final ToolCatalog toolCatalog;

    public ToolController(ToolCatalog toolCatalog) {
        this.toolCatalog = toolCatalog;
    }

    @GetMapping
    public ResponseEntity<Map<String, List<ToolDescriptor>>> listTools() {
        return ResponseEntity.ok(Map.of("tools", toolCatalog.descriptors()));
    }
}
