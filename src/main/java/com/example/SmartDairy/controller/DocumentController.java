package com.example.SmartDairy.controller;

import com.example.SmartDairy.model.DocumentSummary;
import com.example.SmartDairy.service.DocumentCatalogService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentCatalogService documentCatalogService;

    @GetMapping
    public Map<String, List<DocumentSummary>> list() {
        return Map.of("documents", documentCatalogService.listDocuments());
    }

    @DeleteMapping("/{id}")
    public Map<String, Boolean> delete(@PathVariable("id") String id) {
        documentCatalogService.deleteDocument(id);
        return Map.of("success", true);
    }
}
