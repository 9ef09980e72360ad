package com.example.SmartDairy.controller;

import com.example.SmartDairy.model.FarmDataFileSummary;
import com.example.SmartDairy.service.FarmDataCatalogService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/farm-data")
@RequiredArgsConstructor
public class FarmDataController {

    private final FarmDataCatalogService farmDataCatalogService;

    @GetMapping
    public Map<String, List<FarmDataFileSummary>> list() {
        return Map.of("files", farmDataCatalogService.listFiles());
    }

    @DeleteMapping("/{id}")
    public Map<String, Boolean> delete(@PathVariable("id") String id) {
        farmDataCatalogService.deleteFile(id);
        return Map.of("success", true);
    }
}
