package com.herzen.planner.api;

import com.herzen.planner.domain.DomainModels.CatalogSnapshot;
import com.herzen.planner.service.CatalogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/catalog")
public class CatalogController {
    private final CatalogService catalogService;

    public CatalogController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @PutMapping
    public ResponseEntity<CatalogService.CatalogSummary> importCatalog(@RequestBody CatalogSnapshot snapshot) {
        return ResponseEntity.ok(catalogService.importCatalog(snapshot));
    }

    @GetMapping("/summary")
    public ResponseEntity<CatalogService.CatalogSummary> summary() {
        return ResponseEntity.ok(catalogService.summary());
    }
}
