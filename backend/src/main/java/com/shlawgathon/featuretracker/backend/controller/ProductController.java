package com.shlawgathon.featuretracker.backend.controller;

import com.shlawgathon.featuretracker.backend.dto.ProductSummary;
import com.shlawgathon.featuretracker.backend.model.ProductDataset;
import com.shlawgathon.featuretracker.backend.service.ProductDatasetService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/products")
@Tag(name = "Products", description = "Tracked products and their features")
public class ProductController {

    private final ProductDatasetService productDatasetService;

    public ProductController(ProductDatasetService productDatasetService) {
        this.productDatasetService = productDatasetService;
    }

    @GetMapping
    @Operation(summary = "List products", description = "Products with feature counts per classification status")
    public ResponseEntity<List<ProductSummary>> listProducts() {
        return ResponseEntity.ok(productDatasetService.listProducts());
    }

    @GetMapping("/{name}")
    @Operation(summary = "Get product", description = "Full dataset of one product")
    public ResponseEntity<ProductDataset> getProduct(
            @Parameter(description = "Product name") @PathVariable String name) {
        return ResponseEntity.ok(productDatasetService.getProduct(name));
    }
}
