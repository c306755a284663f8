package com.shlawgathon.featuretracker.backend.exception;

/**
 * Thrown when a stored product document lacks the expected feature array.
 */
public class ProductDataCorruptedException extends RuntimeException {

    private final String productName;

    public ProductDataCorruptedException(String productName, String message) {
        super("Product '" + productName + "': " + message);
        this.productName = productName;
    }

    public String getProductName() {
        return productName;
    }
}
