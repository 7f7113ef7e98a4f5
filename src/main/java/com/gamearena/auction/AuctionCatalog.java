package com.gamearena.auction;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamearena.game.CatalogException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * The list of items an auction draws from, loaded from JSON.
 */
public class AuctionCatalog {
    public static final String DEFAULT_RESOURCE = "auction-items.json";

    private static final TypeReference<List<AuctionItem>> ITEM_LIST = new TypeReference<>() {};

    private final List<AuctionItem> items;

    public AuctionCatalog(List<AuctionItem> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("Auction catalog needs at least one item");
        }
        this.items = List.copyOf(items);
    }

    /**
     * The bundled five-item catalog.
     */
    public static AuctionCatalog standard() throws CatalogException {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Load items from a JSON file.
     */
    public static AuctionCatalog fromFile(String path) throws CatalogException {
        try {
            return fromJson(Files.readString(Path.of(path)));
        } catch (IOException e) {
            throw new CatalogException("IO error reading " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load items from a classpath resource.
     */
    public static AuctionCatalog fromResource(String resourcePath) throws CatalogException {
        try (InputStream is = AuctionCatalog.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CatalogException("Resource not found: " + resourcePath);
            }
            return build(new ObjectMapper().readValue(is, ITEM_LIST));
        } catch (IOException e) {
            throw new CatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load items from a JSON array string.
     */
    public static AuctionCatalog fromJson(String json) throws CatalogException {
        try {
            return build(new ObjectMapper().readValue(json, ITEM_LIST));
        } catch (IOException e) {
            throw new CatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static AuctionCatalog build(List<AuctionItem> items) throws CatalogException {
        if (items == null || items.isEmpty()) {
            throw new CatalogException("Auction catalog is empty");
        }
        return new AuctionCatalog(items);
    }

    public List<AuctionItem> getItems() {
        return items;
    }

    public int size() {
        return items.size();
    }
}
