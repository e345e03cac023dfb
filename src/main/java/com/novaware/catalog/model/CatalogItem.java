package com.novaware.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * A product document of the catalog the pipeline reconciles and enriches.
 *
 * <p>{@code seq} is assigned by the store on insert and strictly increases, so it serves
 * as the resume cursor of every batch stage. {@code external_key} links the item to the
 * external datasets and is written at most once.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CatalogItem {
    private String id;
    private Long seq;                        // monotonic cursor key, store-assigned
    private String name;
    private String category;
    private String brand;
    private String description;
    private List<String> images;
    private Double price;
    private Double rating;
    private Integer num_reviews;
    private List<Review> reviews;
    private List<Variant> variants;
    private Map<String, Integer> size_stock; // legacy per-size totals: s, m, l, xl
    private List<ColorOption> colors;
    private Integer count_in_stock;
    private String external_key;
    private List<Double> feature_vector;
    private List<String> compatible_items;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public Long getSeq() { return seq; }
    public void setSeq(Long seq) { this.seq = seq; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public String getBrand() { return brand; }
    public void setBrand(String brand) { this.brand = brand; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public List<String> getImages() { return images; }
    public void setImages(List<String> images) { this.images = images; }
    public Double getPrice() { return price; }
    public void setPrice(Double price) { this.price = price; }
    public Double getRating() { return rating; }
    public void setRating(Double rating) { this.rating = rating; }
    public Integer getNum_reviews() { return num_reviews; }
    public void setNum_reviews(Integer num_reviews) { this.num_reviews = num_reviews; }
    public List<Review> getReviews() { return reviews; }
    public void setReviews(List<Review> reviews) { this.reviews = reviews; }
    public List<Variant> getVariants() { return variants; }
    public void setVariants(List<Variant> variants) { this.variants = variants; }
    public Map<String, Integer> getSize_stock() { return size_stock; }
    public void setSize_stock(Map<String, Integer> size_stock) { this.size_stock = size_stock; }
    public List<ColorOption> getColors() { return colors; }
    public void setColors(List<ColorOption> colors) { this.colors = colors; }
    public Integer getCount_in_stock() { return count_in_stock; }
    public void setCount_in_stock(Integer count_in_stock) { this.count_in_stock = count_in_stock; }
    public String getExternal_key() { return external_key; }
    public void setExternal_key(String external_key) { this.external_key = external_key; }
    public List<Double> getFeature_vector() { return feature_vector; }
    public void setFeature_vector(List<Double> feature_vector) { this.feature_vector = feature_vector; }
    public List<String> getCompatible_items() { return compatible_items; }
    public void setCompatible_items(List<String> compatible_items) { this.compatible_items = compatible_items; }

    @JsonIgnore
    public boolean isResolved() {
        return external_key != null && !external_key.isBlank();
    }
}
