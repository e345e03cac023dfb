package com.novaware.catalog.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * One row of the external product metadata stream.
 *
 * <p>Image entries may be plain URLs or objects carrying {@code large}, {@code hi_res} and
 * {@code thumb} variants; the first non-empty of those is kept. Color names come from every
 * {@code details} entry whose key mentions "Color".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExternalMetadata {
    private String parent_key;
    private String title;
    private List<String> description;
    private Double price;
    private List<String> images;
    private String store;
    private String main_category;
    private List<String> categories;
    private Double average_rating;
    private Integer rating_number;
    private List<String> color_names;

    public static ExternalMetadata fromJsonNode(JsonNode n) {
        ExternalMetadata m = new ExternalMetadata();
        m.setParent_key(ExternalReview.firstText(n, "parent_asin", "parentKey"));
        m.setTitle(n.path("title").asText(null));
        m.setDescription(textList(n.path("description")));
        m.setPrice(parsePrice(n.path("price")));
        m.setStore(n.path("store").isTextual() ? n.path("store").asText() : null);
        m.setMain_category(n.path("main_category").isTextual() ? n.path("main_category").asText() : null);
        m.setCategories(textList(n.path("categories")));
        m.setAverage_rating(n.path("average_rating").isNumber() ? n.path("average_rating").asDouble() : null);
        m.setRating_number(n.path("rating_number").canConvertToInt() ? n.path("rating_number").asInt() : null);

        List<String> images = new ArrayList<>();
        if (n.path("images").isArray()) {
            for (JsonNode img : n.path("images")) {
                String url = img.isTextual() ? img.asText() : firstNonBlank(img, "large", "hi_res", "thumb");
                if (url != null && !url.isBlank()) images.add(url);
            }
        }
        m.setImages(images);

        List<String> colors = new ArrayList<>();
        JsonNode details = n.path("details");
        if (details.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = details.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (e.getKey().contains("Color") && e.getValue().isTextual() && !e.getValue().asText().isBlank()) {
                    colors.add(e.getValue().asText().trim());
                }
            }
        }
        m.setColor_names(colors);
        return m;
    }

    private static List<String> textList(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode v : node) {
                if (v.isTextual()) out.add(v.asText());
            }
        } else if (node.isTextual()) {
            out.add(node.asText());
        }
        return out;
    }

    private static String firstNonBlank(JsonNode obj, String... fields) {
        for (String f : fields) {
            JsonNode v = obj.path(f);
            if (v.isTextual() && !v.asText().isBlank()) return v.asText();
        }
        return null;
    }

    private static Double parsePrice(JsonNode node) {
        if (node.isNumber()) return node.asDouble();
        if (!node.isTextual()) return null;
        String digits = node.asText().replaceAll("[^0-9.]", "");
        if (digits.isEmpty()) return null;
        try {
            return Double.parseDouble(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public String getParent_key() { return parent_key; }
    public void setParent_key(String parent_key) { this.parent_key = parent_key; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public List<String> getDescription() { return description; }
    public void setDescription(List<String> description) { this.description = description; }
    public Double getPrice() { return price; }
    public void setPrice(Double price) { this.price = price; }
    public List<String> getImages() { return images; }
    public void setImages(List<String> images) { this.images = images; }
    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }
    public String getMain_category() { return main_category; }
    public void setMain_category(String main_category) { this.main_category = main_category; }
    public List<String> getCategories() { return categories; }
    public void setCategories(List<String> categories) { this.categories = categories; }
    public Double getAverage_rating() { return average_rating; }
    public void setAverage_rating(Double average_rating) { this.average_rating = average_rating; }
    public Integer getRating_number() { return rating_number; }
    public void setRating_number(Integer rating_number) { this.rating_number = rating_number; }
    public List<String> getColor_names() { return color_names; }
    public void setColor_names(List<String> color_names) { this.color_names = color_names; }
}
