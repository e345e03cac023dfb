package com.novaware.catalog.model;

public class Variant {
    private String size;
    private String color; // hex
    private double price;
    private int stock;

    public Variant() {}

    public Variant(String size, String color, double price, int stock) {
        this.size = size;
        this.color = color;
        this.price = price;
        this.stock = stock;
    }

    public String getSize() { return size; }
    public void setSize(String size) { this.size = size; }
    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }
    public double getPrice() { return price; }
    public void setPrice(double price) { this.price = price; }
    public int getStock() { return stock; }
    public void setStock(int stock) { this.stock = stock; }
}
