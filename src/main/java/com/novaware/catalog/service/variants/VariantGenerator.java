package com.novaware.catalog.service.variants;

import com.novaware.catalog.config.PipelineProperties;
import com.novaware.catalog.model.CatalogItem;
import com.novaware.catalog.model.ColorOption;
import com.novaware.catalog.model.Variant;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Expands an item into its full size x color variant grid.
 *
 * <p>Each size keeps its declared total: taken from the existing variants when there are any,
 * otherwise from the legacy per-size stock. The total is split over the colors by
 * {@link StockDistributor}; prices carry a size and a color surcharge.
 */
@Component
public class VariantGenerator {
    public static final List<String> SIZES = List.of("s", "m", "l", "xl");
    private static final Map<String, Double> SIZE_ADJUSTMENT = Map.of("s", 0.0, "m", 0.01, "l", 0.02, "xl", 0.03);
    private static final double COLOR_STEP = 0.01;
    private static final double COLOR_CAP = 0.03;

    private final ColorPalette palette;
    private final BigDecimal currencyUnit;

    @Autowired
    public VariantGenerator(PipelineProperties props) {
        this(ColorPalette.from(props), props.getCurrencyUnit());
    }

    public VariantGenerator(ColorPalette palette, double currencyUnit) {
        this.palette = palette;
        this.currencyUnit = BigDecimal.valueOf(currencyUnit > 0 ? currencyUnit : 0.01);
    }

    public static class Result {
        private final List<ColorOption> colors;
        private final List<Variant> variants;
        private final int countInStock;

        Result(List<ColorOption> colors, List<Variant> variants) {
            this.colors = colors;
            this.variants = variants;
            int sum = 0;
            for (Variant v : variants) sum += v.getStock();
            this.countInStock = sum;
        }

        public List<ColorOption> getColors() { return colors; }
        public List<Variant> getVariants() { return variants; }
        public int getCountInStock() { return countInStock; }
    }

    public Result generate(CatalogItem item, Random random) {
        List<ColorOption> colors = palette.resolve(item.getColors());
        Map<String, Integer> totals = sizeTotals(item);
        double base = item.getPrice() != null ? item.getPrice() : 0.0;
        List<Variant> variants = new ArrayList<>();
        for (String size : SIZES) {
            int[] split = StockDistributor.distribute(totals.getOrDefault(size, 0), colors.size(), random);
            for (int c = 0; c < colors.size(); c++) {
                variants.add(new Variant(size, colors.get(c).getHex(), price(base, size, c), split[c]));
            }
        }
        return new Result(colors, variants);
    }

    /** Declared stock per size, from existing variants if present, else the legacy map. */
    public static Map<String, Integer> sizeTotals(CatalogItem item) {
        Map<String, Integer> totals = new LinkedHashMap<>();
        for (String s : SIZES) totals.put(s, 0);
        if (item.getVariants() != null && !item.getVariants().isEmpty()) {
            for (Variant v : item.getVariants()) {
                if (v.getSize() != null && totals.containsKey(v.getSize())) {
                    totals.merge(v.getSize(), Math.max(0, v.getStock()), Integer::sum);
                }
            }
        } else if (item.getSize_stock() != null) {
            for (String s : SIZES) {
                Integer n = item.getSize_stock().get(s);
                totals.put(s, n != null ? Math.max(0, n) : 0);
            }
        }
        return totals;
    }

    double price(double base, String size, int colorIndex) {
        double adjustment = SIZE_ADJUSTMENT.getOrDefault(size, 0.0) + Math.min(colorIndex * COLOR_STEP, COLOR_CAP);
        BigDecimal raw = BigDecimal.valueOf(base * (1 + adjustment));
        return raw.divide(currencyUnit, 0, RoundingMode.HALF_UP).multiply(currencyUnit).doubleValue();
    }
}
