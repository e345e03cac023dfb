package com.novaware.catalog.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    /** Newline-delimited JSON file with external reviews. */
    private String reviewsFile;
    /** Newline-delimited JSON file with external product metadata. */
    private String metadataFile;
    /** Number of catalog items fetched per cursor batch. */
    @Positive
    private int batchSize = 500;
    /** Emit a reader progress log line every N input lines. */
    private int readerProgressEvery = 10_000;
    /** Emit an orchestrator progress log line every N items. */
    private int itemProgressEvery = 100;
    /** Number of recent items used for the rolling ETA estimate. */
    private int etaWindow = 50;

    /** Minimum score a candidate must exceed to be accepted. */
    private double acceptThreshold = 0.4;
    /** Score above which candidate scanning stops early. */
    private double earlyAcceptThreshold = 0.8;
    /** Score assigned when one title fully contains the other. */
    private double containmentScore = 0.8;
    /** Maximum candidates gathered from the keyword index per item. */
    @Positive
    private int candidateCap = 100;
    /** Number of keys scored when the keyword index yields nothing. */
    private int fallbackSampleSize = 1000;
    /** Maximum keys kept per keyword token. */
    private int keywordFanOutCap = 500;
    /** Qualifying title tokens indexed per record. */
    private int keywordsPerTitle = 5;

    /** Global cap on synthesized reviewer identities. */
    @Positive
    private int identityQuota = 2512;
    /** Domain of synthesized reviewer emails. */
    private String identityEmailDomain = "placeholder.novaware.dev";

    /** Catalog documents sampled to fit the TF-IDF vocabulary. */
    @Positive
    private int vocabularySample = 1000;
    /** Compatible items sampled per item. */
    @Positive
    private int compatibleCount = 3;

    /** Minimum colors per item after padding with the default palette. */
    @Min(1)
    private int minColors = 3;
    /** Maximum colors per item. */
    private int maxColors = 6;
    /** Variant prices are rounded to a multiple of this unit. */
    private double currencyUnit = 0.01;
    /** Palette used to pad items with too few colors, in order. */
    private List<PaletteColor> defaultPalette = new ArrayList<>(List.of(
            new PaletteColor("Black", "#000000"),
            new PaletteColor("White", "#FFFFFF"),
            new PaletteColor("Gray", "#808080"),
            new PaletteColor("Navy", "#001F3F")));

    /** Optional seed for the pipeline random source; unseeded when null. */
    private Long randomSeed;

    public static class PaletteColor {
        private String name;
        private String hex;

        public PaletteColor() {}

        public PaletteColor(String name, String hex) {
            this.name = name;
            this.hex = hex;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getHex() { return hex; }
        public void setHex(String hex) { this.hex = hex; }
    }

    public String getReviewsFile() { return reviewsFile; }
    public void setReviewsFile(String reviewsFile) { this.reviewsFile = reviewsFile; }
    public String getMetadataFile() { return metadataFile; }
    public void setMetadataFile(String metadataFile) { this.metadataFile = metadataFile; }
    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    public int getReaderProgressEvery() { return readerProgressEvery; }
    public void setReaderProgressEvery(int readerProgressEvery) { this.readerProgressEvery = readerProgressEvery; }
    public int getItemProgressEvery() { return itemProgressEvery; }
    public void setItemProgressEvery(int itemProgressEvery) { this.itemProgressEvery = itemProgressEvery; }
    public int getEtaWindow() { return etaWindow; }
    public void setEtaWindow(int etaWindow) { this.etaWindow = etaWindow; }
    public double getAcceptThreshold() { return acceptThreshold; }
    public void setAcceptThreshold(double acceptThreshold) { this.acceptThreshold = acceptThreshold; }
    public double getEarlyAcceptThreshold() { return earlyAcceptThreshold; }
    public void setEarlyAcceptThreshold(double earlyAcceptThreshold) { this.earlyAcceptThreshold = earlyAcceptThreshold; }
    public double getContainmentScore() { return containmentScore; }
    public void setContainmentScore(double containmentScore) { this.containmentScore = containmentScore; }
    public int getCandidateCap() { return candidateCap; }
    public void setCandidateCap(int candidateCap) { this.candidateCap = candidateCap; }
    public int getFallbackSampleSize() { return fallbackSampleSize; }
    public void setFallbackSampleSize(int fallbackSampleSize) { this.fallbackSampleSize = fallbackSampleSize; }
    public int getKeywordFanOutCap() { return keywordFanOutCap; }
    public void setKeywordFanOutCap(int keywordFanOutCap) { this.keywordFanOutCap = keywordFanOutCap; }
    public int getKeywordsPerTitle() { return keywordsPerTitle; }
    public void setKeywordsPerTitle(int keywordsPerTitle) { this.keywordsPerTitle = keywordsPerTitle; }
    public int getIdentityQuota() { return identityQuota; }
    public void setIdentityQuota(int identityQuota) { this.identityQuota = identityQuota; }
    public String getIdentityEmailDomain() { return identityEmailDomain; }
    public void setIdentityEmailDomain(String identityEmailDomain) { this.identityEmailDomain = identityEmailDomain; }
    public int getVocabularySample() { return vocabularySample; }
    public void setVocabularySample(int vocabularySample) { this.vocabularySample = vocabularySample; }
    public int getCompatibleCount() { return compatibleCount; }
    public void setCompatibleCount(int compatibleCount) { this.compatibleCount = compatibleCount; }
    public int getMinColors() { return minColors; }
    public void setMinColors(int minColors) { this.minColors = minColors; }
    public int getMaxColors() { return maxColors; }
    public void setMaxColors(int maxColors) { this.maxColors = maxColors; }
    public double getCurrencyUnit() { return currencyUnit; }
    public void setCurrencyUnit(double currencyUnit) { this.currencyUnit = currencyUnit; }
    public List<PaletteColor> getDefaultPalette() { return defaultPalette; }
    public void setDefaultPalette(List<PaletteColor> defaultPalette) { this.defaultPalette = defaultPalette; }
    public Long getRandomSeed() { return randomSeed; }
    public void setRandomSeed(Long randomSeed) { this.randomSeed = randomSeed; }
}
