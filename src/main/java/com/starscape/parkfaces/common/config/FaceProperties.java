package com.starscape.parkfaces.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for face ingestion, extraction and search.
 * Binds to app.faces.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.faces")
public class FaceProperties {

    /**
     * Length of every embedding produced by the configured model.
     * Facenet512 emits 512 floats.
     */
    private int embeddingDimension = 512;

    private final Ingestion ingestion = new Ingestion();
    private final Search search = new Search();
    private final Extractor extractor = new Extractor();

    public int getEmbeddingDimension() {
        return embeddingDimension;
    }

    public void setEmbeddingDimension(int embeddingDimension) {
        this.embeddingDimension = embeddingDimension;
    }

    public Ingestion getIngestion() {
        return ingestion;
    }

    public Search getSearch() {
        return search;
    }

    public Extractor getExtractor() {
        return extractor;
    }

    public static class Ingestion {

        private int concurrency = 4;
        private int queueCapacity = 100;
        private Duration extractionTimeout = Duration.ofSeconds(30);
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public Duration getExtractionTimeout() {
            return extractionTimeout;
        }

        public void setExtractionTimeout(Duration extractionTimeout) {
            this.extractionTimeout = extractionTimeout;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    public static class Search {

        private double threshold = 0.65;
        private int topK = 20;

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }
    }

    public static class Extractor {

        private String baseUrl = "http://localhost:5005";
        private String modelName = "Facenet512";
        private String detectorBackend = "retinaface";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);

        /**
         * Faces reported with a confidence at or below this value are dropped.
         */
        private double minFaceConfidence = 0.0;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public String getDetectorBackend() {
            return detectorBackend;
        }

        public void setDetectorBackend(String detectorBackend) {
            this.detectorBackend = detectorBackend;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public double getMinFaceConfidence() {
            return minFaceConfidence;
        }

        public void setMinFaceConfidence(double minFaceConfidence) {
            this.minFaceConfidence = minFaceConfidence;
        }
    }
}
