package de.bsommerfeld.landcover.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class BackendConfig {

    // ground size of one pixel in metres; sampling scale is measured against it
    @JsonProperty("native-scale")
    private double nativeScale = 10.0;

    @JsonProperty("worker-threads")
    private int workerThreads = 2;

    public double getNativeScale() {
        return nativeScale;
    }

    public void setNativeScale(double nativeScale) {
        this.nativeScale = nativeScale;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }
}
