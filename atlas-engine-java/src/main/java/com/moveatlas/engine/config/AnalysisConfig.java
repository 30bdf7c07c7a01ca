package com.moveatlas.engine.config;

import com.google.gson.annotations.SerializedName;
import com.moveatlas.engine.source.Network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Options for one package analysis. Every option is optional; getters apply the defaults.
 * Deserialized from analysis.json by {@link AnalysisConfigReader} or built with {@link #builder()}.
 */
public class AnalysisConfig {

    public static final int DEFAULT_MAX_PKG_DEPTH = 1;
    public static final int DEFAULT_MAX_OBJ_DEPTH = 1;
    public static final int DEFAULT_TYPE_COUNT_THRESHOLD = 100;
    public static final int DEFAULT_OBJECT_SAMPLE_SIZE = 10;
    public static final int DEFAULT_HARD_CAP_CRITICAL = 5000;
    public static final int DEFAULT_EVENTS_WINDOW_DAYS = 7;

    /** How many package levels to analyze; 1 = root only. */
    @SerializedName("max_pkg_depth")
    private Integer maxPkgDepth;

    /** Dynamic-field traversal depth; 0 disables child lookups. */
    @SerializedName("max_obj_depth")
    private Integer maxObjDepth;

    /** Non-critical types at or below this count are fetched completely. */
    @SerializedName("type_count_threshold")
    private Integer typeCountThreshold;

    @SerializedName("sample_large_types")
    private Boolean sampleLargeTypes;

    @SerializedName("object_sample_size")
    private Integer objectSampleSize;

    /** Ceiling for exhaustive fetching of critical types. */
    @SerializedName("hard_cap_critical")
    private Integer hardCapCritical;

    /** Recorded with the analysis; events are not filtered by time. */
    @SerializedName("events_window_days")
    private Integer eventsWindowDays;

    /** User critical-type substrings, merged with the built-in table. */
    @SerializedName("critical_types")
    private List<String> criticalTypes;

    /** Preferred network; null means try mainnet, then testnet. */
    @SerializedName("network")
    private String network;

    public int getMaxPkgDepth()         { return maxPkgDepth != null ? maxPkgDepth : DEFAULT_MAX_PKG_DEPTH; }
    public int getMaxObjDepth()         { return maxObjDepth != null ? maxObjDepth : DEFAULT_MAX_OBJ_DEPTH; }
    public int getTypeCountThreshold()  { return typeCountThreshold != null ? typeCountThreshold : DEFAULT_TYPE_COUNT_THRESHOLD; }
    public boolean isSampleLargeTypes() { return sampleLargeTypes == null || sampleLargeTypes; }
    public int getObjectSampleSize()    { return objectSampleSize != null ? objectSampleSize : DEFAULT_OBJECT_SAMPLE_SIZE; }
    public int getHardCapCritical()     { return hardCapCritical != null ? hardCapCritical : DEFAULT_HARD_CAP_CRITICAL; }
    public int getEventsWindowDays()    { return eventsWindowDays != null ? eventsWindowDays : DEFAULT_EVENTS_WINDOW_DAYS; }
    public List<String> getCriticalTypes() {
        return criticalTypes != null ? Collections.unmodifiableList(criticalTypes) : Collections.emptyList();
    }
    public Network getNetwork()         { return network != null ? Network.fromId(network) : null; }

    /**
     * @throws IllegalArgumentException naming the first out-of-range option
     */
    public void validate() {
        requireAtLeast("max_pkg_depth", getMaxPkgDepth(), 1);
        requireAtLeast("max_obj_depth", getMaxObjDepth(), 0);
        requireAtLeast("type_count_threshold", getTypeCountThreshold(), 1);
        requireAtLeast("object_sample_size", getObjectSampleSize(), 1);
        requireAtLeast("hard_cap_critical", getHardCapCritical(), 1);
        requireAtLeast("events_window_days", getEventsWindowDays(), 0);
        if (network != null) {
            Network.fromId(network);
        }
    }

    private static void requireAtLeast(String key, int value, int min) {
        if (value < min) {
            throw new IllegalArgumentException(key + " must be >= " + min + " but was " + value);
        }
    }

    private AnalysisConfig copy() {
        AnalysisConfig c = new AnalysisConfig();
        c.maxPkgDepth = maxPkgDepth;
        c.maxObjDepth = maxObjDepth;
        c.typeCountThreshold = typeCountThreshold;
        c.sampleLargeTypes = sampleLargeTypes;
        c.objectSampleSize = objectSampleSize;
        c.hardCapCritical = hardCapCritical;
        c.eventsWindowDays = eventsWindowDays;
        c.criticalTypes = criticalTypes != null ? new ArrayList<>(criticalTypes) : null;
        c.network = network;
        return c;
    }

    public static AnalysisConfig defaults() {
        return new AnalysisConfig();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final AnalysisConfig config = new AnalysisConfig();

        public Builder maxPkgDepth(int v)         { config.maxPkgDepth = v; return this; }
        public Builder maxObjDepth(int v)         { config.maxObjDepth = v; return this; }
        public Builder typeCountThreshold(int v)  { config.typeCountThreshold = v; return this; }
        public Builder sampleLargeTypes(boolean v){ config.sampleLargeTypes = v; return this; }
        public Builder objectSampleSize(int v)    { config.objectSampleSize = v; return this; }
        public Builder hardCapCritical(int v)     { config.hardCapCritical = v; return this; }
        public Builder eventsWindowDays(int v)    { config.eventsWindowDays = v; return this; }
        public Builder criticalTypes(List<String> v) {
            config.criticalTypes = v != null ? new ArrayList<>(v) : null;
            return this;
        }
        public Builder network(Network v)         { config.network = v != null ? v.id() : null; return this; }

        public AnalysisConfig build() {
            config.validate();
            return config.copy();
        }
    }
}
