package com.moveatlas.engine.graph;

import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * POJOs for the package graph consumed by the visualization UI.
 * Field names use @SerializedName so the JSON contract stays camelCase
 * independent of Java naming.
 */
public final class GraphModel {

    private GraphModel() {}

    // --- Enums ---

    public enum Visibility {
        @SerializedName("Entry")   ENTRY,
        @SerializedName("Public")  PUBLIC,
        @SerializedName("Private") PRIVATE,
        @SerializedName("Friend")  FRIEND
    }

    public enum OwnerKind {
        @SerializedName("AddressOwner") ADDRESS_OWNER,
        @SerializedName("Shared")       SHARED,
        @SerializedName("Immutable")    IMMUTABLE,
        @SerializedName("ObjectOwner")  OBJECT_OWNER;

        public boolean carriesAddress() {
            return this == ADDRESS_OWNER || this == OBJECT_OWNER;
        }
    }

    public enum EventKind {
        @SerializedName("Publish") PUBLISH,
        @SerializedName("Upgrade") UPGRADE,
        @SerializedName("Mint")    MINT,
        @SerializedName("Burn")    BURN,
        @SerializedName("Custom")  CUSTOM
    }

    public enum EdgeKind {
        PKG_CONTAINS,
        PKG_DEPENDS,
        MOD_CALLS,
        MOD_DEFINES_TYPE,
        TYPE_USES_TYPE,
        MOD_FRIEND_ALLOW,
        OBJ_INSTANCE_OF,
        OBJ_OWNED_BY,
        OBJ_DF_CHILD,
        OBJ_REFERS_OBJ,
        MOD_EMITS_EVENT,
        PKG_EMITS_EVENT
    }

    public enum CallType {
        @SerializedName("friend")      FRIEND,
        @SerializedName("samePackage") SAME_PACKAGE,
        @SerializedName("external")    EXTERNAL
    }

    public enum Severity { HIGH, MED, LOW }

    public enum FlagScope {
        @SerializedName("module") MODULE,
        @SerializedName("type")   TYPE,
        @SerializedName("object") OBJECT
    }

    // --- Nodes ---

    public static class PackageNode {
        @SerializedName("id")            public String id;
        @SerializedName("address")       public String address;
        @SerializedName("displayName")   public String displayName;
        @SerializedName("stats")         public PackageStats stats;          // nullable, set for analyzed packages
        @SerializedName("explorerLinks") public Map<String, String> explorerLinks;
    }

    public static class PackageStats {
        @SerializedName("modules")      public int modules;
        @SerializedName("types")        public int types;
        @SerializedName("recentEvents") public int recentEvents;
    }

    public static class ModuleNode {
        @SerializedName("id")            public String id;
        @SerializedName("fullName")      public String fullName;
        @SerializedName("package")       public String packageId;
        @SerializedName("name")          public String name;
        @SerializedName("functions")     public List<FunctionSummary> functions = new ArrayList<>();
        @SerializedName("typesDefined")  public List<String> typesDefined = new ArrayList<>();
        @SerializedName("friends")       public List<String> friends = new ArrayList<>();
        @SerializedName("flags")         public List<String> flags = new ArrayList<>();
        @SerializedName("constants")     public List<ModuleConstant> constants;   // null when none
        @SerializedName("explorerLinks") public Map<String, String> explorerLinks;
        @SerializedName("placeholder")   public boolean placeholder;
    }

    public static class FunctionSummary {
        @SerializedName("name")       public String name;
        @SerializedName("visibility") public Visibility visibility;
        @SerializedName("isEntry")    public boolean isEntry;
        @SerializedName("parameters") public List<Parameter> parameters = new ArrayList<>();
        @SerializedName("returnType") public String returnType;
    }

    public static class Parameter {
        @SerializedName("name") public String name;
        @SerializedName("type") public String type;

        public Parameter() {}

        public Parameter(String name, String type) {
            this.name = name;
            this.type = type;
        }
    }

    public static class ModuleConstant {
        @SerializedName("name")  public String name;
        @SerializedName("type")  public String type;
        @SerializedName("value") public String value;

        public ModuleConstant() {}

        public ModuleConstant(String name, String type, String value) {
            this.name = name;
            this.type = type;
            this.value = value;
        }
    }

    public static class TypeNode {
        @SerializedName("id")          public String id;
        @SerializedName("fqn")         public String fqn;
        @SerializedName("module")      public String moduleId;
        @SerializedName("fields")      public List<FieldInfo> fields = new ArrayList<>();
        @SerializedName("hasKey")      public boolean hasKey;
        @SerializedName("abilities")   public List<String> abilities = new ArrayList<>();
        @SerializedName("placeholder") public boolean placeholder;
    }

    public static class FieldInfo {
        @SerializedName("name") public String name;
        @SerializedName("type") public String type;

        public FieldInfo() {}

        public FieldInfo(String name, String type) {
            this.name = name;
            this.type = type;
        }
    }

    public static class ObjectNode {
        @SerializedName("id")       public String id;
        @SerializedName("objectId") public String objectId;
        @SerializedName("typeFqn")  public String typeFqn;
        @SerializedName("owner")    public Owner owner;
        @SerializedName("shared")   public boolean shared;
        @SerializedName("version")  public String version;     // nullable
        @SerializedName("digest")   public String digest;      // nullable
        @SerializedName("snapshot") public JsonObject snapshot; // nullable
    }

    public static class Owner {
        @SerializedName("kind")    public OwnerKind kind;
        @SerializedName("address") public String address;   // only for AddressOwner / ObjectOwner

        public Owner() {}

        public Owner(OwnerKind kind, String address) {
            this.kind = kind;
            this.address = kind.carriesAddress() ? address : null;
        }
    }

    public static class AddressNode {
        @SerializedName("id")      public String id;
        @SerializedName("address") public String address;
        @SerializedName("label")   public String label;
    }

    public static class EventNode {
        @SerializedName("id")     public String id;
        @SerializedName("kind")   public EventKind kind;
        @SerializedName("pkg")    public String packageId;   // nullable
        @SerializedName("mod")    public String moduleId;    // nullable
        @SerializedName("ts")     public Long timestampMs;   // nullable
        @SerializedName("tx")     public String txDigest;
        @SerializedName("data")   public JsonObject data;    // nullable
        @SerializedName("sender") public String sender;
    }

    // --- Edges ---

    public static class GraphEdge {
        @SerializedName("kind")      public EdgeKind kind;
        @SerializedName("from")      public String from;
        @SerializedName("to")        public String to;
        @SerializedName("callType")  public CallType callType;                 // MOD_CALLS only
        @SerializedName("calls")     public List<CallEvidence> calls;          // MOD_CALLS only
        @SerializedName("evidence")  public List<DependencyEvidence> evidence; // PKG_DEPENDS only
        @SerializedName("fieldName") public String fieldName;                  // TYPE_USES_TYPE only

        public GraphEdge() {}

        public GraphEdge(EdgeKind kind, String from, String to) {
            this.kind = kind;
            this.from = from;
            this.to = to;
        }

        /** Identity of the edge for deduplication: (kind, from, to). */
        public String key() {
            return kind + "\u0000" + from + "\u0000" + to;
        }
    }

    public static class CallEvidence {
        @SerializedName("callerFunc")   public String callerFunc;
        @SerializedName("calleeModule") public String calleeModule;
        @SerializedName("calleeFunc")   public String calleeFunc;

        public CallEvidence() {}

        public CallEvidence(String callerFunc, String calleeModule, String calleeFunc) {
            this.callerFunc = callerFunc;
            this.calleeModule = calleeModule;
            this.calleeFunc = calleeFunc;
        }
    }

    public static class DependencyEvidence {
        @SerializedName("module")  public String moduleId;
        @SerializedName("typeFqn") public String typeFqn;

        public DependencyEvidence() {}

        public DependencyEvidence(String moduleId, String typeFqn) {
            this.moduleId = moduleId;
            this.typeFqn = typeFqn;
        }
    }

    // --- Stats and flags ---

    public static class TypeStats {
        @SerializedName("typeFqn")      public String typeFqn;
        @SerializedName("count")        public long count;
        @SerializedName("sampled")      public int sampled;
        @SerializedName("shared")       public int shared;
        @SerializedName("uniqueOwners") public int uniqueOwners;
    }

    public static class Flag {
        @SerializedName("level")   public Severity level;
        @SerializedName("kind")    public String kind;
        @SerializedName("scope")   public FlagScope scope;
        @SerializedName("refId")   public String refId;
        @SerializedName("details") public Map<String, Object> details = new LinkedHashMap<>();

        public Flag() {}

        public Flag(Severity level, String kind, FlagScope scope, String refId) {
            this.level = level;
            this.kind = kind;
            this.scope = scope;
            this.refId = refId;
        }

        public Flag detail(String key, Object value) {
            details.put(key, value);
            return this;
        }
    }

    public static class Stats {
        @SerializedName("types") public Map<String, TypeStats> types = new LinkedHashMap<>();
        @SerializedName("risk")  public Risk risk = new Risk();
    }

    public static class Risk {
        @SerializedName("modules") public Map<String, List<String>> modules = new LinkedHashMap<>();
        @SerializedName("objects") public Map<String, List<String>> objects = new LinkedHashMap<>();
    }

    // --- Root ---

    public static class Graph {
        @SerializedName("packages")  public List<PackageNode> packages = new ArrayList<>();
        @SerializedName("modules")   public List<ModuleNode> modules = new ArrayList<>();
        @SerializedName("types")     public List<TypeNode> types = new ArrayList<>();
        @SerializedName("objects")   public List<ObjectNode> objects = new ArrayList<>();
        @SerializedName("addresses") public List<AddressNode> addresses = new ArrayList<>();
        @SerializedName("events")    public List<EventNode> events = new ArrayList<>();
        @SerializedName("edges")     public List<GraphEdge> edges = new ArrayList<>();
        @SerializedName("stats")     public Stats stats = new Stats();
        @SerializedName("flags")     public List<Flag> flags = new ArrayList<>();
    }
}
